package com.wangbin.otconnector.core.connection.model;

import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Modbus 逐地址读取结果，单个地址失败只记录在对应条目中
 */
@Getter
public class ModbusReadResult implements ReadResult {

    private final Instant timestamp;
    private final int functionCode;
    private final Map<Integer, Integer> registers;
    private final List<RegisterValue> raw;

    public ModbusReadResult(Instant timestamp, int functionCode, List<RegisterValue> raw) {
        this.timestamp = timestamp;
        this.functionCode = functionCode;
        this.raw = List.copyOf(raw);
        Map<Integer, Integer> map = new LinkedHashMap<>();
        for (RegisterValue entry : raw) {
            if (entry.isSuccess()) {
                map.put(entry.address(), entry.value());
            }
        }
        this.registers = Collections.unmodifiableMap(map);
    }

    @Override
    public OtProtocol getProtocol() {
        return OtProtocol.MODBUS;
    }

    public long getErrorCount() {
        return raw.stream().filter(entry -> !entry.isSuccess()).count();
    }

    /**
     * 批量中所有地址都失败，通常意味着底层链路已不可用
     */
    public boolean isAllFailed() {
        return !raw.isEmpty() && registers.isEmpty();
    }

    public record RegisterValue(int address, Integer value, int functionCode, Instant timestamp, String error) {

        public static RegisterValue ok(int address, int value, int functionCode, Instant timestamp) {
            return new RegisterValue(address, value, functionCode, timestamp, null);
        }

        public static RegisterValue failed(int address, int functionCode, Instant timestamp, String error) {
            return new RegisterValue(address, null, functionCode, timestamp, error);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }
}
