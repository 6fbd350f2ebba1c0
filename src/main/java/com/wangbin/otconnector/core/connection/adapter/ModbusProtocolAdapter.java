package com.wangbin.otconnector.core.connection.adapter;

import com.wangbin.otconnector.common.constant.OtConstant;
import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import com.wangbin.otconnector.core.connection.driver.ModbusChannel;
import com.wangbin.otconnector.core.connection.driver.ProtocolDriver;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import com.wangbin.otconnector.core.connection.model.ModbusReadResult;
import com.wangbin.otconnector.core.connection.model.ProbeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Modbus TCP/RTU 协议适配器
 */
@Slf4j
@Component
public class ModbusProtocolAdapter extends AbstractProtocolAdapter<ModbusChannel> {

    public ModbusProtocolAdapter(ProtocolDriver<ModbusChannel> modbusDriver) {
        super(modbusDriver);
    }

    @Override
    public OtProtocol getProtocol() {
        return OtProtocol.MODBUS;
    }

    @Override
    public String cacheKey(ConnectionConfig config) {
        String target = config.isRtu()
                ? (config.getSerialPort() != null ? config.getSerialPort() : OtConstant.DEFAULT_SERIAL_PORT)
                : config.getHost();
        return joinKey(OtProtocol.MODBUS.getCode(), target,
                config.resolvePort(OtConstant.DEFAULT_MODBUS_PORT), config.resolveUnitId());
    }

    @Override
    protected void doValidate(ConnectionConfig config) {
        if (config.isRtu()) {
            require(config.getSerialPort(), "Modbus RTU serialPort is required");
        } else {
            require(config.getHost(), "Modbus host is required");
        }
    }

    @Override
    protected String connectFailurePrefix() {
        return "Failed to create Modbus client: ";
    }

    /**
     * Modbus 没有会话层心跳，链路失效由读取失败体现
     */
    @Override
    public boolean verifyLive(ModbusChannel client) {
        return true;
    }

    @Override
    public ProbeResult probe(ModbusChannel client) {
        try {
            client.readHoldingRegister(0);
            return ProbeResult.success("Modbus connection successful");
        } catch (Exception e) {
            // 连接已建立，测试读失败不算探测失败
            log.debug("Modbus 测试读取失败: {}", describe(e));
            return ProbeResult.success("Modbus connection established (test read may have failed: "
                    + describe(e) + ")");
        }
    }

    /**
     * 逐地址读取，单个地址失败不影响其余地址
     */
    public ModbusReadResult read(ModbusChannel client, List<Integer> addresses, int functionCode,
                                 String connectionKey) {
        List<ModbusReadResult.RegisterValue> entries = new ArrayList<>(addresses.size());
        for (Integer address : addresses) {
            Instant now = Instant.now();
            try {
                int value = readOne(client, address, functionCode);
                entries.add(ModbusReadResult.RegisterValue.ok(address, value, functionCode, now));
            } catch (Exception e) {
                log.debug("Modbus 地址读取失败: key={}, address={}, fc={}, error={}",
                        connectionKey, address, functionCode, describe(e));
                entries.add(ModbusReadResult.RegisterValue.failed(address, functionCode, now, describe(e)));
            }
        }
        ModbusReadResult result = new ModbusReadResult(Instant.now(), functionCode, entries);
        if (result.getErrorCount() > 0) {
            log.warn("Modbus 批量读取部分失败: key={}, 失败 {}/{}", connectionKey, result.getErrorCount(), addresses.size());
        }
        return result;
    }

    private int readOne(ModbusChannel client, int address, int functionCode) throws Exception {
        return switch (functionCode) {
            case OtConstant.FC_READ_COILS -> client.readCoil(address) ? 1 : 0;
            case OtConstant.FC_READ_DISCRETE_INPUTS -> client.readDiscreteInput(address) ? 1 : 0;
            case OtConstant.FC_READ_HOLDING_REGISTERS -> client.readHoldingRegister(address);
            case OtConstant.FC_READ_INPUT_REGISTERS -> client.readInputRegister(address);
            default -> throw new IllegalArgumentException("Unsupported Modbus function code: " + functionCode);
        };
    }
}
