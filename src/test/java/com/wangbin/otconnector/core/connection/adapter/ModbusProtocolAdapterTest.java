package com.wangbin.otconnector.core.connection.adapter;

import com.wangbin.otconnector.common.exception.OtConnectionException;
import com.wangbin.otconnector.core.connection.driver.ModbusChannel;
import com.wangbin.otconnector.core.connection.fake.FakeDriver;
import com.wangbin.otconnector.core.connection.fake.FakeModbusChannel;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import com.wangbin.otconnector.core.connection.model.ModbusReadResult;
import com.wangbin.otconnector.core.connection.model.ProbeResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModbusProtocolAdapterTest {

    private final ModbusProtocolAdapter adapter =
            new ModbusProtocolAdapter(new FakeDriver<ModbusChannel>(cfg -> new FakeModbusChannel()));

    @Test
    void partialFailureKeepsOtherAddresses() {
        FakeModbusChannel channel = new FakeModbusChannel()
                .register(1, 100)
                .register(2, 200)
                .register(4, 400)
                .failAt(3);

        ModbusReadResult result = adapter.read(channel, List.of(1, 2, 3, 4), 3, "k");

        assertEquals(4, result.getRaw().size());
        assertEquals(100, result.getRegisters().get(1));
        assertEquals(200, result.getRegisters().get(2));
        assertEquals(400, result.getRegisters().get(4));
        assertFalse(result.getRegisters().containsKey(3));

        ModbusReadResult.RegisterValue failed = result.getRaw().get(2);
        assertEquals(3, failed.address());
        assertNull(failed.value());
        assertTrue(failed.error().contains("Illegal data address"));
        assertEquals(1, result.getErrorCount());
        assertFalse(result.isAllFailed());
    }

    @Test
    void coilsAreReportedAsZeroOrOne() {
        FakeModbusChannel channel = new FakeModbusChannel().register(0, 1).register(1, 0);

        ModbusReadResult result = adapter.read(channel, List.of(0, 1), 1, "k");

        assertEquals(1, result.getRegisters().get(0));
        assertEquals(0, result.getRegisters().get(1));
        assertEquals(1, result.getFunctionCode());
    }

    @Test
    void unsupportedFunctionCodeIsPerAddressError() {
        FakeModbusChannel channel = new FakeModbusChannel().register(0, 7);

        ModbusReadResult result = adapter.read(channel, List.of(0, 1), 6, "k");

        assertTrue(result.isAllFailed());
        assertTrue(result.getRaw().get(0).error().contains("Unsupported Modbus function code: 6"));
    }

    @Test
    void probeReportsSuccessEvenWhenTestReadFails() {
        ProbeResult ok = adapter.probe(new FakeModbusChannel());
        assertTrue(ok.success());
        assertEquals("Modbus connection successful", ok.message());

        ProbeResult degraded = adapter.probe(new FakeModbusChannel().failAt(0));
        assertTrue(degraded.success());
        assertTrue(degraded.message().startsWith("Modbus connection established (test read may have failed"));
    }

    @Test
    void cacheKeyUsesDefaultsAndSerialPortForRtu() {
        ConnectionConfig tcp = new ConnectionConfig();
        tcp.setHost("plc-1");
        assertEquals("modbus|plc-1|502|1", adapter.cacheKey(tcp));

        ConnectionConfig rtu = new ConnectionConfig();
        rtu.setType("RTU");
        rtu.setSerialPort("/dev/ttyS1");
        rtu.setUnitId(3);
        assertEquals("modbus|/dev/ttyS1|502|3", adapter.cacheKey(rtu));
    }

    @Test
    void validateRequiresHostOrSerialPort() {
        ConnectionConfig tcp = new ConnectionConfig();
        OtConnectionException error = assertThrows(OtConnectionException.class, () -> adapter.validate(tcp));
        assertEquals(OtConnectionException.ErrorType.CONFIG, error.getErrorType());

        ConnectionConfig rtu = new ConnectionConfig();
        rtu.setType("rtu");
        rtu.setHost("ignored");
        assertThrows(OtConnectionException.class, () -> adapter.validate(rtu));

        rtu.setSerialPort("/dev/ttyUSB0");
        assertDoesNotThrow(() -> adapter.validate(rtu));
    }
}
