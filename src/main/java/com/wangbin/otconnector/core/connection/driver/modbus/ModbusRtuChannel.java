package com.wangbin.otconnector.core.connection.driver.modbus;

import com.digitalpetri.modbus.client.ModbusRtuClient;

class ModbusRtuChannel extends AbstractModbusChannel {

    private final String serialPort;

    ModbusRtuChannel(ModbusRtuClient client, String serialPort, int unitId, long requestTimeoutMs) {
        super(client, unitId, requestTimeoutMs);
        this.serialPort = serialPort;
    }

    @Override
    protected String describe() {
        return "rtu://" + serialPort + " unit=" + unitId;
    }
}
