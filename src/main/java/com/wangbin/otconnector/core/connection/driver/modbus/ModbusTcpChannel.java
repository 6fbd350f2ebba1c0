package com.wangbin.otconnector.core.connection.driver.modbus;

import com.digitalpetri.modbus.client.ModbusTcpClient;

class ModbusTcpChannel extends AbstractModbusChannel {

    private final String host;
    private final int port;

    ModbusTcpChannel(ModbusTcpClient client, String host, int port, int unitId, long requestTimeoutMs) {
        super(client, unitId, requestTimeoutMs);
        this.host = host;
        this.port = port;
    }

    @Override
    protected String describe() {
        return "tcp://" + host + ":" + port + " unit=" + unitId;
    }
}
