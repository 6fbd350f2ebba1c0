package com.wangbin.otconnector.core.connection.driver.modbus;

import com.digitalpetri.modbus.client.ModbusRtuClient;
import com.digitalpetri.modbus.client.ModbusTcpClient;
import com.digitalpetri.modbus.serial.client.SerialPortClientTransport;
import com.digitalpetri.modbus.tcp.client.NettyTcpClientTransport;
import com.wangbin.otconnector.common.constant.OtConstant;
import com.wangbin.otconnector.core.connection.driver.ModbusChannel;
import com.wangbin.otconnector.core.connection.driver.ProtocolDriver;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于 digitalpetri modbus 的 Modbus TCP/RTU 驱动
 */
@Slf4j
public class DigitalPetriModbusDriver implements ProtocolDriver<ModbusChannel> {

    private final boolean serialAvailable;

    public DigitalPetriModbusDriver(boolean serialAvailable) {
        this.serialAvailable = serialAvailable;
    }

    @Override
    public String getName() {
        return "Modbus (digitalpetri)";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public ModbusChannel open(ConnectionConfig config) throws Exception {
        return config.isRtu() ? openRtu(config) : openTcp(config);
    }

    private ModbusChannel openTcp(ConnectionConfig config) throws Exception {
        String host = config.getHost();
        int port = config.resolvePort(OtConstant.DEFAULT_MODBUS_PORT);
        NettyTcpClientTransport transport = NettyTcpClientTransport.create(cfg -> {
            cfg.setHostname(host);
            cfg.setPort(port);
        });
        ModbusTcpClient client = ModbusTcpClient.create(transport);
        ModbusChannel channel = ProtocolDriver.connectOrClose(
                new ModbusTcpChannel(client, host, port, config.resolveUnitId(), config.resolveConnectTimeoutMs()),
                client::connect);
        log.info("Modbus TCP 连接已建立: {}:{}, unitId={}", host, port, config.resolveUnitId());
        return channel;
    }

    private ModbusChannel openRtu(ConnectionConfig config) throws Exception {
        if (!serialAvailable) {
            throw new IllegalStateException("Modbus RTU 串口支持不可用");
        }
        String serialPort = config.getSerialPort() != null ? config.getSerialPort() : OtConstant.DEFAULT_SERIAL_PORT;
        int baudRate = config.getBaudRate() != null ? config.getBaudRate() : OtConstant.DEFAULT_BAUD_RATE;
        int dataBits = config.getDataBits() != null ? config.getDataBits() : 8;
        int parity = config.getParity() != null ? config.getParity() : 0;
        int stopBits = config.getStopBits() != null ? config.getStopBits() : 1;

        var transport = SerialPortClientTransport.create(cfg -> {
            cfg.setSerialPort(serialPort);
            cfg.setBaudRate(baudRate);
            cfg.setDataBits(dataBits);
            cfg.setParity(parity);
            cfg.setStopBits(stopBits);
        });
        ModbusRtuClient client = ModbusRtuClient.create(transport);
        ModbusChannel channel = ProtocolDriver.connectOrClose(
                new ModbusRtuChannel(client, serialPort, config.resolveUnitId(), config.resolveConnectTimeoutMs()),
                client::connect);
        log.info("Modbus RTU 连接已建立: {} baud={} dataBits={} stopBits={} parity={}",
                serialPort, baudRate, dataBits, stopBits, parity);
        return channel;
    }
}
