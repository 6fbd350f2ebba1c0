package com.wangbin.otconnector.core.connection.driver;

import com.wangbin.otconnector.core.config.OtConnectorProperties;
import com.wangbin.otconnector.core.connection.driver.milo.MiloOpcUaDriver;
import com.wangbin.otconnector.core.connection.driver.modbus.DigitalPetriModbusDriver;
import com.wangbin.otconnector.core.connection.driver.paho.PahoMqttDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

/**
 * 协议驱动装配
 * <p>
 * 依赖缺失或 ot-connector.drivers.* 关闭时装配 {@link UnavailableDriver}，
 * 对应协议的连接请求返回 UNAVAILABLE，不影响其他协议。
 */
@Slf4j
@Configuration
public class DriverConfig {

    private static final String MILO_CLIENT = "org.eclipse.milo.opcua.sdk.client.OpcUaClient";
    private static final String PAHO_V3_CLIENT = "org.eclipse.paho.client.mqttv3.MqttAsyncClient";
    private static final String MODBUS_TCP_CLIENT = "com.digitalpetri.modbus.client.ModbusTcpClient";
    private static final String MODBUS_SERIAL_TRANSPORT = "com.digitalpetri.modbus.serial.client.SerialPortClientTransport";

    @Bean
    public ProtocolDriver<OpcUaChannel> opcUaDriver(OtConnectorProperties properties) {
        if (properties.getDrivers().isOpcuaEnabled() && isPresent(MILO_CLIENT)) {
            return new MiloOpcUaDriver();
        }
        log.warn("OPC UA 驱动不可用");
        return new UnavailableDriver<>("OPC UA");
    }

    @Bean
    public ProtocolDriver<MqttChannel> mqttDriver(OtConnectorProperties properties) {
        if (properties.getDrivers().isMqttEnabled() && isPresent(PAHO_V3_CLIENT)) {
            return new PahoMqttDriver();
        }
        log.warn("MQTT 驱动不可用");
        return new UnavailableDriver<>("MQTT");
    }

    @Bean
    public ProtocolDriver<ModbusChannel> modbusDriver(OtConnectorProperties properties) {
        if (properties.getDrivers().isModbusEnabled() && isPresent(MODBUS_TCP_CLIENT)) {
            return new DigitalPetriModbusDriver(isPresent(MODBUS_SERIAL_TRANSPORT));
        }
        log.warn("Modbus 驱动不可用");
        return new UnavailableDriver<>("Modbus");
    }

    private static boolean isPresent(String className) {
        return ClassUtils.isPresent(className, DriverConfig.class.getClassLoader());
    }
}
