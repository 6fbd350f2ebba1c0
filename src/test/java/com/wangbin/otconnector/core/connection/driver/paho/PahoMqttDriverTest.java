package com.wangbin.otconnector.core.connection.driver.paho;

import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class PahoMqttDriverTest {

    @Test
    void brokerUrlMapsSchemeAndDefaultPort() {
        ConnectionConfig config = new ConnectionConfig();
        config.setBroker("broker.local");
        assertEquals("tcp://broker.local:1883", PahoMqttDriver.buildBrokerUrl(config));

        config.setProtocol("mqtts");
        config.setPort(8883);
        assertEquals("ssl://broker.local:8883", PahoMqttDriver.buildBrokerUrl(config));

        config.setProtocol("ws");
        assertEquals("ws://broker.local:8883", PahoMqttDriver.buildBrokerUrl(config));
    }

    @Test
    void fullBrokerUrlIsUsedAsIs() {
        ConnectionConfig config = new ConnectionConfig();
        config.setBroker("ssl://broker.local:8884");
        config.setPort(1883);
        assertEquals("ssl://broker.local:8884", PahoMqttDriver.buildBrokerUrl(config));
    }

    @Test
    void versionSelection() {
        assertFalse(PahoMqttDriver.isV5(null));
        assertFalse(PahoMqttDriver.isV5("3.1.1"));
        assertTrue(PahoMqttDriver.isV5("5"));
        assertTrue(PahoMqttDriver.isV5("V5"));
        assertTrue(PahoMqttDriver.isV5("5.0"));
    }

    @Test
    void generatedClientIdWhenMissing() {
        ConnectionConfig config = new ConnectionConfig();
        assertTrue(PahoMqttDriver.resolveClientId(config).startsWith("mqtt_client_"));
        config.setClientId("gw-1");
        assertEquals("gw-1", PahoMqttDriver.resolveClientId(config));
    }

    @Test
    void schemeAndVersionIgnoreDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            ConnectionConfig config = new ConnectionConfig();
            config.setBroker("broker.local");
            config.setProtocol("MQTTS");
            assertEquals("ssl://broker.local:1883", PahoMqttDriver.buildBrokerUrl(config));
            assertTrue(PahoMqttDriver.isV5("MQTT5"));
        } finally {
            Locale.setDefault(original);
        }
    }
}
