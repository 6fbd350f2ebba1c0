package com.wangbin.otconnector.core.connection.driver.paho;

import com.wangbin.otconnector.common.constant.OtConstant;
import com.wangbin.otconnector.core.connection.driver.MqttChannel;
import com.wangbin.otconnector.core.connection.driver.ProtocolDriver;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * 基于 Eclipse Paho 的 MQTT 驱动，version 为 5 时使用 v5 客户端，否则使用 v3.1.1
 */
@Slf4j
public class PahoMqttDriver implements ProtocolDriver<MqttChannel> {

    @Override
    public String getName() {
        return "MQTT (Paho)";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public MqttChannel open(ConnectionConfig config) throws Exception {
        String brokerUrl = buildBrokerUrl(config);
        String clientId = resolveClientId(config);
        int timeoutSeconds = Math.max(1, config.resolveConnectTimeoutMs() / 1000);
        boolean cleanSession = config.getCleanSession() == null || config.getCleanSession();

        MqttChannel channel;
        if (isV5(config.getVersion())) {
            PahoV5MqttChannel v5 = new PahoV5MqttChannel(brokerUrl, clientId);
            channel = ProtocolDriver.connectOrClose(v5,
                    () -> v5.connect(config.getUsername(), config.getPassword(), cleanSession, timeoutSeconds));
        } else {
            PahoV3MqttChannel v3 = new PahoV3MqttChannel(brokerUrl, clientId);
            channel = ProtocolDriver.connectOrClose(v3,
                    () -> v3.connect(config.getUsername(), config.getPassword(), cleanSession, timeoutSeconds));
        }
        log.info("MQTT 连接已建立: broker={}, clientId={}, version={}",
                brokerUrl, clientId, isV5(config.getVersion()) ? "5" : "3.1.1");
        return channel;
    }

    static boolean isV5(String version) {
        if (version == null) {
            return false;
        }
        String text = version.trim().toLowerCase(Locale.ROOT);
        return text.equals("5") || text.equals("5.0") || text.equals("v5") || text.equals("mqtt5");
    }

    /**
     * mqtt -> tcp, mqtts -> ssl，其余 scheme 原样使用
     */
    static String buildBrokerUrl(ConnectionConfig config) {
        String broker = config.getBroker().trim();
        if (broker.contains("://")) {
            return broker;
        }
        String scheme = config.getProtocol() == null || config.getProtocol().isBlank()
                ? "mqtt"
                : config.getProtocol().trim().toLowerCase(Locale.ROOT);
        scheme = switch (scheme) {
            case "mqtt" -> "tcp";
            case "mqtts" -> "ssl";
            default -> scheme;
        };
        return scheme + "://" + broker + ":" + config.resolvePort(OtConstant.DEFAULT_MQTT_PORT);
    }

    static String resolveClientId(ConnectionConfig config) {
        if (config.getClientId() != null && !config.getClientId().isBlank()) {
            return config.getClientId();
        }
        return "mqtt_client_" + System.currentTimeMillis();
    }
}
