package com.wangbin.otconnector.core.connection.driver.paho;

import com.wangbin.otconnector.core.connection.driver.AbstractMqttChannel;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.mqttv5.client.IMqttToken;
import org.eclipse.paho.mqttv5.client.MqttAsyncClient;
import org.eclipse.paho.mqttv5.client.MqttCallback;
import org.eclipse.paho.mqttv5.client.MqttConnectionOptions;
import org.eclipse.paho.mqttv5.client.MqttDisconnectResponse;
import org.eclipse.paho.mqttv5.client.persist.MemoryPersistence;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.eclipse.paho.mqttv5.common.packet.MqttProperties;

import java.nio.charset.StandardCharsets;

@Slf4j
class PahoV5MqttChannel extends AbstractMqttChannel {

    private final MqttAsyncClient client;

    PahoV5MqttChannel(String brokerUrl, String clientId) throws MqttException {
        this.client = new MqttAsyncClient(brokerUrl, clientId, new MemoryPersistence());
        this.client.setCallback(new MqttCallback() {
            @Override
            public void disconnected(MqttDisconnectResponse response) {
                log.warn("MQTT v5 连接断开: {}", response != null ? response.getReasonString() : null);
            }

            @Override
            public void mqttErrorOccurred(MqttException exception) {
                log.warn("MQTT v5 客户端错误: {}", exception.getMessage());
            }

            @Override
            public void messageArrived(String topic, MqttMessage message) {
                dispatch(topic, message.getPayload());
            }

            @Override
            public void deliveryComplete(IMqttToken token) {
            }

            @Override
            public void connectComplete(boolean reconnect, String serverURI) {
            }

            @Override
            public void authPacketArrived(int reasonCode, MqttProperties properties) {
            }
        });
    }

    void connect(String username, String password, boolean cleanStart, int timeoutSeconds) throws MqttException {
        MqttConnectionOptions options = new MqttConnectionOptions();
        options.setAutomaticReconnect(false);
        options.setCleanStart(cleanStart);
        options.setConnectionTimeout(timeoutSeconds);
        if (username != null && !username.isBlank()) {
            options.setUserName(username);
        }
        if (password != null) {
            options.setPassword(password.getBytes(StandardCharsets.UTF_8));
        }
        client.connect(options).waitForCompletion(timeoutSeconds * 1000L);
        if (!client.isConnected()) {
            throw new IllegalStateException("MQTT v5 client failed to connect");
        }
    }

    @Override
    protected void doSubscribe(String topic, int qos) throws Exception {
        client.subscribe(topic, qos).waitForCompletion(ACTION_TIMEOUT_MS);
    }

    @Override
    protected void doUnsubscribe(String topic) throws Exception {
        if (client.isConnected()) {
            client.unsubscribe(topic).waitForCompletion(ACTION_TIMEOUT_MS);
        }
    }

    @Override
    public boolean isConnected() {
        return client.isConnected();
    }

    @Override
    public void close() throws Exception {
        try {
            if (client.isConnected()) {
                client.disconnect().waitForCompletion(ACTION_TIMEOUT_MS);
            }
        } finally {
            // 建连未完成时普通 close 会被拒绝
            client.close(true);
        }
    }
}
