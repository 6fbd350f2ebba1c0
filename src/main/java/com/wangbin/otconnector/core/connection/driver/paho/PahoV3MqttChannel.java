package com.wangbin.otconnector.core.connection.driver.paho;

import com.wangbin.otconnector.core.connection.driver.AbstractMqttChannel;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

@Slf4j
class PahoV3MqttChannel extends AbstractMqttChannel {

    private final MqttAsyncClient client;

    PahoV3MqttChannel(String brokerUrl, String clientId) throws MqttException {
        this.client = new MqttAsyncClient(brokerUrl, clientId, new MemoryPersistence());
    }

    void connect(String username, String password, boolean cleanSession, int timeoutSeconds) throws MqttException {
        MqttConnectOptions options = new MqttConnectOptions();
        // 断线恢复由连接池负责
        options.setAutomaticReconnect(false);
        options.setCleanSession(cleanSession);
        options.setConnectionTimeout(timeoutSeconds);
        if (username != null && !username.isBlank()) {
            options.setUserName(username);
        }
        if (password != null) {
            options.setPassword(password.toCharArray());
        }
        IMqttToken token = client.connect(options);
        token.waitForCompletion(timeoutSeconds * 1000L);
        if (!client.isConnected()) {
            throw new IllegalStateException("MQTT v3 client failed to connect");
        }
    }

    @Override
    protected void doSubscribe(String topic, int qos) throws Exception {
        client.subscribe(topic, qos, (receivedTopic, message) -> dispatch(receivedTopic, message.getPayload()))
                .waitForCompletion(ACTION_TIMEOUT_MS);
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
