package com.wangbin.otconnector.core.connection.fake;

import com.wangbin.otconnector.core.connection.driver.AbstractMqttChannel;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 订阅时立即投递预置的保留消息
 */
public class FakeMqttChannel extends AbstractMqttChannel {

    private final Map<String, List<Message>> retained = new ConcurrentHashMap<>();
    private final List<String> brokerSubscriptions = new CopyOnWriteArrayList<>();
    private final List<String> unsubscribed = new CopyOnWriteArrayList<>();
    private volatile boolean connected = true;
    private volatile boolean closed;

    public FakeMqttChannel retain(String filter, String topic, String payload) {
        retained.computeIfAbsent(filter, k -> new CopyOnWriteArrayList<>()).add(new Message(topic, payload));
        return this;
    }

    public void publish(String topic, String payload) {
        dispatch(topic, payload.getBytes(StandardCharsets.UTF_8));
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    public List<String> getBrokerSubscriptions() {
        return new ArrayList<>(brokerSubscriptions);
    }

    public List<String> getUnsubscribed() {
        return new ArrayList<>(unsubscribed);
    }

    public int activeSubscriptions() {
        return activeSubscriptionCount();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    protected void doSubscribe(String topic, int qos) {
        brokerSubscriptions.add(topic);
        for (Message message : retained.getOrDefault(topic, List.of())) {
            publish(message.topic(), message.payload());
        }
    }

    @Override
    protected void doUnsubscribe(String topic) {
        unsubscribed.add(topic);
    }

    @Override
    public boolean isConnected() {
        return connected && !closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    private record Message(String topic, String payload) {
    }
}
