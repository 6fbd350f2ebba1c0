package com.wangbin.otconnector.core.connection.driver;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * MQTT 通道公共逻辑：订阅引用计数与消息分发
 */
@Slf4j
public abstract class AbstractMqttChannel implements MqttChannel {

    protected static final long ACTION_TIMEOUT_MS = 5000L;

    private final List<IncomingMessageHandler> handlers = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> subscriptions = new HashMap<>();

    @Override
    public void subscribe(String topic, int qos) throws Exception {
        synchronized (subscriptions) {
            Integer count = subscriptions.get(topic);
            if (count == null) {
                doSubscribe(topic, qos);
                subscriptions.put(topic, 1);
            } else {
                subscriptions.put(topic, count + 1);
            }
        }
    }

    @Override
    public void unsubscribe(String topic) throws Exception {
        synchronized (subscriptions) {
            Integer count = subscriptions.get(topic);
            if (count == null) {
                return;
            }
            if (count > 1) {
                subscriptions.put(topic, count - 1);
                return;
            }
            subscriptions.remove(topic);
            doUnsubscribe(topic);
        }
    }

    @Override
    public void addHandler(IncomingMessageHandler handler) {
        handlers.add(handler);
    }

    @Override
    public void removeHandler(IncomingMessageHandler handler) {
        handlers.remove(handler);
    }

    protected void dispatch(String topic, byte[] payload) {
        for (IncomingMessageHandler handler : handlers) {
            try {
                handler.handle(topic, payload);
            } catch (Exception e) {
                log.warn("MQTT 消息处理器异常: topic={}, error={}", topic, e.getMessage());
            }
        }
    }

    protected int activeSubscriptionCount() {
        synchronized (subscriptions) {
            return subscriptions.size();
        }
    }

    protected abstract void doSubscribe(String topic, int qos) throws Exception;

    protected abstract void doUnsubscribe(String topic) throws Exception;
}
