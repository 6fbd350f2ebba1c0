package com.wangbin.otconnector.core.connection.driver;

/**
 * MQTT 会话通道
 * <p>
 * 多个采集方可以共享同一通道：订阅按主题引用计数，消息分发给所有已注册的处理器。
 */
public interface MqttChannel extends AutoCloseable {

    boolean isConnected();

    void subscribe(String topic, int qos) throws Exception;

    /**
     * 引用计数归零时才真正退订
     */
    void unsubscribe(String topic) throws Exception;

    void addHandler(IncomingMessageHandler handler);

    void removeHandler(IncomingMessageHandler handler);
}
