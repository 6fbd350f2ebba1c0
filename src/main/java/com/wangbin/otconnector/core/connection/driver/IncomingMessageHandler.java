package com.wangbin.otconnector.core.connection.driver;

@FunctionalInterface
public interface IncomingMessageHandler {

    void handle(String topic, byte[] payload);
}
