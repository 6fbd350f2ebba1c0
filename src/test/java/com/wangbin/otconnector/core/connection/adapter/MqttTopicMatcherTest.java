package com.wangbin.otconnector.core.connection.adapter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MqttTopicMatcherTest {

    @Test
    void exactAndSingleLevelWildcard() {
        assertTrue(MqttTopicMatcher.matches("plant/line1/temp", "plant/line1/temp"));
        assertTrue(MqttTopicMatcher.matches("plant/+/temp", "plant/line1/temp"));
        assertFalse(MqttTopicMatcher.matches("plant/+/temp", "plant/line1/cell/temp"));
        assertFalse(MqttTopicMatcher.matches("plant/+", "plant"));
    }

    @Test
    void multiLevelWildcard() {
        assertTrue(MqttTopicMatcher.matches("plant/#", "plant/line1/temp"));
        assertTrue(MqttTopicMatcher.matches("plant/#", "plant"));
        assertTrue(MqttTopicMatcher.matches("#", "anything/at/all"));
        assertFalse(MqttTopicMatcher.matches("plant/#", "factory/line1"));
    }
}
