package com.wangbin.otconnector.core.connection.model;

import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MQTT 时间窗口采集结果
 */
@Getter
public class MqttReadResult implements ReadResult {

    private final Instant timestamp;
    private final Map<String, List<Object>> topicData;
    private final List<TopicMessage> messages;
    private final int topicCount;
    private final int messageCount;

    public MqttReadResult(Instant timestamp, List<TopicMessage> messages, int topicCount) {
        this.timestamp = timestamp;
        this.messages = List.copyOf(messages);
        Map<String, List<Object>> grouped = new LinkedHashMap<>();
        for (TopicMessage message : messages) {
            grouped.computeIfAbsent(message.topic(), k -> new ArrayList<>()).add(message.payload());
        }
        this.topicData = Collections.unmodifiableMap(grouped);
        this.topicCount = topicCount;
        this.messageCount = this.messages.size();
    }

    @Override
    public OtProtocol getProtocol() {
        return OtProtocol.MQTT;
    }

    /**
     * payload 为解析后的JSON对象，或无法解析时的原始字符串
     */
    public record TopicMessage(String topic, Object payload, Instant timestamp) {
    }
}
