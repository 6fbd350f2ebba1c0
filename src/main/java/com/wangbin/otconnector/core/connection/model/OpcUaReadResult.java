package com.wangbin.otconnector.core.connection.model;

import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OPC UA 批量读取结果，raw 与请求的节点顺序一致
 */
@Getter
public class OpcUaReadResult implements ReadResult {

    private final Instant timestamp;
    private final Map<String, Object> values;
    private final List<NodeValue> raw;

    public OpcUaReadResult(Instant timestamp, List<NodeValue> raw) {
        this.timestamp = timestamp;
        this.raw = List.copyOf(raw);
        Map<String, Object> map = new LinkedHashMap<>();
        for (NodeValue node : raw) {
            map.put(node.nodeId(), node.value());
        }
        this.values = Collections.unmodifiableMap(map);
    }

    @Override
    public OtProtocol getProtocol() {
        return OtProtocol.OPCUA;
    }

    /**
     * 单个节点读数
     *
     * @param quality    Good / Bad
     * @param statusCode 原始状态码文本
     */
    public record NodeValue(String nodeId, Object value, Instant timestamp, String quality, String statusCode) {
    }
}
