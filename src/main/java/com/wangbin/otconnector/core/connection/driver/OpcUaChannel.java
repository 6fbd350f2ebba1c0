package com.wangbin.otconnector.core.connection.driver;

import java.time.Instant;
import java.util.List;

/**
 * OPC UA 会话通道
 */
public interface OpcUaChannel extends AutoCloseable {

    /**
     * 检查会话是否仍然可用（读取服务器状态节点）
     */
    boolean checkSession();

    /**
     * 批量读取节点值，结果顺序与 nodeIds 一致
     */
    List<NodeReading> readNodes(List<String> nodeIds) throws Exception;

    /**
     * 单个节点读数
     */
    record NodeReading(String nodeId, Object value, boolean good, String statusCode, Instant sourceTime) {
    }
}
