package com.wangbin.otconnector.core.store;

import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;

import java.time.Instant;

/**
 * 一次探测后写回连接记录的字段
 *
 * @param lastError 探测成功时为 null
 */
public record ConnectionStatusUpdate(ConnectionStatus status, Instant lastTestedAt, String lastError, long latencyMs) {
}
