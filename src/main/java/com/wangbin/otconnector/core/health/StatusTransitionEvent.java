package com.wangbin.otconnector.core.health;

import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;

import java.time.Instant;

/**
 * 连接状态变化事件，只在新旧状态不同时产生
 *
 * @param oldStatus 探测前的状态，从未检测过时为 null
 */
public record StatusTransitionEvent(String connectionId,
                                    String orgId,
                                    String protocol,
                                    ConnectionStatus oldStatus,
                                    ConnectionStatus newStatus,
                                    long latencyMs,
                                    String lastError,
                                    Instant timestamp) {
}
