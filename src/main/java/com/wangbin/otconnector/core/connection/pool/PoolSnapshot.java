package com.wangbin.otconnector.core.connection.pool;

import com.wangbin.otconnector.common.domain.enums.OtProtocol;

import java.time.Instant;
import java.util.List;

/**
 * 连接池统计快照
 *
 * @param connects  新建连接次数
 * @param hits      复用命中次数
 * @param evictions 因失效或超时被移除的次数
 */
public record PoolSnapshot(int size, long connects, long hits, long evictions, List<HandleInfo> handles) {

    public record HandleInfo(String key, OtProtocol protocol, Instant createdAt, Instant lastUsedAt) {
    }
}
