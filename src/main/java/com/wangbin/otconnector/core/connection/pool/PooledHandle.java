package com.wangbin.otconnector.core.connection.pool;

import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import com.wangbin.otconnector.core.connection.adapter.ProtocolAdapter;
import lombok.Getter;

import java.time.Instant;

/**
 * 连接池中的一个已建立连接
 */
@Getter
public class PooledHandle<C extends AutoCloseable> {

    private final String key;
    private final OtProtocol protocol;
    private final C client;
    private final Instant createdAt;
    private volatile Instant lastUsedAt;
    private final ProtocolAdapter<C> adapter;

    PooledHandle(String key, C client, ProtocolAdapter<C> adapter) {
        this.key = key;
        this.protocol = adapter.getProtocol();
        this.client = client;
        this.adapter = adapter;
        this.createdAt = Instant.now();
        this.lastUsedAt = createdAt;
    }

    void touch() {
        lastUsedAt = Instant.now();
    }

    boolean isLive() {
        try {
            return adapter.verifyLive(client);
        } catch (Exception e) {
            return false;
        }
    }

    void close() {
        adapter.disconnect(client);
    }

    PoolSnapshot.HandleInfo toInfo() {
        return new PoolSnapshot.HandleInfo(key, protocol, createdAt, lastUsedAt);
    }
}
