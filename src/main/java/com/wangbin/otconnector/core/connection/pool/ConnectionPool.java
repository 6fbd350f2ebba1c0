package com.wangbin.otconnector.core.connection.pool;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.wangbin.otconnector.common.exception.OtConnectionException;
import com.wangbin.otconnector.core.config.OtConnectorProperties;
import com.wangbin.otconnector.core.connection.adapter.ProtocolAdapter;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 协议连接池
 * <p>
 * 按适配器给出的缓存键复用连接。同一键的建连在键级锁内串行，
 * 复用前先校验连接存活，失效则移除并重建；建连失败不会留下缓存项。
 * 每个键独占一把锁，不同键的建连互不等待。
 */
@Slf4j
@Component
public class ConnectionPool {

    private final Map<String, PooledHandle<?>> handles = new ConcurrentHashMap<>();
    // 弱引用值：持锁或等锁的线程仍引用该锁，空闲后才会被回收
    private final LoadingCache<String, ReentrantLock> keyLocks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());
    private final long lockTimeoutMs;

    private final AtomicLong connects = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    @Autowired
    public ConnectionPool(OtConnectorProperties properties) {
        this(properties.getPool().getLockTimeoutMs());
    }

    public ConnectionPool(long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * 获取可用连接，必要时新建
     */
    @SuppressWarnings("unchecked")
    public <C extends AutoCloseable> PooledHandle<C> acquire(ProtocolAdapter<C> adapter, ConnectionConfig config) {
        adapter.validate(config);
        String key = adapter.cacheKey(config);
        Lock lock = lockFor(key, "acquire");
        try {
            PooledHandle<?> existing = handles.get(key);
            if (existing != null) {
                if (existing.isLive()) {
                    existing.touch();
                    hits.incrementAndGet();
                    return (PooledHandle<C>) existing;
                }
                log.info("连接已失效，移除并重建: key={}", key);
                if (handles.remove(key, existing)) {
                    evictions.incrementAndGet();
                }
                existing.close();
            }

            C client = adapter.connect(config);
            PooledHandle<C> handle = new PooledHandle<>(key, client, adapter);
            handles.put(key, handle);
            connects.incrementAndGet();
            return handle;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 移除并关闭指定连接，键不存在时无操作
     * <p>
     * 不等待键级锁：超时后调用方需要立即返回，而超时的建连可能仍持有锁。
     * 这类建连完成后仍会放入池中，下次复用时由存活校验兜底。
     */
    public boolean invalidate(String key) {
        if (key == null) {
            return false;
        }
        PooledHandle<?> handle = handles.remove(key);
        if (handle == null) {
            return false;
        }
        evictions.incrementAndGet();
        handle.close();
        log.info("连接已移除: key={}", key);
        return true;
    }

    /**
     * 关闭全部连接，单个连接关闭失败不影响其他连接
     */
    public void closeAll() {
        List<String> keys = new ArrayList<>(handles.keySet());
        int closed = 0;
        for (String key : keys) {
            PooledHandle<?> handle = handles.remove(key);
            if (handle != null) {
                handle.close();
                closed++;
            }
        }
        if (closed > 0) {
            log.info("连接池已清空，关闭连接数: {}", closed);
        }
    }

    public boolean contains(String key) {
        return handles.containsKey(key);
    }

    public int size() {
        return handles.size();
    }

    public PoolSnapshot snapshot() {
        List<PoolSnapshot.HandleInfo> infos = new ArrayList<>();
        for (PooledHandle<?> handle : handles.values()) {
            infos.add(handle.toInfo());
        }
        infos.sort(Comparator.comparing(PoolSnapshot.HandleInfo::key));
        return new PoolSnapshot(infos.size(), connects.get(), hits.get(), evictions.get(), infos);
    }

    private Lock lockFor(String key, String operation) {
        Lock lock = keyLocks.get(key);
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OtConnectionException.connectException("Interrupted while waiting for connection lock", key, e);
        }
        if (!acquired) {
            throw OtConnectionException.timeoutException("Connection pool " + operation, key, lockTimeoutMs);
        }
        return lock;
    }
}
