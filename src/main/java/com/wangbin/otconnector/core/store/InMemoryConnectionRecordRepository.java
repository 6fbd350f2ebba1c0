package com.wangbin.otconnector.core.store;

import com.wangbin.otconnector.common.domain.entity.ConnectionRecord;
import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;
import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import com.wangbin.otconnector.common.exception.BusinessException;
import com.wangbin.otconnector.common.web.result.ResultCode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 内存版连接记录存储，按插入顺序返回，读写都使用副本
 */
@Slf4j
public class InMemoryConnectionRecordRepository implements ConnectionRecordRepository {

    private final Map<String, ConnectionRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized List<ConnectionRecord> listOtConnections() {
        List<ConnectionRecord> result = new ArrayList<>();
        for (ConnectionRecord record : records.values()) {
            if (OtProtocol.isOtClass(record.getProtocol())) {
                result.add(record.copy());
            }
        }
        return result;
    }

    @Override
    public synchronized List<ConnectionRecord> findAll() {
        List<ConnectionRecord> result = new ArrayList<>(records.size());
        for (ConnectionRecord record : records.values()) {
            result.add(record.copy());
        }
        return result;
    }

    @Override
    public synchronized Optional<ConnectionRecord> findById(String id) {
        ConnectionRecord record = records.get(id);
        return Optional.ofNullable(record != null ? record.copy() : null);
    }

    @Override
    public synchronized ConnectionRecord save(ConnectionRecord record) {
        ConnectionRecord stored = record.copy();
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(UUID.randomUUID().toString());
        }
        records.put(stored.getId(), stored);
        return stored.copy();
    }

    @Override
    public synchronized ConnectionStatus updateConnectionStatus(String id, ConnectionStatusUpdate update) {
        ConnectionRecord record = records.get(id);
        if (record == null) {
            throw new BusinessException(ResultCode.DATA_NOT_FOUND, "连接记录不存在: " + id);
        }
        ConnectionStatus previous = record.getStatus();
        record.setStatus(update.status());
        record.setLastTestedAt(update.lastTestedAt());
        record.setLastError(update.lastError());
        record.setLatencyMs(update.latencyMs());
        log.debug("连接状态已更新: id={}, {} -> {}", id, previous, update.status());
        return previous;
    }

    public synchronized int size() {
        return records.size();
    }
}
