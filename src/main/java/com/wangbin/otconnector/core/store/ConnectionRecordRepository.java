package com.wangbin.otconnector.core.store;

import com.wangbin.otconnector.common.domain.entity.ConnectionRecord;
import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;

import java.util.List;
import java.util.Optional;

/**
 * 连接记录存储
 */
public interface ConnectionRecordRepository {

    /**
     * 所有 OT 类协议的连接记录
     */
    List<ConnectionRecord> listOtConnections();

    List<ConnectionRecord> findAll();

    Optional<ConnectionRecord> findById(String id);

    ConnectionRecord save(ConnectionRecord record);

    /**
     * 写回探测结果，记录不存在时抛出 DATA_NOT_FOUND
     *
     * @return 写入前的状态，读取与写入在同一原子操作内完成
     */
    ConnectionStatus updateConnectionStatus(String id, ConnectionStatusUpdate update);
}
