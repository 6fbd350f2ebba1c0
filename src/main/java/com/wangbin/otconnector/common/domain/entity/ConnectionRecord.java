package com.wangbin.otconnector.common.domain.entity;

import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 用户配置的 OT 连接记录（持久化实体）
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionRecord {

    private String id;
    private String orgId;
    private String name;
    /**
     * 协议编码：opcua / mqtt / modbus / scada / mes / dataHistorian
     */
    private String protocol;
    /**
     * 协议配置（JSON字符串）
     */
    private String config;

    // 健康检查结果
    private ConnectionStatus status;
    private Instant lastTestedAt;
    private String lastError;
    private Long latencyMs;

    public ConnectionRecord copy() {
        return toBuilder().build();
    }
}
