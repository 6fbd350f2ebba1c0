package com.wangbin.otconnector.common.domain.dto.connection;

import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * 数据读取请求DTO
 */
@Data
public class ReadConnectionRequest {

    @NotBlank(message = "协议不能为空")
    private String protocol;

    @NotNull(message = "连接配置不能为空")
    private ConnectionConfig config;

    /**
     * OPC UA 节点ID / MQTT 主题 / Modbus 地址
     */
    @NotEmpty(message = "读取目标不能为空")
    private List<String> targets;

    private Integer functionCode;
    private Integer qos;
    private Long timeoutMs;
}
