package com.wangbin.otconnector.common.domain.dto.connection;

import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 连接测试请求DTO
 */
@Data
public class TestConnectionRequest {

    @NotBlank(message = "协议不能为空")
    private String protocol;

    @NotNull(message = "连接配置不能为空")
    private ConnectionConfig config;

    /**
     * 测试超时，为空使用默认值
     */
    private Long timeoutMs;
}
