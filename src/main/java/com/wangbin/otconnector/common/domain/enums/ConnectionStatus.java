package com.wangbin.otconnector.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 连接记录状态枚举
 */
@Getter
public enum ConnectionStatus {

    ACTIVE("active", "在线"),
    INACTIVE("inactive", "未启用"),
    ERROR("error", "异常");

    private final String code;
    private final String description;

    ConnectionStatus(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    // 根据code获取枚举，空值表示从未检测过
    @JsonCreator
    public static ConnectionStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (ConnectionStatus status : values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        return INACTIVE;
    }

    public static ConnectionStatus fromProbe(boolean success) {
        return success ? ACTIVE : ERROR;
    }
}
