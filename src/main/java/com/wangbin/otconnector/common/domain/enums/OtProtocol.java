package com.wangbin.otconnector.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * OT 协议类型枚举
 */
@Getter
public enum OtProtocol {

    OPCUA("opcua", "OPC UA", true),
    MQTT("mqtt", "MQTT", true),
    MODBUS("modbus", "Modbus", true),
    SCADA("scada", "SCADA", false),
    MES("mes", "MES", false),
    DATA_HISTORIAN("dataHistorian", "Data Historian", false);

    private final String code;
    private final String displayName;
    /**
     * 是否有真实驱动，可被健康检查自动探测
     */
    private final boolean autoChecked;

    OtProtocol(String code, String displayName, boolean autoChecked) {
        this.code = code;
        this.displayName = displayName;
        this.autoChecked = autoChecked;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    // 根据code获取枚举，未知协议返回null
    @JsonCreator
    public static OtProtocol fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim();
        if ("data-historian".equalsIgnoreCase(normalized)) {
            return DATA_HISTORIAN;
        }
        for (OtProtocol protocol : values()) {
            if (protocol.code.equalsIgnoreCase(normalized) || protocol.name().equalsIgnoreCase(normalized)) {
                return protocol;
            }
        }
        return null;
    }

    // 判断是否为OT类协议
    public static boolean isOtClass(String code) {
        return fromCode(code) != null;
    }
}
