package com.wangbin.otconnector.core.connection.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.wangbin.otconnector.common.constant.OtConstant;
import lombok.Data;

import java.util.Map;

/**
 * 连接配置
 * <p>
 * 字段与连接记录中持久化的 JSON 配置保持一致，各协议只使用自己关心的字段。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConnectionConfig {

    // OPC UA
    private String endpoint;
    private String securityMode;
    private String securityPolicy;

    // MQTT
    private String broker;
    /**
     * MQTT 为 URL scheme（mqtt/mqtts/tcp/ssl/ws/wss），SCADA 为现场协议名
     */
    private String protocol;
    private String clientId;
    private String version;
    private Boolean cleanSession;

    // Modbus
    private String host;
    private Integer port;
    private Integer unitId;
    /**
     * TCP 或 RTU
     */
    private String type;
    private String serialPort;
    private Integer baudRate;
    private Integer dataBits;
    private Integer parity;
    private Integer stopBits;

    // MES / Data Historian
    private String apiUrl;
    private Map<String, String> headers;
    private String server;
    private String database;

    // 认证配置
    private String username;
    private String password;

    // 连接参数
    private Integer connectTimeoutMs;

    public int resolvePort(int defaultPort) {
        return port != null && port > 0 ? port : defaultPort;
    }

    public int resolveUnitId() {
        return unitId != null ? unitId : OtConstant.DEFAULT_MODBUS_UNIT_ID;
    }

    public int resolveConnectTimeoutMs() {
        return connectTimeoutMs != null && connectTimeoutMs > 0
                ? connectTimeoutMs
                : OtConstant.DEFAULT_CONNECT_TIMEOUT_MS;
    }

    public boolean isRtu() {
        return "RTU".equalsIgnoreCase(type);
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }
}
