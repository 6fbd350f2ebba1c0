package com.wangbin.otconnector.core.connection.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 通用读取请求：OPC UA 节点ID、MQTT 主题或 Modbus 地址
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadRequest {

    @Builder.Default
    private List<String> targets = new ArrayList<>();

    /**
     * Modbus 功能码，默认 3
     */
    private Integer functionCode;

    /**
     * MQTT 订阅 QoS，默认 0
     */
    private Integer qos;

    /**
     * 读取超时；MQTT 为采集窗口
     */
    private Long timeoutMs;
}
