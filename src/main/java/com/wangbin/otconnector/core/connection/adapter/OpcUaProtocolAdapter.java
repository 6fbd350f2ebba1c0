package com.wangbin.otconnector.core.connection.adapter;

import com.wangbin.otconnector.common.constant.OtConstant;
import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import com.wangbin.otconnector.common.exception.OtConnectionException;
import com.wangbin.otconnector.core.connection.driver.OpcUaChannel;
import com.wangbin.otconnector.core.connection.driver.ProtocolDriver;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import com.wangbin.otconnector.core.connection.model.OpcUaReadResult;
import com.wangbin.otconnector.core.connection.model.ProbeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * OPC UA 协议适配器
 */
@Slf4j
@Component
public class OpcUaProtocolAdapter extends AbstractProtocolAdapter<OpcUaChannel> {

    public OpcUaProtocolAdapter(ProtocolDriver<OpcUaChannel> opcUaDriver) {
        super(opcUaDriver);
    }

    @Override
    public OtProtocol getProtocol() {
        return OtProtocol.OPCUA;
    }

    @Override
    public String cacheKey(ConnectionConfig config) {
        String user = config.hasCredentials() ? config.getUsername() : OtConstant.ANONYMOUS;
        return joinKey(OtProtocol.OPCUA.getCode(), config.getEndpoint(), user);
    }

    @Override
    protected void doValidate(ConnectionConfig config) {
        require(config.getEndpoint(), "OPC UA endpoint is required");
    }

    @Override
    protected String connectFailurePrefix() {
        return "Failed to connect to OPC UA server: ";
    }

    @Override
    public boolean verifyLive(OpcUaChannel client) {
        return client.checkSession();
    }

    @Override
    public ProbeResult probe(OpcUaChannel client) {
        // 连接建立即视为成功
        return ProbeResult.success("OPC UA connection successful");
    }

    /**
     * 批量读取节点，结果顺序与请求一致
     */
    public OpcUaReadResult read(OpcUaChannel client, List<String> nodeIds, String connectionKey) {
        Instant now = Instant.now();
        List<OpcUaChannel.NodeReading> readings;
        try {
            readings = client.readNodes(nodeIds);
        } catch (Exception e) {
            log.warn("OPC UA 读取失败: key={}, nodes={}, error={}", connectionKey, nodeIds.size(), e.getMessage());
            throw OtConnectionException.readException("Failed to read OPC UA nodes: " + describe(e), connectionKey, e);
        }
        List<OpcUaReadResult.NodeValue> values = new ArrayList<>(readings.size());
        for (OpcUaChannel.NodeReading reading : readings) {
            values.add(new OpcUaReadResult.NodeValue(
                    reading.nodeId(),
                    reading.value(),
                    reading.sourceTime() != null ? reading.sourceTime() : now,
                    reading.good() ? "Good" : "Bad",
                    reading.statusCode()));
        }
        return new OpcUaReadResult(now, values);
    }
}
