package com.wangbin.otconnector.core.connection.driver.milo;

import com.wangbin.otconnector.core.connection.driver.OpcUaChannel;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.milo.opcua.sdk.client.OpcUaClient;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.enumerated.TimestampsToReturn;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
class MiloOpcUaChannel implements OpcUaChannel {

    /**
     * Server_ServerStatus_State
     */
    private static final NodeId SERVER_STATE = new NodeId(0, 2259);

    private final OpcUaClient client;
    private final String endpointUrl;

    MiloOpcUaChannel(OpcUaClient client, String endpointUrl) {
        this.client = client;
        this.endpointUrl = endpointUrl;
    }

    @Override
    public boolean checkSession() {
        try {
            List<DataValue> values = client.readValues(0, TimestampsToReturn.Neither, List.of(SERVER_STATE));
            return !values.isEmpty() && isGood(values.get(0).getStatusCode());
        } catch (Exception e) {
            log.debug("OPC UA 会话检查失败: endpoint={}, error={}", endpointUrl, e.getMessage());
            return false;
        }
    }

    @Override
    public List<NodeReading> readNodes(List<String> nodeIds) throws Exception {
        List<NodeId> targets = new ArrayList<>(nodeIds.size());
        for (String nodeId : nodeIds) {
            targets.add(NodeId.parse(nodeId));
        }
        List<DataValue> values = client.readValues(0, TimestampsToReturn.Both, targets);
        List<NodeReading> readings = new ArrayList<>(nodeIds.size());
        for (int i = 0; i < nodeIds.size(); i++) {
            DataValue value = i < values.size() ? values.get(i) : null;
            if (value == null) {
                readings.add(new NodeReading(nodeIds.get(i), null, false, "null", null));
                continue;
            }
            StatusCode status = value.getStatusCode();
            Instant sourceTime = value.getSourceTime() != null ? value.getSourceTime().getJavaInstant() : null;
            readings.add(new NodeReading(
                    nodeIds.get(i),
                    value.getValue() != null ? value.getValue().getValue() : null,
                    isGood(status),
                    status != null ? status.toString() : "null",
                    sourceTime));
        }
        return readings;
    }

    @Override
    public void close() throws Exception {
        client.disconnect();
        log.info("OPC UA 会话已关闭: {}", endpointUrl);
    }

    private static boolean isGood(StatusCode status) {
        return status != null && status.isGood();
    }
}
