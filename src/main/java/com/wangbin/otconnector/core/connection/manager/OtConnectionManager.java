package com.wangbin.otconnector.core.connection.manager;

import com.wangbin.otconnector.common.constant.OtConstant;
import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import com.wangbin.otconnector.common.exception.OtConnectionException;
import com.wangbin.otconnector.core.config.OtConnectorProperties;
import com.wangbin.otconnector.core.connection.adapter.ModbusProtocolAdapter;
import com.wangbin.otconnector.core.connection.adapter.MqttProtocolAdapter;
import com.wangbin.otconnector.core.connection.adapter.OpcUaProtocolAdapter;
import com.wangbin.otconnector.core.connection.adapter.ProtocolAdapter;
import com.wangbin.otconnector.core.connection.driver.ModbusChannel;
import com.wangbin.otconnector.core.connection.driver.MqttChannel;
import com.wangbin.otconnector.core.connection.driver.OpcUaChannel;
import com.wangbin.otconnector.core.connection.executor.TimedOperationExecutor;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import com.wangbin.otconnector.core.connection.model.ModbusReadResult;
import com.wangbin.otconnector.core.connection.model.MqttReadResult;
import com.wangbin.otconnector.core.connection.model.OpcUaReadResult;
import com.wangbin.otconnector.core.connection.model.ProbeResult;
import com.wangbin.otconnector.core.connection.model.ReadRequest;
import com.wangbin.otconnector.core.connection.model.ReadResult;
import com.wangbin.otconnector.core.connection.pool.ConnectionPool;
import com.wangbin.otconnector.core.connection.pool.PoolSnapshot;
import com.wangbin.otconnector.core.connection.pool.PooledHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * OT 连接管理门面
 * <p>
 * 对外提供连接测试与读取，所有涉及网络的操作都经由 {@link TimedOperationExecutor}
 * 执行并受截止时间约束，连接通过 {@link ConnectionPool} 复用。
 */
@Slf4j
@Service
public class OtConnectionManager {

    private static final long MQTT_DEADLINE_GRACE_MS = 2_000L;

    private final ConnectionPool pool;
    private final TimedOperationExecutor executor;
    private final OpcUaProtocolAdapter opcUaAdapter;
    private final MqttProtocolAdapter mqttAdapter;
    private final ModbusProtocolAdapter modbusAdapter;
    private final OtConnectorProperties properties;

    public OtConnectionManager(ConnectionPool pool,
                               TimedOperationExecutor executor,
                               OpcUaProtocolAdapter opcUaAdapter,
                               MqttProtocolAdapter mqttAdapter,
                               ModbusProtocolAdapter modbusAdapter,
                               OtConnectorProperties properties) {
        this.pool = pool;
        this.executor = executor;
        this.opcUaAdapter = opcUaAdapter;
        this.mqttAdapter = mqttAdapter;
        this.modbusAdapter = modbusAdapter;
        this.properties = properties;
    }

    // =============== 连接测试 ===============

    public ProbeResult testConnection(OtProtocol protocol, ConnectionConfig config) {
        return testConnection(protocol, config, properties.getTimeouts().getTestMs());
    }

    /**
     * 测试连接，从不抛出异常，失败以 success=false 返回
     */
    public ProbeResult testConnection(OtProtocol protocol, ConnectionConfig config, long timeoutMs) {
        if (protocol == null) {
            return ProbeResult.failure("Unsupported OT protocol");
        }
        long start = System.currentTimeMillis();
        try {
            ProbeResult result = switch (protocol) {
                case OPCUA -> probe(opcUaAdapter, config, "OPC UA test", timeoutMs);
                case MQTT -> probe(mqttAdapter, config, "MQTT test", timeoutMs);
                case MODBUS -> probe(modbusAdapter, config, "Modbus test", timeoutMs);
                case SCADA, MES, DATA_HISTORIAN -> validateOnly(protocol, config);
            };
            return result.withLatency(System.currentTimeMillis() - start);
        } catch (OtConnectionException e) {
            log.warn("{} 连接测试失败: type={}, key={}, error={}",
                    protocol.getDisplayName(), e.getErrorType(), e.getConnectionKey(), e.getMessage());
            return ProbeResult.failure(e.getMessage()).withLatency(System.currentTimeMillis() - start);
        } catch (Exception e) {
            log.error("{} 连接测试异常", protocol.getDisplayName(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ProbeResult.failure(message).withLatency(System.currentTimeMillis() - start);
        }
    }

    private <C extends AutoCloseable> ProbeResult probe(ProtocolAdapter<C> adapter, ConnectionConfig config,
                                                        String operation, long timeoutMs) {
        adapter.validate(config);
        String key = adapter.cacheKey(config);
        try {
            return executor.execute(operation, key, timeoutMs, () -> {
                PooledHandle<C> handle = pool.acquire(adapter, config);
                return adapter.probe(handle.getClient());
            });
        } catch (OtConnectionException e) {
            if (e.isTimeout()) {
                pool.invalidate(key);
            }
            throw e;
        }
    }

    /**
     * 无驱动的协议只校验必填字段
     */
    private ProbeResult validateOnly(OtProtocol protocol, ConnectionConfig config) {
        if (config == null) {
            return ProbeResult.failure(protocol.getDisplayName() + " configuration is required");
        }
        switch (protocol) {
            case SCADA -> {
                if (isBlank(config.getProtocol()) || isBlank(config.getEndpoint())) {
                    return ProbeResult.failure("SCADA protocol and endpoint are required");
                }
            }
            case MES -> {
                if (isBlank(config.getApiUrl())) {
                    return ProbeResult.failure("MES API URL is required");
                }
            }
            case DATA_HISTORIAN -> {
                if (isBlank(config.getServer()) || isBlank(config.getDatabase())) {
                    return ProbeResult.failure("Data Historian server and database are required");
                }
            }
            default -> {
                return ProbeResult.failure("Unsupported OT protocol: " + protocol.getCode());
            }
        }
        return ProbeResult.success(protocol.getDisplayName() + " configuration valid");
    }

    // =============== 数据读取 ===============

    public OpcUaReadResult readOpcUaNodes(ConnectionConfig config, List<String> nodeIds, long timeoutMs) {
        opcUaAdapter.validate(config);
        String key = opcUaAdapter.cacheKey(config);
        try {
            return executor.execute("OPC UA read", key, timeoutMs, () -> {
                PooledHandle<OpcUaChannel> handle = pool.acquire(opcUaAdapter, config);
                return opcUaAdapter.read(handle.getClient(), nodeIds, key);
            });
        } catch (OtConnectionException e) {
            onReadFailure(key, e);
            throw e;
        }
    }

    /**
     * 在时间窗口内订阅并收集消息；截止时间为窗口 + 建连超时 + 余量
     */
    public MqttReadResult subscribeMqttTopics(ConnectionConfig config, List<String> topics, int qos, long windowMs) {
        mqttAdapter.validate(config);
        String key = mqttAdapter.cacheKey(config);
        long deadline = windowMs + config.resolveConnectTimeoutMs() + MQTT_DEADLINE_GRACE_MS;
        try {
            return executor.execute("MQTT subscribe", key, deadline, () -> {
                PooledHandle<MqttChannel> handle = pool.acquire(mqttAdapter, config);
                return mqttAdapter.collect(handle.getClient(), topics, qos, windowMs, key);
            });
        } catch (OtConnectionException e) {
            onReadFailure(key, e);
            throw e;
        }
    }

    public ModbusReadResult readModbusRegisters(ConnectionConfig config, List<Integer> addresses,
                                                int functionCode, long timeoutMs) {
        modbusAdapter.validate(config);
        String key = modbusAdapter.cacheKey(config);
        ModbusReadResult result;
        try {
            result = executor.execute("Modbus read", key, timeoutMs, () -> {
                PooledHandle<ModbusChannel> handle = pool.acquire(modbusAdapter, config);
                return modbusAdapter.read(handle.getClient(), addresses, functionCode, key);
            });
        } catch (OtConnectionException e) {
            onReadFailure(key, e);
            throw e;
        }
        if (result.isAllFailed()) {
            log.warn("Modbus 批量读取全部失败，移除连接: key={}", key);
            pool.invalidate(key);
        }
        return result;
    }

    /**
     * 按协议分发的通用读取入口
     */
    public ReadResult readConnection(OtProtocol protocol, ConnectionConfig config, ReadRequest request) {
        if (protocol == null || !protocol.isAutoChecked()) {
            throw OtConnectionException.configException("Unsupported protocol for reading: "
                    + (protocol != null ? protocol.getCode() : null));
        }
        List<String> targets = request.getTargets() != null ? request.getTargets() : List.of();
        return switch (protocol) {
            case OPCUA -> readOpcUaNodes(config, targets,
                    resolveTimeout(request.getTimeoutMs(), properties.getTimeouts().getReadMs()));
            case MQTT -> subscribeMqttTopics(config, targets,
                    request.getQos() != null ? request.getQos() : 0,
                    resolveTimeout(request.getTimeoutMs(), properties.getTimeouts().getMqttCollectWindowMs()));
            case MODBUS -> readModbusRegisters(config, parseAddresses(targets),
                    request.getFunctionCode() != null ? request.getFunctionCode() : OtConstant.FC_READ_HOLDING_REGISTERS,
                    resolveTimeout(request.getTimeoutMs(), properties.getTimeouts().getReadMs()));
            default -> throw OtConnectionException.configException("Unsupported protocol for reading: "
                    + protocol.getCode());
        };
    }

    // =============== 生命周期与统计 ===============

    public void closeAll() {
        pool.closeAll();
    }

    public PoolSnapshot snapshot() {
        return pool.snapshot();
    }

    private void onReadFailure(String key, OtConnectionException e) {
        if (e.isTimeout()) {
            log.warn("读取超时，移除连接: key={}, after={}ms", key, e.getAfterMs());
            pool.invalidate(key);
        }
    }

    private static List<Integer> parseAddresses(List<String> targets) {
        List<Integer> addresses = new ArrayList<>(targets.size());
        for (String target : targets) {
            try {
                addresses.add(Integer.parseInt(target.trim()));
            } catch (NumberFormatException e) {
                throw OtConnectionException.configException("Invalid Modbus address: " + target);
            }
        }
        return addresses;
    }

    private static long resolveTimeout(Long requested, long fallback) {
        return requested != null && requested > 0 ? requested : fallback;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
