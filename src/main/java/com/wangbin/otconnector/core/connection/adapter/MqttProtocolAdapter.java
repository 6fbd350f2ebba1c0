package com.wangbin.otconnector.core.connection.adapter;

import com.wangbin.otconnector.common.constant.OtConstant;
import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import com.wangbin.otconnector.common.exception.OtConnectionException;
import com.wangbin.otconnector.common.utils.JsonUtil;
import com.wangbin.otconnector.core.connection.driver.IncomingMessageHandler;
import com.wangbin.otconnector.core.connection.driver.MqttChannel;
import com.wangbin.otconnector.core.connection.driver.ProtocolDriver;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import com.wangbin.otconnector.core.connection.model.MqttReadResult;
import com.wangbin.otconnector.core.connection.model.ProbeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MQTT 协议适配器
 */
@Slf4j
@Component
public class MqttProtocolAdapter extends AbstractProtocolAdapter<MqttChannel> {

    public MqttProtocolAdapter(ProtocolDriver<MqttChannel> mqttDriver) {
        super(mqttDriver);
    }

    @Override
    public OtProtocol getProtocol() {
        return OtProtocol.MQTT;
    }

    @Override
    public String cacheKey(ConnectionConfig config) {
        String clientId = config.getClientId() != null && !config.getClientId().isBlank()
                ? config.getClientId()
                : OtConstant.DEFAULT_CLIENT;
        return joinKey(OtProtocol.MQTT.getCode(), config.getBroker(),
                config.resolvePort(OtConstant.DEFAULT_MQTT_PORT), clientId);
    }

    @Override
    protected void doValidate(ConnectionConfig config) {
        require(config.getBroker(), "MQTT broker is required");
    }

    @Override
    protected String connectFailurePrefix() {
        return "MQTT connection failed: ";
    }

    @Override
    public boolean verifyLive(MqttChannel client) {
        return client.isConnected();
    }

    @Override
    public ProbeResult probe(MqttChannel client) {
        if (client.isConnected()) {
            return ProbeResult.success("MQTT connection successful");
        }
        return ProbeResult.failure("MQTT client is not connected");
    }

    /**
     * 订阅主题并在时间窗口内收集消息，窗口结束后退订
     * <p>
     * 不早于窗口结束返回；负载是合法JSON时解析，否则保留原始字符串。
     */
    public MqttReadResult collect(MqttChannel client, List<String> topics, int qos, long windowMs,
                                  String connectionKey) {
        List<MqttReadResult.TopicMessage> messages = Collections.synchronizedList(new ArrayList<>());
        IncomingMessageHandler handler = (topic, payload) -> {
            if (!MqttTopicMatcher.matchesAny(topics, topic)) {
                return;
            }
            String text = payload != null ? new String(payload, StandardCharsets.UTF_8) : "";
            messages.add(new MqttReadResult.TopicMessage(topic, JsonUtil.parsePayload(text), Instant.now()));
        };

        client.addHandler(handler);
        List<String> subscribed = new ArrayList<>(topics.size());
        try {
            for (String topic : topics) {
                client.subscribe(topic, qos);
                subscribed.add(topic);
                log.debug("MQTT 已订阅: key={}, topic={}, qos={}", connectionKey, topic, qos);
            }
            Thread.sleep(windowMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OtConnectionException.readException("MQTT collection interrupted", connectionKey, e);
        } catch (Exception e) {
            throw OtConnectionException.readException("MQTT subscription failed: " + describe(e), connectionKey, e);
        } finally {
            client.removeHandler(handler);
            for (String topic : subscribed) {
                try {
                    client.unsubscribe(topic);
                } catch (Exception e) {
                    log.debug("MQTT 退订失败: key={}, topic={}, error={}", connectionKey, topic, e.getMessage());
                }
            }
        }

        List<MqttReadResult.TopicMessage> snapshot;
        synchronized (messages) {
            snapshot = new ArrayList<>(messages);
        }
        log.debug("MQTT 采集完成: key={}, topics={}, messages={}", connectionKey, topics.size(), snapshot.size());
        return new MqttReadResult(Instant.now(), snapshot, topics.size());
    }
}
