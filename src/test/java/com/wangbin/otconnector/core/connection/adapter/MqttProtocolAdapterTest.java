package com.wangbin.otconnector.core.connection.adapter;

import com.alibaba.fastjson2.JSONObject;
import com.wangbin.otconnector.core.connection.driver.MqttChannel;
import com.wangbin.otconnector.core.connection.fake.FakeDriver;
import com.wangbin.otconnector.core.connection.fake.FakeMqttChannel;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import com.wangbin.otconnector.core.connection.model.MqttReadResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MqttProtocolAdapterTest {

    private final MqttProtocolAdapter adapter =
            new MqttProtocolAdapter(new FakeDriver<MqttChannel>(cfg -> new FakeMqttChannel()));

    @Test
    void collectsJsonAndRawPayloadsForSubscribedTopics() {
        FakeMqttChannel channel = new FakeMqttChannel()
                .retain("plant/line1/#", "plant/line1/temp", "{\"value\":21.5,\"unit\":\"C\"}")
                .retain("plant/line1/#", "plant/line1/state", "RUNNING")
                .retain("plant/line2/speed", "plant/line2/speed", "{\"rpm\":1200}");

        MqttReadResult result = adapter.collect(channel, List.of("plant/line1/#", "plant/line2/speed"), 0, 50, "k");

        assertEquals(2, result.getTopicCount());
        assertEquals(3, result.getMessageCount());
        Object temp = result.getTopicData().get("plant/line1/temp").get(0);
        assertInstanceOf(JSONObject.class, temp);
        assertEquals(21.5, ((JSONObject) temp).getDoubleValue("value"));
        assertEquals("RUNNING", result.getTopicData().get("plant/line1/state").get(0));
        assertEquals(1200, ((JSONObject) result.getTopicData().get("plant/line2/speed").get(0)).getIntValue("rpm"));
    }

    @Test
    void ignoresMessagesOutsideTheFilters() {
        FakeMqttChannel channel = new FakeMqttChannel()
                .retain("plant/+/temp", "plant/line1/temp", "20");

        MqttReadResult result = adapter.collect(channel, List.of("plant/+/temp"), 1, 20, "k");
        channel.publish("other/topic", "x");

        assertEquals(1, result.getMessageCount());
        assertFalse(result.getTopicData().containsKey("other/topic"));
    }

    @Test
    void unsubscribesAfterTheWindow() {
        FakeMqttChannel channel = new FakeMqttChannel();

        long start = System.currentTimeMillis();
        MqttReadResult result = adapter.collect(channel, List.of("a/b", "c/d"), 0, 100, "k");
        long elapsed = System.currentTimeMillis() - start;

        assertTrue(elapsed >= 100, "must not return before the window ends");
        assertEquals(0, result.getMessageCount());
        assertEquals(List.of("a/b", "c/d"), channel.getBrokerSubscriptions());
        assertEquals(List.of("a/b", "c/d"), channel.getUnsubscribed());
        assertEquals(0, channel.activeSubscriptions());
    }

    @Test
    void sharedTopicStaysSubscribedWhileAnotherCollectorUsesIt() throws Exception {
        FakeMqttChannel channel = new FakeMqttChannel();
        channel.subscribe("shared/topic", 0);

        adapter.collect(channel, List.of("shared/topic"), 0, 10, "k");

        assertTrue(channel.getUnsubscribed().isEmpty());
        assertEquals(1, channel.getBrokerSubscriptions().size());
        assertEquals(1, channel.activeSubscriptions());
    }

    @Test
    void cacheKeyAndProbe() {
        ConnectionConfig config = new ConnectionConfig();
        config.setBroker("broker.local");
        assertEquals("mqtt|broker.local|1883|default", adapter.cacheKey(config));
        config.setClientId("gw-1");
        config.setPort(8883);
        assertEquals("mqtt|broker.local|8883|gw-1", adapter.cacheKey(config));

        FakeMqttChannel channel = new FakeMqttChannel();
        assertTrue(adapter.probe(channel).success());
        assertEquals("MQTT connection successful", adapter.probe(channel).message());
        channel.setConnected(false);
        assertFalse(adapter.verifyLive(channel));
        assertFalse(adapter.probe(channel).success());
    }
}
