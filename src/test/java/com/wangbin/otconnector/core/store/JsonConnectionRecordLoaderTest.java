package com.wangbin.otconnector.core.store;

import com.wangbin.otconnector.common.domain.entity.ConnectionRecord;
import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;
import com.wangbin.otconnector.common.utils.JsonUtil;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonConnectionRecordLoaderTest {

    @Test
    void loadsRecordsFromClasspath() {
        List<ConnectionRecord> records = JsonConnectionRecordLoader.loadFromJson("test-connections.json");

        assertEquals(3, records.size());
        ConnectionRecord opcua = records.get(0);
        assertEquals("conn-opcua", opcua.getId());
        assertEquals(ConnectionStatus.ACTIVE, opcua.getStatus());
        ConnectionConfig config = JsonUtil.parseObject(opcua.getConfig(), ConnectionConfig.class);
        assertEquals("opc.tcp://192.168.1.10:4840", config.getEndpoint());

        // 字符串形式的 config 原样保留
        assertEquals("{\"broker\":\"broker.local\",\"port\":1883}", records.get(1).getConfig());
        assertNull(records.get(1).getStatus());

        // 未知状态按未启用处理
        assertEquals(ConnectionStatus.INACTIVE, records.get(2).getStatus());
    }

    @Test
    void loadsRecordsFromString() {
        List<ConnectionRecord> records = JsonConnectionRecordLoader.loadFromJsonString(
                "[{\"id\":\"m1\",\"protocol\":\"modbus\",\"config\":{\"host\":\"10.0.0.5\",\"unitId\":2}}]");

        assertEquals(1, records.size());
        ConnectionConfig config = JsonUtil.parseObject(records.get(0).getConfig(), ConnectionConfig.class);
        assertEquals("10.0.0.5", config.getHost());
        assertEquals(2, config.getUnitId());
    }

    @Test
    void missingFileOrBadJsonFails() {
        assertThrows(IllegalStateException.class, () -> JsonConnectionRecordLoader.loadFromJson("no-such-file.json"));
        assertThrows(IllegalStateException.class, () -> JsonConnectionRecordLoader.loadFromJsonString("{not json"));
    }
}
