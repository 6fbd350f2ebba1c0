package com.wangbin.otconnector.common.domain.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OtProtocolTest {

    @Test
    void fromCodeAcceptsCodesAndNames() {
        assertEquals(OtProtocol.OPCUA, OtProtocol.fromCode("opcua"));
        assertEquals(OtProtocol.MODBUS, OtProtocol.fromCode(" MODBUS "));
        assertEquals(OtProtocol.DATA_HISTORIAN, OtProtocol.fromCode("dataHistorian"));
        assertEquals(OtProtocol.DATA_HISTORIAN, OtProtocol.fromCode("data-historian"));
        assertNull(OtProtocol.fromCode("rest"));
        assertNull(OtProtocol.fromCode(null));
    }

    @Test
    void onlyDriverBackedProtocolsAreAutoChecked() {
        assertTrue(OtProtocol.OPCUA.isAutoChecked());
        assertTrue(OtProtocol.MQTT.isAutoChecked());
        assertTrue(OtProtocol.MODBUS.isAutoChecked());
        assertFalse(OtProtocol.SCADA.isAutoChecked());
        assertFalse(OtProtocol.MES.isAutoChecked());
        assertFalse(OtProtocol.DATA_HISTORIAN.isAutoChecked());
        assertTrue(OtProtocol.isOtClass("mes"));
        assertFalse(OtProtocol.isOtClass("database"));
    }
}
