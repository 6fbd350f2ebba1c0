package com.wangbin.otconnector.common.constant;

/**
 * OT 连接常量
 */
public final class OtConstant {

    private OtConstant() {
    }

    // 默认端口
    public static final int DEFAULT_OPCUA_PORT = 4840;
    public static final int DEFAULT_MQTT_PORT = 1883;
    public static final int DEFAULT_MODBUS_PORT = 502;
    public static final int DEFAULT_MODBUS_UNIT_ID = 1;
    public static final String DEFAULT_SERIAL_PORT = "/dev/ttyUSB0";
    public static final int DEFAULT_BAUD_RATE = 9600;

    // 默认超时（毫秒）
    public static final long DEFAULT_READ_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_TEST_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_MQTT_COLLECT_WINDOW_MS = 5_000L;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;
    public static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 300_000L;

    // 缓存键
    public static final String KEY_SEPARATOR = "|";
    public static final String ANONYMOUS = "anonymous";
    public static final String DEFAULT_CLIENT = "default";

    // 探测消息
    public static final String NOT_AUTO_CHECKED = "not auto-checked";

    // Modbus 功能码
    public static final int FC_READ_COILS = 1;
    public static final int FC_READ_DISCRETE_INPUTS = 2;
    public static final int FC_READ_HOLDING_REGISTERS = 3;
    public static final int FC_READ_INPUT_REGISTERS = 4;
}
