package com.wangbin.otconnector.core.config;

import com.wangbin.otconnector.common.constant.OtConstant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * OT 连接服务配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "ot-connector")
public class OtConnectorProperties {

    /**
     * 健康检查配置
     */
    private HealthCheckConfig healthCheck = new HealthCheckConfig();

    /**
     * 超时配置
     */
    private TimeoutConfig timeouts = new TimeoutConfig();

    /**
     * 连接池配置
     */
    private PoolConfig pool = new PoolConfig();

    /**
     * 操作线程池配置
     */
    private ExecutorConfig executor = new ExecutorConfig();

    /**
     * 协议驱动开关
     */
    private DriversConfig drivers = new DriversConfig();

    /**
     * 状态变化通知配置
     */
    private NotifierConfig notifier = new NotifierConfig();

    /**
     * 连接记录存储配置
     */
    private StoreConfig store = new StoreConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = OtConstant.DEFAULT_HEALTH_CHECK_INTERVAL_MS;
        private long probeTimeoutMs = OtConstant.DEFAULT_TEST_TIMEOUT_MS;
    }

    @Data
    public static class TimeoutConfig {
        private long readMs = OtConstant.DEFAULT_READ_TIMEOUT_MS;
        private long testMs = OtConstant.DEFAULT_TEST_TIMEOUT_MS;
        private long mqttCollectWindowMs = OtConstant.DEFAULT_MQTT_COLLECT_WINDOW_MS;
    }

    @Data
    public static class PoolConfig {
        private long lockTimeoutMs = 30_000L;
    }

    @Data
    public static class ExecutorConfig {
        private int coreSize = 4;
        private int maxSize = 32;
        private int queueCapacity = 200;
    }

    @Data
    public static class DriversConfig {
        private boolean opcuaEnabled = true;
        private boolean mqttEnabled = true;
        private boolean modbusEnabled = true;
    }

    @Data
    public static class NotifierConfig {
        /**
         * 同一连接同一目标状态的重复通知抑制时间，0 表示不抑制
         */
        private long throttleMs = 60_000L;
        private long maxEntries = 1000L;
    }

    @Data
    public static class StoreConfig {
        /**
         * 启动时导入的连接记录文件（类路径或文件路径），为空则不导入
         */
        private String seedFile;
    }
}
