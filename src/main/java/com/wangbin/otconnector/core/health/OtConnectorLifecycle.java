package com.wangbin.otconnector.core.health;

import com.wangbin.otconnector.core.config.OtConnectorProperties;
import com.wangbin.otconnector.core.connection.manager.OtConnectionManager;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 应用就绪后启动健康检查，停机时停止巡检并释放全部连接
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OtConnectorLifecycle {

    private final ConnectionHealthChecker healthChecker;
    private final OtConnectionManager connectionManager;
    private final OtConnectorProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        OtConnectorProperties.HealthCheckConfig config = properties.getHealthCheck();
        if (!config.isEnabled()) {
            log.info("OT 连接健康检查未启用");
            return;
        }
        healthChecker.start(config.getIntervalMs());
    }

    /**
     * 巡检未启动时 stop() 不会释放连接，而按需测试和读取接口仍会建连，
     * 因此这里始终再关闭一次连接池，对已清空的池无副作用
     */
    @PreDestroy
    public void shutdown() {
        log.info("开始关闭 OT 连接服务...");
        healthChecker.stop();
        connectionManager.closeAll();
        log.info("OT 连接服务已关闭");
    }
}
