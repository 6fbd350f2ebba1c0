package com.wangbin.otconnector.core.health.notify;

import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;
import com.wangbin.otconnector.core.health.StatusTransitionEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * 记录状态变化日志，进入 ERROR 记为 WARN
 */
@Slf4j
public class LoggingStatusChangeNotifier implements StatusChangeNotifier {

    @Override
    public void onStatusChange(StatusTransitionEvent event) {
        if (event.newStatus() == ConnectionStatus.ERROR) {
            log.warn("连接状态变化: id={}, protocol={}, {} -> {}, error={}",
                    event.connectionId(), event.protocol(), event.oldStatus(), event.newStatus(), event.lastError());
        } else {
            log.info("连接状态变化: id={}, protocol={}, {} -> {}, latency={}ms",
                    event.connectionId(), event.protocol(), event.oldStatus(), event.newStatus(), event.latencyMs());
        }
    }
}
