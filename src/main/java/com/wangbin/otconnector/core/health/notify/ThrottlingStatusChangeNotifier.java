package com.wangbin.otconnector.core.health.notify;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;
import com.wangbin.otconnector.core.health.StatusTransitionEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 同一连接进入同一状态的通知在抑制窗口内只转发一次，防止链路抖动刷屏
 * <p>
 * 只用于包装日志等本地处理；应用事件由 {@link PublishingStatusChangeNotifier} 在节流之外发布
 */
@Slf4j
public class ThrottlingStatusChangeNotifier implements StatusChangeNotifier {

    private final StatusChangeNotifier delegate;
    private final Cache<ThrottleKey, Boolean> recent;

    public ThrottlingStatusChangeNotifier(StatusChangeNotifier delegate, long throttleMs, long maxEntries) {
        this.delegate = delegate;
        this.recent = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(throttleMs))
                .maximumSize(maxEntries)
                .build();
    }

    @Override
    public void onStatusChange(StatusTransitionEvent event) {
        ThrottleKey key = new ThrottleKey(event.connectionId(), event.newStatus());
        if (recent.asMap().putIfAbsent(key, Boolean.TRUE) != null) {
            log.debug("状态通知已抑制: id={}, status={}", event.connectionId(), event.newStatus());
            return;
        }
        delegate.onStatusChange(event);
    }

    record ThrottleKey(String connectionId, ConnectionStatus status) {
    }
}
