package com.wangbin.otconnector.core.health.notify;

import com.wangbin.otconnector.core.health.StatusTransitionEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * 每个状态变化都作为 Spring 应用事件发布，告警等下游通过 @EventListener 订阅；
 * 随后交给本地处理（日志等），本地处理可以被节流，事件发布不受影响
 */
public class PublishingStatusChangeNotifier implements StatusChangeNotifier {

    private final ApplicationEventPublisher publisher;
    private final StatusChangeNotifier local;

    public PublishingStatusChangeNotifier(ApplicationEventPublisher publisher, StatusChangeNotifier local) {
        this.publisher = publisher;
        this.local = local;
    }

    @Override
    public void onStatusChange(StatusTransitionEvent event) {
        publisher.publishEvent(event);
        local.onStatusChange(event);
    }
}
