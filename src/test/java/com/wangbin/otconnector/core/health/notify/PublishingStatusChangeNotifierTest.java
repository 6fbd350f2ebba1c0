package com.wangbin.otconnector.core.health.notify;

import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;
import com.wangbin.otconnector.core.health.StatusTransitionEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PublishingStatusChangeNotifierTest {

    private final List<Object> published = new ArrayList<>();
    private final List<StatusTransitionEvent> logged = new ArrayList<>();

    @Test
    void publishesEveryEventAndForwardsToLocalHandling() {
        PublishingStatusChangeNotifier notifier = new PublishingStatusChangeNotifier(published::add, logged::add);
        StatusTransitionEvent event = event("c1", null, ConnectionStatus.ACTIVE);

        notifier.onStatusChange(event);

        assertEquals(List.of(event), published);
        assertEquals(List.of(event), logged);
    }

    @Test
    void flappingConnectionLeavesListenersWithTheLatestStatus() {
        PublishingStatusChangeNotifier notifier = new PublishingStatusChangeNotifier(published::add,
                new ThrottlingStatusChangeNotifier(logged::add, 60_000, 100));

        notifier.onStatusChange(event("c1", ConnectionStatus.ACTIVE, ConnectionStatus.ERROR));
        notifier.onStatusChange(event("c1", ConnectionStatus.ERROR, ConnectionStatus.ACTIVE));
        notifier.onStatusChange(event("c1", ConnectionStatus.ACTIVE, ConnectionStatus.ERROR));

        assertEquals(3, published.size());
        StatusTransitionEvent last = (StatusTransitionEvent) published.get(2);
        assertEquals(ConnectionStatus.ERROR, last.newStatus());
        // 本地日志仍按窗口节流
        assertEquals(2, logged.size());
    }

    @Test
    void loggingNotifierAcceptsEveryStatus() {
        LoggingStatusChangeNotifier logging = new LoggingStatusChangeNotifier();

        assertDoesNotThrow(() -> {
            logging.onStatusChange(event("c1", null, ConnectionStatus.ACTIVE));
            logging.onStatusChange(event("c1", ConnectionStatus.ACTIVE, ConnectionStatus.ERROR));
        });
    }

    private static StatusTransitionEvent event(String id, ConnectionStatus from, ConnectionStatus to) {
        return new StatusTransitionEvent(id, "org-1", "opcua", from, to, 12L,
                to == ConnectionStatus.ERROR ? "OPC UA test timeout after 5000ms" : null, Instant.now());
    }
}
