package com.wangbin.otconnector.core.health.notify;

import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;
import com.wangbin.otconnector.core.health.StatusTransitionEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThrottlingStatusChangeNotifierTest {

    private final List<StatusTransitionEvent> delivered = new ArrayList<>();

    @Test
    void repeatedTransitionIntoSameStatusIsSuppressed() {
        ThrottlingStatusChangeNotifier notifier = new ThrottlingStatusChangeNotifier(delivered::add, 60_000, 100);

        notifier.onStatusChange(event("c1", ConnectionStatus.ACTIVE, ConnectionStatus.ERROR));
        notifier.onStatusChange(event("c1", ConnectionStatus.ERROR, ConnectionStatus.ACTIVE));
        notifier.onStatusChange(event("c1", ConnectionStatus.ACTIVE, ConnectionStatus.ERROR));
        notifier.onStatusChange(event("c2", ConnectionStatus.ACTIVE, ConnectionStatus.ERROR));

        assertEquals(3, delivered.size());
        assertEquals("c2", delivered.get(2).connectionId());
    }

    @Test
    void suppressionExpires() throws Exception {
        ThrottlingStatusChangeNotifier notifier = new ThrottlingStatusChangeNotifier(delivered::add, 50, 100);

        notifier.onStatusChange(event("c1", ConnectionStatus.ACTIVE, ConnectionStatus.ERROR));
        Thread.sleep(150);
        notifier.onStatusChange(event("c1", ConnectionStatus.ACTIVE, ConnectionStatus.ERROR));

        assertEquals(2, delivered.size());
    }

    private static StatusTransitionEvent event(String id, ConnectionStatus from, ConnectionStatus to) {
        return new StatusTransitionEvent(id, "org-1", "modbus", from, to, 5L,
                to == ConnectionStatus.ERROR ? "Modbus test timeout after 5000ms" : null, Instant.now());
    }
}
