package com.wangbin.otconnector.core.health;

import com.wangbin.otconnector.core.connection.fake.FakeModbusChannel;
import com.wangbin.otconnector.core.connection.fake.OtTestFixture;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import com.wangbin.otconnector.core.store.InMemoryConnectionRecordRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class OtConnectorLifecycleTest {

    private final OtTestFixture fixture = new OtTestFixture();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        fixture.close();
    }

    @Test
    void shutdownReleasesConnectionsWhenHealthCheckNeverStarted() {
        fixture.properties.getHealthCheck().setEnabled(false);
        FakeModbusChannel channel = new FakeModbusChannel().register(0, 7);
        fixture.modbusChannels = () -> channel;
        ConnectionHealthChecker checker = new ConnectionHealthChecker(fixture.manager,
                new InMemoryConnectionRecordRepository(), event -> { }, scheduler, fixture.properties);
        OtConnectorLifecycle lifecycle = new OtConnectorLifecycle(checker, fixture.manager, fixture.properties);

        lifecycle.onApplicationReady();
        ConnectionConfig config = new ConnectionConfig();
        config.setHost("10.0.0.20");
        fixture.manager.readModbusRegisters(config, List.of(0), 3, 1_000);
        assertFalse(checker.isRunning());
        assertEquals(1, fixture.pool.size());

        lifecycle.shutdown();

        assertEquals(0, fixture.pool.size());
        assertTrue(channel.isClosed());
    }
}
