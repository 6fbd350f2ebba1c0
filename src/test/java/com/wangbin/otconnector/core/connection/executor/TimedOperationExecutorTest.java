package com.wangbin.otconnector.core.connection.executor;

import com.wangbin.otconnector.common.exception.OtConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TimedOperationExecutorTest {

    private final ThreadPoolExecutor workers = new ThreadPoolExecutor(
            2, 2, 60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>());
    private final TimedOperationExecutor executor = new TimedOperationExecutor(workers);

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void returnsResultWithinDeadline() {
        String result = executor.execute("Modbus read", "modbus|h|502|1", 1_000, () -> "ok");
        assertEquals("ok", result);
    }

    @Test
    void hangingOperationTimesOutAndIsNotInterrupted() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean(false);
        AtomicBoolean finished = new AtomicBoolean(false);

        long start = System.nanoTime();
        OtConnectionException error = assertThrows(OtConnectionException.class,
                () -> executor.execute("Modbus test", "modbus|h|502|1", 200, () -> {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        interrupted.set(true);
                    }
                    finished.set(true);
                    return "late";
                }));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(error.isTimeout());
        assertEquals(200, error.getAfterMs());
        assertEquals("modbus|h|502|1", error.getConnectionKey());
        assertEquals("Modbus test timeout after 200ms", error.getMessage());
        assertTrue(elapsedMs >= 200 && elapsedMs < 1_500, "elapsed " + elapsedMs);

        // 被放弃的任务仍然在跑，放行后正常结束
        release.countDown();
        long deadline = System.currentTimeMillis() + 2_000;
        while (!finished.get() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(finished.get());
        assertFalse(interrupted.get());
    }

    @Test
    void operationErrorsAreWrappedWithConnectionKey() {
        OtConnectionException error = assertThrows(OtConnectionException.class,
                () -> executor.execute("OPC UA read", "opcua|e|anonymous", 1_000, () -> {
                    throw new IllegalStateException("session closed");
                }));
        assertEquals(OtConnectionException.ErrorType.CONNECT, error.getErrorType());
        assertEquals("session closed", error.getMessage());
        assertEquals("opcua|e|anonymous", error.getConnectionKey());
    }

    @Test
    void typedErrorsPassThroughUnchanged() {
        OtConnectionException original = OtConnectionException.readException("bad read", "k", null);
        OtConnectionException error = assertThrows(OtConnectionException.class,
                () -> executor.execute("OPC UA read", "k", 1_000, () -> {
                    throw original;
                }));
        assertSame(original, error);
    }

    @Test
    void saturatedPoolReportsUnavailable() throws Exception {
        ThreadPoolExecutor single = new ThreadPoolExecutor(1, 1, 60L, TimeUnit.SECONDS, new SynchronousQueue<>());
        TimedOperationExecutor saturated = new TimedOperationExecutor(single);
        CountDownLatch release = new CountDownLatch(1);
        try {
            saturated.submit("MQTT subscribe", "a", 5_000, () -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            });
            OtConnectionException error = assertThrows(OtConnectionException.class,
                    () -> saturated.execute("MQTT subscribe", "b", 5_000, () -> "never"));
            assertEquals(OtConnectionException.ErrorType.UNAVAILABLE, error.getErrorType());
        } finally {
            release.countDown();
            single.shutdownNow();
        }
    }
}
