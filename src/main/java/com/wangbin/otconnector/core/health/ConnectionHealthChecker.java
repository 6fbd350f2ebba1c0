package com.wangbin.otconnector.core.health;

import com.wangbin.otconnector.common.constant.OtConstant;
import com.wangbin.otconnector.common.domain.entity.ConnectionRecord;
import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;
import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import com.wangbin.otconnector.common.exception.BusinessException;
import com.wangbin.otconnector.common.utils.JsonUtil;
import com.wangbin.otconnector.common.web.result.ResultCode;
import com.wangbin.otconnector.core.config.OtConnectorProperties;
import com.wangbin.otconnector.core.connection.manager.OtConnectionManager;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import com.wangbin.otconnector.core.connection.model.ProbeResult;
import com.wangbin.otconnector.core.health.notify.StatusChangeNotifier;
import com.wangbin.otconnector.core.store.ConnectionRecordRepository;
import com.wangbin.otconnector.core.store.ConnectionStatusUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * OT 连接健康检查调度器
 * <p>
 * 启动后立即巡检一次，之后按固定延迟周期执行，两轮巡检不会重叠。
 * 每轮按顺序逐条探测连接记录，写回探测结果，状态发生变化时发出通知；
 * 单条记录的任何异常只记录日志，不会中断本轮巡检。
 */
@Slf4j
@Service
public class ConnectionHealthChecker {

    private final OtConnectionManager connectionManager;
    private final ConnectionRecordRepository repository;
    private final StatusChangeNotifier notifier;
    private final ScheduledExecutorService scheduler;
    private final long probeTimeoutMs;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledTask;
    private volatile long intervalMs;
    private volatile SweepSummary lastSweep;

    public ConnectionHealthChecker(OtConnectionManager connectionManager,
                                   ConnectionRecordRepository repository,
                                   StatusChangeNotifier notifier,
                                   @Qualifier("healthCheckScheduler") ScheduledExecutorService scheduler,
                                   OtConnectorProperties properties) {
        this.connectionManager = connectionManager;
        this.repository = repository;
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.probeTimeoutMs = properties.getHealthCheck().getProbeTimeoutMs();
    }

    // =============== 生命周期 ===============

    /**
     * 启动周期巡检，已运行时无操作
     */
    public void start(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
        }
        lifecycleLock.lock();
        try {
            if (scheduledTask != null) {
                log.debug("健康检查已在运行，忽略重复启动");
                return;
            }
            this.intervalMs = intervalMs;
            scheduledTask = scheduler.scheduleWithFixedDelay(
                    this::runScheduledSweep, 0, intervalMs, TimeUnit.MILLISECONDS);
            log.info("OT 连接健康检查已启动，间隔: {}ms", intervalMs);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * 停止周期巡检并关闭所有池化连接，未运行时无操作
     * <p>
     * 正在进行的巡检不会被中断，会在当前记录处理完后自然结束。
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (scheduledTask == null) {
                return;
            }
            scheduledTask.cancel(false);
            scheduledTask = null;
            connectionManager.closeAll();
            log.info("OT 连接健康检查已停止");
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isRunning() {
        lifecycleLock.lock();
        try {
            return scheduledTask != null;
        } finally {
            lifecycleLock.unlock();
        }
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public SweepSummary getLastSweep() {
        return lastSweep;
    }

    // =============== 巡检 ===============

    private void runScheduledSweep() {
        try {
            sweepNow();
        } catch (Exception e) {
            // 异常逃逸会取消后续调度
            log.error("健康检查巡检异常", e);
        }
    }

    /**
     * 立即执行一轮巡检；上一轮未结束时直接返回 skipped
     */
    public SweepSummary sweepNow() {
        if (!sweeping.compareAndSet(false, true)) {
            log.info("上一轮健康检查尚未结束，跳过本次巡检");
            return SweepSummary.skipped(Instant.now());
        }
        try {
            SweepSummary summary = doSweep();
            lastSweep = summary;
            return summary;
        } finally {
            sweeping.set(false);
        }
    }

    private SweepSummary doSweep() {
        Instant startedAt = Instant.now();
        List<ConnectionRecord> records = repository.listOtConnections();
        log.debug("开始健康检查巡检，连接数: {}", records.size());

        int succeeded = 0;
        int failed = 0;
        int transitions = 0;
        for (ConnectionRecord record : records) {
            try {
                CheckOutcome outcome = checkRecord(record, false);
                if (outcome.probe().success()) {
                    succeeded++;
                } else {
                    failed++;
                }
                if (outcome.transitioned()) {
                    transitions++;
                }
            } catch (Exception e) {
                failed++;
                log.warn("连接健康检查失败: id={}, protocol={}, error={}",
                        record.getId(), record.getProtocol(), e.getMessage());
            }
        }

        SweepSummary summary = new SweepSummary(startedAt, Instant.now(),
                records.size(), succeeded, failed, transitions, false);
        log.info("健康检查巡检完成: 总数={}, 成功={}, 失败={}, 状态变化={}, 耗时={}ms",
                summary.total(), summary.succeeded(), summary.failed(), summary.transitions(), summary.durationMs());
        return summary;
    }

    /**
     * 按需检查单条连接记录，规则与周期巡检一致
     */
    public ProbeResult checkConnection(String connectionId) {
        ConnectionRecord record = repository.findById(connectionId)
                .orElseThrow(() -> new BusinessException(ResultCode.DATA_NOT_FOUND, "连接记录不存在: " + connectionId));
        return checkRecord(record, true).probe();
    }

    CheckOutcome checkRecord(ConnectionRecord record, boolean onDemand) {
        ProbeResult probe = probe(record, onDemand);
        ConnectionStatus newStatus = ConnectionStatus.fromProbe(probe.success());
        Instant now = Instant.now();
        String lastError = probe.success() ? null : probe.message();

        // 以存储中写入前的状态为准，record 可能是巡检开始时的旧快照
        ConnectionStatus oldStatus = repository.updateConnectionStatus(record.getId(),
                new ConnectionStatusUpdate(newStatus, now, lastError, probe.latencyMs()));

        if (oldStatus == newStatus) {
            return new CheckOutcome(probe, false);
        }
        StatusTransitionEvent event = new StatusTransitionEvent(record.getId(), record.getOrgId(),
                record.getProtocol(), oldStatus, newStatus, probe.latencyMs(), lastError, now);
        try {
            notifier.onStatusChange(event);
        } catch (Exception e) {
            log.warn("状态变化通知失败: id={}, error={}", record.getId(), e.getMessage());
        }
        return new CheckOutcome(probe, true);
    }

    /**
     * 周期巡检不探测无驱动的协议；按需检查时对其做配置校验
     */
    private ProbeResult probe(ConnectionRecord record, boolean onDemand) {
        OtProtocol protocol = OtProtocol.fromCode(record.getProtocol());
        if (protocol == null) {
            return onDemand
                    ? ProbeResult.failure("Unsupported OT protocol: " + record.getProtocol())
                    : ProbeResult.success(OtConstant.NOT_AUTO_CHECKED);
        }
        if (!protocol.isAutoChecked() && !onDemand) {
            return ProbeResult.success(OtConstant.NOT_AUTO_CHECKED);
        }
        ConnectionConfig config = JsonUtil.parseObject(record.getConfig(), ConnectionConfig.class);
        if (config == null) {
            return ProbeResult.failure("Invalid connection config");
        }
        return connectionManager.testConnection(protocol, config, probeTimeoutMs);
    }

    record CheckOutcome(ProbeResult probe, boolean transitioned) {
    }
}
