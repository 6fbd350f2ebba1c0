package com.wangbin.otconnector.core.health;

import java.time.Instant;

/**
 * 一轮巡检的汇总
 *
 * @param skipped 上一轮巡检仍在进行时为 true，其余计数均为 0
 */
public record SweepSummary(Instant startedAt,
                           Instant finishedAt,
                           int total,
                           int succeeded,
                           int failed,
                           int transitions,
                           boolean skipped) {

    static SweepSummary skipped(Instant now) {
        return new SweepSummary(now, now, 0, 0, 0, 0, true);
    }

    public long durationMs() {
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
