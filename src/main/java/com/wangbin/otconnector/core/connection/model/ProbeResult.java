package com.wangbin.otconnector.core.connection.model;

/**
 * 单次连接探测结果
 */
public record ProbeResult(boolean success, String message, long latencyMs) {

    public static ProbeResult success(String message) {
        return new ProbeResult(true, message, 0L);
    }

    public static ProbeResult failure(String message) {
        return new ProbeResult(false, message, 0L);
    }

    public ProbeResult withLatency(long latencyMs) {
        return new ProbeResult(success, message, latencyMs);
    }
}
