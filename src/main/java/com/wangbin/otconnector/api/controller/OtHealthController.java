package com.wangbin.otconnector.api.controller;

import com.wangbin.otconnector.common.web.result.ApiResult;
import com.wangbin.otconnector.core.connection.manager.OtConnectionManager;
import com.wangbin.otconnector.core.health.ConnectionHealthChecker;
import com.wangbin.otconnector.core.health.SweepSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查状态接口。
 */
@RestController
@RequestMapping("/api/ot/health")
@RequiredArgsConstructor
public class OtHealthController {

    private final ConnectionHealthChecker healthChecker;
    private final OtConnectionManager connectionManager;

    @GetMapping
    public ApiResult<Map<String, Object>> health() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("running", healthChecker.isRunning());
        data.put("intervalMs", healthChecker.getIntervalMs());
        data.put("lastSweep", healthChecker.getLastSweep());
        data.put("pool", connectionManager.snapshot());
        return ApiResult.success(data);
    }

    @PostMapping("/sweep")
    public ApiResult<SweepSummary> sweep() {
        return ApiResult.success(healthChecker.sweepNow());
    }
}
