package com.wangbin.otconnector.api.controller;

import com.wangbin.otconnector.common.domain.dto.connection.ReadConnectionRequest;
import com.wangbin.otconnector.common.domain.dto.connection.TestConnectionRequest;
import com.wangbin.otconnector.common.domain.entity.ConnectionRecord;
import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import com.wangbin.otconnector.common.exception.OtConnectionException;
import com.wangbin.otconnector.common.web.result.ApiResult;
import com.wangbin.otconnector.core.connection.manager.OtConnectionManager;
import com.wangbin.otconnector.core.connection.model.ProbeResult;
import com.wangbin.otconnector.core.connection.model.ReadRequest;
import com.wangbin.otconnector.core.connection.model.ReadResult;
import com.wangbin.otconnector.core.health.ConnectionHealthChecker;
import com.wangbin.otconnector.core.store.ConnectionRecordRepository;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * OT 连接管理控制器
 * 提供连接记录查询、连接测试与数据读取接口
 */
@Slf4j
@RestController
@RequestMapping("/api/ot/connections")
@RequiredArgsConstructor
public class OtConnectionController {

    private final OtConnectionManager connectionManager;
    private final ConnectionHealthChecker healthChecker;
    private final ConnectionRecordRepository repository;

    @GetMapping
    public ApiResult<List<ConnectionRecord>> listConnections() {
        return ApiResult.success(repository.findAll());
    }

    /**
     * 测试已登记的连接并写回状态
     */
    @PostMapping("/{id}/test")
    public ApiResult<ProbeResult> testConnection(@PathVariable String id) {
        ProbeResult result = healthChecker.checkConnection(id);
        log.info("连接测试完成: id={}, success={}, latency={}ms", id, result.success(), result.latencyMs());
        return ApiResult.success(result);
    }

    /**
     * 测试未登记的连接配置，不写回任何状态
     */
    @PostMapping("/test")
    public ApiResult<ProbeResult> testConfig(@Valid @RequestBody TestConnectionRequest request) {
        OtProtocol protocol = requireProtocol(request.getProtocol());
        ProbeResult result = request.getTimeoutMs() != null && request.getTimeoutMs() > 0
                ? connectionManager.testConnection(protocol, request.getConfig(), request.getTimeoutMs())
                : connectionManager.testConnection(protocol, request.getConfig());
        return ApiResult.success(result);
    }

    @PostMapping("/read")
    public ApiResult<ReadResult> read(@Valid @RequestBody ReadConnectionRequest request) {
        OtProtocol protocol = requireProtocol(request.getProtocol());
        ReadRequest readRequest = ReadRequest.builder()
                .targets(request.getTargets())
                .functionCode(request.getFunctionCode())
                .qos(request.getQos())
                .timeoutMs(request.getTimeoutMs())
                .build();
        return ApiResult.success(connectionManager.readConnection(protocol, request.getConfig(), readRequest));
    }

    private static OtProtocol requireProtocol(String code) {
        OtProtocol protocol = OtProtocol.fromCode(code);
        if (protocol == null) {
            throw OtConnectionException.configException("Unsupported OT protocol: " + code);
        }
        return protocol;
    }
}
