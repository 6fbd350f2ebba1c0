package com.wangbin.otconnector.core.connection.model;

import com.wangbin.otconnector.common.domain.enums.OtProtocol;

import java.time.Instant;

/**
 * 协议读取结果
 */
public interface ReadResult {

    OtProtocol getProtocol();

    Instant getTimestamp();
}
