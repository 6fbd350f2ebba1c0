package com.wangbin.otconnector.core.connection.driver;

import com.wangbin.otconnector.common.exception.OtConnectionException;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;

/**
 * 依赖缺失或被禁用时的占位驱动，任何连接请求都以 UNAVAILABLE 失败
 */
public class UnavailableDriver<C extends AutoCloseable> implements ProtocolDriver<C> {

    private final String name;

    public UnavailableDriver(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public C open(ConnectionConfig config) {
        throw OtConnectionException.unavailableException(name);
    }
}
