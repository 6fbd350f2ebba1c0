package com.wangbin.otconnector.core.connection.adapter;

import com.wangbin.otconnector.common.domain.enums.OtProtocol;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import com.wangbin.otconnector.core.connection.model.ProbeResult;

/**
 * 协议适配器：连接池通过它建立、校验和关闭某一协议的客户端
 *
 * @param <C> 客户端（通道）类型
 */
public interface ProtocolAdapter<C extends AutoCloseable> {

    OtProtocol getProtocol();

    /**
     * 连接复用键，配置等价的请求必须得到相同的键
     */
    String cacheKey(ConnectionConfig config);

    /**
     * 校验必填项，缺失时抛出 CONFIG 类型的连接异常
     */
    void validate(ConnectionConfig config);

    C connect(ConnectionConfig config);

    /**
     * 复用前检查客户端是否仍然可用
     */
    boolean verifyLive(C client);

    /**
     * 关闭客户端，只记录日志不抛出异常
     */
    void disconnect(C client);

    /**
     * 在已建立的客户端上做一次轻量探测
     */
    ProbeResult probe(C client);
}
