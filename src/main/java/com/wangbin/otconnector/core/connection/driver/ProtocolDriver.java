package com.wangbin.otconnector.core.connection.driver;

import com.wangbin.otconnector.core.connection.model.ConnectionConfig;

/**
 * 协议驱动，负责把连接配置变成一个已连接的通道
 *
 * @param <C> 通道类型
 */
public interface ProtocolDriver<C extends AutoCloseable> {

    /**
     * 驱动名称，用于日志与错误信息
     */
    String getName();

    /**
     * 驱动是否可用（依赖存在且未被配置禁用）
     */
    boolean isAvailable();

    /**
     * 建立连接，返回已就绪的通道
     */
    C open(ConnectionConfig config) throws Exception;

    /**
     * 对已创建的通道执行建连，失败时先关闭通道再抛出原异常，关闭异常作为 suppressed 附加
     */
    static <C extends AutoCloseable> C connectOrClose(C channel, ConnectAction connect) throws Exception {
        try {
            connect.connect();
            return channel;
        } catch (Exception e) {
            try {
                channel.close();
            } catch (Exception closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    @FunctionalInterface
    interface ConnectAction {
        void connect() throws Exception;
    }
}
