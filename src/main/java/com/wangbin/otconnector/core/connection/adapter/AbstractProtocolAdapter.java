package com.wangbin.otconnector.core.connection.adapter;

import com.wangbin.otconnector.common.constant.OtConstant;
import com.wangbin.otconnector.common.exception.OtConnectionException;
import com.wangbin.otconnector.core.connection.driver.ProtocolDriver;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * 协议适配器基类
 * <p>
 * 统一连接异常归类与关闭日志，子类只需实现 {@link #doValidate} 和协议相关的探测逻辑。
 */
@Slf4j
public abstract class AbstractProtocolAdapter<C extends AutoCloseable> implements ProtocolAdapter<C> {

    protected final ProtocolDriver<C> driver;

    protected AbstractProtocolAdapter(ProtocolDriver<C> driver) {
        this.driver = driver;
    }

    @Override
    public void validate(ConnectionConfig config) {
        if (config == null) {
            throw OtConnectionException.configException(getProtocol().getDisplayName() + " 连接配置为空");
        }
        doValidate(config);
    }

    @Override
    public C connect(ConnectionConfig config) {
        String key = cacheKey(config);
        long start = System.currentTimeMillis();
        try {
            C client = driver.open(config);
            log.info("{} 连接建立成功: key={}, 耗时={}ms",
                    getProtocol().getDisplayName(), key, System.currentTimeMillis() - start);
            return client;
        } catch (OtConnectionException e) {
            throw e;
        } catch (Exception e) {
            log.warn("{} 连接建立失败: key={}, error={}", getProtocol().getDisplayName(), key, e.getMessage());
            throw OtConnectionException.connectException(connectFailurePrefix() + describe(e), key, e);
        }
    }

    @Override
    public void disconnect(C client) {
        if (client == null) {
            return;
        }
        try {
            client.close();
        } catch (Exception e) {
            log.warn("{} 关闭连接异常: {}", getProtocol().getDisplayName(), e.getMessage());
        }
    }

    protected abstract void doValidate(ConnectionConfig config);

    /**
     * 连接失败时错误消息的前缀
     */
    protected String connectFailurePrefix() {
        return getProtocol().getDisplayName() + " connection failed: ";
    }

    protected static void require(String value, String message) {
        if (value == null || value.isBlank()) {
            throw OtConnectionException.configException(message);
        }
    }

    protected static String joinKey(Object... parts) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                builder.append(OtConstant.KEY_SEPARATOR);
            }
            builder.append(parts[i]);
        }
        return builder.toString();
    }

    protected static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
