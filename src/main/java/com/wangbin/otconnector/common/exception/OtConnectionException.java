package com.wangbin.otconnector.common.exception;

import com.wangbin.otconnector.common.web.result.ResultCode;
import lombok.Getter;

/**
 * OT 连接异常
 */
@Getter
public class OtConnectionException extends BusinessException {

    /**
     * 错误分类
     */
    public enum ErrorType {
        CONNECT(ResultCode.CONNECTION_ERROR),
        TIMEOUT(ResultCode.TIMEOUT_ERROR),
        READ(ResultCode.READ_ERROR),
        CONFIG(ResultCode.CONFIG_INVALID),
        UNAVAILABLE(ResultCode.SERVICE_UNAVAILABLE);

        private final ResultCode resultCode;

        ErrorType(ResultCode resultCode) {
            this.resultCode = resultCode;
        }

        public ResultCode getResultCode() {
            return resultCode;
        }
    }

    private final ErrorType errorType;
    private final String connectionKey;
    /**
     * 超时阈值，仅 TIMEOUT 有效
     */
    private final long afterMs;

    public OtConnectionException(ErrorType errorType, String message, String connectionKey) {
        this(errorType, message, connectionKey, 0L, null);
    }

    public OtConnectionException(ErrorType errorType, String message, String connectionKey,
                                 long afterMs, Throwable cause) {
        super(errorType.getResultCode().getCode(), message, cause);
        this.errorType = errorType;
        this.connectionKey = connectionKey;
        this.afterMs = afterMs;
    }

    public boolean isTimeout() {
        return errorType == ErrorType.TIMEOUT;
    }

    // 创建连接异常
    public static OtConnectionException connectException(String message, String connectionKey, Throwable cause) {
        return new OtConnectionException(ErrorType.CONNECT, message, connectionKey, 0L, cause);
    }

    // 创建超时异常
    public static OtConnectionException timeoutException(String operation, String connectionKey, long afterMs) {
        return new OtConnectionException(ErrorType.TIMEOUT,
                operation + " timeout after " + afterMs + "ms", connectionKey, afterMs, null);
    }

    // 创建读取异常
    public static OtConnectionException readException(String message, String connectionKey, Throwable cause) {
        return new OtConnectionException(ErrorType.READ, message, connectionKey, 0L, cause);
    }

    // 创建配置异常
    public static OtConnectionException configException(String message) {
        return new OtConnectionException(ErrorType.CONFIG, message, null);
    }

    // 创建驱动不可用异常
    public static OtConnectionException unavailableException(String driverName) {
        return new OtConnectionException(ErrorType.UNAVAILABLE,
                driverName + " 驱动不可用，请检查依赖或 ot-connector.drivers 配置", null);
    }

    /**
     * 将任意异常归一为连接异常
     */
    public static OtConnectionException wrap(Throwable error, String connectionKey) {
        if (error instanceof OtConnectionException otError) {
            return otError;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return connectException(message, connectionKey, error);
    }
}
