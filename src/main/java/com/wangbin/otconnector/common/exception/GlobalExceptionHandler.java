package com.wangbin.otconnector.common.exception;

import com.wangbin.otconnector.common.web.result.ApiResult;
import com.wangbin.otconnector.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理 OT 连接异常
     */
    @ExceptionHandler(OtConnectionException.class)
    public ApiResult<?> handleOtConnectionException(OtConnectionException e, HttpServletRequest request) {
        log.warn("OT连接异常 - Type: {}, Key: {}, Message: {}",
                e.getErrorType(), e.getConnectionKey(), e.getMessage());

        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.addExtra("errorType", e.getErrorType().name());
        if (e.getConnectionKey() != null) {
            result.addExtra("connectionKey", e.getConnectionKey());
        }
        if (e.isTimeout()) {
            result.addExtra("afterMs", e.getAfterMs());
        }
        return result;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage(), e);
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理参数校验异常
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ApiResult<?> handleMethodArgumentNotValidException(MethodArgumentNotValidException e,
                                                              HttpServletRequest request) {
        List<FieldError> fieldErrors = e.getBindingResult().getFieldErrors();
        String message = fieldErrors.stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));

        log.error("参数校验异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}",
                request.getRequestURI(), request.getMethod(), e.getMessage(), e);
        return ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), "系统内部错误，请联系管理员");
    }
}
