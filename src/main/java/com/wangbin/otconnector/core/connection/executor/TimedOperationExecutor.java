package com.wangbin.otconnector.core.connection.executor;

import com.wangbin.otconnector.common.exception.OtConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 带截止时间的协议操作执行器
 * <p>
 * 操作在独立线程池中执行，调用方最多等待 timeoutMs。超时后调用方立即得到
 * TIMEOUT 异常，底层操作不被中断，继续执行直至自行结束，结果被丢弃。
 */
@Slf4j
@Component
public class TimedOperationExecutor {

    private final Executor executor;

    public TimedOperationExecutor(@Qualifier("otOperationExecutor") Executor executor) {
        this.executor = executor;
    }

    /**
     * 异步执行，返回的 future 在超时后以 TIMEOUT 类型的连接异常完成
     */
    public <T> CompletableFuture<T> submit(String operation, String connectionKey, long timeoutMs, Supplier<T> task) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.warn("操作线程池已满，拒绝执行: operation={}, key={}", operation, connectionKey);
            return CompletableFuture.failedFuture(new OtConnectionException(
                    OtConnectionException.ErrorType.UNAVAILABLE,
                    "Operation executor saturated, rejected " + operation, connectionKey));
        }
        return future
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error == null) {
                        return result;
                    }
                    throw translate(unwrap(error), operation, connectionKey, timeoutMs);
                });
    }

    /**
     * 同步执行，最迟在 timeoutMs 后返回或抛出异常
     */
    public <T> T execute(String operation, String connectionKey, long timeoutMs, Supplier<T> task) {
        try {
            return submit(operation, connectionKey, timeoutMs, task).join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof OtConnectionException otError) {
                throw otError;
            }
            throw OtConnectionException.wrap(cause, connectionKey);
        }
    }

    private static OtConnectionException translate(Throwable error, String operation, String connectionKey,
                                                   long timeoutMs) {
        if (error instanceof TimeoutException) {
            log.warn("操作超时: operation={}, key={}, timeout={}ms", operation, connectionKey, timeoutMs);
            return OtConnectionException.timeoutException(operation, connectionKey, timeoutMs);
        }
        return OtConnectionException.wrap(error, connectionKey);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
