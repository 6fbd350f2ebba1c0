package com.wangbin.otconnector.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.otconnector.core.config.OtConnectorProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.*;

@Configuration
public class ThreadPoolConfig {

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 协议操作线程池（IO密集型）
     * <p>
     * 连接、读取、探测都在这里执行，超时由调用方通过 future 控制；
     * 被放弃的任务继续跑完，不会被中断。
     */
    @Bean(name = "otOperationExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor otOperationExecutor(OtConnectorProperties properties) {
        OtConnectorProperties.ExecutorConfig config = properties.getExecutor();
        int core = Math.max(1, config.getCoreSize());
        int max = Math.max(core, config.getMaxSize());
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                core,
                max,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, config.getQueueCapacity())),
                buildNamedThreadFactory("ot-operation", true),
                new ThreadPoolExecutor.AbortPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * 健康检查调度线程（单线程，巡检串行执行）
     */
    @Bean(name = "healthCheckScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService healthCheckScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                1,
                buildNamedThreadFactory("ot-health-check", true)
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
