package com.forex.infrastructure.concurrent;

import com.forex.config.OptimizerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * 工作线程池工厂
 * 每个处理阶段（数据准备、回测）使用一个独立的有界线程池，阶段结束时关闭
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerPoolFactory {

    private final OptimizerProperties properties;

    /**
     * 为一个处理阶段创建屏障执行器，关闭时同时关闭线程池
     */
    public BarrierTaskRunner openRunner(String passName) {
        ThreadPoolTaskExecutor executor = createExecutor(passName);
        return new BarrierTaskRunner(executor, executor::shutdown);
    }

    ThreadPoolTaskExecutor createExecutor(String passName) {
        OptimizerProperties.WorkerPool pool = properties.getWorkerPool();
        int size = pool.resolveSize();
        log.info("创建工作线程池: pass={}, threads={}", passName, size);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // 固定大小，任务在屏障处全部完成后才提交下一批，无需额外的拒绝策略
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setKeepAliveSeconds(60);

        executor.setThreadNamePrefix(pool.getThreadNamePrefix() + passName + "-");
        executor.setDaemon(true);

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(pool.getAwaitTerminationSeconds());

        executor.initialize();
        return executor;
    }
}
