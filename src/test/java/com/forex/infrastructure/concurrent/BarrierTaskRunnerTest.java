package com.forex.infrastructure.concurrent;

import com.forex.config.OptimizerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BarrierTaskRunner单元测试")
class BarrierTaskRunnerTest {

    @Test
    @DisplayName("所有任务完成后才返回")
    void testRunAllWaitsForEveryTask() {
        OptimizerProperties properties = new OptimizerProperties();
        properties.getWorkerPool().setSize(4);
        AtomicInteger completed = new AtomicInteger();

        try (BarrierTaskRunner runner = new WorkerPoolFactory(properties).openRunner("test")) {
            runner.runAll("batch", List.of(1, 2, 3, 4, 5, 6, 7, 8), i -> {
                sleep(10L * i);
                completed.incrementAndGet();
            });
            assertThat(completed.get()).isEqualTo(8);
        }
    }

    @Test
    @DisplayName("任务在线程池中并行执行")
    void testTasksRunInParallel() throws InterruptedException {
        OptimizerProperties properties = new OptimizerProperties();
        properties.getWorkerPool().setSize(3);
        CountDownLatch allStarted = new CountDownLatch(3);
        Set<String> threadNames = ConcurrentHashMap.newKeySet();

        try (BarrierTaskRunner runner = new WorkerPoolFactory(properties).openRunner("parallel")) {
            // 三个任务互相等待，串行执行会超时
            runner.runAll("latch", List.of(1, 2, 3), i -> {
                threadNames.add(Thread.currentThread().getName());
                allStarted.countDown();
                try {
                    assertThat(allStarted.await(5, TimeUnit.SECONDS)).isTrue();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            });
        }

        assertThat(threadNames).hasSize(3).allMatch(name -> name.startsWith("optimizer-worker-parallel-"));
    }

    @Test
    @DisplayName("多个任务失败时等待全部结束并聚合错误")
    void testFailuresAggregated() {
        AtomicInteger finished = new AtomicInteger();

        try (BarrierTaskRunner runner = new BarrierTaskRunner(Runnable::run)) {
            assertThatThrownBy(() -> runner.runAll("agg", List.of(1, 2, 3, 4), i -> {
                finished.incrementAndGet();
                if (i % 2 == 0) {
                    throw new IllegalArgumentException("bad " + i);
                }
            }))
                    .isInstanceOf(TaskExecutionException.class)
                    .hasMessageContaining("失败任务 2/4")
                    .hasCauseInstanceOf(IllegalArgumentException.class)
                    .satisfies(e -> {
                        TaskExecutionException ex = (TaskExecutionException) e;
                        assertThat(ex.getFailedTasks()).isEqualTo(2);
                        assertThat(ex.getTotalTasks()).isEqualTo(4);
                        assertThat(ex.getSuppressed()).hasSize(1);
                    });
        }
        assertThat(finished.get()).isEqualTo(4);
    }

    @Test
    @DisplayName("关闭时执行回调")
    void testCloseRunsCallback() {
        AtomicBoolean closed = new AtomicBoolean();
        BarrierTaskRunner runner = new BarrierTaskRunner(Runnable::run, () -> closed.set(true));

        runner.runAll("empty", List.<Integer>of(), i -> { });
        runner.close();

        assertThat(closed.get()).isTrue();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
