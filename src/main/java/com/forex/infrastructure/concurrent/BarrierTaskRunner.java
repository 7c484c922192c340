package com.forex.infrastructure.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * 带屏障的并行执行器
 * <p>
 * {@link #runAll(String, List, Consumer)} 为每个元素提交一个任务，并阻塞直到全部任务结束。
 * 任一任务失败时，仍等待同批其余任务结束，然后抛出 {@link TaskExecutionException}，
 * 调用方不会进入下一批。
 * </p>
 */
@Slf4j
public class BarrierTaskRunner implements AutoCloseable {

    private final Executor executor;
    private final Runnable onClose;

    public BarrierTaskRunner(Executor executor) {
        this(executor, () -> { });
    }

    public BarrierTaskRunner(Executor executor, Runnable onClose) {
        this.executor = executor;
        this.onClose = onClose;
    }

    /**
     * 并行处理所有元素并等待完成
     *
     * @param barrierName 屏障名称，用于错误信息
     * @param items       待处理元素
     * @param task        对单个元素执行的任务，只能修改该元素自身的状态
     * @throws TaskExecutionException 任一任务失败
     */
    public <T> void runAll(String barrierName, List<T> items, Consumer<? super T> task) {
        if (items.isEmpty()) {
            return;
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture.runAsync(() -> task.accept(item), executor));
        }

        Throwable firstFailure = null;
        List<Throwable> otherFailures = new ArrayList<>();
        for (CompletableFuture<Void> future : futures) {
            try {
                future.join();
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (firstFailure == null) {
                    firstFailure = cause;
                } else {
                    otherFailures.add(cause);
                }
            }
        }

        if (firstFailure != null) {
            TaskExecutionException exception = new TaskExecutionException(
                    barrierName + " 并行任务失败", firstFailure, otherFailures.size() + 1, items.size());
            otherFailures.forEach(exception::addSuppressed);
            throw exception;
        }
    }

    @Override
    public void close() {
        onClose.run();
    }
}
