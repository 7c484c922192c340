package com.forex.infrastructure.concurrent;

/**
 * 并行任务执行失败
 * 同一屏障内的第一个失败作为 cause，其余失败作为 suppressed 附加
 */
public class TaskExecutionException extends RuntimeException {

    private final int failedTasks;
    private final int totalTasks;

    public TaskExecutionException(String message, Throwable cause, int failedTasks, int totalTasks) {
        super(String.format("%s (失败任务 %d/%d): %s", message, failedTasks, totalTasks,
                cause != null ? cause.getMessage() : "unknown"), cause);
        this.failedTasks = failedTasks;
        this.totalTasks = totalTasks;
    }

    public int getFailedTasks() {
        return failedTasks;
    }

    public int getTotalTasks() {
        return totalTasks;
    }
}
