package com.forex.optimizer;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 数据准备结果
 */
@Data
@Builder
public class PreparationResult {

    private String symbol;
    private long ticksReceived;
    private long ticksPersisted;
    private int batchesFlushed;
    private int residentTicks;
    private List<String> failedBatches;
    private long preparationTimeMs;

    public boolean isSuccessful() {
        return failedBatches == null || failedBatches.isEmpty();
    }

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== 数据准备摘要 ===\n");
        sb.append(String.format("交易标的: %s\n", symbol));
        sb.append(String.format("输入Tick: %d\n", ticksReceived));
        sb.append(String.format("写入Tick: %d (%d 批)\n", ticksPersisted, batchesFlushed));
        sb.append(String.format("窗口剩余: %d\n", residentTicks));
        sb.append(String.format("准备耗时: %.1f秒\n", preparationTimeMs / 1000.0));
        if (!isSuccessful()) {
            sb.append(String.format("写入失败批次: %d\n", failedBatches.size()));
            for (String failure : failedBatches) {
                sb.append(String.format("  - %s\n", failure));
            }
        }
        return sb.toString();
    }
}
