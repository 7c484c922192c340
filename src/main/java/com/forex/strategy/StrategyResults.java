package com.forex.strategy;

import lombok.Builder;
import lombok.Data;

/**
 * 策略回测统计
 */
@Data
@Builder
public class StrategyResults {
    private double profitLoss;
    private int winCount;
    private int loseCount;
    private double winRate;
    private int tradeCount;
    private int maximumConsecutiveLosses;
    private double minimumProfitLoss;
}
