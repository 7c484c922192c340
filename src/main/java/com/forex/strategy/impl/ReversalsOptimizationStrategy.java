package com.forex.strategy.impl;

import com.forex.domain.vo.DataIndex;
import com.forex.domain.vo.DatasetRow;
import com.forex.optimizer.configuration.Configuration;
import com.forex.strategy.AbstractOptimizationStrategy;
import com.forex.strategy.position.CallPosition;
import com.forex.strategy.position.PutPosition;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * 反转策略
 * <p>
 * 在趋势、超买超卖和回归通道条件同时满足时，于下一行的开盘价开出5分钟到期的看跌或看涨仓位。
 * 只有参数组合中设置了的条件才参与判断；被判断的列为 NaN（指标预热期）时当行不交易。
 * </p>
 */
public class ReversalsOptimizationStrategy extends AbstractOptimizationStrategy {

    static final int EXPIRATION_MINUTES = 5;
    static final long CONTIGUOUS_SECONDS = 60;

    // UTC 0 点到 7 点之间不发出信号
    static final int TRADING_START_HOUR = 7;

    private boolean putNextTick;
    private boolean callNextTick;
    private long previousTimestamp = Long.MIN_VALUE;

    public ReversalsOptimizationStrategy(String symbol, DataIndex dataIndex, int group, Configuration configuration) {
        super(symbol, dataIndex, group, configuration);
    }

    @Override
    public void backtest(DatasetRow row, double investment, double profitability) {
        Configuration configuration = getConfiguration();
        long timestamp = (long) row.get(configuration.getTimestamp());
        boolean contiguous = previousTimestamp != Long.MIN_VALUE
                && timestamp - previousTimestamp <= CONTIGUOUS_SECONDS;

        // 上一行发出的信号只在数据连续时执行
        if (contiguous && (putNextTick || callNextTick)) {
            double open = row.get(configuration.getOpen());
            long expiration = timestamp + (EXPIRATION_MINUTES - 1) * 60L;
            if (putNextTick) {
                addPosition(new PutPosition(getSymbol(), timestamp, open, investment, profitability, expiration));
            } else {
                addPosition(new CallPosition(getSymbol(), timestamp, open, investment, profitability, expiration));
            }
        }
        putNextTick = false;
        callNextTick = false;

        closeExpiredPositions(row.get(configuration.getClose()), timestamp);

        previousTimestamp = timestamp;

        int hour = Instant.ofEpochSecond(timestamp).atZone(ZoneOffset.UTC).getHour();
        if (hour < TRADING_START_HOUR) {
            return;
        }

        Signal signal = new Signal();
        checkTrend(signal, row, configuration.getEma200(), configuration.getEma100());
        checkTrend(signal, row, configuration.getEma100(), configuration.getEma50());
        checkTrend(signal, row, configuration.getEma50(), configuration.getSma13());
        checkOscillator(signal, row, configuration.getRsi(),
                configuration.getRsiOverbought(), configuration.getRsiOversold());
        checkOscillator(signal, row, configuration.getStochasticK(),
                configuration.getStochasticOverbought(), configuration.getStochasticOversold());
        checkOscillator(signal, row, configuration.getStochasticD(),
                configuration.getStochasticOverbought(), configuration.getStochasticOversold());
        checkChannel(signal, row, configuration);

        // 两个方向同时满足时视为冲突，不交易
        if (signal.put != signal.call) {
            putNextTick = signal.put;
            callNextTick = signal.call;
        }
    }

    boolean isPutNextTick() {
        return putNextTick;
    }

    boolean isCallNextTick() {
        return callNextTick;
    }

    /**
     * 长周期均线在短周期均线之下时不看跌，之上时不看涨
     */
    private void checkTrend(Signal signal, DatasetRow row, OptionalInt longer, OptionalInt shorter) {
        if (longer.isEmpty() || shorter.isEmpty()) {
            return;
        }
        double longerValue = row.get(longer.getAsInt());
        double shorterValue = row.get(shorter.getAsInt());
        if (Double.isNaN(longerValue) || Double.isNaN(shorterValue)) {
            signal.disable();
            return;
        }
        if (longerValue < shorterValue) {
            signal.put = false;
        }
        if (longerValue > shorterValue) {
            signal.call = false;
        }
    }

    /**
     * 看跌要求超买，看涨要求超卖
     */
    private void checkOscillator(Signal signal, DatasetRow row, OptionalInt column,
                                 OptionalDouble overbought, OptionalDouble oversold) {
        if (column.isEmpty()) {
            return;
        }
        double value = row.get(column.getAsInt());
        if (Double.isNaN(value)) {
            signal.disable();
            return;
        }
        if (overbought.isPresent() && value <= overbought.getAsDouble()) {
            signal.put = false;
        }
        if (oversold.isPresent() && value >= oversold.getAsDouble()) {
            signal.call = false;
        }
    }

    /**
     * 看跌要求最高价突破通道上轨，看涨要求最低价跌破通道下轨
     */
    private void checkChannel(Signal signal, DatasetRow row, Configuration configuration) {
        OptionalInt upper = configuration.getPrChannelUpper();
        OptionalInt lower = configuration.getPrChannelLower();
        if (upper.isPresent()) {
            double upperValue = row.get(upper.getAsInt());
            if (Double.isNaN(upperValue)) {
                signal.disable();
            } else if (row.get(configuration.getHigh()) <= upperValue) {
                signal.put = false;
            }
        }
        if (lower.isPresent()) {
            double lowerValue = row.get(lower.getAsInt());
            if (Double.isNaN(lowerValue)) {
                signal.disable();
            } else if (row.get(configuration.getLow()) >= lowerValue) {
                signal.call = false;
            }
        }
    }

    private static final class Signal {
        private boolean put = true;
        private boolean call = true;

        private void disable() {
            put = false;
            call = false;
        }
    }
}
