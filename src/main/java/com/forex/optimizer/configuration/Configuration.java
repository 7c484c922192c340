package com.forex.optimizer.configuration;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * 参数空间中的一个点
 * <p>
 * 始终包含基础列（timestamp/open/high/low/close）的位置；指标列位置和阈值只有在某个参数组提供时才设置，
 * 未设置的字段通过空的 {@link OptionalInt}/{@link OptionalDouble} 表示。
 * </p>
 */
@Builder
@ToString
@EqualsAndHashCode
public final class Configuration {

    private final int timestamp;
    private final int open;
    private final int high;
    private final int low;
    private final int close;

    // 指标列位置
    private final Integer sma13;
    private final Integer ema50;
    private final Integer ema100;
    private final Integer ema200;
    private final Integer rsi;
    private final Integer stochasticD;
    private final Integer stochasticK;
    private final Integer prChannelUpper;
    private final Integer prChannelLower;

    // 阈值
    private final Double rsiOverbought;
    private final Double rsiOversold;
    private final Double stochasticOverbought;
    private final Double stochasticOversold;

    public int getTimestamp() {
        return timestamp;
    }

    public int getOpen() {
        return open;
    }

    public int getHigh() {
        return high;
    }

    public int getLow() {
        return low;
    }

    public int getClose() {
        return close;
    }

    public OptionalInt getSma13() {
        return column(sma13);
    }

    public OptionalInt getEma50() {
        return column(ema50);
    }

    public OptionalInt getEma100() {
        return column(ema100);
    }

    public OptionalInt getEma200() {
        return column(ema200);
    }

    public OptionalInt getRsi() {
        return column(rsi);
    }

    public OptionalInt getStochasticD() {
        return column(stochasticD);
    }

    public OptionalInt getStochasticK() {
        return column(stochasticK);
    }

    public OptionalInt getPrChannelUpper() {
        return column(prChannelUpper);
    }

    public OptionalInt getPrChannelLower() {
        return column(prChannelLower);
    }

    public OptionalDouble getRsiOverbought() {
        return threshold(rsiOverbought);
    }

    public OptionalDouble getRsiOversold() {
        return threshold(rsiOversold);
    }

    public OptionalDouble getStochasticOverbought() {
        return threshold(stochasticOverbought);
    }

    public OptionalDouble getStochasticOversold() {
        return threshold(stochasticOversold);
    }

    private static OptionalInt column(Integer value) {
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    private static OptionalDouble threshold(Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
