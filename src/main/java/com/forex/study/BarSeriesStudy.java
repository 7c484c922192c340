package com.forex.study;

import com.forex.domain.vo.Tick;
import org.ta4j.core.Bar;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBar;
import org.ta4j.core.BaseBarSeries;
import org.ta4j.core.num.DoubleNum;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;

/**
 * 基于 TA4J 的指标基类
 * <p>
 * 每次 tick 把窗口最后一个Tick追加到内部的 BarSeries 中；窗口重新开始（只含一个Tick）时
 * 重建 BarSeries 和指标，保证指标不跨越交易时段中断。
 * 时间戳与上一根Bar相同的Tick替换最后一根Bar，而不是追加新的Bar。
 * </p>
 */
public abstract class BarSeriesStudy extends AbstractStudy {

    private static final int MIN_MAXIMUM_BAR_COUNT = 1000;

    private static final Duration BAR_PERIOD = Duration.ofMinutes(1);

    private BarSeries series;

    protected BarSeriesStudy(Map<String, ? extends Number> inputs, Map<String, String> outputMap) {
        super(inputs, outputMap);
    }

    @Override
    protected void calculate(Map<String, Double> outputs) {
        Tick tick = getLastTick();
        if (series == null || getData().size() == 1) {
            series = new BaseBarSeries(getClass().getSimpleName(), DoubleNum::valueOf);
            series.setMaximumBarCount(Math.max(MIN_MAXIMUM_BAR_COUNT, getLookback() * 10));
            initializeIndicators(series);
        }

        ZonedDateTime endTime = ZonedDateTime.ofInstant(Instant.ofEpochSecond(tick.getTimestamp()), ZoneOffset.UTC);
        boolean replace = series.getBarCount() > 0 && !endTime.isAfter(series.getLastBar().getEndTime());
        Bar bar = BaseBar.builder()
                .timePeriod(BAR_PERIOD)
                .endTime(replace ? series.getLastBar().getEndTime() : endTime)
                .openPrice(DoubleNum.valueOf(tick.get(Tick.OPEN)))
                .highPrice(DoubleNum.valueOf(tick.get(Tick.HIGH)))
                .lowPrice(DoubleNum.valueOf(tick.get(Tick.LOW)))
                .closePrice(DoubleNum.valueOf(tick.get(Tick.CLOSE)))
                .volume(DoubleNum.valueOf(0))
                .build();
        series.addBar(bar, replace);

        int endIndex = series.getEndIndex();
        int barCount = series.getEndIndex() - series.getBeginIndex() + 1;
        if (barCount >= getLookback()) {
            calculate(outputs, endIndex);
        }
    }

    /**
     * 输出有效值所需的最少Tick数
     */
    protected abstract int getLookback();

    /**
     * 为新的 BarSeries 创建指标
     */
    protected abstract void initializeIndicators(BarSeries series);

    /**
     * 计算 endIndex 处的输出
     */
    protected abstract void calculate(Map<String, Double> outputs, int endIndex);
}
