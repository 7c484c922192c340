package com.forex.study;

import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.StochasticOscillatorKIndicator;

import java.util.Map;

/**
 * 随机指标，参数 length 和 averageLength（默认3），输出 K 和 D
 */
public class StochasticStudy extends BarSeriesStudy {

    private final int length;
    private final int averageLength;
    private StochasticOscillatorKIndicator k;
    private SMAIndicator d;

    public StochasticStudy(Map<String, ? extends Number> inputs, Map<String, String> outputMap) {
        super(inputs, outputMap);
        this.length = getIntInput("length");
        this.averageLength = (int) getInput("averageLength", 3);
        if (averageLength <= 0) {
            throw new IllegalArgumentException("StochasticStudy 参数 averageLength 必须为正数: " + averageLength);
        }
    }

    @Override
    protected int getLookback() {
        return length + averageLength - 1;
    }

    @Override
    protected void initializeIndicators(BarSeries series) {
        k = new StochasticOscillatorKIndicator(series, length);
        d = new SMAIndicator(k, averageLength);
    }

    @Override
    protected void calculate(Map<String, Double> outputs, int endIndex) {
        setOutput(outputs, "K", k.getValue(endIndex).doubleValue());
        setOutput(outputs, "D", d.getValue(endIndex).doubleValue());
    }
}
