package com.forex.study;

import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

import java.util.Map;

/**
 * 简单移动平均，参数 length，输出 sma
 */
public class SmaStudy extends BarSeriesStudy {

    private final int length;
    private SMAIndicator sma;

    public SmaStudy(Map<String, ? extends Number> inputs, Map<String, String> outputMap) {
        super(inputs, outputMap);
        this.length = getIntInput("length");
    }

    @Override
    protected int getLookback() {
        return length;
    }

    @Override
    protected void initializeIndicators(BarSeries series) {
        sma = new SMAIndicator(new ClosePriceIndicator(series), length);
    }

    @Override
    protected void calculate(Map<String, Double> outputs, int endIndex) {
        setOutput(outputs, "sma", sma.getValue(endIndex).doubleValue());
    }
}
