package com.forex.study;

import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

import java.util.Map;

/**
 * 指数移动平均，参数 length，输出 ema
 */
public class EmaStudy extends BarSeriesStudy {

    private final int length;
    private EMAIndicator ema;

    public EmaStudy(Map<String, ? extends Number> inputs, Map<String, String> outputMap) {
        super(inputs, outputMap);
        this.length = getIntInput("length");
    }

    @Override
    protected int getLookback() {
        return length;
    }

    @Override
    protected void initializeIndicators(BarSeries series) {
        ema = new EMAIndicator(new ClosePriceIndicator(series), length);
    }

    @Override
    protected void calculate(Map<String, Double> outputs, int endIndex) {
        setOutput(outputs, "ema", ema.getValue(endIndex).doubleValue());
    }
}
