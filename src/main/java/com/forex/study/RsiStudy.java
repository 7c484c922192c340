package com.forex.study;

import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

import java.util.Map;

/**
 * 相对强弱指数，参数 length，输出 rsi
 */
public class RsiStudy extends BarSeriesStudy {

    private final int length;
    private RSIIndicator rsi;

    public RsiStudy(Map<String, ? extends Number> inputs, Map<String, String> outputMap) {
        super(inputs, outputMap);
        this.length = getIntInput("length");
    }

    @Override
    protected int getLookback() {
        // 第一根K线没有涨跌幅
        return length + 1;
    }

    @Override
    protected void initializeIndicators(BarSeries series) {
        rsi = new RSIIndicator(new ClosePriceIndicator(series), length);
    }

    @Override
    protected void calculate(Map<String, Double> outputs, int endIndex) {
        setOutput(outputs, "rsi", rsi.getValue(endIndex).doubleValue());
    }
}
