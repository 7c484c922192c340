package com.forex.strategy.impl;

import com.forex.domain.vo.DataIndex;
import com.forex.optimizer.configuration.Configuration;
import com.forex.optimizer.configuration.ConfigurationOption;
import com.forex.optimizer.configuration.OptionValue;
import com.forex.strategy.OptimizationStrategy;
import com.forex.strategy.StrategyDefinition;
import com.forex.study.EmaStudy;
import com.forex.study.PolynomialRegressionChannelStudy;
import com.forex.study.RsiStudy;
import com.forex.study.SmaStudy;
import com.forex.study.StochasticStudy;
import com.forex.study.Study;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ReversalsStrategyDefinition implements StrategyDefinition {

    public static final String NAME = "reversals";

    // length, degree, deviations
    private static final double[][] CHANNELS = {
            {100, 2, 1.95}, {100, 2, 1.9}, {100, 3, 1.95}, {100, 4, 1.95}, {200, 3, 1.9}, {300, 2, 2.1}
    };

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "均线趋势 + RSI/随机指标超买超卖 + 多项式回归通道突破的反转策略";
    }

    @Override
    public List<Study> createStudies() {
        List<Study> studies = new ArrayList<>();
        studies.add(new EmaStudy(Map.of("length", 200), Map.of("ema", "ema200")));
        studies.add(new EmaStudy(Map.of("length", 100), Map.of("ema", "ema100")));
        studies.add(new EmaStudy(Map.of("length", 50), Map.of("ema", "ema50")));
        studies.add(new SmaStudy(Map.of("length", 13), Map.of("sma", "sma13")));
        studies.add(new RsiStudy(Map.of("length", 5), Map.of("rsi", "rsi5")));
        studies.add(new RsiStudy(Map.of("length", 7), Map.of("rsi", "rsi7")));
        studies.add(new StochasticStudy(Map.of("length", 5, "averageLength", 3),
                orderedMap("K", "stochasticK5", "D", "stochasticD5")));
        for (double[] channel : CHANNELS) {
            String suffix = channelSuffix(channel);
            studies.add(new PolynomialRegressionChannelStudy(
                    Map.of("length", channel[0], "degree", channel[1], "deviations", channel[2]),
                    orderedMap("regression", "prChannel" + suffix,
                            "upper", "prChannelUpper" + suffix,
                            "lower", "prChannelLower" + suffix)));
        }
        return studies;
    }

    @Override
    public Map<String, ConfigurationOption> getDefaultConfigurationOptions() {
        Map<String, ConfigurationOption> options = new LinkedHashMap<>();

        options.put("longTrend", ConfigurationOption.of(
                Map.of("ema200", OptionValue.reference("ema200"), "ema100", OptionValue.reference("ema100")),
                Map.of()));
        options.put("mediumTrend", ConfigurationOption.of(
                Map.of("ema100", OptionValue.reference("ema100"), "ema50", OptionValue.reference("ema50")),
                Map.of()));
        options.put("shortTrend", ConfigurationOption.of(
                Map.of("ema50", OptionValue.reference("ema50"), "sma13", OptionValue.reference("sma13")),
                Map.of()));
        options.put("rsi", ConfigurationOption.of(
                rsi("rsi5", 80, 20),
                rsi("rsi5", 77, 23),
                rsi("rsi7", 80, 20),
                rsi("rsi7", 77, 23),
                Map.of()));
        options.put("stochastic", ConfigurationOption.of(
                Map.of("stochasticK", OptionValue.reference("stochasticK5"),
                        "stochasticD", OptionValue.reference("stochasticD5"),
                        "stochasticOverbought", OptionValue.literal(80),
                        "stochasticOversold", OptionValue.literal(20)),
                Map.of()));

        List<Map<String, OptionValue>> channels = new ArrayList<>();
        for (double[] channel : CHANNELS) {
            String suffix = channelSuffix(channel);
            channels.add(Map.of(
                    "prChannelUpper", OptionValue.reference("prChannelUpper" + suffix),
                    "prChannelLower", OptionValue.reference("prChannelLower" + suffix)));
        }
        options.put("prChannel", ConfigurationOption.of(channels));

        return options;
    }

    @Override
    public OptimizationStrategy create(String symbol, DataIndex dataIndex, int group, Configuration configuration) {
        return new ReversalsOptimizationStrategy(symbol, dataIndex, group, configuration);
    }

    private static Map<String, OptionValue> rsi(String feature, double overbought, double oversold) {
        return Map.of("rsi", OptionValue.reference(feature),
                "rsiOverbought", OptionValue.literal(overbought),
                "rsiOversold", OptionValue.literal(oversold));
    }

    /**
     * 100, 2, 1.95 -> 100_2_195
     */
    static String channelSuffix(double[] channel) {
        String deviations = String.valueOf(channel[2]).replace(".", "");
        if (deviations.endsWith("0") && deviations.length() > 2) {
            deviations = deviations.substring(0, deviations.length() - 1);
        }
        return (int) channel[0] + "_" + (int) channel[1] + "_" + deviations;
    }

    private static Map<String, String> orderedMap(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
