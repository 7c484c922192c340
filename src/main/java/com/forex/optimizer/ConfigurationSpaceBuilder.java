package com.forex.optimizer;

import com.forex.domain.vo.DataIndex;
import com.forex.domain.vo.Tick;
import com.forex.optimizer.configuration.Configuration;
import com.forex.optimizer.configuration.ConfigurationOption;
import com.forex.optimizer.configuration.OptionValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 参数空间构建器
 * <p>
 * 对所有参数维度做笛卡尔积：深度优先遍历维度，每个分支在自己的累加器副本上合并当前取值组，
 * 特征引用解析为列位置，数值常量原样保留。
 * </p>
 */
@Slf4j
@Component
public class ConfigurationSpaceBuilder {

    /**
     * 取值必须是特征引用（列位置）的字段
     */
    public static final List<String> COLUMN_FIELDS = List.of(
            "sma13", "ema50", "ema100", "ema200", "rsi",
            "stochasticD", "stochasticK", "prChannelUpper", "prChannelLower");

    /**
     * 数值阈值字段
     */
    public static final List<String> THRESHOLD_FIELDS = List.of(
            "rsiOverbought", "rsiOversold", "stochasticOverbought", "stochasticOversold");

    /**
     * 展开参数空间为键值映射形式，特征引用已解析为 Integer 列位置，常量为 Double
     *
     * @throws ConfigurationResolutionException 引用了不存在的特征，指标字段给了常量，或阈值字段给了引用
     */
    public List<Map<String, Number>> buildMapConfigurations(Map<String, ConfigurationOption> options, DataIndex dataIndex) {
        List<Map<String, Number>> results = new ArrayList<>();
        if (options.isEmpty()) {
            return results;
        }
        List<String> optionKeys = new ArrayList<>(options.keySet());
        expand(options, optionKeys, 0, dataIndex, Collections.emptyMap(), results);
        return results;
    }

    private void expand(Map<String, ConfigurationOption> options, List<String> optionKeys, int optionIndex,
                        DataIndex dataIndex, Map<String, Number> current, List<Map<String, Number>> results) {
        ConfigurationOption option = options.get(optionKeys.get(optionIndex));

        for (Map<String, OptionValue> assignment : option.getAssignments()) {
            // 每个分支使用独立的副本，兄弟分支之间互不影响
            Map<String, Number> branch = new LinkedHashMap<>(current);
            for (Map.Entry<String, OptionValue> entry : assignment.entrySet()) {
                branch.put(entry.getKey(), resolve(entry.getKey(), entry.getValue(), dataIndex));
            }

            if (optionIndex + 1 < optionKeys.size()) {
                expand(options, optionKeys, optionIndex + 1, dataIndex, branch, results);
            } else {
                results.add(Collections.unmodifiableMap(branch));
            }
        }
    }

    /**
     * 构建全部参数组合
     *
     * @throws ConfigurationResolutionException 引用了不存在的特征，或字段的取值类型不符
     */
    public List<Configuration> buildConfigurations(Map<String, ConfigurationOption> options, DataIndex dataIndex) {
        log.info("开始构建参数组合: 维度={}", options.keySet());

        List<Map<String, Number>> mapConfigurations = buildMapConfigurations(options, dataIndex);
        List<Configuration> configurations = new ArrayList<>(mapConfigurations.size());

        for (Map<String, Number> mapConfiguration : mapConfigurations) {
            Configuration.ConfigurationBuilder builder = Configuration.builder()
                    .timestamp(requireColumn(dataIndex, Tick.TIMESTAMP))
                    .open(requireColumn(dataIndex, Tick.OPEN))
                    .high(requireColumn(dataIndex, Tick.HIGH))
                    .low(requireColumn(dataIndex, Tick.LOW))
                    .close(requireColumn(dataIndex, Tick.CLOSE));

            for (String field : COLUMN_FIELDS) {
                Number value = mapConfiguration.get(field);
                if (value != null) {
                    setColumn(builder, field, value.intValue());
                }
            }

            for (String field : THRESHOLD_FIELDS) {
                Number value = mapConfiguration.get(field);
                if (value != null) {
                    setThreshold(builder, field, value.doubleValue());
                }
            }

            configurations.add(builder.build());
        }

        log.info("参数组合构建完成: {} 个", configurations.size());
        return configurations;
    }

    private Number resolve(String key, OptionValue value, DataIndex dataIndex) {
        if (value instanceof OptionValue.Reference reference) {
            if (THRESHOLD_FIELDS.contains(key)) {
                throw new ConfigurationResolutionException(key,
                        String.format("字段 %s 必须是数值，实际引用了特征 %s", key, reference.featureName()));
            }
            return dataIndex.findColumn(reference.featureName())
                    .orElseThrow(() -> new ConfigurationResolutionException(key,
                            String.format("字段 %s 引用了不存在的特征: %s", key, reference.featureName())));
        }
        OptionValue.Literal literal = (OptionValue.Literal) value;
        if (COLUMN_FIELDS.contains(key)) {
            throw new ConfigurationResolutionException(key,
                    String.format("字段 %s 必须引用一个特征，实际为常量 %s", key, literal.value()));
        }
        return literal.value();
    }

    private int requireColumn(DataIndex dataIndex, String featureName) {
        return dataIndex.findColumn(featureName)
                .orElseThrow(() -> new ConfigurationResolutionException(featureName,
                        "数据集中缺少基础字段: " + featureName));
    }

    private void setColumn(Configuration.ConfigurationBuilder builder, String field, int column) {
        switch (field) {
            case "sma13" -> builder.sma13(column);
            case "ema50" -> builder.ema50(column);
            case "ema100" -> builder.ema100(column);
            case "ema200" -> builder.ema200(column);
            case "rsi" -> builder.rsi(column);
            case "stochasticD" -> builder.stochasticD(column);
            case "stochasticK" -> builder.stochasticK(column);
            case "prChannelUpper" -> builder.prChannelUpper(column);
            case "prChannelLower" -> builder.prChannelLower(column);
            default -> throw new IllegalArgumentException("未知的指标字段: " + field);
        }
    }

    private void setThreshold(Configuration.ConfigurationBuilder builder, String field, double value) {
        switch (field) {
            case "rsiOverbought" -> builder.rsiOverbought(value);
            case "rsiOversold" -> builder.rsiOversold(value);
            case "stochasticOverbought" -> builder.stochasticOverbought(value);
            case "stochasticOversold" -> builder.stochasticOversold(value);
            default -> throw new IllegalArgumentException("未知的阈值字段: " + field);
        }
    }
}
