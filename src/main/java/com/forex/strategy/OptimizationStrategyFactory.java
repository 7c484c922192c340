package com.forex.strategy;

import com.forex.domain.vo.DataIndex;
import com.forex.optimizer.configuration.Configuration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 优化策略工厂
 * 按名称查找策略定义并创建策略实例
 */
@Slf4j
@Component
public class OptimizationStrategyFactory {

    private final Map<String, StrategyDefinition> definitions = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public OptimizationStrategyFactory(List<StrategyDefinition> definitions) {
        for (StrategyDefinition definition : definitions) {
            if (this.definitions.put(definition.getName(), definition) != null) {
                log.warn("策略名称冲突，覆盖原有定义: {}", definition.getName());
            }
        }
        log.debug("已注册策略: {}", this.definitions.keySet());
    }

    /**
     * @throws IllegalArgumentException 策略不存在
     */
    public StrategyDefinition getDefinition(String strategyName) {
        StrategyDefinition definition = strategyName != null ? definitions.get(strategyName) : null;
        if (definition == null) {
            throw new IllegalArgumentException("未知策略: " + strategyName + "，可用策略: " + definitions.keySet());
        }
        return definition;
    }

    public OptimizationStrategy create(String strategyName, String symbol, DataIndex dataIndex,
                                       int group, Configuration configuration) {
        return getDefinition(strategyName).create(symbol, dataIndex, group, configuration);
    }

    public List<String> getAvailableStrategies() {
        return Collections.unmodifiableList(new ArrayList<>(definitions.keySet()));
    }
}
