package com.forex.strategy;

import com.forex.domain.vo.DataIndex;
import com.forex.optimizer.configuration.Configuration;
import com.forex.optimizer.configuration.ConfigurationOption;
import com.forex.study.Study;

import java.util.List;
import java.util.Map;

/**
 * 策略定义
 * 描述一种策略需要预先计算的指标、默认的参数空间以及如何创建策略实例
 */
public interface StrategyDefinition {

    String getName();

    String getDescription();

    /**
     * 创建数据准备阶段使用的指标，每次调用返回新的实例
     */
    List<Study> createStudies();

    /**
     * 默认参数空间
     */
    Map<String, ConfigurationOption> getDefaultConfigurationOptions();

    OptimizationStrategy create(String symbol, DataIndex dataIndex, int group, Configuration configuration);
}
