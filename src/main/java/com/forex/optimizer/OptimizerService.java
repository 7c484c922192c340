package com.forex.optimizer;

import com.forex.config.OptimizerProperties;
import com.forex.domain.vo.DataIndex;
import com.forex.domain.vo.Tick;
import com.forex.infrastructure.concurrent.BarrierTaskRunner;
import com.forex.infrastructure.concurrent.WorkerPoolFactory;
import com.forex.optimizer.configuration.Configuration;
import com.forex.optimizer.configuration.ConfigurationOption;
import com.forex.repository.StorageGateway;
import com.forex.strategy.OptimizationStrategy;
import com.forex.strategy.OptimizationStrategyFactory;
import com.forex.strategy.StrategyDefinition;
import com.forex.study.Study;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 优化流程服务
 * 数据准备 -> 数据加载 -> 参数组合构建 -> 并行回测
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizerService {

    private final StorageGateway storageGateway;
    private final DatasetLoader datasetLoader;
    private final ConfigurationSpaceBuilder configurationSpaceBuilder;
    private final BacktestScheduler backtestScheduler;
    private final OptimizationStrategyFactory strategyFactory;
    private final WorkerPoolFactory workerPoolFactory;
    private final OptimizerProperties properties;

    private volatile List<OptimizationStrategy> strategies = List.of();

    /**
     * 为指定策略计算指标并写入存储，结束时写入窗口中剩余的Tick
     */
    public PreparationResult prepareData(String strategyName, String symbol, Iterable<Tick> ticks) {
        StrategyDefinition definition = strategyFactory.getDefinition(strategyName);
        List<Study> studies = definition.createStudies();
        log.info("策略 {} 需要 {} 个指标, {} 个输出", definition.getName(), studies.size(), getDataPropertyCount(studies));

        storageGateway.ensureIndexes();

        try (BarrierTaskRunner taskRunner = workerPoolFactory.openRunner("prepare")) {
            TickPreparer preparer = new TickPreparer(symbol, studies, storageGateway, taskRunner,
                    properties.getPreparation());
            preparer.prepare(ticks);
            return preparer.flush();
        }
    }

    public LoadedDataset loadData(String symbol) {
        return datasetLoader.load(symbol);
    }

    public Map<String, ConfigurationOption> getDefaultConfigurationOptions(String strategyName) {
        return strategyFactory.getDefinition(strategyName).getDefaultConfigurationOptions();
    }

    public List<Configuration> buildConfigurations(Map<String, ConfigurationOption> options, DataIndex dataIndex) {
        return configurationSpaceBuilder.buildConfigurations(options, dataIndex);
    }

    /**
     * 对全部参数组合执行并行回测
     *
     * @return 各参数组合对应的策略实例，回测结果通过 {@link OptimizationStrategy#getResults()} 查询
     */
    public List<OptimizationStrategy> optimize(String strategyName, String symbol, int group, LoadedDataset data,
                                               List<Configuration> configurations,
                                               double investment, double profitability) {
        try (BarrierTaskRunner taskRunner = workerPoolFactory.openRunner("optimize")) {
            strategies = List.copyOf(backtestScheduler.optimize(taskRunner, strategyName, symbol, group, data,
                    configurations, investment, profitability));
            return strategies;
        }
    }

    /**
     * 最近一次优化的策略实例
     */
    public List<OptimizationStrategy> getStrategies() {
        return strategies;
    }

    public List<String> getAvailableStrategies() {
        return strategyFactory.getAvailableStrategies();
    }

    static int getDataPropertyCount(List<Study> studies) {
        int count = 0;
        for (Study study : studies) {
            count += study.getOutputMap().size();
        }
        return count;
    }
}
