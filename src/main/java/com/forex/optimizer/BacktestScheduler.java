package com.forex.optimizer;

import com.forex.domain.vo.DataIndex;
import com.forex.domain.vo.Dataset;
import com.forex.domain.vo.DatasetRow;
import com.forex.infrastructure.concurrent.BarrierTaskRunner;
import com.forex.optimizer.configuration.Configuration;
import com.forex.strategy.OptimizationStrategy;
import com.forex.strategy.OptimizationStrategyFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 并行回测调度器
 * <p>
 * 每个参数组合对应一个策略实例。逐行推进数据集：同一行内所有策略并行执行，
 * 全部完成后才进入下一行，保证每个策略严格按行顺序看到数据。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestScheduler {

    private final OptimizationStrategyFactory strategyFactory;

    /**
     * 为每个参数组合创建一个策略实例
     */
    public List<OptimizationStrategy> prepareStrategies(String strategyName, String symbol, DataIndex dataIndex,
                                                        int group, List<Configuration> configurations) {
        List<OptimizationStrategy> strategies = new ArrayList<>(configurations.size());
        for (Configuration configuration : configurations) {
            strategies.add(strategyFactory.create(strategyName, symbol, dataIndex, group, configuration));
        }
        log.info("已创建 {} 个策略实例", strategies.size());
        return strategies;
    }

    /**
     * 用全部数据行驱动所有策略
     *
     * @throws com.forex.infrastructure.concurrent.TaskExecutionException 任一策略在某行失败，该行所有任务结束后终止
     */
    public void backtest(BarrierTaskRunner taskRunner, Dataset dataset, List<OptimizationStrategy> strategies,
                         double investment, double profitability) {
        int rowCount = dataset.getRowCount();
        log.info("开始优化: rows={}, strategies={}", rowCount, strategies.size());
        if (strategies.isEmpty()) {
            return;
        }

        long startTime = System.currentTimeMillis();
        int progressStep = Math.max(1, rowCount / 10);

        for (int i = 0; i < rowCount; i++) {
            DatasetRow row = dataset.row(i);
            taskRunner.runAll("回测第" + i + "行", strategies,
                    strategy -> strategy.backtest(row, investment, profitability));

            if ((i + 1) % progressStep == 0) {
                log.info("优化进度: {}%", String.format("%.1f", (i + 1) * 100.0 / rowCount));
            }
        }

        log.info("优化完成: 耗时={}ms", System.currentTimeMillis() - startTime);
    }

    /**
     * 创建策略并完成一次回测，返回策略实例供查询结果
     */
    public List<OptimizationStrategy> optimize(BarrierTaskRunner taskRunner, String strategyName, String symbol, int group,
                                               LoadedDataset data, List<Configuration> configurations,
                                               double investment, double profitability) {
        List<OptimizationStrategy> strategies =
                prepareStrategies(strategyName, symbol, data.dataIndex(), group, configurations);
        backtest(taskRunner, data.dataset(), strategies, investment, profitability);
        return strategies;
    }
}
