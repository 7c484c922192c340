package com.forex.optimizer;

import com.forex.config.OptimizerProperties;
import com.forex.domain.vo.Tick;
import com.forex.infrastructure.concurrent.WorkerPoolFactory;
import com.forex.optimizer.configuration.Configuration;
import com.forex.strategy.OptimizationStrategy;
import com.forex.strategy.OptimizationStrategyFactory;
import com.forex.strategy.StrategyResults;
import com.forex.strategy.impl.ReversalsStrategyDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OptimizerService流程测试")
class OptimizerServiceTest {

    private static final String SYMBOL = "EURUSD";
    // 2024-01-02 08:00:00 UTC
    private static final long START = 1704182400L;
    private static final int TICKS = 400;

    private InMemoryStorageGateway gateway;
    private OptimizerService service;

    @BeforeEach
    void setUp() {
        OptimizerProperties properties = new OptimizerProperties();
        properties.getWorkerPool().setSize(4);
        properties.getPreparation().setFlushThreshold(200);
        properties.getPreparation().setRetain(150);

        gateway = new InMemoryStorageGateway();
        OptimizationStrategyFactory strategyFactory =
                new OptimizationStrategyFactory(List.of(new ReversalsStrategyDefinition()));
        service = new OptimizerService(
                gateway,
                new DatasetLoader(gateway, properties),
                new ConfigurationSpaceBuilder(),
                new BacktestScheduler(strategyFactory),
                strategyFactory,
                new WorkerPoolFactory(properties),
                properties);
    }

    @Test
    @DisplayName("准备、加载、构建参数组合、并行回测完整流程")
    void testFullPipeline() {
        PreparationResult prepared = service.prepareData("reversals", SYMBOL, sineTicks());

        assertThat(prepared.isSuccessful()).isTrue();
        assertThat(prepared.getTicksPersisted()).isEqualTo(TICKS);
        assertThat(prepared.getResidentTicks()).isZero();

        LoadedDataset data = service.loadData(SYMBOL);
        assertThat(data.dataset().getRowCount()).isEqualTo(TICKS);
        assertThat(data.dataIndex().findColumn(Tick.TIMESTAMP)).hasValue(0);
        assertThat(data.dataIndex().contains("prChannelUpper300_2_21")).isTrue();

        List<Configuration> configurations = service.buildConfigurations(
                service.getDefaultConfigurationOptions("reversals"), data.dataIndex());
        assertThat(configurations).hasSize(480);

        List<OptimizationStrategy> strategies =
                service.optimize("reversals", SYMBOL, 0, data, configurations, 1000, 0.76);

        assertThat(strategies).hasSize(480);
        assertThat(service.getStrategies()).containsExactlyElementsOf(strategies);
        for (OptimizationStrategy strategy : strategies) {
            StrategyResults results = strategy.getResults();
            assertThat(results.getTradeCount()).isEqualTo(results.getWinCount() + results.getLoseCount());
            assertThat(results.getWinRate()).isBetween(0.0, 1.0);
        }
    }

    @Test
    @DisplayName("未知策略名称时报错")
    void testUnknownStrategy() {
        assertThatThrownBy(() -> service.prepareData("momentum", SYMBOL, sineTicks()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(service.getAvailableStrategies()).containsExactly("reversals");
        assertThat(service.getStrategies()).isEmpty();
    }

    private static List<Tick> sineTicks() {
        List<Tick> ticks = new ArrayList<>(TICKS);
        for (int i = 0; i < TICKS; i++) {
            double mid = 1.10 + 0.002 * Math.sin(i / 7.0) + 0.0005 * Math.sin(i / 1.3);
            ticks.add(Tick.of(START + i * 60L, mid - 0.0001, mid + 0.0004, mid - 0.0004, mid + 0.0001));
        }
        return ticks;
    }
}
