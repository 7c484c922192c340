package com.forex.strategy.impl;

import com.forex.domain.vo.DataIndex;
import com.forex.domain.vo.Tick;
import com.forex.optimizer.ConfigurationSpaceBuilder;
import com.forex.optimizer.configuration.Configuration;
import com.forex.optimizer.configuration.ConfigurationOption;
import com.forex.strategy.OptimizationStrategyFactory;
import com.forex.study.Study;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReversalsStrategyDefinition单元测试")
class ReversalsStrategyDefinitionTest {

    private final ReversalsStrategyDefinition definition = new ReversalsStrategyDefinition();

    @Test
    @DisplayName("通道参数转换为特征名后缀")
    void testChannelSuffix() {
        assertThat(ReversalsStrategyDefinition.channelSuffix(new double[]{100, 2, 1.95})).isEqualTo("100_2_195");
        assertThat(ReversalsStrategyDefinition.channelSuffix(new double[]{200, 3, 1.9})).isEqualTo("200_3_19");
        assertThat(ReversalsStrategyDefinition.channelSuffix(new double[]{300, 2, 2.1})).isEqualTo("300_2_21");
    }

    @Test
    @DisplayName("默认参数选项全部引用指标产生的特征")
    void testDefaultOptionsResolveAgainstStudyOutputs() {
        List<String> features = new ArrayList<>(List.of(
                Tick.TIMESTAMP, Tick.OPEN, Tick.HIGH, Tick.LOW, Tick.CLOSE));
        for (Study study : definition.createStudies()) {
            features.addAll(study.getOutputMap());
        }
        DataIndex dataIndex = DataIndex.of(features);
        Map<String, ConfigurationOption> options = definition.getDefaultConfigurationOptions();

        List<Configuration> configurations = new ConfigurationSpaceBuilder().buildConfigurations(options, dataIndex);

        // 2 x 2 x 2 x 5 x 2 x 6
        assertThat(configurations).hasSize(480);
        assertThat(configurations).allMatch(c -> c.getPrChannelUpper().isPresent());
    }

    @Test
    @DisplayName("工厂按名称（忽略大小写）创建策略")
    void testFactoryLookup() {
        OptimizationStrategyFactory factory = new OptimizationStrategyFactory(List.of(definition));
        Configuration configuration = Configuration.builder().close(4).build();

        assertThat(factory.create("Reversals", "EURUSD", DataIndex.empty(), 0, configuration))
                .isInstanceOf(ReversalsOptimizationStrategy.class);
        assertThat(factory.getAvailableStrategies()).containsExactly("reversals");
        assertThatThrownBy(() -> factory.getDefinition("momentum"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("momentum");
    }
}
