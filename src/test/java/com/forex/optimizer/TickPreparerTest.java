package com.forex.optimizer;

import com.forex.config.OptimizerProperties;
import com.forex.domain.vo.Tick;
import com.forex.infrastructure.concurrent.BarrierTaskRunner;
import com.forex.infrastructure.concurrent.TaskExecutionException;
import com.forex.study.AbstractStudy;
import com.forex.study.EmaStudy;
import com.forex.study.Study;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("TickPreparer单元测试")
class TickPreparerTest {

    private static final String SYMBOL = "EURUSD";

    private InMemoryStorageGateway gateway;
    private ExecutorService executor;
    private BarrierTaskRunner taskRunner;
    private OptimizerProperties.Preparation settings;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryStorageGateway();
        executor = Executors.newFixedThreadPool(4);
        taskRunner = new BarrierTaskRunner(executor, executor::shutdown);
        settings = new OptimizerProperties.Preparation();
    }

    @AfterEach
    void tearDown() {
        taskRunner.close();
    }

    @Test
    @DisplayName("时间差超过60秒时写入此前的窗口")
    void testSessionGapFlushesWindow() {
        TickPreparer preparer = newPreparer(new WindowSizeStudy());

        PreparationResult result = preparer.prepare(List.of(tick(0), tick(60), tick(200)));

        assertThat(gateway.getBatches()).hasSize(1);
        assertThat(gateway.getBatches().get(0)).extracting(Tick::getTimestamp).containsExactly(0L, 60L);
        assertThat(preparer.getWindowSize()).isEqualTo(1);
        assertThat(result.getTicksPersisted()).isEqualTo(2);
        assertThat(result.getResidentTicks()).isEqualTo(1);
    }

    @Test
    @DisplayName("时间差恰好60秒不算中断")
    void testGapEqualToThresholdIsContiguous() {
        TickPreparer preparer = newPreparer(new WindowSizeStudy());

        preparer.prepare(List.of(tick(0), tick(60), tick(120)));

        assertThat(gateway.getBatches()).isEmpty();
        assertThat(preparer.getWindowSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("窗口达到2000时写入最早的1000个，2500个Tick后窗口剩余1500")
    void testWindowTrim() {
        TickPreparer preparer = newPreparer(new WindowSizeStudy());

        PreparationResult result = preparer.prepare(ticks(2500));

        assertThat(gateway.getBatches()).hasSize(1);
        assertThat(gateway.getBatches().get(0)).hasSize(1000);
        assertThat(gateway.getBatches().get(0).get(0).getTimestamp()).isZero();
        assertThat(result.getTicksPersisted()).isEqualTo(1000);
        assertThat(preparer.getWindowSize()).isEqualTo(1500);
    }

    @Test
    @DisplayName("显式flush后全部Tick都被写入")
    void testFlushPersistsEverything() {
        TickPreparer preparer = newPreparer(new WindowSizeStudy());

        preparer.prepare(ticks(2500));
        PreparationResult result = preparer.flush();

        assertThat(gateway.getPersistedTicks()).hasSize(2500);
        assertThat(result.getTicksReceived()).isEqualTo(2500);
        assertThat(result.getTicksPersisted()).isEqualTo(2500);
        assertThat(result.getResidentTicks()).isZero();
        assertThat(result.isSuccessful()).isTrue();
    }

    @Test
    @DisplayName("指标输出合并到Tick中，且窗口在中断后重新开始")
    void testStudyOutputsMerged() {
        TickPreparer preparer = newPreparer(new WindowSizeStudy());

        preparer.prepare(List.of(tick(0), tick(60), tick(200)));
        preparer.flush();

        assertThat(gateway.getPersistedTicks())
                .extracting(t -> t.get("windowSize"))
                .containsExactly(1.0, 2.0, 1.0);
    }

    @Test
    @DisplayName("预热期的输出为NaN，特征顺序保持一致")
    void testWarmupOutputsAreNaN() {
        TickPreparer preparer = newPreparer(new WindowSizeStudy(), new WarmupStudy(3));

        preparer.prepare(ticks(4));
        preparer.flush();

        List<Tick> persisted = gateway.getPersistedTicks();
        assertThat(persisted.get(0).get("warm")).isNaN();
        assertThat(persisted.get(1).get("warm")).isNaN();
        assertThat(persisted.get(2).get("warm")).isEqualTo(3.0);
        for (Tick tick : persisted) {
            assertThat(tick.features().keySet())
                    .containsExactly("timestamp", "open", "high", "low", "close", "windowSize", "warm");
        }
    }

    @Test
    @DisplayName("重复时间戳的Tick替换最后一根Bar，不中断准备过程")
    void testRepeatedTimestampReplacesLastBar() {
        TickPreparer preparer = newPreparer(new EmaStudy(Map.of("length", 3), Map.of("ema", "ema3")));

        PreparationResult result = preparer.prepare(List.of(
                closeTick(0, 1.0), closeTick(60, 2.0), closeTick(60, 3.0), closeTick(120, 4.0)));
        preparer.flush();

        assertThat(result.isSuccessful()).isTrue();
        List<Tick> persisted = gateway.getPersistedTicks();
        assertThat(persisted).hasSize(4);
        assertThat(persisted.get(2).get("ema3")).isNaN();
        // Bar序列为 1.0, 3.0, 4.0
        assertThat(persisted.get(3).get("ema3")).isCloseTo(3.0, within(1e-9));
    }

    @Test
    @DisplayName("指标计算失败时终止准备过程")
    void testStudyFailureAborts() {
        TickPreparer preparer = newPreparer(new WindowSizeStudy(), new FailingStudy(3));

        assertThatThrownBy(() -> preparer.prepare(ticks(5)))
                .isInstanceOf(TaskExecutionException.class)
                .hasRootCauseMessage("指标计算出错");
        assertThat(preparer.getWindowSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("写入失败被记录在结果中，不会中断准备过程")
    void testPersistFailureRecorded() {
        gateway.failWrites();
        TickPreparer preparer = newPreparer(new WindowSizeStudy());

        preparer.prepare(List.of(tick(0), tick(60), tick(200)));
        PreparationResult result = preparer.flush();

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFailedBatches()).hasSize(2);
        assertThat(result.getFailedBatches().get(0)).contains("E11000");
        assertThat(result.getTicksPersisted()).isZero();
        assertThat(result.getSummary()).contains("写入失败批次: 2");
    }

    @Test
    @DisplayName("保留数量必须小于写入阈值")
    void testInvalidWindowSettings() {
        settings.setRetain(2000);

        assertThatThrownBy(() -> newPreparer(new WindowSizeStudy()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private TickPreparer newPreparer(Study... studies) {
        return new TickPreparer(SYMBOL, List.of(studies), gateway, taskRunner, settings);
    }

    private static Tick closeTick(long timestamp, double close) {
        return Tick.of(timestamp, close, close, close, close);
    }

    private static Tick tick(long timestamp) {
        return Tick.of(timestamp, 1.1, 1.2, 1.0, 1.15);
    }

    private static List<Tick> ticks(int count) {
        List<Tick> ticks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ticks.add(tick(i * 60L));
        }
        return ticks;
    }

    private static class WindowSizeStudy extends AbstractStudy {
        WindowSizeStudy() {
            super(Map.of(), Map.of("size", "windowSize"));
        }

        @Override
        protected void calculate(Map<String, Double> outputs) {
            setOutput(outputs, "size", getData().size());
        }
    }

    private static class WarmupStudy extends AbstractStudy {
        WarmupStudy(int length) {
            super(Map.of("length", length), Map.of("value", "warm"));
        }

        @Override
        protected void calculate(Map<String, Double> outputs) {
            if (getData().size() >= getIntInput("length")) {
                setOutput(outputs, "value", getData().size());
            }
        }
    }

    private static class FailingStudy extends AbstractStudy {
        FailingStudy(int failAt) {
            super(Map.of("failAt", failAt), Map.of("value", "failing"));
        }

        @Override
        protected void calculate(Map<String, Double> outputs) {
            if (getData().size() == getIntInput("failAt")) {
                throw new IllegalStateException("指标计算出错");
            }
            setOutput(outputs, "value", 0);
        }
    }
}
