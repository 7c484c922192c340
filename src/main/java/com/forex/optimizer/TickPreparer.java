package com.forex.optimizer;

import com.forex.config.OptimizerProperties;
import com.forex.domain.vo.Tick;
import com.forex.infrastructure.concurrent.BarrierTaskRunner;
import com.forex.repository.PersistResult;
import com.forex.repository.StorageGateway;
import com.forex.study.Study;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tick数据准备器
 * <p>
 * 按顺序消费原始Tick，维护一个连续Tick窗口：
 * <ol>
 *   <li>与上一个Tick的时间差超过会话间隔时，写入并清空整个窗口；</li>
 *   <li>所有指标并行计算当前Tick，全部完成后才处理下一个Tick；</li>
 *   <li>指标输出合并到当前Tick；</li>
 *   <li>窗口达到阈值时写入最早的部分，只保留最近的Tick。</li>
 * </ol>
 * 输入结束时窗口中剩余的Tick不会自动写入，需要调用 {@link #flush()}。
 * 该类有状态，每次准备过程使用一个新实例，不可并发调用。
 * </p>
 */
@Slf4j
public class TickPreparer {

    private static final int PROGRESS_INTERVAL = 10_000;

    private final String symbol;
    private final List<Study> studies;
    private final StorageGateway storageGateway;
    private final BarrierTaskRunner taskRunner;
    private final long sessionGapSeconds;
    private final int flushThreshold;
    private final int retain;

    private final List<Tick> window = new ArrayList<>();
    private final List<Tick> windowView = Collections.unmodifiableList(window);
    private final List<String> failedBatches = new ArrayList<>();

    private long ticksReceived;
    private long ticksPersisted;
    private int batchesFlushed;
    private long startedAt;

    public TickPreparer(String symbol, List<Study> studies, StorageGateway storageGateway,
                        BarrierTaskRunner taskRunner, OptimizerProperties.Preparation settings) {
        if (settings.getRetain() <= 0 || settings.getRetain() >= settings.getFlushThreshold()) {
            throw new IllegalArgumentException(String.format("窗口参数无效: flushThreshold=%d, retain=%d",
                    settings.getFlushThreshold(), settings.getRetain()));
        }
        this.symbol = symbol;
        this.studies = List.copyOf(studies);
        this.storageGateway = storageGateway;
        this.taskRunner = taskRunner;
        this.sessionGapSeconds = settings.getSessionGapSeconds();
        this.flushThreshold = settings.getFlushThreshold();
        this.retain = settings.getRetain();
    }

    /**
     * 依次处理所有Tick，指标输出直接合并到传入的Tick中
     *
     * @return 截至目前的准备结果
     */
    public PreparationResult prepare(Iterable<Tick> ticks) {
        if (startedAt == 0) {
            startedAt = System.currentTimeMillis();
        }
        log.info("开始准备数据: symbol={}, studies={}", symbol, studies.size());

        for (Tick tick : ticks) {
            process(tick);

            if (++ticksReceived % PROGRESS_INTERVAL == 0) {
                log.info("数据准备进度: {} 个Tick, 已写入 {}", ticksReceived, ticksPersisted);
            }
        }

        log.info("数据准备完成: symbol={}, ticks={}, persisted={}, resident={}",
                symbol, ticksReceived, ticksPersisted, window.size());
        return buildResult();
    }

    /**
     * 写入并清空窗口中剩余的Tick
     */
    public PreparationResult flush() {
        if (!window.isEmpty()) {
            log.info("写入窗口剩余数据: {} 个Tick", window.size());
            persist(new ArrayList<>(window));
            window.clear();
        }
        return buildResult();
    }

    public int getWindowSize() {
        return window.size();
    }

    private void process(Tick tick) {
        if (!window.isEmpty()) {
            Tick previous = window.get(window.size() - 1);
            if (tick.getTimestamp() - previous.getTimestamp() > sessionGapSeconds) {
                log.debug("检测到交易时段中断: {} -> {}, 写入 {} 个Tick",
                        previous.getTimestamp(), tick.getTimestamp(), window.size());
                persist(new ArrayList<>(window));
                window.clear();
            }
        }

        window.add(tick);

        for (Study study : studies) {
            study.setData(windowView);
        }
        taskRunner.runAll("指标计算@" + tick.getTimestamp(), studies, Study::tick);

        for (Study study : studies) {
            tick.putAll(study.getTickOutputs());
        }

        if (window.size() >= flushThreshold) {
            List<Tick> oldest = window.subList(0, window.size() - retain);
            persist(new ArrayList<>(oldest));
            oldest.clear();
        }
    }

    private void persist(List<Tick> batch) {
        if (batch.isEmpty()) {
            return;
        }
        PersistResult result = storageGateway.persist(symbol, batch);
        batchesFlushed++;
        ticksPersisted += result.inserted();
        if (!result.isSuccessful()) {
            String failure = String.format("批次 %d [%d..%d] 写入 %d/%d: %s", batchesFlushed,
                    batch.get(0).getTimestamp(), batch.get(batch.size() - 1).getTimestamp(),
                    result.inserted(), result.requested(), result.errorMessage());
            failedBatches.add(failure);
            log.error("数据写入失败: {}", failure);
        }
    }

    private PreparationResult buildResult() {
        long elapsedMs = startedAt == 0 ? 0 : System.currentTimeMillis() - startedAt;
        return PreparationResult.builder()
                .symbol(symbol)
                .ticksReceived(ticksReceived)
                .ticksPersisted(ticksPersisted)
                .batchesFlushed(batchesFlushed)
                .residentTicks(window.size())
                .failedBatches(List.copyOf(failedBatches))
                .preparationTimeMs(elapsedMs)
                .build();
    }
}
