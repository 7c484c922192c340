package com.forex.study;

import com.forex.domain.vo.Tick;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 技术指标计算单元
 * <p>
 * 指标是有状态的：{@link #tick()} 的结果依赖于此前按顺序看到的全部Tick，
 * 因此同一指标的两次 tick() 不能并发执行；不同指标之间相互独立。
 * </p>
 */
public interface Study {

    /**
     * 更新指标可见的Tick窗口，窗口最后一个元素为当前Tick
     */
    void setData(List<Tick> window);

    /**
     * 计算当前Tick的输出并缓存
     */
    void tick();

    /**
     * 当前Tick的输出，键为输出特征名，包含全部输出。预热期内的值为 NaN
     */
    Map<String, Double> getTickOutputs();

    /**
     * 该指标可能产生的全部输出特征名
     */
    Set<String> getOutputMap();
}
