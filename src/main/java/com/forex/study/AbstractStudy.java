package com.forex.study;

import com.forex.domain.vo.Tick;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 指标基类
 * 管理输入参数、输出名映射、当前窗口和当前Tick的输出
 */
public abstract class AbstractStudy implements Study {

    private final Map<String, Double> inputs;
    private final Map<String, String> outputMap;

    private List<Tick> data = Collections.emptyList();
    private Map<String, Double> tickOutputs = Collections.emptyMap();

    /**
     * @param inputs    指标参数，例如 length
     * @param outputMap 指标内部输出键到特征名的映射，例如 ema -> ema200
     */
    protected AbstractStudy(Map<String, ? extends Number> inputs, Map<String, String> outputMap) {
        Map<String, Double> converted = new LinkedHashMap<>();
        inputs.forEach((key, value) -> converted.put(key, value.doubleValue()));
        this.inputs = Collections.unmodifiableMap(converted);
        this.outputMap = Collections.unmodifiableMap(new LinkedHashMap<>(outputMap));
        if (this.outputMap.isEmpty()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " 未定义任何输出");
        }
    }

    @Override
    public void setData(List<Tick> window) {
        this.data = window;
    }

    @Override
    public final void tick() {
        if (data.isEmpty()) {
            tickOutputs = Collections.emptyMap();
            return;
        }
        // 每个Tick都输出全部特征，预热期内为 NaN，保证持久化后的特征顺序一致
        Map<String, Double> outputs = new LinkedHashMap<>();
        for (String name : outputMap.values()) {
            outputs.put(name, Double.NaN);
        }
        calculate(outputs);
        tickOutputs = outputs;
    }

    /**
     * 计算窗口中最后一个Tick的输出，通过 {@link #setOutput(Map, String, double)} 写入
     */
    protected abstract void calculate(Map<String, Double> outputs);

    /**
     * 写入一个内部输出键的值，未映射的键被忽略
     */
    protected void setOutput(Map<String, Double> outputs, String key, double value) {
        String name = outputMap.get(key);
        if (name != null) {
            outputs.put(name, value);
        }
    }

    @Override
    public Map<String, Double> getTickOutputs() {
        return Collections.unmodifiableMap(tickOutputs);
    }

    @Override
    public Set<String> getOutputMap() {
        return new LinkedHashSet<>(outputMap.values());
    }

    protected List<Tick> getData() {
        return data;
    }

    protected Tick getLastTick() {
        return data.get(data.size() - 1);
    }

    protected double getInput(String name) {
        Double value = inputs.get(name);
        if (value == null) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " 缺少参数: " + name);
        }
        return value;
    }

    protected double getInput(String name, double defaultValue) {
        return inputs.getOrDefault(name, defaultValue);
    }

    protected int getIntInput(String name) {
        int value = (int) getInput(name);
        if (value <= 0) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " 参数 " + name + " 必须为正数: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + inputs + "->" + outputMap.values();
    }
}
