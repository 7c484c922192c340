package com.forex.domain.vo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 行情Tick
 * <p>
 * 字段名到数值的有序映射。字段插入顺序即持久化后 data 子文档中的特征顺序，
 * 数据加载时据此建立列索引，因此所有Tick必须以相同顺序写入字段。
 * </p>
 */
public class Tick {

    public static final String TIMESTAMP = "timestamp";
    public static final String OPEN = "open";
    public static final String HIGH = "high";
    public static final String LOW = "low";
    public static final String CLOSE = "close";

    public static final String TESTING_GROUPS = "testingGroups";
    public static final String VALIDATION_GROUPS = "validationGroups";

    private final Map<String, Double> values;

    public Tick() {
        this.values = new LinkedHashMap<>();
    }

    /**
     * 创建只包含时间戳和OHLC字段的Tick
     */
    public static Tick of(long timestamp, double open, double high, double low, double close) {
        Tick tick = new Tick();
        tick.put(TIMESTAMP, timestamp);
        tick.put(OPEN, open);
        tick.put(HIGH, high);
        tick.put(LOW, low);
        tick.put(CLOSE, close);
        return tick;
    }

    public double get(String field) {
        Double value = values.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Tick中不存在字段: " + field);
        }
        return value;
    }

    public void put(String field, double value) {
        values.put(field, value);
    }

    public void putAll(Map<String, Double> outputs) {
        values.putAll(outputs);
    }

    public long getTimestamp() {
        return (long) get(TIMESTAMP);
    }

    public int getTestingGroups() {
        return values.getOrDefault(TESTING_GROUPS, 0.0).intValue();
    }

    public int getValidationGroups() {
        return values.getOrDefault(VALIDATION_GROUPS, 0.0).intValue();
    }

    /**
     * 返回去除分组标记后的特征字段，保持原有顺序
     */
    public LinkedHashMap<String, Double> features() {
        LinkedHashMap<String, Double> features = new LinkedHashMap<>(values);
        features.remove(TESTING_GROUPS);
        features.remove(VALIDATION_GROUPS);
        return features;
    }

    public Map<String, Double> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "Tick" + values;
    }
}
