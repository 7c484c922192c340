package com.forex.domain.vo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 特征名到数据列位置的映射
 * <p>
 * 由第一条加载的文档的字段顺序一次性建立，之后只读共享。
 * </p>
 */
public final class DataIndex {

    private static final DataIndex EMPTY = new DataIndex(Collections.emptyMap());

    private final Map<String, Integer> columns;

    private DataIndex(Map<String, Integer> columns) {
        this.columns = columns;
    }

    public static DataIndex empty() {
        return EMPTY;
    }

    /**
     * 按给定顺序为特征名分配列位置 0..n-1
     */
    public static DataIndex of(List<String> featureNames) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        for (String name : featureNames) {
            if (columns.putIfAbsent(name, columns.size()) != null) {
                throw new IllegalArgumentException("特征名重复: " + name);
            }
        }
        return new DataIndex(Collections.unmodifiableMap(columns));
    }

    public OptionalInt findColumn(String featureName) {
        Integer column = columns.get(featureName);
        return column == null ? OptionalInt.empty() : OptionalInt.of(column);
    }

    public boolean contains(String featureName) {
        return columns.containsKey(featureName);
    }

    public int size() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    public Map<String, Integer> asMap() {
        return columns;
    }

    @Override
    public String toString() {
        return "DataIndex" + columns;
    }
}
