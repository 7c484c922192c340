package com.forex.optimizer.configuration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 参数空间的一个维度
 * 由若干组取值构成，每组是子键到 {@link OptionValue} 的映射
 */
public final class ConfigurationOption {

    private final List<Map<String, OptionValue>> assignments;

    private ConfigurationOption(List<Map<String, OptionValue>> assignments) {
        this.assignments = assignments;
    }

    public static ConfigurationOption of(List<Map<String, OptionValue>> assignments) {
        List<Map<String, OptionValue>> copy = new ArrayList<>(assignments.size());
        for (Map<String, OptionValue> assignment : assignments) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(assignment)));
        }
        return new ConfigurationOption(Collections.unmodifiableList(copy));
    }

    @SafeVarargs
    public static ConfigurationOption of(Map<String, OptionValue>... assignments) {
        return of(List.of(assignments));
    }

    public List<Map<String, OptionValue>> getAssignments() {
        return assignments;
    }

    public int size() {
        return assignments.size();
    }

    @Override
    public String toString() {
        return "ConfigurationOption" + assignments;
    }
}
