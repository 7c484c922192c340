package com.forex.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.LinkedHashMap;

/**
 * 持久化的数据点文档
 * <p>
 * 结构: { symbol, testingGroups, validationGroups, data: { 特征名: 数值, ... } }。
 * 分组标记只作为顶层字段保存，不会出现在 data 中。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = DataPoint.COLLECTION)
public class DataPoint {

    public static final String COLLECTION = "datapoints";

    public static final String FIELD_SYMBOL = "symbol";
    public static final String FIELD_TESTING_GROUPS = "testingGroups";
    public static final String FIELD_VALIDATION_GROUPS = "validationGroups";
    public static final String FIELD_DATA = "data";

    @Id
    private String id;

    private String symbol;

    private int testingGroups;

    private int validationGroups;

    /**
     * 特征值，保持写入顺序
     */
    private LinkedHashMap<String, Double> data;
}
