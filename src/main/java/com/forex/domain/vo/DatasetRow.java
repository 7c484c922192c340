package com.forex.domain.vo;

/**
 * 数据集中某一行的只读视图
 */
public record DatasetRow(Dataset dataset, int index) {

    public double get(int column) {
        return dataset.get(index, column);
    }

    public int columnCount() {
        return dataset.getColumnCount();
    }
}
