package com.forex.domain.vo;

import java.util.Arrays;

/**
 * 稠密数据集
 * <p>
 * 一块连续的 double 缓冲区，按行存储定宽记录，行按时间戳升序排列，列位置由 {@link DataIndex} 决定。
 * 构建完成后不可变。
 * </p>
 */
public final class Dataset {

    private static final Dataset EMPTY = new Dataset(new double[0], 0, 0);

    private final double[] values;
    private final int rowCount;
    private final int columnCount;

    private Dataset(double[] values, int rowCount, int columnCount) {
        this.values = values;
        this.rowCount = rowCount;
        this.columnCount = columnCount;
    }

    public static Dataset empty() {
        return EMPTY;
    }

    public static Builder builder(int columnCount, long expectedRows) {
        return new Builder(columnCount, expectedRows);
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public double get(int row, int column) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("行号越界: " + row + ", 行数: " + rowCount);
        }
        if (column < 0 || column >= columnCount) {
            throw new IndexOutOfBoundsException("列号越界: " + column + ", 列数: " + columnCount);
        }
        return values[row * columnCount + column];
    }

    public DatasetRow row(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("行号越界: " + row + ", 行数: " + rowCount);
        }
        return new DatasetRow(this, row);
    }

    /**
     * 可增长的行缓冲区，初始容量取存储层报告的文档数量
     */
    public static final class Builder {

        private final int columnCount;
        private double[] buffer;
        private int rowCount;

        private Builder(int columnCount, long expectedRows) {
            if (columnCount < 0) {
                throw new IllegalArgumentException("列数不能为负: " + columnCount);
            }
            this.columnCount = columnCount;
            long capacity = Math.max(0, expectedRows) * columnCount;
            if (capacity > Integer.MAX_VALUE - 8) {
                throw new IllegalArgumentException("数据集过大: " + expectedRows + " 行 x " + columnCount + " 列");
            }
            this.buffer = new double[(int) capacity];
        }

        /**
         * 追加一行并返回该行的起始偏移，调用方随后通过 {@link #set(int, int, double)} 写入各列
         */
        public int appendRow() {
            ensureCapacity(rowCount + 1);
            int row = rowCount++;
            Arrays.fill(buffer, row * columnCount, (row + 1) * columnCount, Double.NaN);
            return row;
        }

        public void set(int row, int column, double value) {
            buffer[row * columnCount + column] = value;
        }

        public int getRowCount() {
            return rowCount;
        }

        public int getColumnCount() {
            return columnCount;
        }

        public Dataset build() {
            int length = rowCount * columnCount;
            double[] values = buffer.length == length ? buffer : Arrays.copyOf(buffer, length);
            buffer = new double[0];
            return new Dataset(values, rowCount, columnCount);
        }

        private void ensureCapacity(int rows) {
            long required = (long) rows * columnCount;
            if (required <= buffer.length) {
                return;
            }
            long grown = Math.max(required, buffer.length + (buffer.length >> 1) + columnCount);
            if (grown > Integer.MAX_VALUE - 8) {
                throw new IllegalStateException("数据集超出最大容量");
            }
            buffer = Arrays.copyOf(buffer, (int) grown);
        }
    }
}
