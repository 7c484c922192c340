package com.forex.optimizer;

import com.forex.domain.vo.DataIndex;
import com.forex.domain.vo.Dataset;

/**
 * 加载结果：数据集及其列索引
 */
public record LoadedDataset(Dataset dataset, DataIndex dataIndex) {

    public static LoadedDataset empty() {
        return new LoadedDataset(Dataset.empty(), DataIndex.empty());
    }
}
