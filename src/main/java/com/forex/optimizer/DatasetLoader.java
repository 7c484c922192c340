package com.forex.optimizer;

import com.forex.config.OptimizerProperties;
import com.forex.domain.entity.DataPoint;
import com.forex.domain.vo.DataIndex;
import com.forex.domain.vo.Dataset;
import com.forex.domain.vo.Tick;
import com.forex.repository.StorageGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

/**
 * 数据集加载器
 * <p>
 * 按时间戳升序读取指定标的的全部数据点，转换为稠密矩阵。列索引只根据第一条文档的字段顺序建立，
 * 之后的文档按位置复制，不再按名称查找：所有文档必须保持相同的特征顺序。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetLoader {

    static final String ORDER_FIELD = DataPoint.FIELD_DATA + "." + Tick.TIMESTAMP;

    private final StorageGateway storageGateway;
    private final OptimizerProperties properties;

    /**
     * 加载数据
     *
     * @throws DatasetLoadException 统计或查询失败
     */
    public LoadedDataset load(String symbol) {
        long startTime = System.currentTimeMillis();
        log.info("开始加载数据: symbol={}", symbol);

        long expectedRows = storageGateway.countMatching(symbol);
        if (expectedRows < 0) {
            throw new DatasetLoadException("无法获取数据点数量: symbol=" + symbol);
        }
        log.info("数据点数量: {}", expectedRows);

        int batchSize = properties.getLoading().getBatchSize();
        DataIndex dataIndex = DataIndex.empty();
        Dataset.Builder builder = null;
        boolean mismatchReported = false;

        try (Stream<DataPoint> documents = storageGateway.queryOrdered(symbol, ORDER_FIELD, batchSize)) {
            Iterator<DataPoint> iterator = documents.iterator();
            while (iterator.hasNext()) {
                Map<String, Double> data = iterator.next().getData();
                if (data == null) {
                    throw new DatasetLoadException("数据点缺少 data 字段: symbol=" + symbol);
                }

                // 只用第一条文档建立列索引
                if (builder == null) {
                    dataIndex = DataIndex.of(new ArrayList<>(data.keySet()));
                    builder = Dataset.builder(dataIndex.size(), expectedRows);
                    log.debug("列索引: {}", dataIndex);
                }

                int row = builder.appendRow();
                int column = 0;
                for (Double value : data.values()) {
                    if (column >= builder.getColumnCount()) {
                        break;
                    }
                    builder.set(row, column++, value != null ? value : Double.NaN);
                }

                if (data.size() != builder.getColumnCount() && !mismatchReported) {
                    log.warn("第 {} 行特征数量 {} 与列索引 {} 不一致", row, data.size(), builder.getColumnCount());
                    mismatchReported = true;
                }

                if (log.isDebugEnabled() && expectedRows > 0 && (row + 1) % 100_000 == 0) {
                    log.debug("数据加载进度: {}%", String.format("%.2f", (row + 1) * 100.0 / expectedRows));
                }
            }
        } catch (DataAccessException e) {
            throw new DatasetLoadException("读取数据点失败: " + e.getMessage(), e);
        }

        if (builder == null) {
            log.warn("没有找到数据点: symbol={}", symbol);
            return LoadedDataset.empty();
        }

        Dataset dataset = builder.build();
        if (dataset.getRowCount() != expectedRows) {
            log.warn("实际加载行数 {} 与统计数量 {} 不一致", dataset.getRowCount(), expectedRows);
        }

        log.info("数据加载完成: rows={}, columns={}, 耗时={}ms",
                dataset.getRowCount(), dataset.getColumnCount(), System.currentTimeMillis() - startTime);
        return new LoadedDataset(dataset, dataIndex);
    }
}
