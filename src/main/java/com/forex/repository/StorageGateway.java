package com.forex.repository;

import com.forex.domain.entity.DataPoint;
import com.forex.domain.vo.Tick;
import com.forex.optimizer.DatasetLoadException;

import java.util.List;
import java.util.stream.Stream;

/**
 * 数据点存储接口
 * 数据准备阶段批量写入，数据加载阶段按时间顺序读取
 */
public interface StorageGateway {

    /**
     * 创建按标的和时间戳查询所需的索引
     */
    default void ensureIndexes() {
    }

    /**
     * 以一次无序批量插入写入一批已计算指标的Tick
     *
     * @param symbol 交易标的
     * @param ticks  按时间顺序排列的Tick
     * @return 写入结果，写入失败不抛出异常，由结果对象携带错误信息
     */
    PersistResult persist(String symbol, List<Tick> ticks);

    /**
     * 统计指定标的的文档数量
     *
     * @throws DatasetLoadException 无法获取数量时抛出，携带存储层错误信息
     */
    long countMatching(String symbol) throws DatasetLoadException;

    /**
     * 按指定字段升序查询指定标的的所有文档
     * <p>
     * 返回的流是惰性的，每次调用独立，使用完毕后必须关闭。
     * </p>
     *
     * @param symbol     交易标的
     * @param orderField 排序字段，例如 data.timestamp
     * @param batchSize  游标批大小
     * @throws DatasetLoadException 查询失败时抛出
     */
    Stream<DataPoint> queryOrdered(String symbol, String orderField, int batchSize) throws DatasetLoadException;
}
