package com.forex.repository;

import com.forex.config.OptimizerProperties;
import com.forex.domain.entity.DataPoint;
import com.forex.domain.vo.Tick;
import com.forex.optimizer.DatasetLoadException;
import com.mongodb.bulk.BulkWriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 基于MongoDB的数据点存储
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MongoStorageGateway implements StorageGateway {

    static final String TIMESTAMP_FIELD = DataPoint.FIELD_DATA + "." + Tick.TIMESTAMP;

    private final MongoTemplate mongoTemplate;
    private final OptimizerProperties properties;

    @Override
    public void ensureIndexes() {
        String collection = properties.getCollection();
        mongoTemplate.indexOps(collection).ensureIndex(new Index()
                .on(DataPoint.FIELD_SYMBOL, Sort.Direction.ASC)
                .on(TIMESTAMP_FIELD, Sort.Direction.ASC));
        mongoTemplate.indexOps(collection).ensureIndex(new Index()
                .on(TIMESTAMP_FIELD, Sort.Direction.ASC));
        log.debug("已确保集合 {} 的索引", collection);
    }

    @Override
    public PersistResult persist(String symbol, List<Tick> ticks) {
        if (ticks.isEmpty()) {
            return PersistResult.success(0);
        }

        List<DataPoint> documents = new ArrayList<>(ticks.size());
        for (Tick tick : ticks) {
            documents.add(toDataPoint(symbol, tick));
        }

        try {
            BulkWriteResult result = mongoTemplate
                    .bulkOps(BulkOperations.BulkMode.UNORDERED, DataPoint.class, properties.getCollection())
                    .insert(documents)
                    .execute();
            log.debug("批量写入完成: symbol={}, count={}", symbol, result.getInsertedCount());
            return PersistResult.success(result.getInsertedCount());
        } catch (BulkOperationException e) {
            int inserted = e.getResult() != null ? e.getResult().getInsertedCount() : 0;
            log.error("批量写入部分失败: symbol={}, requested={}, inserted={}, errors={}",
                    symbol, documents.size(), inserted, e.getErrors().size());
            return PersistResult.failure(documents.size(), inserted, e.getMessage());
        } catch (DataAccessException e) {
            log.error("批量写入失败: symbol={}, requested={}", symbol, documents.size(), e);
            return PersistResult.failure(documents.size(), 0, e.getMessage());
        }
    }

    @Override
    public long countMatching(String symbol) {
        try {
            return mongoTemplate.count(symbolQuery(symbol), properties.getCollection());
        } catch (DataAccessException e) {
            throw new DatasetLoadException("统计数据点数量失败: " + e.getMessage(), e);
        }
    }

    @Override
    public Stream<DataPoint> queryOrdered(String symbol, String orderField, int batchSize) {
        Query query = symbolQuery(symbol)
                .with(Sort.by(Sort.Direction.ASC, orderField))
                .cursorBatchSize(batchSize);
        try {
            return mongoTemplate.stream(query, DataPoint.class, properties.getCollection());
        } catch (DataAccessException e) {
            throw new DatasetLoadException("查询数据点失败: " + e.getMessage(), e);
        }
    }

    static DataPoint toDataPoint(String symbol, Tick tick) {
        return DataPoint.builder()
                .symbol(symbol)
                .testingGroups(tick.getTestingGroups())
                .validationGroups(tick.getValidationGroups())
                .data(tick.features())
                .build();
    }

    private Query symbolQuery(String symbol) {
        return Query.query(Criteria.where(DataPoint.FIELD_SYMBOL).is(symbol));
    }
}
