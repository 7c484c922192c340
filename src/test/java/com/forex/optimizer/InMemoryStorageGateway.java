package com.forex.optimizer;

import com.forex.domain.entity.DataPoint;
import com.forex.domain.vo.Tick;
import com.forex.repository.PersistResult;
import com.forex.repository.StorageGateway;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 内存中的存储实现，记录每次写入的批次
 */
class InMemoryStorageGateway implements StorageGateway {

    private final List<List<Tick>> batches = new ArrayList<>();
    private final List<DataPoint> documents = new ArrayList<>();
    private boolean failWrites;

    void failWrites() {
        this.failWrites = true;
    }

    List<List<Tick>> getBatches() {
        return batches;
    }

    List<Tick> getPersistedTicks() {
        List<Tick> ticks = new ArrayList<>();
        batches.forEach(ticks::addAll);
        return ticks;
    }

    @Override
    public synchronized PersistResult persist(String symbol, List<Tick> ticks) {
        if (failWrites) {
            return PersistResult.failure(ticks.size(), 0, "E11000 duplicate key error");
        }
        batches.add(List.copyOf(ticks));
        for (Tick tick : ticks) {
            documents.add(DataPoint.builder()
                    .symbol(symbol)
                    .testingGroups(tick.getTestingGroups())
                    .validationGroups(tick.getValidationGroups())
                    .data(tick.features())
                    .build());
        }
        return PersistResult.success(ticks.size());
    }

    @Override
    public long countMatching(String symbol) {
        return documents.stream().filter(d -> d.getSymbol().equals(symbol)).count();
    }

    @Override
    public Stream<DataPoint> queryOrdered(String symbol, String orderField, int batchSize) {
        return documents.stream().filter(d -> d.getSymbol().equals(symbol));
    }
}
