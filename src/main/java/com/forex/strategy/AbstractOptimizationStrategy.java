package com.forex.strategy;

import com.forex.domain.vo.DataIndex;
import com.forex.optimizer.configuration.Configuration;
import com.forex.strategy.position.Position;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 优化策略基类
 * 管理持仓和盈亏统计
 */
@Slf4j
public abstract class AbstractOptimizationStrategy implements OptimizationStrategy {

    static final double INITIAL_MINIMUM_PROFIT_LOSS = 99999.0;

    private final String symbol;
    private final DataIndex dataIndex;
    private final int group;
    private final Configuration configuration;

    private final List<Position> openPositions = new ArrayList<>();

    private double profitLoss;
    private int winCount;
    private int loseCount;
    private int consecutiveLosses;
    private int maximumConsecutiveLosses;
    private double minimumProfitLoss = INITIAL_MINIMUM_PROFIT_LOSS;

    protected AbstractOptimizationStrategy(String symbol, DataIndex dataIndex, int group, Configuration configuration) {
        this.symbol = symbol;
        this.dataIndex = dataIndex;
        this.group = group;
        this.configuration = configuration;
    }

    protected void addPosition(Position position) {
        openPositions.add(position);
    }

    /**
     * 按给定价格结算所有到期仓位并更新统计
     *
     * @return 本次结算的仓位
     */
    protected List<Position> closeExpiredPositions(double price, long timestamp) {
        List<Position> expiredPositions = new ArrayList<>();

        Iterator<Position> iterator = openPositions.iterator();
        while (iterator.hasNext()) {
            Position position = iterator.next();
            if (!position.getHasExpired(timestamp)) {
                continue;
            }

            position.close(price, timestamp);

            double positionProfitLoss = position.getProfitLoss();
            profitLoss -= position.getInvestment();
            profitLoss += positionProfitLoss;

            if (positionProfitLoss > position.getInvestment()) {
                winCount++;
                consecutiveLosses = 0;
            }
            if (positionProfitLoss == 0) {
                loseCount++;
                consecutiveLosses++;
            }

            if (positionProfitLoss < minimumProfitLoss) {
                minimumProfitLoss = positionProfitLoss;
            }
            if (consecutiveLosses > maximumConsecutiveLosses) {
                maximumConsecutiveLosses = consecutiveLosses;
            }

            expiredPositions.add(position);
            iterator.remove();

            if (log.isTraceEnabled()) {
                log.trace("仓位到期: {} close={} pl={}", position, price, positionProfitLoss);
            }
        }

        return expiredPositions;
    }

    public double getWinRate() {
        if (winCount + loseCount == 0) {
            return 0;
        }
        return (double) winCount / (winCount + loseCount);
    }

    @Override
    public StrategyResults getResults() {
        return StrategyResults.builder()
                .profitLoss(profitLoss)
                .winCount(winCount)
                .loseCount(loseCount)
                .winRate(getWinRate())
                .tradeCount(winCount + loseCount)
                .maximumConsecutiveLosses(maximumConsecutiveLosses)
                .minimumProfitLoss(minimumProfitLoss)
                .build();
    }

    @Override
    public Configuration getConfiguration() {
        return configuration;
    }

    public String getSymbol() {
        return symbol;
    }

    public DataIndex getDataIndex() {
        return dataIndex;
    }

    public int getGroup() {
        return group;
    }

    public List<Position> getOpenPositions() {
        return List.copyOf(openPositions);
    }
}
