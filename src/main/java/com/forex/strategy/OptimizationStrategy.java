package com.forex.strategy;

import com.forex.domain.vo.DatasetRow;
import com.forex.optimizer.configuration.Configuration;

/**
 * 优化策略
 * <p>
 * 每个实例对应一个参数组合，状态随逐行回测推进。同一实例的 backtest 调用严格按行顺序发生，
 * 不同实例之间相互独立。
 * </p>
 */
public interface OptimizationStrategy {

    /**
     * 用一行数据推进一步
     *
     * @param row           当前数据行
     * @param investment    每笔投资额
     * @param profitability 盈利时的收益率
     */
    void backtest(DatasetRow row, double investment, double profitability);

    StrategyResults getResults();

    Configuration getConfiguration();
}
