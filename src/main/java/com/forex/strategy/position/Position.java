package com.forex.strategy.position;

/**
 * 二元期权仓位
 * <p>
 * 到期时按收盘价结算：盈利时返还 投资额 x (1 + 收益率)，平价返还投资额，亏损返还 0。
 * </p>
 */
public abstract class Position {

    private final String symbol;
    private final long timestamp;
    private final double price;
    private final double investment;
    private final double profitability;
    private final long expirationTimestamp;

    private boolean open = true;
    private double closePrice;
    private long closeTimestamp;

    protected Position(String symbol, long timestamp, double price, double investment,
                       double profitability, long expirationTimestamp) {
        this.symbol = symbol;
        this.timestamp = timestamp;
        this.price = price;
        this.investment = investment;
        this.profitability = profitability;
        this.expirationTimestamp = expirationTimestamp;
    }

    public abstract String getType();

    /**
     * 结算价相对开仓价的方向是否对本仓位有利，0 表示平价
     */
    protected abstract int compareOutcome(double price, double closePrice);

    public boolean getHasExpired(long timestamp) {
        return timestamp >= expirationTimestamp;
    }

    public void close(double price, long timestamp) {
        this.open = false;
        this.closePrice = price;
        this.closeTimestamp = timestamp;
    }

    /**
     * 平仓后的返还金额，未平仓时为 0
     */
    public double getProfitLoss() {
        if (open) {
            return 0.0;
        }
        int outcome = compareOutcome(price, closePrice);
        if (outcome > 0) {
            return investment + investment * profitability;
        }
        if (outcome == 0) {
            return investment;
        }
        return 0.0;
    }

    public String getSymbol() {
        return symbol;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getPrice() {
        return price;
    }

    public double getInvestment() {
        return investment;
    }

    public long getExpirationTimestamp() {
        return expirationTimestamp;
    }

    public boolean isOpen() {
        return open;
    }

    public double getClosePrice() {
        return closePrice;
    }

    public long getCloseTimestamp() {
        return closeTimestamp;
    }

    @Override
    public String toString() {
        return String.format("%s[%s @%.5f, %d -> %d]", getType(), symbol, price, timestamp, expirationTimestamp);
    }
}
