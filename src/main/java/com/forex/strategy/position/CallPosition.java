package com.forex.strategy.position;

/**
 * 看涨仓位：到期价高于开仓价时盈利
 */
public class CallPosition extends Position {

    public CallPosition(String symbol, long timestamp, double price, double investment,
                        double profitability, long expirationTimestamp) {
        super(symbol, timestamp, price, investment, profitability, expirationTimestamp);
    }

    @Override
    public String getType() {
        return "CALL";
    }

    @Override
    protected int compareOutcome(double price, double closePrice) {
        return Double.compare(closePrice, price);
    }
}
