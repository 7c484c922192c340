package com.forex.strategy.position;

/**
 * 看跌仓位：到期价低于开仓价时盈利
 */
public class PutPosition extends Position {

    public PutPosition(String symbol, long timestamp, double price, double investment,
                       double profitability, long expirationTimestamp) {
        super(symbol, timestamp, price, investment, profitability, expirationTimestamp);
    }

    @Override
    public String getType() {
        return "PUT";
    }

    @Override
    protected int compareOutcome(double price, double closePrice) {
        return Double.compare(price, closePrice);
    }
}
