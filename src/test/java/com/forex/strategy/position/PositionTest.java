package com.forex.strategy.position;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("二元期权仓位单元测试")
class PositionTest {

    private static final double INVESTMENT = 1000.0;
    private static final double PROFITABILITY = 0.76;

    @Test
    @DisplayName("看涨仓位在价格上涨时盈利")
    void testCallWins() {
        Position call = new CallPosition("EURUSD", 0, 1.1000, INVESTMENT, PROFITABILITY, 240);
        call.close(1.1010, 240);

        assertThat(call.getProfitLoss()).isCloseTo(1760.0, within(1e-9));
        assertThat(call.getType()).isEqualTo("CALL");
    }

    @Test
    @DisplayName("看跌仓位在价格上涨时亏损")
    void testPutLoses() {
        Position put = new PutPosition("EURUSD", 0, 1.1000, INVESTMENT, PROFITABILITY, 240);
        put.close(1.1010, 240);

        assertThat(put.getProfitLoss()).isZero();
        assertThat(put.getType()).isEqualTo("PUT");
    }

    @Test
    @DisplayName("平价时返还投资额")
    void testTieReturnsInvestment() {
        Position put = new PutPosition("EURUSD", 0, 1.1000, INVESTMENT, PROFITABILITY, 240);
        put.close(1.1000, 240);

        assertThat(put.getProfitLoss()).isEqualTo(INVESTMENT);
    }

    @Test
    @DisplayName("到期时间判断包含到期时刻，未平仓时盈亏为0")
    void testExpiration() {
        Position call = new CallPosition("EURUSD", 0, 1.1000, INVESTMENT, PROFITABILITY, 240);

        assertThat(call.getHasExpired(180)).isFalse();
        assertThat(call.getHasExpired(240)).isTrue();
        assertThat(call.isOpen()).isTrue();
        assertThat(call.getProfitLoss()).isZero();
    }
}
