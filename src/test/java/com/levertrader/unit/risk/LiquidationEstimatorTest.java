package com.levertrader.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.levertrader.config.RiskProperties;
import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.domain.model.Position;
import com.levertrader.risk.LiquidationEstimator;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LiquidationEstimatorTest {

    private LiquidationEstimator liquidationEstimator;

    @BeforeEach
    void setUp() {
        liquidationEstimator = new LiquidationEstimator(new RiskProperties());
    }

    @Test
    @DisplayName("20x long: liquidation at 95% of the margin ratio below entry")
    void long20x_liquidationPrice() {
        Position position = position(PositionSide.LONG, "1.928", "20", "4820");

        assertThat(liquidationEstimator.marginRatio(position)).isEqualByComparingTo("0.05");
        assertThat(liquidationEstimator.liquidationPrice(position)).isEqualByComparingTo("47625");
        assertThat(liquidationEstimator.distancePercent(position, new BigDecimal("48500")))
                .isEqualByComparingTo("1.8041");
    }

    @Test
    @DisplayName("Short liquidation sits above entry")
    void short_liquidationAboveEntry() {
        Position position = position(PositionSide.SHORT, "1", "10", "5000");

        assertThat(liquidationEstimator.liquidationPrice(position)).isEqualByComparingTo("54750");
        assertThat(liquidationEstimator.distancePercent(position, new BigDecimal("50000")))
                .isEqualByComparingTo("9.5");
    }

    @Test
    @DisplayName("Distance is floored at zero once price is past liquidation")
    void pastLiquidation_flooredAtZero() {
        Position position = position(PositionSide.LONG, "1.928", "20", "4820");

        assertThat(liquidationEstimator.distancePercent(position, new BigDecimal("47000")))
                .isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Unleveraged positions cannot be liquidated")
    void unleveraged_noLiquidation() {
        Position position = position(PositionSide.LONG, "1", "1", "50000");

        assertThat(liquidationEstimator.liquidationPrice(position)).isNull();
        assertThat(liquidationEstimator.distancePercent(position, new BigDecimal("40000")))
                .isEqualByComparingTo("100");
    }

    private static Position position(PositionSide side, String quantity, String leverage, String margin) {
        BigDecimal qty = new BigDecimal(quantity);
        return Position.builder()
                .id("p1")
                .symbol("BTCUSD")
                .side(side)
                .status(PositionStatus.OPEN)
                .entryPrice(new BigDecimal("50000"))
                .averageEntryPrice(new BigDecimal("50000"))
                .quantity(qty)
                .totalQuantity(qty)
                .remainingQuantity(qty)
                .leverage(new BigDecimal(leverage))
                .marginUsed(new BigDecimal(margin))
                .build();
    }
}
