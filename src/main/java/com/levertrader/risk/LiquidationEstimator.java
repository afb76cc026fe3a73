package com.levertrader.risk;

import com.levertrader.config.RiskProperties;
import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.model.Position;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Heuristic liquidation model for isolated-margin positions.
 *
 * <p>The margin ratio is {@code marginUsed / (quantity * averageEntry)}. A position is assumed
 * to be liquidated once the price has moved against it by that ratio times the configured
 * margin factor (0.95 by default), leaving the rest of the margin as maintenance buffer:
 * <pre>
 *   LONG   liquidation = entry * (1 - ratio * factor)
 *   SHORT  liquidation = entry * (1 + ratio * factor)
 * </pre>
 * Distance to liquidation is expressed as a percentage of the current price and floored at 0.
 * Unleveraged positions cannot be liquidated and report a distance of 100.
 */
@Component
public class LiquidationEstimator {

    static final BigDecimal NO_LIQUIDATION_DISTANCE = BigDecimal.valueOf(100);

    private static final int SCALE = 8;
    private static final int PERCENT_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskProperties riskProperties;

    public LiquidationEstimator(RiskProperties riskProperties) {
        this.riskProperties = riskProperties;
    }

    /** Margin as a fraction of notional at entry; null when the position carries no leverage. */
    public BigDecimal marginRatio(Position position) {
        if (!isLeveraged(position)) {
            return null;
        }
        BigDecimal notional = position.getEffectiveQuantity().multiply(entryOf(position));
        if (notional.signum() <= 0) {
            return null;
        }
        return position.getMarginUsed().divide(notional, SCALE, RoundingMode.HALF_UP);
    }

    /** Estimated liquidation price; null when the position cannot be liquidated. */
    public BigDecimal liquidationPrice(Position position) {
        BigDecimal ratio = marginRatio(position);
        if (ratio == null) {
            return null;
        }
        BigDecimal move = ratio.multiply(riskProperties.getLiquidationMarginFactor());
        BigDecimal entry = entryOf(position);
        return position.getSide() == PositionSide.LONG
                ? entry.multiply(BigDecimal.ONE.subtract(move))
                : entry.multiply(BigDecimal.ONE.add(move));
    }

    /**
     * Distance from {@code price} to the liquidation price, percent of {@code price}.
     *
     * <p>Example: LONG entry 50000 at 20x with margin 5% of notional liquidates at 47625; at
     * price 48500 the distance is about 1.8.
     */
    public BigDecimal distancePercent(Position position, BigDecimal price) {
        BigDecimal liquidationPrice = liquidationPrice(position);
        if (liquidationPrice == null || price == null || price.signum() <= 0) {
            return NO_LIQUIDATION_DISTANCE;
        }
        BigDecimal gap = position.getSide() == PositionSide.LONG
                ? price.subtract(liquidationPrice)
                : liquidationPrice.subtract(price);
        BigDecimal distance = gap.multiply(HUNDRED).divide(price, PERCENT_SCALE, RoundingMode.HALF_UP);
        return distance.signum() < 0 ? BigDecimal.ZERO.setScale(PERCENT_SCALE) : distance;
    }

    private static boolean isLeveraged(Position position) {
        return position.getLeverage() != null
                && position.getLeverage().compareTo(BigDecimal.ONE) > 0
                && position.getMarginUsed() != null
                && position.getMarginUsed().signum() > 0
                && position.getEffectiveQuantity() != null;
    }

    private static BigDecimal entryOf(Position position) {
        return position.getAverageEntryPrice() != null ? position.getAverageEntryPrice() : position.getEntryPrice();
    }
}
