package com.levertrader.pnl;

import com.levertrader.domain.model.Position;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Mark-to-market arithmetic for leveraged positions.
 *
 * <p>All methods are pure: they read a position and a price and return numbers, leaving the
 * position untouched. {@link com.levertrader.execution.TradeExecutor} writes the results back;
 * the risk engine uses the same methods to evaluate hypothetical prices without mutation.
 *
 * <p>Money amounts are not rounded, so recomputing at the same price yields an identical value.
 * Percentages are rounded to {@value #PERCENT_SCALE} places.
 */
@Component
public class PnLCalculator {

    public static final int PERCENT_SCALE = 4;
    public static final int PRICE_SCALE = 8;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Unrealized PnL on the quantity still open.
     *
     * <p>Formula: {@code (price - averageEntry) * effectiveQuantity}, negated for SHORT.
     * <ul>
     *   <li>Long: entry 50000, price 51000, qty 0.01 → +10</li>
     *   <li>Short: entry 50000, price 51000, qty 0.01 → -10</li>
     * </ul>
     */
    public BigDecimal unrealizedPnl(Position position, BigDecimal price) {
        BigDecimal quantity = position.getEffectiveQuantity();
        if (quantity == null || quantity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return priceMove(position, price).multiply(quantity);
    }

    /** Realized plus unrealized PnL at {@code price}. */
    public BigDecimal totalPnl(Position position, BigDecimal price) {
        return realized(position).add(unrealizedPnl(position, price));
    }

    /** PnL at {@code price} as a percentage of the invested amount; zero when nothing is invested. */
    public BigDecimal pnlPercentage(Position position, BigDecimal price) {
        return percentOfInvested(position, totalPnl(position, price));
    }

    public BigDecimal percentOfInvested(Position position, BigDecimal pnl) {
        BigDecimal invested = position.getInvestedAmount();
        if (invested == null || invested.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return pnl.multiply(HUNDRED).divide(invested, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /** PnL realized by closing {@code quantity} at {@code exitPrice} against the average entry. */
    public BigDecimal realizedPnlOnClose(Position position, BigDecimal quantity, BigDecimal exitPrice) {
        return priceMove(position, exitPrice).multiply(quantity);
    }

    /** Quantity-weighted average of an existing average and a new fill. */
    public BigDecimal weightedAverage(
            BigDecimal existingQuantity, BigDecimal existingAverage, BigDecimal addedQuantity, BigDecimal addedPrice) {
        BigDecimal existingQty = existingQuantity == null ? BigDecimal.ZERO : existingQuantity;
        BigDecimal totalQuantity = existingQty.add(addedQuantity);
        if (totalQuantity.signum() == 0) {
            return addedPrice;
        }
        BigDecimal existingNotional =
                existingAverage == null ? BigDecimal.ZERO : existingQty.multiply(existingAverage);
        return existingNotional
                .add(addedQuantity.multiply(addedPrice))
                .divide(totalQuantity, PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal priceMove(Position position, BigDecimal price) {
        BigDecimal entry = position.getAverageEntryPrice() != null
                ? position.getAverageEntryPrice()
                : position.getEntryPrice();
        BigDecimal move = price.subtract(entry);
        return position.getSide().sign() > 0 ? move : move.negate();
    }

    private BigDecimal realized(Position position) {
        return position.getRealizedPnl() == null ? BigDecimal.ZERO : position.getRealizedPnl();
    }
}
