package com.levertrader.domain.model;

import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A leveraged position, open or closed.
 *
 * <p>The live instances sit in {@link com.levertrader.position.PositionStore} and are mutated
 * only by {@link com.levertrader.execution.TradeExecutor}. Callers outside the executor get
 * {@link #snapshot()} copies, so reading a position never races with a price tick.
 *
 * <p>Quantities are unsigned; direction comes from {@link #side}. After pyramiding,
 * {@code entryPrice} mirrors {@code averageEntryPrice}. After partial closes,
 * {@code remainingQuantity} is what is still exposed to the market, and
 * {@code pnl == realizedPnl + unrealizedPnl} holds after every price update.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String symbol;
    private PositionSide side;
    private PositionStatus status;

    private BigDecimal entryPrice;
    private BigDecimal exitPrice;
    private BigDecimal quantity;
    private BigDecimal leverage;

    /** Margin still reserved for the open quantity. Released proportionally on partial closes. */
    private BigDecimal marginUsed;

    /** Entry fees paid, including fees for pyramid adds. Exit fees derive from this. */
    private BigDecimal tradingFee;

    private BigDecimal stopLoss;
    private BigDecimal target;

    /** Notional at entry (price × quantity), grown by pyramid adds. PnL percentages divide by this. */
    private BigDecimal investedAmount;

    private LocalDateTime entryTime;
    private LocalDateTime exitTime;

    private String strategy;

    /** Close reason, e.g. "Stop Loss Hit". */
    private String notes;

    private BigDecimal pnl;
    private BigDecimal pnlPercentage;

    // ---- Pyramiding ----

    private BigDecimal originalQuantity;
    private BigDecimal totalQuantity;
    private BigDecimal averageEntryPrice;
    private int pyramidCount;

    // ---- Trailing (partial close) ----

    private BigDecimal remainingQuantity;
    private int trailingCount;
    private BigDecimal realizedPnl;
    private BigDecimal unrealizedPnl;

    /** Quantity-weighted average over every partial and final close. */
    private BigDecimal averageExitPrice;

    /** Quantity already closed by partial or final closes. */
    private BigDecimal closedQuantity;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    /** Quantity the unrealized PnL is computed on. */
    public BigDecimal getEffectiveQuantity() {
        return remainingQuantity != null ? remainingQuantity : totalQuantity;
    }

    /** Detached copy for readers outside the executor. */
    public Position snapshot() {
        return toBuilder().build();
    }
}
