package com.levertrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The virtual trading account.
 *
 * <p>Only {@link com.levertrader.ledger.AccountLedger} mutates an account, and only while the
 * owning {@link com.levertrader.execution.TradeExecutor} holds its lock. Everyone else works
 * with copies obtained from {@code TradeExecutor.getAccountSnapshot()}.
 *
 * <p>Invariants: {@code currentBalance >= 0}, and {@code totalMarginUsed} equals the sum of
 * {@code marginUsed} over OPEN positions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private String id;

    private BigDecimal initialBalance;

    /** Free cash. Reserved margin and paid fees are already deducted. */
    private BigDecimal currentBalance;

    private int dailyTradesLimit;
    private int dailyTradesCount;
    private BigDecimal maxLeverage;

    private BigDecimal totalMarginUsed;

    /** Entry and exit fees paid since the account was created. */
    private BigDecimal brokerageCharges;

    private BigDecimal realizedPnl;
    private BigDecimal totalProfit;
    private BigDecimal totalLoss;

    private int totalTrades;
    private int profitableTrades;
    private int losingTrades;

    /** Profitable closes as a percentage of all trades opened. */
    private BigDecimal winRate;

    private LocalDate lastTradeDate;
    private LocalDateTime createdAt;

    /** A fresh account holding only its initial balance. */
    public static Account open(String id, BigDecimal initialBalance, int dailyTradesLimit, BigDecimal maxLeverage,
            LocalDateTime createdAt) {
        return Account.builder()
                .id(id)
                .initialBalance(initialBalance)
                .currentBalance(initialBalance)
                .dailyTradesLimit(dailyTradesLimit)
                .maxLeverage(maxLeverage)
                .totalMarginUsed(BigDecimal.ZERO)
                .brokerageCharges(BigDecimal.ZERO)
                .realizedPnl(BigDecimal.ZERO)
                .totalProfit(BigDecimal.ZERO)
                .totalLoss(BigDecimal.ZERO)
                .winRate(BigDecimal.ZERO)
                .createdAt(createdAt)
                .build();
    }
}
