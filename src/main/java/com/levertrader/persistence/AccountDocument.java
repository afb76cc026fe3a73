package com.levertrader.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Stored form of an {@link com.levertrader.domain.model.Account}, upserted by id. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountDocument {

    private String id;
    private BigDecimal initialBalance;
    private BigDecimal currentBalance;
    private int dailyTradesLimit;
    private int dailyTradesCount;
    private BigDecimal maxLeverage;
    private BigDecimal totalMarginUsed;
    private BigDecimal brokerageCharges;
    private BigDecimal realizedPnl;
    private BigDecimal totalProfit;
    private BigDecimal totalLoss;
    private int totalTrades;
    private int profitableTrades;
    private int losingTrades;
    private BigDecimal winRate;
    private LocalDate lastTradeDate;
    private LocalDateTime createdAt;
    private LocalDateTime lastUpdated;
}
