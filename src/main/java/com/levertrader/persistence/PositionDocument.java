package com.levertrader.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored form of a {@link com.levertrader.domain.model.Position}, upserted by id.
 * Closed positions are kept as trade history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PositionDocument {

    private String id;
    private String symbol;
    private PositionSide side;
    private PositionStatus status;
    private BigDecimal entryPrice;
    private BigDecimal exitPrice;
    private BigDecimal quantity;
    private BigDecimal leverage;
    private BigDecimal marginUsed;
    private BigDecimal tradingFee;
    private BigDecimal stopLoss;
    private BigDecimal target;
    private BigDecimal investedAmount;
    private LocalDateTime entryTime;
    private LocalDateTime exitTime;
    private String strategy;
    private String notes;
    private BigDecimal pnl;
    private BigDecimal pnlPercentage;
    private BigDecimal originalQuantity;
    private BigDecimal totalQuantity;
    private BigDecimal averageEntryPrice;
    private int pyramidCount;
    private BigDecimal remainingQuantity;
    private int trailingCount;
    private BigDecimal realizedPnl;
    private BigDecimal unrealizedPnl;
    private BigDecimal averageExitPrice;
    private BigDecimal closedQuantity;
    private LocalDateTime lastUpdated;
}
