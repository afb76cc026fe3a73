package com.levertrader.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.levertrader.domain.enums.ExecutionStatus;
import com.levertrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Audit record of a {@link com.levertrader.domain.model.TradeRequest} and how it ended. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrderDocument {

    private String id;
    private String symbol;
    private OrderSide side;
    private BigDecimal price;
    private BigDecimal quantity;
    private BigDecimal leverage;
    private String strategy;
    private int confidence;
    private ExecutionStatus status;
    private String errorReason;
    private String positionId;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
    private LocalDateTime lastUpdated;
}
