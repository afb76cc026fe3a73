package com.levertrader.domain.model;

import com.levertrader.domain.enums.ExecutionStatus;
import com.levertrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A request to open a position, typically produced from a strategy signal.
 *
 * <p>Ephemeral: the executor records it as an order document for audit, but positions and the
 * account are the source of truth. Status moves PENDING → EXECUTING → COMPLETED, FAILED or
 * CANCELLED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRequest {

    private String id;
    private String symbol;
    private OrderSide side;
    private BigDecimal price;
    private BigDecimal quantity;

    /** Null means the configured default leverage. */
    private BigDecimal leverage;

    private String strategy;

    /** Signal confidence, 0-100. */
    private int confidence;

    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.PENDING;

    private String errorReason;
    private String positionId;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
}
