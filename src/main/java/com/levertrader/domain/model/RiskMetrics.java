package com.levertrader.domain.model;

import com.levertrader.domain.enums.RiskAction;
import com.levertrader.domain.enums.RiskLevel;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Per-position risk assessment at one price. Recomputed on every evaluation, never persisted.
 *
 * <p>Percent fields are in percent units. {@code trailingStopPrice} is null until the
 * position is profitable enough to trail.
 */
@Data
@Builder
public class RiskMetrics {

    private String positionId;
    private String symbol;
    private RiskLevel riskLevel;
    private BigDecimal marginUsage;
    private BigDecimal pnlPercentage;
    private BigDecimal holdingHours;
    private BigDecimal distanceFromStopLoss;
    private BigDecimal distanceFromTarget;
    private BigDecimal volatilityScore;
    private RiskAction recommendation;
    private BigDecimal trailingStopPrice;

    /** Weighted 0-100 aggregate of margin, loss, holding time and volatility. */
    private BigDecimal riskScore;
}
