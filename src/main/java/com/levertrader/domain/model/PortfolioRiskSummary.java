package com.levertrader.domain.model;

import com.levertrader.domain.enums.RiskLevel;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Portfolio-wide risk picture built from every OPEN position with a known price.
 *
 * <p>{@code portfolioMarginUsage} is pure margin usage (total margin over free balance) and is
 * the figure admission control and the overall level use. {@code effectiveRisk} adds half the
 * portfolio loss on top and is informational only.
 */
@Data
@Builder
public class PortfolioRiskSummary {

    private RiskLevel overallRiskLevel;
    private BigDecimal portfolioMarginUsage;
    private BigDecimal portfolioPnlPercentage;
    private BigDecimal effectiveRisk;
    private BigDecimal portfolioReturnPercentage;
    private BigDecimal totalMarginUsed;
    private BigDecimal totalUnrealizedPnl;
    private BigDecimal accountBalance;
    /** Free balance plus reserved margin plus unrealized PnL. */
    private BigDecimal totalPortfolioValue;
    private int openPositions;

    /** Positions that could be evaluated (OPEN with a known price). */
    private int evaluatedPositions;

    private Map<RiskLevel, Integer> riskDistribution;
    private List<RiskMetrics> positionRisks;
    private List<String> recommendations;
    private LocalDateTime analyzedAt;

    public int countAt(RiskLevel riskLevel) {
        return riskDistribution == null ? 0 : riskDistribution.getOrDefault(riskLevel, 0);
    }
}
