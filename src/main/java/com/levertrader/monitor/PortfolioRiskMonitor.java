package com.levertrader.monitor;

import com.levertrader.domain.enums.AlertSeverity;
import com.levertrader.domain.enums.RiskLevel;
import com.levertrader.domain.model.PortfolioRiskSummary;
import com.levertrader.domain.model.RiskMetrics;
import com.levertrader.domain.model.TradeResult;
import com.levertrader.event.EventPublisherHelper;
import com.levertrader.event.RiskEventType;
import com.levertrader.execution.TradeExecutor;
import com.levertrader.risk.RiskEngine;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Analyzes portfolio risk periodically and reacts to HIGH and CRITICAL levels.
 *
 * <p>Each level raises its alert once on entry (deduplication via AtomicBoolean flags); the
 * flags reset when the portfolio drops back below HIGH. While the portfolio is CRITICAL, every
 * pass closes the position with the highest risk score at its last price.
 */
@Service
public class PortfolioRiskMonitor {

    private static final Logger log = LoggerFactory.getLogger(PortfolioRiskMonitor.class);

    static final String REASON_PORTFOLIO_PROTECTION = "PORTFOLIO PROTECTION - Emergency Close";

    private final RiskEngine riskEngine;
    private final TradeExecutor tradeExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final boolean enabled;

    private final AtomicBoolean highFired = new AtomicBoolean(false);
    private final AtomicBoolean criticalFired = new AtomicBoolean(false);

    public PortfolioRiskMonitor(
            RiskEngine riskEngine,
            TradeExecutor tradeExecutor,
            EventPublisherHelper eventPublisherHelper,
            @Value("${levertrader.monitor.enabled:true}") boolean enabled) {
        this.riskEngine = riskEngine;
        this.tradeExecutor = tradeExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.enabled = enabled;
    }

    @Scheduled(
            fixedDelayString = "${levertrader.monitor.portfolio-interval-ms:30000}",
            initialDelayString = "${levertrader.monitor.initial-delay-ms:5000}")
    public void checkPortfolioRisk() {
        if (!enabled) {
            return;
        }
        try {
            checkPortfolioRisk(riskEngine.analyzePortfolioRisk());
        } catch (Exception e) {
            log.warn("Failed to check portfolio risk", e);
        }
    }

    /** Reacts to the given portfolio summary. Public for testability. */
    public void checkPortfolioRisk(PortfolioRiskSummary summary) {
        RiskLevel level = summary.getOverallRiskLevel();
        Map<String, Object> details = Map.of(
                "marginUsage", summary.getPortfolioMarginUsage(),
                "pnlPercentage", summary.getPortfolioPnlPercentage(),
                "returnPercentage", summary.getPortfolioReturnPercentage());

        if (level == RiskLevel.CRITICAL) {
            if (!criticalFired.getAndSet(true)) {
                log.error(
                        "CRITICAL portfolio risk: margin usage {}%, PnL {}%",
                        summary.getPortfolioMarginUsage(), summary.getPortfolioPnlPercentage());
                eventPublisherHelper.publishRiskEvent(
                        this,
                        RiskEventType.PORTFOLIO_RISK_HIGH,
                        AlertSeverity.CRITICAL,
                        "Portfolio risk CRITICAL: " + String.join("; ", summary.getRecommendations()),
                        details);
            }
            closeWorstPosition(summary);
        } else if (level == RiskLevel.HIGH) {
            criticalFired.set(false);
            if (!highFired.getAndSet(true)) {
                log.warn(
                        "HIGH portfolio risk: margin usage {}%, PnL {}%",
                        summary.getPortfolioMarginUsage(), summary.getPortfolioPnlPercentage());
                eventPublisherHelper.publishRiskEvent(
                        this,
                        RiskEventType.PORTFOLIO_RISK_HIGH,
                        AlertSeverity.WARNING,
                        "Portfolio risk HIGH: " + String.join("; ", summary.getRecommendations()),
                        details);
            }
        } else {
            resetAlertFlags();
        }
    }

    public void resetAlertFlags() {
        highFired.set(false);
        criticalFired.set(false);
    }

    private void closeWorstPosition(PortfolioRiskSummary summary) {
        Optional<RiskMetrics> worst = summary.getPositionRisks().stream()
                .max(Comparator.comparing(RiskMetrics::getRiskScore));
        if (worst.isEmpty()) {
            return;
        }
        RiskMetrics metrics = worst.get();
        TradeResult result = tradeExecutor.forceClosePosition(metrics.getPositionId(), REASON_PORTFOLIO_PROTECTION);
        if (result.isSuccess()) {
            log.error("Portfolio protection closed {} (risk score {})", metrics.getSymbol(), metrics.getRiskScore());
        } else {
            log.warn("Portfolio protection could not close {}: {}", metrics.getSymbol(), result.getReason());
        }
    }
}
