package com.levertrader.risk;

import com.levertrader.config.RiskProperties;
import com.levertrader.domain.enums.RiskLevel;
import com.levertrader.domain.model.Account;
import com.levertrader.domain.model.PortfolioRiskSummary;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.RiskMetrics;
import com.levertrader.pnl.PnLCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Aggregates per-position risk into a portfolio view.
 *
 * <p>Only OPEN positions with a known positive price are evaluated, and a book with none of
 * them is LOW. The overall level uses its
 * own, looser tiers: margin usage at or above the tier, portfolio loss at or beyond it, or a
 * return against the initial balance below it.
 */
@Component
public class PortfolioRiskAnalyzer {

    private static final int PERCENT_SCALE = PnLCalculator.PERCENT_SCALE;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal LOSS_WEIGHT = new BigDecimal("0.5");

    private final RiskProperties riskProperties;
    private final PnLCalculator pnLCalculator;
    private final PositionRiskAnalyzer positionRiskAnalyzer;
    private final Clock clock;

    public PortfolioRiskAnalyzer(
            RiskProperties riskProperties,
            PnLCalculator pnLCalculator,
            PositionRiskAnalyzer positionRiskAnalyzer,
            Clock clock) {
        this.riskProperties = riskProperties;
        this.pnLCalculator = pnLCalculator;
        this.positionRiskAnalyzer = positionRiskAnalyzer;
        this.clock = clock;
    }

    public PortfolioRiskSummary analyze(Account account, List<Position> openPositions, Map<String, BigDecimal> prices) {
        BigDecimal balance = account.getCurrentBalance();
        BigDecimal totalMargin = BigDecimal.ZERO;
        BigDecimal totalUnrealized = BigDecimal.ZERO;
        List<RiskMetrics> positionRisks = new ArrayList<>();
        Map<RiskLevel, Integer> distribution = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            distribution.put(level, 0);
        }

        for (Position position : openPositions) {
            BigDecimal price = prices.get(position.getSymbol());
            if (!position.isOpen() || price == null || price.signum() <= 0) {
                continue;
            }
            RiskMetrics metrics = positionRiskAnalyzer.analyze(position, price, balance);
            positionRisks.add(metrics);
            distribution.merge(metrics.getRiskLevel(), 1, Integer::sum);
            totalMargin = totalMargin.add(position.getMarginUsed());
            totalUnrealized = totalUnrealized.add(pnLCalculator.unrealizedPnl(position, price));
        }

        BigDecimal marginUsage = percentOf(totalMargin, balance);
        BigDecimal pnlPercentage = percentOf(totalUnrealized, balance);
        BigDecimal effectiveRisk = marginUsage.add(pnlPercentage.negate().max(BigDecimal.ZERO).multiply(LOSS_WEIGHT));
        // Free balance excludes reserved margin, which is still the account's money.
        BigDecimal portfolioValue = balance.add(totalMargin).add(totalUnrealized);
        BigDecimal returnPercentage = percentOf(portfolioValue.subtract(account.getInitialBalance()),
                account.getInitialBalance());

        RiskLevel overall = positionRisks.isEmpty()
                ? RiskLevel.LOW
                : classify(marginUsage, pnlPercentage, returnPercentage);

        return PortfolioRiskSummary.builder()
                .overallRiskLevel(overall)
                .portfolioMarginUsage(marginUsage)
                .portfolioPnlPercentage(pnlPercentage)
                .effectiveRisk(effectiveRisk)
                .portfolioReturnPercentage(returnPercentage)
                .totalMarginUsed(totalMargin)
                .totalUnrealizedPnl(totalUnrealized)
                .accountBalance(balance)
                .totalPortfolioValue(portfolioValue)
                .openPositions(openPositions.size())
                .evaluatedPositions(positionRisks.size())
                .riskDistribution(distribution)
                .positionRisks(positionRisks)
                .recommendations(recommendations(overall, distribution, marginUsage, pnlPercentage))
                .analyzedAt(LocalDateTime.now(clock))
                .build();
    }

    RiskLevel classify(BigDecimal marginUsage, BigDecimal pnlPercentage, BigDecimal returnPercentage) {
        if (breaches(riskProperties.getPortfolioCritical(), marginUsage, pnlPercentage, returnPercentage)) {
            return RiskLevel.CRITICAL;
        }
        if (breaches(riskProperties.getPortfolioHigh(), marginUsage, pnlPercentage, returnPercentage)) {
            return RiskLevel.HIGH;
        }
        if (breaches(riskProperties.getPortfolioMedium(), marginUsage, pnlPercentage, returnPercentage)) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    List<String> recommendations(
            RiskLevel overall, Map<RiskLevel, Integer> distribution, BigDecimal marginUsage, BigDecimal pnlPercentage) {
        List<String> lines = new ArrayList<>();
        String margin = formatPercent(marginUsage);
        String pnl = formatPercent(pnlPercentage);
        switch (overall) {
            case CRITICAL -> {
                lines.add("CRITICAL: immediate action required");
                if (marginUsage.compareTo(BigDecimal.valueOf(90)) > 0) {
                    lines.add("Margin usage too high: " + margin + "% - close positions immediately");
                }
                if (pnlPercentage.compareTo(BigDecimal.valueOf(-15)) < 0) {
                    lines.add("Portfolio loss critical: " + pnl + "% - emergency close");
                }
                if (distribution.get(RiskLevel.CRITICAL) > 0) {
                    lines.add(distribution.get(RiskLevel.CRITICAL) + " position(s) in critical state");
                }
            }
            case HIGH -> {
                lines.add("HIGH RISK: consider reducing exposure");
                if (marginUsage.compareTo(BigDecimal.valueOf(75)) > 0) {
                    lines.add("Margin usage high: " + margin + "% - reduce position sizes");
                }
                if (pnlPercentage.compareTo(BigDecimal.valueOf(-10)) < 0) {
                    lines.add("Portfolio declining: " + pnl + "% - review stop losses");
                }
                if (distribution.get(RiskLevel.HIGH) > 1) {
                    lines.add(distribution.get(RiskLevel.HIGH) + " positions need attention");
                }
            }
            case MEDIUM -> {
                lines.add("MODERATE RISK: monitor closely");
                if (marginUsage.compareTo(BigDecimal.valueOf(50)) > 0) {
                    lines.add("Margin usage: " + margin + "% - consider taking profits");
                }
                if (pnlPercentage.compareTo(BigDecimal.valueOf(-5)) < 0) {
                    lines.add("Portfolio down: " + pnl + "% - review positions");
                }
            }
            case LOW -> {
                lines.add("Portfolio risk is healthy");
                if (marginUsage.compareTo(BigDecimal.valueOf(30)) < 0) {
                    lines.add("Low margin usage - room for more positions");
                }
                if (pnlPercentage.compareTo(BigDecimal.valueOf(5)) > 0) {
                    lines.add("Good performance - consider taking partial profits");
                }
            }
        }

        BigDecimal maxPortfolioRisk = riskProperties.getMaxPortfolioRiskPct();
        if (marginUsage.compareTo(maxPortfolioRisk) >= 0) {
            lines.add("ANTI-OVERTRADE ACTIVE: " + margin + "% >= " + maxPortfolioRisk.toPlainString()
                    + "% - new trades blocked");
        } else if (marginUsage.compareTo(riskProperties.getPortfolioHighRiskMarginPct()) >= 0) {
            lines.add("Approaching overtrade threshold: " + margin + "% (limit: " + maxPortfolioRisk.toPlainString()
                    + "%)");
        }
        return lines;
    }

    private static boolean breaches(
            RiskProperties.PortfolioTier tier,
            BigDecimal marginUsage,
            BigDecimal pnlPercentage,
            BigDecimal returnPercentage) {
        return marginUsage.compareTo(tier.getMarginPct()) >= 0
                || pnlPercentage.compareTo(tier.getLossPct().negate()) <= 0
                || returnPercentage.compareTo(tier.getReturnLossPct().negate()) < 0;
    }

    /** {@code amount / base * 100}; an empty base reads 100 for a positive amount and 0 otherwise. */
    private static BigDecimal percentOf(BigDecimal amount, BigDecimal base) {
        if (base == null || base.signum() <= 0) {
            return amount.signum() > 0 ? HUNDRED : BigDecimal.ZERO;
        }
        return amount.multiply(HUNDRED).divide(base, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private static String formatPercent(BigDecimal value) {
        return value.setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
