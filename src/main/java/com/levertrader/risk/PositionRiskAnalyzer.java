package com.levertrader.risk;

import com.levertrader.config.RiskProperties;
import com.levertrader.domain.enums.RiskAction;
import com.levertrader.domain.enums.RiskLevel;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.RiskMetrics;
import com.levertrader.pnl.PnLCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import org.springframework.stereotype.Component;

/**
 * Scores a single position at a given price.
 *
 * <p>Pure with respect to the position: nothing is written back. The level cascades from the
 * most severe tier down; the first tier where margin usage, loss or holding time exceeds its
 * threshold wins.
 */
@Component
public class PositionRiskAnalyzer {

    private static final int PERCENT_SCALE = PnLCalculator.PERCENT_SCALE;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    private final RiskProperties riskProperties;
    private final PnLCalculator pnLCalculator;
    private final TrailingStopTracker trailingStopTracker;
    private final Clock clock;

    public PositionRiskAnalyzer(
            RiskProperties riskProperties,
            PnLCalculator pnLCalculator,
            TrailingStopTracker trailingStopTracker,
            Clock clock) {
        this.riskProperties = riskProperties;
        this.pnLCalculator = pnLCalculator;
        this.trailingStopTracker = trailingStopTracker;
        this.clock = clock;
    }

    public RiskMetrics analyze(Position position, BigDecimal price, BigDecimal accountBalance) {
        BigDecimal pnlPercentage = pnLCalculator.pnlPercentage(position, price);
        BigDecimal marginUsage = marginUsage(position, accountBalance);
        BigDecimal holdingHours = holdingHours(position);
        BigDecimal volatilityScore = riskProperties.getReferenceVolatilityScore();

        RiskLevel riskLevel = classify(marginUsage, pnlPercentage, holdingHours, volatilityScore);

        return RiskMetrics.builder()
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .riskLevel(riskLevel)
                .marginUsage(marginUsage)
                .pnlPercentage(pnlPercentage)
                .holdingHours(holdingHours)
                .distanceFromStopLoss(distancePercent(position.getStopLoss(), price))
                .distanceFromTarget(distancePercent(position.getTarget(), price))
                .volatilityScore(volatilityScore)
                .recommendation(recommend(riskLevel, marginUsage, pnlPercentage, holdingHours))
                .trailingStopPrice(trailingStopPrice(position, price, pnlPercentage))
                .riskScore(riskScore(marginUsage, pnlPercentage, holdingHours, volatilityScore))
                .build();
    }

    /** Position margin as a percentage of free balance, capped at 100. An empty account reads 100. */
    BigDecimal marginUsage(Position position, BigDecimal accountBalance) {
        BigDecimal margin = position.getMarginUsed() != null ? position.getMarginUsed() : BigDecimal.ZERO;
        if (accountBalance == null || accountBalance.signum() <= 0) {
            return margin.signum() > 0 ? HUNDRED : BigDecimal.ZERO;
        }
        return margin.multiply(HUNDRED).divide(accountBalance, PERCENT_SCALE, RoundingMode.HALF_UP).min(HUNDRED);
    }

    BigDecimal holdingHours(Position position) {
        if (position.getEntryTime() == null) {
            return BigDecimal.ZERO;
        }
        long seconds = Math.max(0, Duration.between(position.getEntryTime(), LocalDateTime.now(clock)).getSeconds());
        return BigDecimal.valueOf(seconds).divide(SECONDS_PER_HOUR, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    RiskLevel classify(
            BigDecimal marginUsage, BigDecimal pnlPercentage, BigDecimal holdingHours, BigDecimal volatilityScore) {
        if (exceeds(riskProperties.getCritical(), marginUsage, pnlPercentage, holdingHours)) {
            return RiskLevel.CRITICAL;
        }
        if (exceeds(riskProperties.getHigh(), marginUsage, pnlPercentage, holdingHours)
                || volatilityScore.compareTo(riskProperties.getHighVolatilityScore()) > 0) {
            return RiskLevel.HIGH;
        }
        if (exceeds(riskProperties.getMedium(), marginUsage, pnlPercentage, holdingHours)
                || volatilityScore.compareTo(riskProperties.getMediumVolatilityScore()) > 0) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    RiskAction recommend(
            RiskLevel riskLevel, BigDecimal marginUsage, BigDecimal pnlPercentage, BigDecimal holdingHours) {
        if (exceeds(riskProperties.getEmergency(), marginUsage, pnlPercentage, holdingHours)) {
            return RiskAction.EMERGENCY_CLOSE;
        }
        return switch (riskLevel) {
            case CRITICAL -> exceeds(riskProperties.getCritical(), marginUsage, pnlPercentage, holdingHours)
                    ? RiskAction.CLOSE_POSITION
                    : RiskAction.MONITOR;
            case HIGH -> pnlPercentage.compareTo(riskProperties.getHigh().getLossPct().negate()) < 0
                    ? RiskAction.TIGHTEN_STOP_LOSS
                    : RiskAction.MONITOR;
            case MEDIUM, LOW -> pnlPercentage.compareTo(riskProperties.getActivateTrailingProfitPct()) > 0
                    ? RiskAction.ACTIVATE_TRAILING
                    : RiskAction.MONITOR;
        };
    }

    /**
     * Weighted aggregate, capped at 100: margin usage, loss magnitude, holding time against a
     * 48 hour horizon, and the volatility score.
     */
    BigDecimal riskScore(
            BigDecimal marginUsage, BigDecimal pnlPercentage, BigDecimal holdingHours, BigDecimal volatilityScore) {
        BigDecimal marginScore = marginUsage.min(HUNDRED);
        BigDecimal pnlScore = pnlPercentage.signum() < 0 ? pnlPercentage.abs() : BigDecimal.ZERO;
        BigDecimal timeScore = holdingHours
                .multiply(HUNDRED)
                .divide(riskProperties.getEmergency().getHoldingHours(), PERCENT_SCALE, RoundingMode.HALF_UP)
                .min(HUNDRED);
        BigDecimal volatility = volatilityScore.min(HUNDRED);

        BigDecimal score = marginScore.multiply(riskProperties.getMarginWeight())
                .add(pnlScore.multiply(riskProperties.getPnlWeight()))
                .add(timeScore.multiply(riskProperties.getTimeWeight()))
                .add(volatility.multiply(riskProperties.getVolatilityWeight()));
        return score.min(HUNDRED).setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * The armed ratchet's stop when there is one; otherwise a suggestion trailing the current
     * price once profit reaches the activation threshold; otherwise null.
     */
    private BigDecimal trailingStopPrice(Position position, BigDecimal price, BigDecimal pnlPercentage) {
        if (trailingStopTracker.isActive(position.getId())) {
            return trailingStopTracker.getStopPrice(position.getId()).orElse(null);
        }
        if (pnlPercentage.compareTo(riskProperties.getTrailingActivationProfitPct()) >= 0) {
            return trailingStopTracker.stopBehind(position.getSide(), price);
        }
        return null;
    }

    private static boolean exceeds(
            RiskProperties.Tier tier, BigDecimal marginUsage, BigDecimal pnlPercentage, BigDecimal holdingHours) {
        return marginUsage.compareTo(tier.getMarginPct()) > 0
                || pnlPercentage.compareTo(tier.getLossPct().negate()) < 0
                || holdingHours.compareTo(tier.getHoldingHours()) > 0;
    }

    private static BigDecimal distancePercent(BigDecimal level, BigDecimal price) {
        if (level == null || price.signum() <= 0) {
            return null;
        }
        return level.subtract(price).abs().multiply(HUNDRED).divide(price, PERCENT_SCALE, RoundingMode.HALF_UP);
    }
}
