package com.levertrader.risk;

import com.levertrader.config.RiskProperties;
import com.levertrader.config.TradingProperties;
import com.levertrader.domain.enums.AlertSeverity;
import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.domain.enums.RiskAction;
import com.levertrader.domain.enums.RiskLevel;
import com.levertrader.domain.model.Account;
import com.levertrader.domain.model.MarginHealthReport;
import com.levertrader.domain.model.PortfolioRiskSummary;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.RiskMetrics;
import com.levertrader.domain.model.SafeQuantityResult;
import com.levertrader.domain.model.TradeResult;
import com.levertrader.event.EventPublisherHelper;
import com.levertrader.event.RiskEventType;
import com.levertrader.execution.TradeExecutor;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Risk evaluation and protective actions over the positions owned by {@link TradeExecutor}.
 *
 * <p>Responsible for:
 * <ul>
 *   <li><b>Per-position analysis:</b> risk level, recommendation, trailing stop and score via
 *       {@link PositionRiskAnalyzer}</li>
 *   <li><b>Protective actions:</b> trailing-stop exits, liquidation protection, critical-risk
 *       closes, stop tightening and trailing activation</li>
 *   <li><b>Portfolio analysis:</b> aggregate margin, PnL and level via {@link PortfolioRiskAnalyzer}</li>
 *   <li><b>Admission control:</b> safe quantity for a new trade via {@link SafeQuantityCalculator}</li>
 *   <li><b>Monitoring:</b> one pass over every OPEN position in a fixed check order</li>
 * </ul>
 *
 * <p>The engine holds no position state of its own. All mutation goes through the executor,
 * so it is serialized with trading. Nothing here throws out of a monitoring pass: failed
 * protective actions are logged, reported as {@link RiskEventType#PROTECTIVE_ACTION_FAILED},
 * and retried on the next pass.
 */
@Service
public class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    static final String REASON_STOP_LOSS = "Stop Loss Hit";
    static final String REASON_TARGET = "Target Hit";
    static final String REASON_TIME_LIMIT = "Time Limit Reached";
    static final String REASON_TRAILING_STOP = "Trailing Stop Hit";
    static final String REASON_LIQUIDATION = "LIQUIDATION PROTECTION - Emergency Close";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TradeExecutor tradeExecutor;
    private final PositionRiskAnalyzer positionRiskAnalyzer;
    private final PortfolioRiskAnalyzer portfolioRiskAnalyzer;
    private final SafeQuantityCalculator safeQuantityCalculator;
    private final LiquidationEstimator liquidationEstimator;
    private final TrailingStopTracker trailingStopTracker;
    private final WarningThrottle warningThrottle;
    private final RiskProperties riskProperties;
    private final TradingProperties tradingProperties;
    private final EventPublisherHelper eventPublisherHelper;

    public RiskEngine(
            TradeExecutor tradeExecutor,
            PositionRiskAnalyzer positionRiskAnalyzer,
            PortfolioRiskAnalyzer portfolioRiskAnalyzer,
            SafeQuantityCalculator safeQuantityCalculator,
            LiquidationEstimator liquidationEstimator,
            TrailingStopTracker trailingStopTracker,
            WarningThrottle warningThrottle,
            RiskProperties riskProperties,
            TradingProperties tradingProperties,
            EventPublisherHelper eventPublisherHelper) {
        this.tradeExecutor = tradeExecutor;
        this.positionRiskAnalyzer = positionRiskAnalyzer;
        this.portfolioRiskAnalyzer = portfolioRiskAnalyzer;
        this.safeQuantityCalculator = safeQuantityCalculator;
        this.liquidationEstimator = liquidationEstimator;
        this.trailingStopTracker = trailingStopTracker;
        this.warningThrottle = warningThrottle;
        this.riskProperties = riskProperties;
        this.tradingProperties = tradingProperties;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // ANALYSIS
    // ========================

    /** Risk metrics for {@code position} at {@code price}, against the current free balance. */
    public RiskMetrics analyzePosition(Position position, BigDecimal price) {
        return positionRiskAnalyzer.analyze(
                position, price, tradeExecutor.getAccountSnapshot().getCurrentBalance());
    }

    /** Estimated percentage move left before liquidation; 100 for unleveraged positions. */
    public BigDecimal liquidationDistance(Position position, BigDecimal price) {
        return liquidationEstimator.distancePercent(position, price);
    }

    public PortfolioRiskSummary analyzePortfolioRisk() {
        return portfolioRiskAnalyzer.analyze(
                tradeExecutor.getAccountSnapshot(), tradeExecutor.getOpenPositions(), tradeExecutor.getLastPrices());
    }

    /**
     * Admission control for a prospective trade. Margin usage is measured over every OPEN
     * position, priced or not.
     *
     * @param leverage null for the configured default
     */
    public SafeQuantityResult calculateSafeQuantity(
            String symbol, BigDecimal price, BigDecimal requestedQuantity, BigDecimal leverage) {
        try {
            Account account = tradeExecutor.getAccountSnapshot();
            SafeQuantityResult result = safeQuantityCalculator.calculate(
                    symbol,
                    price,
                    requestedQuantity,
                    leverage,
                    account,
                    tradeExecutor.getOpenPositions(),
                    portfolioMarginUsage(account));
            if (result.isAntiOvertrade()) {
                eventPublisherHelper.publishRiskEvent(
                        this,
                        RiskEventType.ANTI_OVERTRADE,
                        AlertSeverity.WARNING,
                        result.getReason(),
                        Map.of("symbol", symbol));
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Error calculating safe quantity for {}: {}", symbol, e.getMessage(), e);
            return SafeQuantityResult.rejected("Error calculating safe quantity: " + e.getMessage());
        }
    }

    /** OPEN positions held at least the configured warning threshold. */
    public List<Position> positionsApproachingTimeLimit() {
        BigDecimal warningHours = BigDecimal.valueOf(tradingProperties.getHoldingWarningHours());
        return tradeExecutor.getOpenPositions().stream()
                .filter(position -> positionRiskAnalyzer.holdingHours(position).compareTo(warningHours) >= 0)
                .toList();
    }

    /** Margin ratio and liquidation distance of every priced OPEN position. */
    public MarginHealthReport checkMarginHealth() {
        Account account = tradeExecutor.getAccountSnapshot();
        Map<String, BigDecimal> prices = tradeExecutor.getLastPrices();
        List<MarginHealthReport.Entry> entries = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Position position : tradeExecutor.getOpenPositions()) {
            BigDecimal price = prices.get(position.getSymbol());
            if (price == null || price.signum() <= 0) {
                continue;
            }
            BigDecimal ratio = liquidationEstimator.marginRatio(position);
            BigDecimal distance = liquidationEstimator.distancePercent(position, price);
            entries.add(MarginHealthReport.Entry.builder()
                    .positionId(position.getId())
                    .symbol(position.getSymbol())
                    .price(price)
                    .marginRatio(ratio == null ? null : ratio.multiply(HUNDRED).setScale(4, RoundingMode.HALF_UP))
                    .liquidationDistance(distance)
                    .build());
            if (distance.compareTo(riskProperties.getLiquidationWarningDistancePct()) <= 0) {
                warnings.add(String.format(
                        "%s %s is %s%% from liquidation",
                        position.getSide(), position.getSymbol(), distance.setScale(2, RoundingMode.HALF_UP)));
            }
        }

        return MarginHealthReport.builder()
                .totalMarginUsed(account.getTotalMarginUsed())
                .accountBalance(account.getCurrentBalance())
                .entries(entries)
                .warnings(warnings)
                .build();
    }

    // ========================
    // PROTECTIVE ACTIONS
    // ========================

    /**
     * Applies the protective action the metrics call for, in priority order:
     * <ol>
     *   <li>an armed trailing stop that price has crossed closes the position; otherwise the
     *       stop is ratcheted</li>
     *   <li>CRITICAL: within the emergency liquidation distance the position is closed
     *       regardless of recommendation; otherwise a close recommendation is carried out</li>
     *   <li>HIGH: within the warning distance a throttled warning is raised; otherwise a
     *       tighten recommendation moves the stop closer to price</li>
     *   <li>a position past the trailing profit threshold has its trailing stop armed</li>
     * </ol>
     *
     * @return true if anything was changed
     */
    public boolean executeRiskAction(Position position, RiskMetrics metrics, BigDecimal price) {
        try {
            if (trailingStopTracker.isTriggered(position, price)) {
                return close(position, price, REASON_TRAILING_STOP);
            }
            trailingStopTracker.ratchet(position, price);

            boolean actionTaken = false;
            BigDecimal distance = liquidationEstimator.distancePercent(position, price);

            if (metrics.getRiskLevel() == RiskLevel.CRITICAL) {
                if (distance.compareTo(riskProperties.getLiquidationEmergencyDistancePct()) <= 0) {
                    log.error(
                            "LIQUIDATION PROTECTION: {} {} is {}% from liquidation, closing",
                            position.getSide(), position.getSymbol(), distance.toPlainString());
                    boolean closed = close(position, price, REASON_LIQUIDATION);
                    if (closed) {
                        eventPublisherHelper.publishRiskEvent(
                                this,
                                RiskEventType.LIQUIDATION_PROTECTION,
                                AlertSeverity.CRITICAL,
                                String.format("Emergency close of %s %s, %s%% from liquidation",
                                        position.getSide(), position.getSymbol(), distance.toPlainString()),
                                details(position, price, distance));
                    }
                    return closed;
                }
                RiskAction recommendation = metrics.getRecommendation();
                if (recommendation == RiskAction.CLOSE_POSITION || recommendation == RiskAction.EMERGENCY_CLOSE) {
                    boolean closed = close(position, price, "Risk Management: " + recommendation);
                    if (closed) {
                        eventPublisherHelper.publishRiskEvent(
                                this,
                                RiskEventType.CRITICAL_RISK_CLOSURE,
                                AlertSeverity.CRITICAL,
                                String.format("Closed %s %s on %s (risk score %s)",
                                        position.getSide(), position.getSymbol(), recommendation,
                                        metrics.getRiskScore().toPlainString()),
                                details(position, price, distance));
                    }
                    return closed;
                }
            } else if (metrics.getRiskLevel() == RiskLevel.HIGH) {
                if (distance.compareTo(riskProperties.getLiquidationWarningDistancePct()) <= 0) {
                    if (warningThrottle.tryAcquire(position.getSymbol() + "_liquidation_warning")) {
                        log.warn(
                                "{} {} is {}% from liquidation",
                                position.getSide(), position.getSymbol(), distance.toPlainString());
                        eventPublisherHelper.publishRiskEvent(
                                this,
                                RiskEventType.LIQUIDATION_WARNING,
                                AlertSeverity.WARNING,
                                String.format("%s %s approaching liquidation: %s%% away",
                                        position.getSide(), position.getSymbol(), distance.toPlainString()),
                                details(position, price, distance));
                        actionTaken = true;
                    }
                } else if (metrics.getRecommendation() == RiskAction.TIGHTEN_STOP_LOSS) {
                    actionTaken = tightenStop(position, price, distance);
                }
            }

            if (metrics.getPnlPercentage().compareTo(riskProperties.getActivateTrailingProfitPct()) > 0
                    && !trailingStopTracker.isActive(position.getId())) {
                trailingStopTracker.activate(position, price);
                eventPublisherHelper.publishRiskEvent(
                        this,
                        RiskEventType.TRAILING_ACTIVATED,
                        AlertSeverity.INFO,
                        String.format("Trailing stop armed for %s %s at %s",
                                position.getSide(), position.getSymbol(),
                                trailingStopTracker.getStopPrice(position.getId())
                                        .map(BigDecimal::toPlainString)
                                        .orElse("-")),
                        details(position, price, distance));
                actionTaken = true;
            }
            return actionTaken;
        } catch (RuntimeException e) {
            reportFailure(position, "risk action", e);
            return false;
        }
    }

    // ========================
    // MONITORING
    // ========================

    /**
     * One monitoring pass. For each OPEN position with a known price the checks run in order
     * (stop loss, target, holding time, full risk analysis) and the first one that closes the
     * position ends its turn.
     *
     * @return a description of each action taken
     */
    public List<String> monitorPositions() {
        List<String> actions = new ArrayList<>();
        List<Position> openPositions;
        Map<String, BigDecimal> prices;
        try {
            openPositions = tradeExecutor.getOpenPositions();
            prices = tradeExecutor.getLastPrices();
        } catch (RuntimeException e) {
            log.error("Position monitoring skipped: {}", e.getMessage(), e);
            return actions;
        }

        for (Position position : openPositions) {
            BigDecimal price = prices.get(position.getSymbol());
            if (price == null || price.signum() <= 0) {
                continue;
            }
            try {
                if (isStopLossHit(position, price)) {
                    if (close(position, price, REASON_STOP_LOSS)) {
                        actions.add("Stop Loss: " + position.getSymbol());
                        continue;
                    }
                    if (isAlreadyClosed(position.getId())) {
                        continue;
                    }
                }

                if (isTargetHit(position, price)) {
                    if (tradeExecutor.checkTrailingOpportunity(position, price)) {
                        TradeResult result = tradeExecutor.executeTrailing(position.getId(), price);
                        if (result.isSuccess()) {
                            actions.add("Trailing Exit: " + position.getSymbol());
                            continue;
                        }
                    } else if (close(position, price, REASON_TARGET)) {
                        actions.add("Target Hit: " + position.getSymbol());
                        continue;
                    }
                    if (isAlreadyClosed(position.getId())) {
                        continue;
                    }
                }

                if (isTimeLimitExceeded(position)) {
                    if (close(position, price, REASON_TIME_LIMIT)) {
                        actions.add("Time Limit: " + position.getSymbol());
                        continue;
                    }
                    if (isAlreadyClosed(position.getId())) {
                        continue;
                    }
                }

                RiskMetrics metrics = analyzePosition(position, price);
                if (executeRiskAction(position, metrics, price)) {
                    actions.add("Risk Action: " + position.getSymbol());
                }
            } catch (RuntimeException e) {
                reportFailure(position, "monitoring", e);
            }
        }
        return actions;
    }

    // ========================
    // INTERNALS
    // ========================

    boolean isStopLossHit(Position position, BigDecimal price) {
        BigDecimal stopLoss = position.getStopLoss();
        if (stopLoss == null) {
            return false;
        }
        return position.getSide() == PositionSide.LONG
                ? price.compareTo(stopLoss) <= 0
                : price.compareTo(stopLoss) >= 0;
    }

    boolean isTargetHit(Position position, BigDecimal price) {
        BigDecimal target = position.getTarget();
        if (target == null) {
            return false;
        }
        return position.getSide() == PositionSide.LONG
                ? price.compareTo(target) >= 0
                : price.compareTo(target) <= 0;
    }

    boolean isTimeLimitExceeded(Position position) {
        return positionRiskAnalyzer.holdingHours(position)
                        .compareTo(BigDecimal.valueOf(tradingProperties.getMaxHoldingHours()))
                >= 0;
    }

    private boolean tightenStop(Position position, BigDecimal price, BigDecimal distance) {
        BigDecimal offset = riskProperties.getTightenStopPct().divide(HUNDRED);
        BigDecimal newStop = position.getSide() == PositionSide.LONG
                ? price.multiply(BigDecimal.ONE.subtract(offset))
                : price.multiply(BigDecimal.ONE.add(offset));
        if (!tradeExecutor.tightenStopLoss(position.getId(), newStop)) {
            return false;
        }
        if (warningThrottle.tryAcquire(position.getSymbol() + "_stop_loss_tighten")) {
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.STOP_LOSS_TIGHTENED,
                    AlertSeverity.WARNING,
                    String.format("Stop loss tightened on %s %s to %s",
                            position.getSide(), position.getSymbol(), newStop.toPlainString()),
                    details(position, price, distance));
        }
        return true;
    }

    private boolean close(Position position, BigDecimal price, String reason) {
        TradeResult result = tradeExecutor.closePosition(position.getId(), price, reason);
        if (!result.isSuccess()) {
            if (isAlreadyClosed(position.getId())) {
                log.debug("{} already closed by another pass, skipping {}", position.getSymbol(), reason);
                return false;
            }
            log.warn("Could not close {} ({}): {}", position.getSymbol(), reason, result.getReason());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.PROTECTIVE_ACTION_FAILED,
                    AlertSeverity.CRITICAL,
                    String.format("Failed to close %s (%s): %s", position.getSymbol(), reason, result.getReason()),
                    Map.of("symbol", position.getSymbol(), "positionId", position.getId()));
        }
        return result.isSuccess();
    }

    private boolean isAlreadyClosed(String positionId) {
        return tradeExecutor.getPosition(positionId)
                .map(current -> current.getStatus() == PositionStatus.CLOSED)
                .orElse(false);
    }

    private void reportFailure(Position position, String stage, RuntimeException e) {
        log.error("Risk {} failed for {}: {}", stage, position.getSymbol(), e.getMessage(), e);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.PROTECTIVE_ACTION_FAILED,
                AlertSeverity.CRITICAL,
                String.format("Risk %s failed for %s: %s", stage, position.getSymbol(), e.getMessage()),
                Map.of("symbol", position.getSymbol(), "positionId", position.getId()));
    }

    private static BigDecimal portfolioMarginUsage(Account account) {
        BigDecimal margin = account.getTotalMarginUsed();
        BigDecimal balance = account.getCurrentBalance();
        if (balance == null || balance.signum() <= 0) {
            return margin != null && margin.signum() > 0 ? HUNDRED : BigDecimal.ZERO;
        }
        return margin.multiply(HUNDRED).divide(balance, 4, RoundingMode.HALF_UP);
    }

    private static Map<String, Object> details(Position position, BigDecimal price, BigDecimal distance) {
        return Map.of(
                "symbol", position.getSymbol(),
                "positionId", position.getId(),
                "price", price,
                "liquidationDistance", distance);
    }
}
