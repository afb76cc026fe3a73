package com.levertrader.risk;

import com.levertrader.config.RiskProperties;
import com.levertrader.config.TradingProperties;
import com.levertrader.domain.model.Account;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.SafeQuantityResult;
import com.levertrader.pnl.PnLCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Admission control: decides how much of a symbol may be opened, or why nothing may.
 *
 * <p>Checks run in a fixed order and the first failing one decides the outcome:
 * <ol>
 *   <li>portfolio margin usage below the anti-overtrade ceiling</li>
 *   <li>no OPEN position for the symbol</li>
 *   <li>open-position count below the cap</li>
 *   <li>positive free balance</li>
 * </ol>
 * The quantity is then sized from a fraction of the balance (smaller for small accounts),
 * discounted by the liquidation buffer, and capped by the requested quantity unless that is
 * negligible. The returned reason string names the binding constraint.
 */
@Component
public class SafeQuantityCalculator {

    private static final Logger log = LoggerFactory.getLogger(SafeQuantityCalculator.class);

    private static final int SCALE = PnLCalculator.PRICE_SCALE;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TradingProperties tradingProperties;
    private final RiskProperties riskProperties;

    public SafeQuantityCalculator(TradingProperties tradingProperties, RiskProperties riskProperties) {
        this.tradingProperties = tradingProperties;
        this.riskProperties = riskProperties;
    }

    /**
     * @param leverage requested leverage; null for the configured default
     * @param portfolioMarginUsage current portfolio margin usage, percent
     */
    public SafeQuantityResult calculate(
            String symbol,
            BigDecimal price,
            BigDecimal requestedQuantity,
            BigDecimal leverage,
            Account account,
            List<Position> openPositions,
            BigDecimal portfolioMarginUsage) {

        BigDecimal maxPortfolioRisk = riskProperties.getMaxPortfolioRiskPct();
        if (portfolioMarginUsage.compareTo(maxPortfolioRisk) >= 0) {
            return SafeQuantityResult.antiOvertrade(String.format(
                    "ANTI-OVERTRADE: Portfolio risk too high %s%% >= %s%%. Close existing positions first.",
                    oneDecimal(portfolioMarginUsage), maxPortfolioRisk.toPlainString()));
        }
        if (portfolioMarginUsage.compareTo(riskProperties.getPortfolioHighRiskMarginPct()) >= 0) {
            log.warn(
                    "Portfolio approaching high risk: {}% (limit: {}%)",
                    oneDecimal(portfolioMarginUsage), maxPortfolioRisk.toPlainString());
        }

        Optional<Position> existing = openPositions.stream()
                .filter(position -> position.isOpen() && position.getSymbol().equals(symbol))
                .findFirst();
        if (existing.isPresent()) {
            Position position = existing.get();
            return SafeQuantityResult.rejected(String.format(
                    "Position already open for %s (%s, qty=%s, entry=%s)",
                    symbol,
                    position.getSide(),
                    position.getEffectiveQuantity().toPlainString(),
                    position.getEntryPrice().setScale(2, RoundingMode.HALF_UP).toPlainString()));
        }

        int maxPositions = tradingProperties.getMaxPositionsOpen();
        long openCount = openPositions.stream().filter(Position::isOpen).count();
        if (openCount >= maxPositions) {
            return SafeQuantityResult.rejected(String.format(
                    "Maximum open positions limit reached (%d/%d). Close some positions first.", openCount, maxPositions));
        }

        BigDecimal balance = account.getCurrentBalance();
        if (balance == null || balance.signum() <= 0) {
            return SafeQuantityResult.rejected("No available balance. Current balance: "
                    + (balance == null ? "0" : balance.setScale(2, RoundingMode.HALF_UP).toPlainString()));
        }
        if (price == null || price.signum() <= 0) {
            return SafeQuantityResult.rejected("Invalid price: " + price);
        }

        BigDecimal effectiveLeverage = leverage != null ? leverage : tradingProperties.getDefaultLeverage();
        if (effectiveLeverage.signum() <= 0) {
            return SafeQuantityResult.rejected("Invalid leverage: " + effectiveLeverage.toPlainString());
        }

        boolean safeMode = balance.compareTo(tradingProperties.getSafeModeBalanceThreshold()) <= 0;
        BigDecimal balanceFraction = safeMode
                ? tradingProperties.getSafeBalancePerTradePct()
                : tradingProperties.getBalancePerTradePct();
        log.debug(
                "Sizing {} in {} mode: {}% of balance {}",
                symbol,
                safeMode ? "SAFE" : "NORMAL",
                balanceFraction.multiply(HUNDRED).stripTrailingZeros().toPlainString(),
                balance.toPlainString());

        BigDecimal positionValue = balance.multiply(balanceFraction).multiply(effectiveLeverage);
        BigDecimal rawQuantity = positionValue.divide(price, SCALE, RoundingMode.DOWN);
        BigDecimal safeQuantity =
                rawQuantity.multiply(BigDecimal.ONE.subtract(tradingProperties.getLiquidationBufferPct()));

        BigDecimal requested = requestedQuantity != null ? requestedQuantity : BigDecimal.ZERO;
        BigDecimal finalQuantity;
        if (requested.signum() <= 0
                || requested.compareTo(safeQuantity.multiply(tradingProperties.getNegligibleQuantityRatio())) < 0) {
            finalQuantity = safeQuantity;
        } else {
            finalQuantity = requested.min(safeQuantity);
        }

        BigDecimal minTradeSize = tradingProperties.getMinTradeSize();
        if (finalQuantity.compareTo(minTradeSize) < 0) {
            return SafeQuantityResult.rejected(String.format(
                    "Calculated quantity %s below minimum trade size %s",
                    sixDecimals(finalQuantity), minTradeSize.toPlainString()));
        }

        BigDecimal finalValue = finalQuantity.multiply(price);
        BigDecimal finalMargin = finalValue.divide(effectiveLeverage, SCALE, RoundingMode.HALF_UP);
        BigDecimal totalCost = finalMargin.add(finalMargin.multiply(tradingProperties.getTradingFeePct()));
        if (totalCost.compareTo(balance) > 0) {
            return SafeQuantityResult.rejected(String.format(
                    "Insufficient balance. Need %s, have %s",
                    totalCost.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                    balance.setScale(2, RoundingMode.HALF_UP).toPlainString()));
        }

        String details = String.format(
                "Position: %s (%s%% of balance), Margin: %s (%s%%), Liquidation risk: %s%% from entry",
                finalValue.setScale(0, RoundingMode.HALF_UP).toPlainString(),
                oneDecimal(percentOf(finalValue, balance)),
                finalMargin.setScale(0, RoundingMode.HALF_UP).toPlainString(),
                oneDecimal(percentOf(finalMargin, balance)),
                oneDecimal(percentOf(finalMargin, finalValue)));

        if (finalQuantity.compareTo(requested) < 0) {
            String constraint = finalQuantity.compareTo(safeQuantity) == 0 ? "liquidation protection" : "balance limit";
            return SafeQuantityResult.approved(
                    finalQuantity,
                    String.format("Qty: %s (adjusted for %s). %s", sixDecimals(finalQuantity), constraint, details));
        }
        return SafeQuantityResult.approved(
                finalQuantity, String.format("Qty: %s approved. %s", sixDecimals(finalQuantity), details));
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal base) {
        return amount.multiply(HUNDRED).divide(base, 4, RoundingMode.HALF_UP);
    }

    private static String oneDecimal(BigDecimal value) {
        return value.setScale(1, RoundingMode.HALF_UP).toPlainString();
    }

    private static String sixDecimals(BigDecimal value) {
        return value.setScale(6, RoundingMode.HALF_UP).toPlainString();
    }
}
