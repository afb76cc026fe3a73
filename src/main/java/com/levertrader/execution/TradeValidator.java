package com.levertrader.execution;

import com.levertrader.config.TradingProperties;
import com.levertrader.domain.model.TradeRequest;
import com.levertrader.exception.ErrorCode;
import com.levertrader.exception.TradeRejectedException;
import com.levertrader.ledger.AccountLedger;
import com.levertrader.position.PositionStore;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Pre-trade checks for {@link TradeExecutor#openTrade}, applied in a fixed order so that the
 * reason reported is always the first rule broken:
 * <ol>
 *   <li>side present (BUY or SELL)</li>
 *   <li>price and quantity positive</li>
 *   <li>leverage positive and within the account maximum</li>
 *   <li>confidence at or above the configured minimum</li>
 *   <li>daily trade count below the limit</li>
 *   <li>no OPEN position for the symbol</li>
 * </ol>
 * The balance check comes after, as part of the margin reservation.
 */
@Component
public class TradeValidator {

    private final TradingProperties tradingProperties;

    public TradeValidator(TradingProperties tradingProperties) {
        this.tradingProperties = tradingProperties;
    }

    /**
     * @throws TradeRejectedException describing the first failed check
     */
    public void validate(TradeRequest request, BigDecimal leverage, AccountLedger ledger, PositionStore store) {
        if (request.getSide() == null) {
            throw new TradeRejectedException(ErrorCode.VALIDATION_ERROR, "Invalid signal: side must be BUY or SELL");
        }
        if (request.getSymbol() == null || request.getSymbol().isBlank()) {
            throw new TradeRejectedException(ErrorCode.VALIDATION_ERROR, "Invalid symbol");
        }
        if (request.getPrice() == null || request.getPrice().signum() <= 0) {
            throw new TradeRejectedException(ErrorCode.VALIDATION_ERROR, "Invalid price: " + request.getPrice());
        }
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new TradeRejectedException(
                    ErrorCode.VALIDATION_ERROR, "Invalid quantity: " + request.getQuantity());
        }
        if (leverage.signum() <= 0 || leverage.compareTo(tradingProperties.getMaxLeverage()) > 0) {
            throw new TradeRejectedException(
                    ErrorCode.VALIDATION_ERROR,
                    String.format(
                            "Invalid leverage: %s (max %s)",
                            leverage.toPlainString(), tradingProperties.getMaxLeverage().toPlainString()));
        }
        if (request.getConfidence() < tradingProperties.getMinConfidence()) {
            throw new TradeRejectedException(
                    ErrorCode.VALIDATION_ERROR,
                    String.format(
                            "Confidence too low: %d < %d",
                            request.getConfidence(), tradingProperties.getMinConfidence()));
        }
        if (!ledger.hasDailyCapacity()) {
            throw new TradeRejectedException(
                    ErrorCode.DAILY_LIMIT_REACHED,
                    "Daily trade limit reached (" + tradingProperties.getDailyTradesLimit() + ")");
        }
        store.findOpenBySymbol(request.getSymbol()).ifPresent(existing -> {
            throw new TradeRejectedException(
                    ErrorCode.DUPLICATE_POSITION,
                    "Position already open for " + request.getSymbol(),
                    Map.of("existingPositionId", existing.getId()));
        });
    }
}
