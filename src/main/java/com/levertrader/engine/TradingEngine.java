package com.levertrader.engine;

import com.levertrader.domain.enums.ExecutionStatus;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.SafeQuantityResult;
import com.levertrader.domain.model.TradeRequest;
import com.levertrader.domain.model.TradeResult;
import com.levertrader.execution.TradeExecutor;
import com.levertrader.observability.TradingMetricsService;
import com.levertrader.risk.RiskEngine;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for market data and trading signals.
 *
 * <p>A market-data snapshot is applied to the book before the risk pass that follows it, so
 * risk decisions in that pass always see PnL computed from the same snapshot.
 *
 * <p>A signal for a symbol that already has an OPEN position on the same side is treated as a
 * pyramiding candidate. Anything else goes through admission control, which sizes the trade
 * (or rejects it) before the executor opens it.
 */
@Service
public class TradingEngine {

    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private final TradeExecutor tradeExecutor;
    private final RiskEngine riskEngine;
    private final TradingMetricsService tradingMetricsService;

    public TradingEngine(
            TradeExecutor tradeExecutor, RiskEngine riskEngine, TradingMetricsService tradingMetricsService) {
        this.tradeExecutor = tradeExecutor;
        this.riskEngine = riskEngine;
        this.tradingMetricsService = tradingMetricsService;
    }

    /**
     * Applies a price snapshot and runs one monitoring pass over it.
     *
     * @return the protective actions taken in that pass
     */
    public List<String> onMarketData(Map<String, BigDecimal> prices) {
        tradeExecutor.updatePrices(prices);
        List<String> actions = tradingMetricsService.timeMonitorTick(riskEngine::monitorPositions);
        if (!actions.isEmpty()) {
            log.info("Risk actions after market data: {}", actions);
        }
        return actions;
    }

    public TradeResult submitSignal(TradeRequest request) {
        if (request.getSymbol() == null || request.getSide() == null || request.getPrice() == null) {
            return reject(request, "Invalid signal: symbol, side and price are required");
        }

        Optional<Position> existing = tradeExecutor.getOpenPosition(request.getSymbol());
        if (existing.isPresent()
                && existing.get().getSide() == request.getSide().toPositionSide()
                && tradeExecutor.checkPyramidingOpportunity(
                        existing.get(), request.getPrice(), request.getConfidence())) {
            log.info(
                    "Signal {} {} @ {} adds to open position {}",
                    request.getSide(),
                    request.getSymbol(),
                    request.getPrice().toPlainString(),
                    existing.get().getId());
            return tradeExecutor.pyramid(existing.get().getId(), request.getPrice(), request.getConfidence());
        }

        SafeQuantityResult sizing = riskEngine.calculateSafeQuantity(
                request.getSymbol(), request.getPrice(), request.getQuantity(), request.getLeverage());
        if (!sizing.isApproved()) {
            return reject(request, sizing.getReason());
        }
        log.debug("Sized {} {}: {}", request.getSide(), request.getSymbol(), sizing.getReason());
        request.setQuantity(sizing.getQuantity());

        TradeResult result = tradeExecutor.openTrade(request);
        if (!result.isSuccess()) {
            tradingMetricsService.recordTradeRejected();
        }
        return result;
    }

    private TradeResult reject(TradeRequest request, String reason) {
        log.warn("Signal {} {} rejected: {}", request.getSide(), request.getSymbol(), reason);
        request.setStatus(ExecutionStatus.CANCELLED);
        request.setErrorReason(reason);
        tradingMetricsService.recordTradeRejected();
        return TradeResult.failure(reason);
    }
}
