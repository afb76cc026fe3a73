package com.levertrader.unit.engine;

import static com.levertrader.support.EngineFixture.request;
import static org.assertj.core.api.Assertions.assertThat;

import com.levertrader.domain.enums.ExecutionStatus;
import com.levertrader.domain.enums.OrderSide;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.TradeRequest;
import com.levertrader.domain.model.TradeResult;
import com.levertrader.engine.TradingEngine;
import com.levertrader.observability.TradingMetricsService;
import com.levertrader.support.EngineFixture;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for TradingEngine: signals routed to pyramiding or to admission control and the
 * executor, rejections recorded, and market data applied before the monitoring pass.
 */
class TradingEngineTest {

    private EngineFixture fixture;
    private MeterRegistry meterRegistry;
    private TradingEngine tradingEngine;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        meterRegistry = new SimpleMeterRegistry();
        TradingMetricsService tradingMetricsService = new TradingMetricsService(meterRegistry, fixture.tradeExecutor);
        tradingEngine = new TradingEngine(fixture.tradeExecutor, fixture.riskEngine, tradingMetricsService);
    }

    private double rejectedCount() {
        return meterRegistry.get("trades.rejected").counter().count();
    }

    private Position openBtc() {
        return fixture.tradeExecutor.getOpenPosition("BTCUSD").orElseThrow();
    }

    // ==============================
    // SIGNALS
    // ==============================

    @Nested
    @DisplayName("Signals")
    class Signals {

        @Test
        @DisplayName("A request within the safe size opens at the requested quantity")
        void withinSafeSize() {
            TradeResult result = tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(openBtc().getQuantity()).isEqualByComparingTo("0.1");
            assertThat(openBtc().getMarginUsed()).isEqualByComparingTo("500");
            assertThat(fixture.tradeExecutor.getAccountSnapshot().getCurrentBalance())
                    .isEqualByComparingTo("9499.5");
        }

        @Test
        @DisplayName("An oversized request is cut to the liquidation-safe quantity")
        void oversized_adjusted() {
            TradeRequest request = request("BTCUSD", OrderSide.BUY, "50000", "2", "10");

            TradeResult result = tradingEngine.submitSignal(request);

            assertThat(result.isSuccess()).isTrue();
            assertThat(request.getQuantity()).isEqualByComparingTo("0.36");
            assertThat(openBtc().getMarginUsed()).isEqualByComparingTo("1800");
        }

        @Test
        @DisplayName("A signal without a price is rejected and cancelled")
        void invalidSignal() {
            TradeRequest request = request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10");
            request.setPrice(null);

            TradeResult result = tradingEngine.submitSignal(request);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getReason()).isEqualTo("Invalid signal: symbol, side and price are required");
            assertThat(request.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
            assertThat(rejectedCount()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("An opposite-side signal on an open symbol is rejected by admission control")
        void oppositeSide_rejected() {
            tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10"));
            TradeRequest sell = request("BTCUSD", OrderSide.SELL, "50600", "0.1", "10");

            TradeResult result = tradingEngine.submitSignal(sell);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getReason())
                    .isEqualTo("Position already open for BTCUSD (LONG, qty=0.1, entry=50000.00)");
            assertThat(sell.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
            assertThat(sell.getErrorReason()).isEqualTo(result.getReason());
        }

        @Test
        @DisplayName("A confident same-side signal on a profitable position pyramids")
        void sameSide_pyramids() {
            tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10"));

            TradeResult result = tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50600", "0.1", "10"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(openBtc().getPyramidCount()).isEqualTo(1);
            assertThat(openBtc().getTotalQuantity()).isEqualByComparingTo("0.15");
            assertThat(fixture.tradeExecutor.getOpenPositions()).hasSize(1);
        }

        @Test
        @DisplayName("A same-side signal without enough profit falls through to admission control")
        void sameSide_notProfitable_rejected() {
            tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10"));

            TradeResult result = tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50100", "0.1", "10"));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getReason()).startsWith("Position already open for BTCUSD");
            assertThat(openBtc().getPyramidCount()).isZero();
        }

        @Test
        @DisplayName("An executor rejection is counted")
        void executorRejection_counted() {
            TradeRequest request = request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10");
            request.setConfidence(40);

            TradeResult result = tradingEngine.submitSignal(request);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getReason()).isEqualTo("Confidence too low: 40 < 50");
            assertThat(rejectedCount()).isEqualTo(1.0);
        }
    }

    // ==============================
    // MARKET DATA
    // ==============================

    @Nested
    @DisplayName("Market Data")
    class MarketData {

        @Test
        @DisplayName("A snapshot updates prices and the pass that follows acts on it")
        void snapshotThenMonitor() {
            tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10"));

            List<String> actions = tradingEngine.onMarketData(Map.of("BTCUSD", new BigDecimal("49400")));

            assertThat(actions).containsExactly("Stop Loss: BTCUSD");
            assertThat(fixture.tradeExecutor.getLastPrice("BTCUSD"))
                    .hasValueSatisfying(price -> assertThat(price).isEqualByComparingTo("49400"));
            assertThat(fixture.tradeExecutor.getOpenPositions()).isEmpty();
            assertThat(meterRegistry.get("monitor.tick.latency").timer().count()).isEqualTo(1);
        }

        @Test
        @DisplayName("A quiet snapshot takes no action and marks PnL to market")
        void quietSnapshot() {
            tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10"));

            List<String> actions = tradingEngine.onMarketData(Map.of("BTCUSD", new BigDecimal("50200")));

            assertThat(actions).isEmpty();
            assertThat(openBtc().getUnrealizedPnl()).isEqualByComparingTo("20");
        }
    }
}
