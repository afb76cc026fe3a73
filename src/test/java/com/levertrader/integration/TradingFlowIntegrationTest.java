package com.levertrader.integration;

import static com.levertrader.support.EngineFixture.request;
import static org.assertj.core.api.Assertions.assertThat;

import com.levertrader.domain.enums.AlertSeverity;
import com.levertrader.domain.enums.ExecutionStatus;
import com.levertrader.domain.enums.OrderSide;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.domain.model.Account;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.TradeResult;
import com.levertrader.engine.TradingEngine;
import com.levertrader.event.PositionEvent;
import com.levertrader.event.RiskEvent;
import com.levertrader.notification.Alert;
import com.levertrader.notification.NotificationService;
import com.levertrader.notification.NotificationSink;
import com.levertrader.observability.TradingMetricsService;
import com.levertrader.persistence.PositionDocument;
import com.levertrader.support.EngineFixture;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Cross-service integration test for the trading flow.
 * Wires real TradingEngine + TradeExecutor + RiskEngine with the metrics and notification
 * listeners on the same event bus, and drives complete position lifecycles through signals
 * and market data snapshots.
 */
class TradingFlowIntegrationTest {

    private EngineFixture fixture;
    private MeterRegistry meterRegistry;
    private TradingEngine tradingEngine;
    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        meterRegistry = new SimpleMeterRegistry();
        TradingMetricsService tradingMetricsService = new TradingMetricsService(meterRegistry, fixture.tradeExecutor);
        sink = new RecordingSink();
        NotificationService notificationService = new NotificationService(List.of(sink), fixture.clock);

        fixture.events.addListener(event -> {
            if (event instanceof PositionEvent positionEvent) {
                tradingMetricsService.onPositionEvent(positionEvent);
                notificationService.onPositionEvent(positionEvent);
            } else if (event instanceof RiskEvent riskEvent) {
                tradingMetricsService.onRiskEvent(riskEvent);
                notificationService.onRiskEvent(riskEvent);
            }
        });

        tradingEngine = new TradingEngine(fixture.tradeExecutor, fixture.riskEngine, tradingMetricsService);
    }

    private List<String> tick(String btcPrice) {
        return tradingEngine.onMarketData(Map.of("BTCUSD", new BigDecimal(btcPrice)));
    }

    private void assertAccountBalanced() {
        Account account = fixture.tradeExecutor.getAccountSnapshot();
        BigDecimal openMargin = fixture.tradeExecutor.getOpenPositions().stream()
                .map(Position::getMarginUsed)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(account.getTotalMarginUsed()).isEqualByComparingTo(openMargin);
        assertThat(account.getCurrentBalance()).isGreaterThanOrEqualTo(BigDecimal.ZERO);
        // initial + realized - fees = free balance + reserved margin
        assertThat(account.getInitialBalance()
                        .add(account.getRealizedPnl())
                        .subtract(account.getBrokerageCharges()))
                .isEqualByComparingTo(account.getCurrentBalance().add(account.getTotalMarginUsed()));
    }

    @Test
    @DisplayName("Signal opens, target takes a trailing exit, stop loss closes the remainder")
    void fullLifecycle_trailingThenStopLoss() {
        TradeResult opened = tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10"));
        String positionId = opened.getPositionId();
        assertThat(opened.isSuccess()).isTrue();
        assertAccountBalanced();

        assertThat(tick("51500")).containsExactly("Trailing Exit: BTCUSD");
        Position afterTrailing = fixture.tradeExecutor.getPosition(positionId).orElseThrow();
        assertThat(afterTrailing.getRemainingQuantity()).isEqualByComparingTo("0.05");
        assertThat(afterTrailing.getRealizedPnl()).isEqualByComparingTo("75");
        assertThat(afterTrailing.getStopLoss()).isEqualByComparingTo("50985");
        assertAccountBalanced();

        assertThat(tick("51200")).isEmpty();
        assertThat(tick("50900")).containsExactly("Stop Loss: BTCUSD");

        Position closed = fixture.tradeExecutor.getPosition(positionId).orElseThrow();
        assertThat(closed.getStatus()).isEqualTo(PositionStatus.CLOSED);
        assertThat(closed.getNotes()).isEqualTo("Stop Loss Hit");
        assertThat(closed.getPnl()).isEqualByComparingTo("120");
        assertThat(closed.getAverageExitPrice()).isEqualByComparingTo("51200");
        assertThat(closed.getTrailingCount()).isEqualTo(1);
        assertAccountBalanced();

        Account account = fixture.tradeExecutor.getAccountSnapshot();
        assertThat(account.getTotalMarginUsed()).isEqualByComparingTo("0");
        assertThat(account.getProfitableTrades()).isEqualTo(1);
        assertThat(account.getWinRate()).isEqualByComparingTo("100");

        PositionDocument stored = fixture.persistenceGateway.storedPositions().get(positionId);
        assertThat(stored.getStatus()).isEqualTo(PositionStatus.CLOSED);
        assertThat(stored.getPnl()).isEqualByComparingTo("120");
        assertThat(fixture.persistenceGateway.storedOrders().values())
                .singleElement()
                .satisfies(order -> assertThat(order.getStatus()).isEqualTo(ExecutionStatus.COMPLETED));

        assertThat(sink.executions).extracting(Position::getId).containsExactly(positionId);
        assertThat(sink.closes).extracting(Position::getNotes).containsExactly("Stop Loss Hit");
        assertThat(meterRegistry.get("trades.opened").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("positions.partially.closed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("trades.closed").tag("reason", "Stop Loss Hit").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("A leveraged position near liquidation is closed by protection before its stop")
    void liquidationProtection_endToEnd() {
        String positionId = fixture.tradeExecutor
                .openTrade(request("BTCUSD", OrderSide.BUY, "50000", "1.928", "20"))
                .getPositionId();
        fixture.tradeExecutor.updateStopLoss(positionId, new BigDecimal("40000"));

        assertThat(tick("48500")).containsExactly("Risk Action: BTCUSD");

        Position closed = fixture.tradeExecutor.getPosition(positionId).orElseThrow();
        assertThat(closed.getNotes()).isEqualTo("LIQUIDATION PROTECTION - Emergency Close");
        assertThat(closed.getPnl()).isEqualByComparingTo("-2892");
        assertAccountBalanced();

        assertThat(sink.alerts)
                .filteredOn(alert -> alert.getTitle().equals("LIQUIDATION_PROTECTION"))
                .singleElement()
                .satisfies(alert -> assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL));
        assertThat(meterRegistry.get("risk.emergency.closes").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A heavily margined account blocks new signals until exposure falls")
    void antiOvertrade_blocksThenRecovers() {
        String positionId = fixture.tradeExecutor
                .openTrade(request("BTCUSD", OrderSide.BUY, "50000", "1.8", "20"))
                .getPositionId();

        TradeResult blocked = tradingEngine.submitSignal(request("ETHUSD", OrderSide.BUY, "3000", "1", "10"));

        assertThat(blocked.isSuccess()).isFalse();
        assertThat(blocked.getReason()).startsWith("ANTI-OVERTRADE");
        assertThat(sink.alerts).extracting(Alert::getTitle).contains("ANTI_OVERTRADE");
        assertThat(meterRegistry.get("trades.rejected").counter().count()).isEqualTo(1.0);

        fixture.tradeExecutor.closePosition(positionId, new BigDecimal("50100"), "manual");
        TradeResult admitted = tradingEngine.submitSignal(request("ETHUSD", OrderSide.BUY, "3000", "1", "10"));

        assertThat(admitted.isSuccess()).isTrue();
        assertAccountBalanced();
    }

    @Test
    @DisplayName("A position held past the time limit is closed on the next snapshot")
    void timeLimit_endToEnd() {
        tradingEngine.submitSignal(request("BTCUSD", OrderSide.BUY, "50000", "0.1", "10"));
        assertThat(tick("50100")).isEmpty();

        fixture.clock.advance(Duration.ofHours(46));
        assertThat(fixture.riskEngine.positionsApproachingTimeLimit()).hasSize(1);
        fixture.clock.advance(Duration.ofHours(3));

        assertThat(tick("50100")).containsExactly("Time Limit: BTCUSD");
        assertThat(fixture.tradeExecutor.getOpenPositions()).isEmpty();
        assertThat(sink.closes).extracting(Position::getNotes).containsExactly("Time Limit Reached");
        assertAccountBalanced();
    }

    private static final class RecordingSink implements NotificationSink {

        private final List<Position> executions = new ArrayList<>();
        private final List<Position> closes = new ArrayList<>();
        private final List<Alert> alerts = new ArrayList<>();

        @Override
        public void notifyTradeExecution(Position position) {
            executions.add(position);
        }

        @Override
        public void notifyPositionClose(Position position) {
            closes.add(position);
        }

        @Override
        public void notifyRiskAlert(Alert alert) {
            alerts.add(alert);
        }
    }
}
