package com.levertrader.observability;

import com.levertrader.event.PositionEvent;
import com.levertrader.event.RiskEvent;
import com.levertrader.execution.TradeExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.function.Supplier;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the trading engine.
 *
 * <ul>
 *   <li><b>trades.opened</b>, <b>trades.rejected</b> (counters)</li>
 *   <li><b>trades.closed</b> (counter, tagged with the close reason)</li>
 *   <li><b>positions.pyramided</b>, <b>positions.partially.closed</b> (counters)</li>
 *   <li><b>risk.emergency.closes</b>, <b>risk.warnings</b> (counters)</li>
 *   <li><b>account.balance</b>, <b>account.margin.used</b>, <b>positions.open</b> (gauges)</li>
 *   <li><b>monitor.tick.latency</b> (timer around each monitoring pass)</li>
 * </ul>
 *
 * <p>Gauges are read lazily from {@link TradeExecutor} snapshots. Counters are driven by
 * position and risk events, except rejections, which callers record directly because a
 * rejected request never produces a position.
 */
@Service
public class TradingMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter tradesOpenedCounter;
    private final Counter tradesRejectedCounter;
    private final Counter pyramidAddsCounter;
    private final Counter partialClosesCounter;
    private final Counter emergencyClosesCounter;
    private final Counter riskWarningsCounter;
    private final Timer monitorTickTimer;

    public TradingMetricsService(MeterRegistry meterRegistry, TradeExecutor tradeExecutor) {
        this.meterRegistry = meterRegistry;

        this.tradesOpenedCounter = Counter.builder("trades.opened")
                .description("Positions opened")
                .register(meterRegistry);
        this.tradesRejectedCounter = Counter.builder("trades.rejected")
                .description("Trade requests rejected by validation or admission control")
                .register(meterRegistry);
        this.pyramidAddsCounter = Counter.builder("positions.pyramided")
                .description("Quantity added to existing positions")
                .register(meterRegistry);
        this.partialClosesCounter = Counter.builder("positions.partially.closed")
                .description("Trailing partial closes")
                .register(meterRegistry);
        this.emergencyClosesCounter = Counter.builder("risk.emergency.closes")
                .description("Positions closed by liquidation protection or critical risk")
                .register(meterRegistry);
        this.riskWarningsCounter = Counter.builder("risk.warnings")
                .description("Risk warnings raised")
                .register(meterRegistry);

        this.monitorTickTimer = Timer.builder("monitor.tick.latency")
                .description("Duration of one position monitoring pass")
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);

        meterRegistry.gauge("account.balance", tradeExecutor, executor -> executor.getAccountSnapshot()
                .getCurrentBalance()
                .doubleValue());
        meterRegistry.gauge("account.margin.used", tradeExecutor, executor -> executor.getAccountSnapshot()
                .getTotalMarginUsed()
                .doubleValue());
        meterRegistry.gauge("positions.open", tradeExecutor, executor -> executor.getOpenPositions().size());
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        switch (event.getEventType()) {
            case OPENED -> tradesOpenedCounter.increment();
            case INCREASED -> pyramidAddsCounter.increment();
            case REDUCED -> partialClosesCounter.increment();
            case CLOSED -> Counter.builder("trades.closed")
                    .description("Positions closed")
                    .tag("reason", closeReasonTag(event.getPosition().getNotes()))
                    .register(meterRegistry)
                    .increment();
            default -> {}
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        switch (event.getEventType()) {
            case LIQUIDATION_PROTECTION, CRITICAL_RISK_CLOSURE -> emergencyClosesCounter.increment();
            case LIQUIDATION_WARNING, PORTFOLIO_RISK_HIGH, ANTI_OVERTRADE -> riskWarningsCounter.increment();
            default -> {}
        }
    }

    public void recordTradeRejected() {
        tradesRejectedCounter.increment();
    }

    public <T> T timeMonitorTick(Supplier<T> tick) {
        return monitorTickTimer.record(tick);
    }

    /** Trailing step numbers are dropped so the tag keeps a small, fixed set of values. */
    static String closeReasonTag(String reason) {
        if (reason == null || reason.isBlank()) {
            return "unknown";
        }
        if (reason.startsWith("Trailing Exit")) {
            return "Trailing Exit";
        }
        return reason;
    }
}
