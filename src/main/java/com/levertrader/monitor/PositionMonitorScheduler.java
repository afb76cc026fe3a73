package com.levertrader.monitor;

import com.levertrader.observability.TradingMetricsService;
import com.levertrader.risk.RiskEngine;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs {@link RiskEngine#monitorPositions()} on a fixed delay against the last known prices,
 * so stop losses and time limits fire even when no new market data arrives.
 */
@Component
public class PositionMonitorScheduler {

    private static final Logger log = LoggerFactory.getLogger(PositionMonitorScheduler.class);

    private final RiskEngine riskEngine;
    private final TradingMetricsService tradingMetricsService;
    private final boolean enabled;

    public PositionMonitorScheduler(
            RiskEngine riskEngine,
            TradingMetricsService tradingMetricsService,
            @Value("${levertrader.monitor.enabled:true}") boolean enabled) {
        this.riskEngine = riskEngine;
        this.tradingMetricsService = tradingMetricsService;
        this.enabled = enabled;
    }

    @Scheduled(
            fixedDelayString = "${levertrader.monitor.position-interval-ms:1500}",
            initialDelayString = "${levertrader.monitor.initial-delay-ms:5000}")
    public void monitorPositions() {
        if (!enabled) {
            return;
        }
        try {
            List<String> actions = tradingMetricsService.timeMonitorTick(riskEngine::monitorPositions);
            if (!actions.isEmpty()) {
                log.info("Monitoring pass took {} action(s): {}", actions.size(), actions);
            }
        } catch (Exception e) {
            log.error("Monitoring pass failed", e);
        }
    }
}
