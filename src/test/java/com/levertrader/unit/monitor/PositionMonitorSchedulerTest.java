package com.levertrader.unit.monitor;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.levertrader.execution.TradeExecutor;
import com.levertrader.monitor.PositionMonitorScheduler;
import com.levertrader.observability.TradingMetricsService;
import com.levertrader.risk.RiskEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PositionMonitorSchedulerTest {

    @Mock
    private RiskEngine riskEngine;

    @Mock
    private TradeExecutor tradeExecutor;

    private TradingMetricsService tradingMetricsService;

    @BeforeEach
    void setUp() {
        tradingMetricsService = new TradingMetricsService(new SimpleMeterRegistry(), tradeExecutor);
    }

    @Test
    @DisplayName("Each scheduled run performs one monitoring pass")
    void runsMonitoringPass() {
        when(riskEngine.monitorPositions()).thenReturn(List.of("Stop Loss: BTCUSD"));

        new PositionMonitorScheduler(riskEngine, tradingMetricsService, true).monitorPositions();

        verify(riskEngine).monitorPositions();
    }

    @Test
    @DisplayName("A failing pass is logged and does not escape the scheduler")
    void failingPass_contained() {
        when(riskEngine.monitorPositions()).thenThrow(new IllegalStateException("boom"));
        PositionMonitorScheduler scheduler = new PositionMonitorScheduler(riskEngine, tradingMetricsService, true);

        assertThatCode(scheduler::monitorPositions).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("A disabled scheduler does not monitor")
    void disabled() {
        new PositionMonitorScheduler(riskEngine, tradingMetricsService, false).monitorPositions();

        verify(riskEngine, never()).monitorPositions();
    }
}
