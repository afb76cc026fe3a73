package com.levertrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Account snapshot plus the figures a dashboard or status command shows next to it. */
@Data
@Builder
public class TradingSummary {

    private Account account;
    private int openPositions;
    private int closedPositions;
    private int tradesRemainingToday;
    private BigDecimal totalUnrealizedPnl;

    /** Balance plus reserved margin plus unrealized PnL. */
    private BigDecimal equity;
}
