package com.levertrader.config;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Account and execution parameters, bound from {@code levertrader.trading.*}.
 *
 * <p>Fields suffixed {@code Pct} here are fractions ({@code 0.01} means one percent) because
 * they are multiplied directly into prices and balances. Risk thresholds in
 * {@link RiskProperties} are expressed in percent units instead.
 */
@Data
@Component
@ConfigurationProperties(prefix = "levertrader.trading")
public class TradingProperties {

    /** Id of the single paper-trading account owned by this engine instance. */
    private String accountId = "paper-account";

    private BigDecimal initialBalance = new BigDecimal("10000");
    private int dailyTradesLimit = 50;

    /** Leverage used when a signal does not specify one. */
    private BigDecimal defaultLeverage = new BigDecimal("50");

    private BigDecimal maxLeverage = new BigDecimal("50");

    /** Entry fee as a fraction of the margin reserved. */
    private BigDecimal tradingFeePct = new BigDecimal("0.001");

    /** Exit fee as a multiple of the entry fee. */
    private BigDecimal exitFeeMultiplier = new BigDecimal("0.5");

    private BigDecimal stopLossPct = new BigDecimal("0.01");
    private BigDecimal targetPct = new BigDecimal("0.03");
    private int minConfidence = 50;

    private int maxHoldingHours = 48;

    /** Positions held at least this long are reported as approaching the time limit. */
    private int holdingWarningHours = 46;

    // ---- Sizing ----

    private BigDecimal balancePerTradePct = new BigDecimal("0.20");
    private BigDecimal safeBalancePerTradePct = new BigDecimal("0.05");

    /** Balances at or below this use {@link #safeBalancePerTradePct}. */
    private BigDecimal safeModeBalanceThreshold = new BigDecimal("1000");

    private BigDecimal liquidationBufferPct = new BigDecimal("0.10");
    private BigDecimal minTradeSize = new BigDecimal("0.001");
    private int maxPositionsOpen = 2;

    /** A requested quantity below this fraction of the safe quantity is treated as unspecified. */
    private BigDecimal negligibleQuantityRatio = new BigDecimal("0.1");

    private Pyramiding pyramiding = new Pyramiding();
    private Trailing trailing = new Trailing();

    @Data
    public static class Pyramiding {

        private boolean enabled = true;
        private int minConfidence = 75;
        private int maxAdds = 2;

        /** Size of each add as a fraction of the original quantity. */
        private BigDecimal addPercentage = new BigDecimal("0.5");

        /** Position must be at least this profitable (percent of invested amount) before adding. */
        private BigDecimal minProfitPct = new BigDecimal("1.0");
    }

    @Data
    public static class Trailing {

        private boolean enabled = true;
        private int maxCount = 3;

        /** Fraction of the remaining quantity closed on each trailing step. */
        private BigDecimal exitPercentage = new BigDecimal("0.5");

        /** Position must be at least this profitable (percent of invested amount) to trail. */
        private BigDecimal minProfitPct = new BigDecimal("2.0");

        /** Stop offset re-anchored to the trailing price, as a fraction. */
        private BigDecimal stopLossPct = new BigDecimal("0.01");

        /** Target offset re-anchored to the trailing price, as a fraction. */
        private BigDecimal targetPct = new BigDecimal("0.02");
    }
}
