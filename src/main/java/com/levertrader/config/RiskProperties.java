package com.levertrader.config;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Risk thresholds, bound from {@code levertrader.risk.*}. All values are percent units
 * ({@code 90} means ninety percent) unless named otherwise.
 *
 * <p>Per-position tiers are checked from the most severe down: a position is CRITICAL when
 * any one of margin usage, loss or holding time exceeds the critical tier, and so on.
 * The emergency tier is stricter than critical and only drives the close recommendation.
 */
@Data
@Component
@ConfigurationProperties(prefix = "levertrader.risk")
public class RiskProperties {

    // ---- Per-position tiers ----

    private Tier medium = new Tier(new BigDecimal("70"), new BigDecimal("5"), new BigDecimal("12"));
    private Tier high = new Tier(new BigDecimal("80"), new BigDecimal("8"), new BigDecimal("24"));
    private Tier critical = new Tier(new BigDecimal("90"), new BigDecimal("12"), new BigDecimal("36"));
    private Tier emergency = new Tier(new BigDecimal("95"), new BigDecimal("15"), new BigDecimal("48"));

    // ---- Portfolio tiers ----

    private PortfolioTier portfolioMedium =
            new PortfolioTier(new BigDecimal("70"), new BigDecimal("15"), new BigDecimal("20"));
    private PortfolioTier portfolioHigh =
            new PortfolioTier(new BigDecimal("85"), new BigDecimal("25"), new BigDecimal("30"));
    private PortfolioTier portfolioCritical =
            new PortfolioTier(new BigDecimal("92"), new BigDecimal("35"), new BigDecimal("40"));

    /** New trades are blocked once portfolio margin usage reaches this. */
    private BigDecimal maxPortfolioRiskPct = new BigDecimal("80");

    /** Portfolio margin usage at which admission logs an approaching-limit warning. */
    private BigDecimal portfolioHighRiskMarginPct = new BigDecimal("70");

    private long warningCooldownSeconds = 300;

    // ---- Protective actions ----

    /** Profit at which a trailing stop is suggested. */
    private BigDecimal trailingActivationProfitPct = new BigDecimal("5");

    /** Distance of the trailing stop behind the best price. */
    private BigDecimal trailingDistancePct = new BigDecimal("3");

    /** Profit above which the ACTIVATE_TRAILING recommendation is issued and the ratchet armed. */
    private BigDecimal activateTrailingProfitPct = new BigDecimal("10");

    /** Distance of a tightened stop from the current price. */
    private BigDecimal tightenStopPct = new BigDecimal("2");

    private BigDecimal liquidationEmergencyDistancePct = new BigDecimal("5");
    private BigDecimal liquidationWarningDistancePct = new BigDecimal("15");

    /** Share of the margin assumed consumable before liquidation (a fraction, not percent). */
    private BigDecimal liquidationMarginFactor = new BigDecimal("0.95");

    // ---- Risk score ----

    private BigDecimal marginWeight = new BigDecimal("0.3");
    private BigDecimal pnlWeight = new BigDecimal("0.3");
    private BigDecimal timeWeight = new BigDecimal("0.2");
    private BigDecimal volatilityWeight = new BigDecimal("0.2");

    /** Volatility score used until a real volatility source is wired in. */
    private BigDecimal referenceVolatilityScore = new BigDecimal("50");

    private BigDecimal highVolatilityScore = new BigDecimal("90");
    private BigDecimal mediumVolatilityScore = new BigDecimal("80");

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tier {

        private BigDecimal marginPct;
        private BigDecimal lossPct;
        private BigDecimal holdingHours;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PortfolioTier {

        private BigDecimal marginPct;
        private BigDecimal lossPct;

        /** Decline of total portfolio value against the initial balance. */
        private BigDecimal returnLossPct;
    }
}
