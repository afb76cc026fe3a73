package com.levertrader.event;

/**
 * Classifies the risk condition behind a {@link RiskEvent}. Listeners filter on the type,
 * for example notification sinks escalate LIQUIDATION_PROTECTION but only log
 * STOP_LOSS_TIGHTENED.
 */
public enum RiskEventType {

    /** A position came within the warning distance of its estimated liquidation price. */
    LIQUIDATION_WARNING,

    /** A CRITICAL position within the emergency distance was force-closed. */
    LIQUIDATION_PROTECTION,

    /** A CRITICAL position was closed on the risk recommendation. */
    CRITICAL_RISK_CLOSURE,

    /** Stop loss moved closer to the current price on a HIGH-risk position. */
    STOP_LOSS_TIGHTENED,

    /** Trailing-stop ratchet armed on a profitable position. */
    TRAILING_ACTIVATED,

    /** Portfolio-level risk moved into HIGH or CRITICAL. */
    PORTFOLIO_RISK_HIGH,

    /** New trades refused because portfolio margin usage is at the ceiling. */
    ANTI_OVERTRADE,

    /** A protective action failed and will be retried on the next monitoring tick. */
    PROTECTIVE_ACTION_FAILED
}
