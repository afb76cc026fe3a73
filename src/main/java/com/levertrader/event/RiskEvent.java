package com.levertrader.event;

import com.levertrader.domain.enums.AlertSeverity;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the risk engine or portfolio monitor detects a condition or takes a
 * protective action.
 *
 * <p>Carries the condition type, a severity, a human-readable message and a details map with
 * condition-specific values (symbol, price, liquidation distance, margin usage).
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final AlertSeverity severity;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, AlertSeverity severity, String message) {
        this(source, eventType, severity, message, null);
    }

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            AlertSeverity severity,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.severity = severity;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>LIQUIDATION_WARNING: {"symbol": "BTCUSD", "price": 48500, "liquidationDistance": 12.4}</li>
     *   <li>PORTFOLIO_RISK_HIGH: {"marginUsage": 86.1, "pnlPercentage": -3.2}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
