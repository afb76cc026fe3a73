package com.levertrader.event;

import com.levertrader.domain.enums.AlertSeverity;
import com.levertrader.domain.model.Position;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the engine's events.
 *
 * <p>Publishing is synchronous; listeners that do slow work (notifications) are annotated
 * {@code @Async} so they do not hold up the executor.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Position ----

    public void publishPositionOpened(Object source, Position position) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, PositionEventType.OPENED));
    }

    public void publishPositionUpdated(Object source, Position position) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, PositionEventType.UPDATED));
    }

    public void publishPositionIncreased(Object source, Position position) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, PositionEventType.INCREASED));
    }

    public void publishPositionReduced(Object source, Position position, BigDecimal realizedPnl) {
        applicationEventPublisher.publishEvent(
                new PositionEvent(source, position, PositionEventType.REDUCED, realizedPnl));
    }

    public void publishPositionClosed(Object source, Position position, BigDecimal realizedPnl) {
        applicationEventPublisher.publishEvent(
                new PositionEvent(source, position, PositionEventType.CLOSED, realizedPnl));
    }

    // ---- Risk ----

    public void publishRiskEvent(Object source, RiskEventType eventType, AlertSeverity severity, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, severity, message));
    }

    public void publishRiskEvent(
            Object source,
            RiskEventType eventType,
            AlertSeverity severity,
            String message,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, severity, message, details));
    }
}
