package com.levertrader.notification;

import com.levertrader.domain.enums.AlertType;
import com.levertrader.domain.model.Position;
import com.levertrader.event.PositionEvent;
import com.levertrader.event.RiskEvent;
import com.levertrader.event.RiskEventType;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Fans position and risk events out to every registered {@link NotificationSink}.
 *
 * <p>Delivery runs on the {@code eventExecutor} pool so the executor lock is never held while
 * a sink is talking to the outside world. Each sink is called in isolation: a sink that throws
 * is logged and the remaining sinks still receive the notification.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final List<NotificationSink> notificationSinks;
    private final Clock clock;

    public NotificationService(List<NotificationSink> notificationSinks, Clock clock) {
        this.notificationSinks = notificationSinks;
        this.clock = clock;
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onPositionEvent(PositionEvent event) {
        Position position = event.getPosition();
        switch (event.getEventType()) {
            case OPENED, INCREASED -> deliver("trade execution", sink -> sink.notifyTradeExecution(position));
            case CLOSED -> deliver("position close", sink -> sink.notifyPositionClose(position));
            default -> log.trace("No notification for {} on {}", event.getEventType(), position.getSymbol());
        }
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onRiskEvent(RiskEvent event) {
        Object symbol = event.getDetails().get("symbol");
        Alert alert = Alert.builder()
                .type(event.getEventType() == RiskEventType.PORTFOLIO_RISK_HIGH ? AlertType.PORTFOLIO : AlertType.RISK)
                .severity(event.getSeverity())
                .symbol(symbol != null ? symbol.toString() : null)
                .title(event.getEventType().name())
                .message(event.getMessage())
                .details(event.getDetails())
                .timestamp(LocalDateTime.now(clock))
                .build();

        deliver("risk alert", sink -> sink.notifyRiskAlert(alert));
    }

    void deliver(String kind, Consumer<NotificationSink> delivery) {
        for (NotificationSink notificationSink : notificationSinks) {
            try {
                delivery.accept(notificationSink);
            } catch (Exception e) {
                log.error(
                        "Failed to deliver {} via {}: {}",
                        kind,
                        notificationSink.getClass().getSimpleName(),
                        e.getMessage());
            }
        }
    }
}
