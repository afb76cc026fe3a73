package com.levertrader.event;

import com.levertrader.domain.model.Position;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the TradeExecutor after a position mutation has been applied.
 *
 * <p>The position is a snapshot taken under the executor lock, so listeners may read it
 * from any thread.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>NotificationService: trade-execution and close notifications</li>
 *   <li>TrailingStopTracker: drops ratchet state on CLOSED</li>
 *   <li>TradingMetricsService: lifecycle counters</li>
 * </ul>
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;
    private final BigDecimal changePnl;

    /**
     * @param source    the component publishing this event
     * @param position  snapshot after the change
     * @param eventType what kind of change occurred
     * @param changePnl PnL realized by this change (partial or final close), null otherwise
     */
    public PositionEvent(Object source, Position position, PositionEventType eventType, BigDecimal changePnl) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.changePnl = changePnl;
    }

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        this(source, position, eventType, null);
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public BigDecimal getChangePnl() {
        return changePnl;
    }
}
