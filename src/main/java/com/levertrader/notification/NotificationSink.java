package com.levertrader.notification;

import com.levertrader.domain.model.Position;

/**
 * Outbound notification channel (log, e-mail, chat bot, websocket push).
 *
 * <p>Calls are fire-and-forget. {@link NotificationService} invokes sinks off the trading
 * thread and isolates failures, so an implementation may block or throw without affecting
 * trades or risk actions.
 */
public interface NotificationSink {

    /** A position was opened or pyramided. */
    void notifyTradeExecution(Position position);

    /** A position was fully closed; {@code position.getNotes()} holds the reason. */
    void notifyPositionClose(Position position);

    void notifyRiskAlert(Alert alert);
}
