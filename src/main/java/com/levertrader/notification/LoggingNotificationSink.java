package com.levertrader.notification;

import com.levertrader.domain.enums.AlertSeverity;
import com.levertrader.domain.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default sink: writes one formatted line per notification to the application log. */
@Component
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notifyTradeExecution(Position position) {
        log.info(
                "[TRADE] {} {} qty={} @ {} leverage={}x margin={} SL={} TP={}",
                position.getSide(),
                position.getSymbol(),
                position.getTotalQuantity().toPlainString(),
                position.getEntryPrice().toPlainString(),
                position.getLeverage().toPlainString(),
                position.getMarginUsed().toPlainString(),
                position.getStopLoss().toPlainString(),
                position.getTarget().toPlainString());
    }

    @Override
    public void notifyPositionClose(Position position) {
        log.info(
                "[CLOSE] {} {} exit={} pnl={} ({}%) reason={}",
                position.getSide(),
                position.getSymbol(),
                position.getExitPrice() != null ? position.getExitPrice().toPlainString() : "-",
                position.getPnl() != null ? position.getPnl().toPlainString() : "-",
                position.getPnlPercentage() != null ? position.getPnlPercentage().toPlainString() : "-",
                position.getNotes());
    }

    @Override
    public void notifyRiskAlert(Alert alert) {
        if (alert.getSeverity() == AlertSeverity.INFO) {
            log.info("[RISK] {} {}: {}", alert.getTitle(), alert.getSymbol(), alert.getMessage());
        } else {
            log.warn("[RISK {}] {} {}: {}", alert.getSeverity(), alert.getTitle(), alert.getSymbol(), alert.getMessage());
        }
    }
}
