package com.levertrader.notification;

import com.levertrader.domain.enums.AlertSeverity;
import com.levertrader.domain.enums.AlertType;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * A risk alert handed to {@link NotificationSink#notifyRiskAlert}.
 *
 * <p>Built by {@link NotificationService} from a {@link com.levertrader.event.RiskEvent};
 * {@code title} is the risk event type and {@code details} carries its values unchanged.
 */
@Data
@Builder
public class Alert {

    private AlertType type;
    private AlertSeverity severity;
    private String symbol;
    private String title;
    private String message;
    private Map<String, Object> details;
    private LocalDateTime timestamp;
}
