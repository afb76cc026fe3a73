package com.levertrader.risk;

import com.levertrader.config.RiskProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

/**
 * Per-key cooldown for repeated warnings. A key is admitted at most once per cooldown window,
 * so a position hovering near liquidation does not raise an alert on every monitor pass.
 */
@Component
public class WarningThrottle {

    private final Map<String, Instant> lastWarningAt = new ConcurrentHashMap<>();
    private final RiskProperties riskProperties;
    private final Clock clock;

    public WarningThrottle(RiskProperties riskProperties, Clock clock) {
        this.riskProperties = riskProperties;
        this.clock = clock;
    }

    /**
     * Records a warning for {@code key} if its cooldown has elapsed.
     *
     * @return true if the caller should emit the warning now
     */
    public boolean tryAcquire(String key) {
        Instant now = clock.instant();
        Duration cooldown = Duration.ofSeconds(riskProperties.getWarningCooldownSeconds());
        AtomicBoolean acquired = new AtomicBoolean(false);
        lastWarningAt.compute(key, (k, last) -> {
            if (last == null || !now.isBefore(last.plus(cooldown))) {
                acquired.set(true);
                return now;
            }
            return last;
        });
        return acquired.get();
    }

    public void reset() {
        lastWarningAt.clear();
    }
}
