package com.levertrader.risk;

import com.levertrader.config.RiskProperties;
import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.model.Position;
import com.levertrader.event.PositionEvent;
import com.levertrader.event.PositionEventType;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Ratcheting trailing stops, one per position.
 *
 * <p>Once armed, the tracker remembers the best price seen (highest for LONG, lowest for
 * SHORT) and keeps the stop a fixed distance behind it. The stop only ever moves in the
 * position's favour. State is dropped when the position closes.
 */
@Component
public class TrailingStopTracker {

    private static final Logger log = LoggerFactory.getLogger(TrailingStopTracker.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Map<String, TrailState> states = new ConcurrentHashMap<>();
    private final RiskProperties riskProperties;

    public TrailingStopTracker(RiskProperties riskProperties) {
        this.riskProperties = riskProperties;
    }

    /** Arms the trailing stop at {@code price}. No-op if already armed. */
    public void activate(Position position, BigDecimal price) {
        TrailState state = new TrailState(position.getSide(), price, stopBehind(position.getSide(), price));
        if (states.putIfAbsent(position.getId(), state) == null) {
            log.info(
                    "Trailing stop armed for {} {} at {} (best {})",
                    position.getSide(),
                    position.getSymbol(),
                    state.stopPrice().toPlainString(),
                    price.toPlainString());
        }
    }

    public boolean isActive(String positionId) {
        return states.containsKey(positionId);
    }

    public Optional<BigDecimal> getStopPrice(String positionId) {
        TrailState state = states.get(positionId);
        return state == null ? Optional.empty() : Optional.of(state.stopPrice());
    }

    /** Whether {@code price} has crossed the armed stop: at or below for LONG, at or above for SHORT. */
    public boolean isTriggered(Position position, BigDecimal price) {
        TrailState state = states.get(position.getId());
        if (state == null) {
            return false;
        }
        return state.side() == PositionSide.LONG
                ? price.compareTo(state.stopPrice()) <= 0
                : price.compareTo(state.stopPrice()) >= 0;
    }

    /**
     * Moves the best price and the stop forward if {@code price} improves on the best seen.
     *
     * @return the stop after the update, empty if the position has no armed stop
     */
    public Optional<BigDecimal> ratchet(Position position, BigDecimal price) {
        TrailState updated = states.computeIfPresent(position.getId(), (id, state) -> {
            boolean better = state.side() == PositionSide.LONG
                    ? price.compareTo(state.bestPrice()) > 0
                    : price.compareTo(state.bestPrice()) < 0;
            if (!better) {
                return state;
            }
            BigDecimal candidate = stopBehind(state.side(), price);
            boolean tighter = state.side() == PositionSide.LONG
                    ? candidate.compareTo(state.stopPrice()) > 0
                    : candidate.compareTo(state.stopPrice()) < 0;
            return new TrailState(state.side(), price, tighter ? candidate : state.stopPrice());
        });
        return updated == null ? Optional.empty() : Optional.of(updated.stopPrice());
    }

    public void clear() {
        states.clear();
    }

    @EventListener
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.CLOSED && states.remove(event.getPosition().getId()) != null) {
            log.debug("Trailing stop released for closed position {}", event.getPosition().getId());
        }
    }

    /** {@code price} less the trailing distance for LONG, plus it for SHORT. */
    BigDecimal stopBehind(PositionSide side, BigDecimal price) {
        BigDecimal fraction = riskProperties.getTrailingDistancePct().divide(HUNDRED);
        return side == PositionSide.LONG
                ? price.multiply(BigDecimal.ONE.subtract(fraction))
                : price.multiply(BigDecimal.ONE.add(fraction));
    }

    private record TrailState(PositionSide side, BigDecimal bestPrice, BigDecimal stopPrice) {}
}
