package com.levertrader.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.levertrader.config.RiskProperties;
import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.domain.model.Position;
import com.levertrader.event.PositionEvent;
import com.levertrader.event.PositionEventType;
import com.levertrader.risk.TrailingStopTracker;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TrailingStopTracker: arming, one-way ratcheting for both sides, trigger
 * detection, and release on close.
 */
class TrailingStopTrackerTest {

    private TrailingStopTracker trailingStopTracker;

    @BeforeEach
    void setUp() {
        trailingStopTracker = new TrailingStopTracker(new RiskProperties());
    }

    @Nested
    @DisplayName("Long")
    class LongSide {

        private final Position position = position("long-1", PositionSide.LONG);

        @Test
        @DisplayName("Arms 3% below the activation price")
        void activate() {
            trailingStopTracker.activate(position, new BigDecimal("55500"));

            assertThat(trailingStopTracker.isActive("long-1")).isTrue();
            assertThat(trailingStopTracker.getStopPrice("long-1"))
                    .hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("53835"));
        }

        @Test
        @DisplayName("Ratchets up with a new high and never moves down")
        void ratchet_onlyUp() {
            trailingStopTracker.activate(position, new BigDecimal("55500"));

            assertThat(trailingStopTracker.ratchet(position, new BigDecimal("57000")))
                    .hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("55290"));
            assertThat(trailingStopTracker.ratchet(position, new BigDecimal("56000")))
                    .hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("55290"));
        }

        @Test
        @DisplayName("Triggers at or below the stop")
        void triggered() {
            trailingStopTracker.activate(position, new BigDecimal("55500"));
            trailingStopTracker.ratchet(position, new BigDecimal("57000"));

            assertThat(trailingStopTracker.isTriggered(position, new BigDecimal("55300"))).isFalse();
            assertThat(trailingStopTracker.isTriggered(position, new BigDecimal("55290"))).isTrue();
            assertThat(trailingStopTracker.isTriggered(position, new BigDecimal("55000"))).isTrue();
        }

        @Test
        @DisplayName("Activating again keeps the existing state")
        void activateTwice_keepsFirst() {
            trailingStopTracker.activate(position, new BigDecimal("55500"));
            trailingStopTracker.activate(position, new BigDecimal("60000"));

            assertThat(trailingStopTracker.getStopPrice("long-1"))
                    .hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("53835"));
        }
    }

    @Nested
    @DisplayName("Short")
    class ShortSide {

        private final Position position = position("short-1", PositionSide.SHORT);

        @Test
        @DisplayName("Arms above price and ratchets down with a new low")
        void ratchet_onlyDown() {
            trailingStopTracker.activate(position, new BigDecimal("45000"));
            assertThat(trailingStopTracker.getStopPrice("short-1"))
                    .hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("46350"));

            trailingStopTracker.ratchet(position, new BigDecimal("44000"));
            trailingStopTracker.ratchet(position, new BigDecimal("44500"));

            assertThat(trailingStopTracker.getStopPrice("short-1"))
                    .hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("45320"));
            assertThat(trailingStopTracker.isTriggered(position, new BigDecimal("45320"))).isTrue();
            assertThat(trailingStopTracker.isTriggered(position, new BigDecimal("45000"))).isFalse();
        }
    }

    @Test
    @DisplayName("Unarmed positions neither ratchet nor trigger")
    void unarmed() {
        Position position = position("none", PositionSide.LONG);

        assertThat(trailingStopTracker.ratchet(position, new BigDecimal("60000"))).isEmpty();
        assertThat(trailingStopTracker.isTriggered(position, new BigDecimal("1"))).isFalse();
    }

    @Test
    @DisplayName("State is released when the position closes")
    void closedEvent_releasesState() {
        Position position = position("long-1", PositionSide.LONG);
        trailingStopTracker.activate(position, new BigDecimal("55500"));

        trailingStopTracker.onPositionEvent(
                new PositionEvent(this, position, PositionEventType.UPDATED));
        assertThat(trailingStopTracker.isActive("long-1")).isTrue();

        trailingStopTracker.onPositionEvent(
                new PositionEvent(this, position, PositionEventType.CLOSED, BigDecimal.TEN));
        assertThat(trailingStopTracker.isActive("long-1")).isFalse();
    }

    private static Position position(String id, PositionSide side) {
        return Position.builder()
                .id(id)
                .symbol("BTCUSD")
                .side(side)
                .status(PositionStatus.OPEN)
                .build();
    }
}
