package com.levertrader.unit.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.domain.model.Position;
import com.levertrader.exception.ErrorCode;
import com.levertrader.exception.TradeRejectedException;
import com.levertrader.position.PositionStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionStoreTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 2, 10, 0);

    private PositionStore positionStore;

    @BeforeEach
    void setUp() {
        positionStore = new PositionStore();
    }

    @Test
    @DisplayName("Second OPEN position for a symbol is refused as a duplicate")
    void add_duplicateOpenSymbol_refused() {
        positionStore.add(open("p1", "BTCUSD", T0));

        assertThatThrownBy(() -> positionStore.add(open("p2", "BTCUSD", T0.plusMinutes(1))))
                .isInstanceOf(TradeRejectedException.class)
                .hasMessageContaining("Position already open for BTCUSD")
                .extracting(e -> ((TradeRejectedException) e).getErrorCode())
                .isEqualTo(ErrorCode.DUPLICATE_POSITION);
        assertThat(positionStore.countOpen()).isEqualTo(1);
        assertThat(positionStore.findById("p2")).isEmpty();
    }

    @Test
    @DisplayName("Symbol is free again once its position is marked closed")
    void markClosed_freesSymbol() {
        Position first = open("p1", "BTCUSD", T0);
        positionStore.add(first);

        first.setStatus(PositionStatus.CLOSED);
        first.setExitTime(T0.plusHours(1));
        positionStore.markClosed(first);
        positionStore.add(open("p2", "BTCUSD", T0.plusHours(2)));

        assertThat(positionStore.findOpenBySymbol("BTCUSD")).map(Position::getId).contains("p2");
        assertThat(positionStore.findClosed(10)).extracting(Position::getId).containsExactly("p1");
    }

    @Test
    @DisplayName("Open positions come back ordered by entry time")
    void findOpen_orderedByEntryTime() {
        positionStore.add(open("late", "ETHUSD", T0.plusMinutes(5)));
        positionStore.add(open("early", "BTCUSD", T0));

        List<Position> open = positionStore.findOpen();

        assertThat(open).extracting(Position::getId).containsExactly("early", "late");
    }

    @Test
    @DisplayName("Closed history is most recent first and respects the limit")
    void findClosed_mostRecentFirst() {
        for (int i = 0; i < 3; i++) {
            Position position = open("c" + i, "SYM" + i, T0);
            position.setStatus(PositionStatus.CLOSED);
            position.setExitTime(T0.plusHours(i));
            positionStore.add(position);
        }

        assertThat(positionStore.findClosed(2)).extracting(Position::getId).containsExactly("c2", "c1");
    }

    @Test
    @DisplayName("Clear drops positions and the symbol index")
    void clear_dropsEverything() {
        positionStore.add(open("p1", "BTCUSD", T0));

        positionStore.clear();

        assertThat(positionStore.findAll()).isEmpty();
        assertThat(positionStore.hasOpenPosition("BTCUSD")).isFalse();
    }

    private static Position open(String id, String symbol, LocalDateTime entryTime) {
        return Position.builder()
                .id(id)
                .symbol(symbol)
                .side(PositionSide.LONG)
                .status(PositionStatus.OPEN)
                .entryPrice(new BigDecimal("100"))
                .quantity(BigDecimal.ONE)
                .entryTime(entryTime)
                .build();
    }
}
