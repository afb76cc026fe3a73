package com.levertrader.position;

import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.domain.model.Position;
import com.levertrader.exception.ErrorCode;
import com.levertrader.exception.TradeRejectedException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Positions keyed by id, with an index of the OPEN position per symbol.
 *
 * <p>The symbol index enforces the one-open-position-per-symbol rule: {@link #add} refuses an
 * OPEN position for a symbol that already has one. Closed positions stay in the store as
 * history until an explicit {@link #clear()}.
 *
 * <p>Maps are concurrent so readers can iterate safely, but compound check-then-act sequences
 * rely on the caller ({@link com.levertrader.execution.TradeExecutor}) holding its lock.
 */
public class PositionStore {

    private final Map<String, Position> positionsById = new ConcurrentHashMap<>();
    private final Map<String, String> openPositionIdBySymbol = new ConcurrentHashMap<>();

    /**
     * Adds a position.
     *
     * @throws TradeRejectedException with DUPLICATE_POSITION if the position is OPEN and its
     *     symbol already has an OPEN position
     */
    public void add(Position position) {
        if (position.isOpen()) {
            String existingId = openPositionIdBySymbol.putIfAbsent(position.getSymbol(), position.getId());
            if (existingId != null && !existingId.equals(position.getId())) {
                throw new TradeRejectedException(
                        ErrorCode.DUPLICATE_POSITION,
                        "Position already open for " + position.getSymbol(),
                        Map.of("existingPositionId", existingId));
            }
        }
        positionsById.put(position.getId(), position);
    }

    public Optional<Position> findById(String positionId) {
        return Optional.ofNullable(positionsById.get(positionId));
    }

    public Optional<Position> findOpenBySymbol(String symbol) {
        String positionId = openPositionIdBySymbol.get(symbol);
        return positionId == null ? Optional.empty() : findById(positionId);
    }

    public boolean hasOpenPosition(String symbol) {
        return openPositionIdBySymbol.containsKey(symbol);
    }

    /** Drops the symbol index entry once a position leaves OPEN. */
    public void markClosed(Position position) {
        openPositionIdBySymbol.remove(position.getSymbol(), position.getId());
    }

    public List<Position> findOpen() {
        List<Position> open = new ArrayList<>();
        for (String positionId : openPositionIdBySymbol.values()) {
            Position position = positionsById.get(positionId);
            if (position != null && position.getStatus() == PositionStatus.OPEN) {
                open.add(position);
            }
        }
        open.sort(Comparator.comparing(Position::getEntryTime, Comparator.nullsFirst(Comparator.naturalOrder())));
        return open;
    }

    /** Closed positions, most recently closed first. */
    public List<Position> findClosed(int limit) {
        return positionsById.values().stream()
                .filter(position -> position.getStatus() == PositionStatus.CLOSED)
                .sorted(Comparator.comparing(Position::getExitTime, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList();
    }

    public int countOpen() {
        return openPositionIdBySymbol.size();
    }

    public Collection<Position> findAll() {
        return List.copyOf(positionsById.values());
    }

    public void clear() {
        positionsById.clear();
        openPositionIdBySymbol.clear();
    }
}
