package com.levertrader.persistence;

import com.levertrader.domain.enums.PositionStatus;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for account, position and order documents.
 *
 * <p>Writes are upserts keyed by document id and report success as a boolean: the engine logs
 * a failed write and carries on with its in-memory state. Reads throw
 * {@link com.levertrader.exception.PersistenceException} when the store is unreachable, so
 * callers can tell an empty store from a broken one.
 */
public interface PersistenceGateway {

    boolean saveAccount(AccountDocument document);

    Optional<AccountDocument> loadAccount(String accountId);

    boolean savePosition(PositionDocument document);

    /**
     * @param statusFilter only positions in this status; null for all
     */
    List<PositionDocument> loadPositions(PositionStatus statusFilter);

    boolean saveOrder(OrderDocument document);

    /** Removes every stored document. Used by an explicit data wipe only. */
    boolean deleteAll();
}
