package com.levertrader.domain.enums;

/**
 * Status of a {@link com.levertrader.domain.model.TradeRequest}.
 *
 * <p>PENDING → EXECUTING → one of COMPLETED, FAILED, CANCELLED. The last three are terminal.
 */
public enum ExecutionStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
