package com.levertrader.domain.model;

import lombok.Getter;

/**
 * Outcome of a public TradeExecutor operation. Failures carry a human-readable reason and
 * never an exception.
 */
@Getter
public class TradeResult {

    private final boolean success;
    private final String reason;
    private final String positionId;

    private TradeResult(boolean success, String reason, String positionId) {
        this.success = success;
        this.reason = reason;
        this.positionId = positionId;
    }

    public static TradeResult success(String positionId, String reason) {
        return new TradeResult(true, reason, positionId);
    }

    public static TradeResult failure(String reason) {
        return new TradeResult(false, reason, null);
    }

    public static TradeResult failure(String positionId, String reason) {
        return new TradeResult(false, reason, positionId);
    }

    @Override
    public String toString() {
        return (success ? "OK" : "FAILED") + (positionId != null ? " [" + positionId + "]" : "") + ": " + reason;
    }
}
