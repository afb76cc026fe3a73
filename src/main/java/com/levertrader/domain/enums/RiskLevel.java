package com.levertrader.domain.enums;

/** Risk classification for a single position or for the whole portfolio. Ordered by severity. */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
