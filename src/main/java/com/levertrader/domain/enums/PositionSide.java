package com.levertrader.domain.enums;

/** Direction of a leveraged position. */
public enum PositionSide {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Multiplies price moves into PnL. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
