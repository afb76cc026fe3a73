package com.levertrader.domain.enums;

/** Side of a trade signal. BUY opens a LONG position, SELL opens a SHORT one. */
public enum OrderSide {
    BUY,
    SELL;

    public PositionSide toPositionSide() {
        return this == BUY ? PositionSide.LONG : PositionSide.SHORT;
    }
}
