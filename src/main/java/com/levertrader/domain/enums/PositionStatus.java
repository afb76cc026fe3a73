package com.levertrader.domain.enums;

/**
 * Lifecycle of a position.
 *
 * <p>OPEN positions may be pyramided or partially closed any number of times; CLOSED is
 * terminal and the position's fields are frozen from then on. PENDING is reserved for
 * positions restored from the store without a confirmed fill.
 */
public enum PositionStatus {
    PENDING,
    OPEN,
    CLOSED
}
