package com.levertrader.event;

/** Kind of change carried by a {@link PositionEvent}. */
public enum PositionEventType {

    /** A new position was opened from a trade request. */
    OPENED,

    /** Stop loss or target changed without a quantity change. */
    UPDATED,

    /** Quantity added by pyramiding. */
    INCREASED,

    /** Part of the remaining quantity was closed (trailing step). */
    REDUCED,

    /** Position closed; terminal. */
    CLOSED
}
