package com.levertrader.domain.enums;

/** Protective action recommended by position risk analysis. */
public enum RiskAction {

    /** Nothing to do beyond continued observation. */
    MONITOR,

    /** Move the stop loss closer to the current price. */
    TIGHTEN_STOP_LOSS,

    /** Close the position at market. */
    CLOSE_POSITION,

    /** Arm the trailing-stop ratchet to protect accumulated profit. */
    ACTIVATE_TRAILING,

    /** Close immediately: margin, loss or holding time passed the emergency tier. */
    EMERGENCY_CLOSE
}
