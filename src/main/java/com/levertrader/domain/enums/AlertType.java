package com.levertrader.domain.enums;

/** Category of a risk alert, used by sinks to pick a format. */
public enum AlertType {
    RISK,
    PORTFOLIO
}
