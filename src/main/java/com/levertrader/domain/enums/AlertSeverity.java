package com.levertrader.domain.enums;

/**
 * Severity of an alert delivered to notification sinks.
 *
 * <p>Ordinal order puts CRITICAL first so sinks that batch can flush the most severe alerts first.
 */
public enum AlertSeverity {

    /** An automatic protective action was taken (emergency close, liquidation protection). */
    CRITICAL,

    /** Needs trader attention but no automatic action was taken. */
    WARNING,

    /** Informational, such as trade executions and normal closes. */
    INFO
}
