package com.levertrader.recovery;

import lombok.Builder;
import lombok.Data;

/** Outcome of restoring the account and open positions at startup. */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    /** False when no stored account existed and a fresh one was created. */
    private boolean accountRestored;

    private int positionsRestored;
}
