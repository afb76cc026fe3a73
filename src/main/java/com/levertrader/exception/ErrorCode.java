package com.levertrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Failure categories for trade execution, admission control and persistence. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE", false),
    DUPLICATE_POSITION("DUPLICATE_POSITION", false),
    DAILY_LIMIT_REACHED("DAILY_LIMIT_REACHED", false),
    POSITION_NOT_FOUND("POSITION_NOT_FOUND", false),
    INVALID_POSITION_STATE("INVALID_POSITION_STATE", false),
    PERSISTENCE_ERROR("PERSISTENCE_ERROR", true);

    private final String code;

    /** Whether the failure is a fault in the engine or its store rather than a rejected request. */
    private final boolean systemFault;
}
