package com.levertrader.exception;

import java.util.Map;

/**
 * A trade request or position mutation refused by validation or admission control.
 * The message is the reason string handed back to the caller.
 */
public class TradeRejectedException extends BaseException {

    public TradeRejectedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TradeRejectedException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
