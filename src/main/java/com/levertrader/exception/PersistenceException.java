package com.levertrader.exception;

/** The document store could not complete a read or write. */
public class PersistenceException extends BaseException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
