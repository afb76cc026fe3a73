package com.levertrader.exception;

public class PositionNotFoundException extends BaseException {

    public PositionNotFoundException(String positionId) {
        super(ErrorCode.POSITION_NOT_FOUND, String.format("Position not found: %s", positionId));
    }
}
