package com.vtrade.backend.exception;

public class ConflictException extends TradingException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
