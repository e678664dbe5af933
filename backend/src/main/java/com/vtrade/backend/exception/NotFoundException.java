package com.vtrade.backend.exception;

public class NotFoundException extends TradingException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
