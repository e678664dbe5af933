package com.vtrade.backend.exception;

public class BadRequestException extends TradingException {

    public BadRequestException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
