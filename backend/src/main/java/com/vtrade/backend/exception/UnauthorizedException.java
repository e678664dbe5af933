package com.vtrade.backend.exception;

public class UnauthorizedException extends TradingException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
