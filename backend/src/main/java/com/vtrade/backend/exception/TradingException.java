package com.vtrade.backend.exception;

public class TradingException extends RuntimeException {

    private final ErrorCode errorCode;

    public TradingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TradingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
