package com.vtrade.backend.exception;

public class InvalidInstrumentException extends TradingException {

    public InvalidInstrumentException(String message) {
        super(ErrorCode.INVALID_INSTRUMENT, message);
    }
}
