package com.vtrade.backend.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientMarginException extends TradingException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientMarginException(BigDecimal required, BigDecimal available) {
        super(ErrorCode.INSUFFICIENT_MARGIN,
                "Insufficient margin: required " + required.toPlainString() + ", available " + available.toPlainString());
        this.required = required;
        this.available = available;
    }
}
