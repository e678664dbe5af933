package com.vtrade.backend.model;

public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * +1 for BUY, -1 for SELL; multiplying a fill quantity by this gives the signed position delta.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
