package com.vtrade.backend.model;

public enum TransactionCategory {
    MARGIN_BLOCK,
    MARGIN_RELEASE,
    CHARGES,
    REALIZED_PNL,
    DEPOSIT,
    WITHDRAWAL,
    ADJUSTMENT;

    /**
     * Categories whose amounts track the value of a position, as opposed to margin bookkeeping and fees.
     */
    public boolean isPositionValue() {
        return this == REALIZED_PNL || this == ADJUSTMENT;
    }
}
