package com.vtrade.backend.model;

/**
 * Order lifecycle. PENDING is the only non-terminal state; each terminal state is reached exactly once,
 * through a compare-and-swap on the persisted status.
 */
public enum OrderStatus {
    PENDING,
    EXECUTED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null) return false;
        return this == PENDING && target != PENDING;
    }
}
