package com.crossvenue.arb.domain;

public enum LegState {
    PENDING,
    SUBMITTED,
    FILLED,
    PARTIALLY_FILLED,
    REJECTED,
    TIMED_OUT,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != SUBMITTED;
    }
}
