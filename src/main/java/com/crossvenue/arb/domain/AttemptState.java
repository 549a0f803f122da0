package com.crossvenue.arb.domain;

public enum AttemptState {
    PLANNED(false),
    LEG1_SUBMITTED(false),
    LEG1_FILLED(false),
    LEG1_PARTIAL_FILL(false),
    LEG1_REJECTED(false),
    LEG1_TIMED_OUT(false),
    LEG2_SUBMITTED(false),
    LEG2_REJECTED(false),
    LEG2_TIMED_OUT(false),
    ABANDONED(true),
    BOTH_FILLED(true),
    LEG2_PARTIAL_FILL(true),
    NAKED_EXPOSURE(true);

    private final boolean terminal;

    AttemptState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccess() {
        return this == BOTH_FILLED || this == LEG2_PARTIAL_FILL;
    }
}
