package com.crossvenue.arb.risk;

public record RiskViolation(Type type, String venueId, String detail) {

    public enum Type {
        KILL_SWITCH,
        VENUE_THROTTLED,
        BELOW_MIN_SIZE,
        PER_BET_CAP,
        DAILY_VOLUME_CAP,
        GLOBAL_EXPOSURE_CAP,
        ATTEMPT_CAP,
        DAILY_LOSS_LIMIT
    }

    @Override
    public String toString() {
        return type + (venueId != null ? "@" + venueId : "") + ": " + detail;
    }
}
