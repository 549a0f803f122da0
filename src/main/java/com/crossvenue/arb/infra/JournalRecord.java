package com.crossvenue.arb.infra;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record JournalRecord(Instant at, String type, Map<String, Object> data) {

    public static final String SCAN = "SCAN";
    public static final String OPPORTUNITY = "OPPORTUNITY";
    public static final String DROPPED = "DROPPED";
    public static final String RISK_REJECTED = "RISK_REJECTED";
    public static final String ATTEMPT = "ATTEMPT";
    public static final String KILL_SWITCH = "KILL_SWITCH";
    public static final String SETTLEMENT = "SETTLEMENT";
    public static final String VALUE_SIGNAL = "VALUE_SIGNAL";

    public static JournalRecord of(Instant at, String type, Map<String, Object> data) {
        return new JournalRecord(at, type, Collections.unmodifiableMap(new LinkedHashMap<>(data)));
    }
}
