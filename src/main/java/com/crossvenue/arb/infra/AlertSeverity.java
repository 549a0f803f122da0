package com.crossvenue.arb.infra;

public enum AlertSeverity {
    CRITICAL,
    WARNING,
    INFO
}
