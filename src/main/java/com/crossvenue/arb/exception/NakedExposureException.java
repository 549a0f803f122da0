package com.crossvenue.arb.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Leg 2 failed after leg 1 filled. Never swallowed: it is logged, alerted and handed to the
 * portfolio manager with the attempt.
 */
@Getter
public class NakedExposureException extends ArbitrageException {

    private final String attemptId;
    private final String venueId;
    private final String instrumentId;
    private final BigDecimal unhedgedSize;

    public NakedExposureException(String attemptId, String venueId, String instrumentId,
                                  BigDecimal unhedgedSize, String reason) {
        super("Naked exposure on attempt " + attemptId + ": " + unhedgedSize + " units of "
                + instrumentId + " at " + venueId + " unhedged (" + reason + ")");
        this.attemptId = attemptId;
        this.venueId = venueId;
        this.instrumentId = instrumentId;
        this.unhedgedSize = unhedgedSize;
    }
}
