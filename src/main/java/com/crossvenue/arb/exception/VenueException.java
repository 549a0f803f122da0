package com.crossvenue.arb.exception;

import lombok.Getter;

/**
 * A venue call failed. Not retried unless it is one of the retryable subtypes.
 */
@Getter
public class VenueException extends ArbitrageException {

    private final String venueId;

    public VenueException(String venueId, String message) {
        super("[" + venueId + "] " + message);
        this.venueId = venueId;
    }

    public VenueException(String venueId, String message, Throwable cause) {
        super("[" + venueId + "] " + message, cause);
        this.venueId = venueId;
    }
}
