package com.crossvenue.arb.exception;

/**
 * Network failure, 5xx or timeout. Retried with exponential backoff.
 */
public class TransientVenueException extends VenueException {

    public TransientVenueException(String venueId, String message) {
        super(venueId, message);
    }

    public TransientVenueException(String venueId, String message, Throwable cause) {
        super(venueId, message, cause);
    }
}
