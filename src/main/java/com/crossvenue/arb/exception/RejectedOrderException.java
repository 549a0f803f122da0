package com.crossvenue.arb.exception;

/**
 * The venue declined an order. Terminal for that leg.
 */
public class RejectedOrderException extends VenueException {

    public RejectedOrderException(String venueId, String message) {
        super(venueId, message);
    }
}
