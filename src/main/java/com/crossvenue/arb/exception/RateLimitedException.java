package com.crossvenue.arb.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * The venue asked us to back off. Retried after {@link #getRetryAfter()}, not counted as a failure.
 */
@Getter
public class RateLimitedException extends VenueException {

    private final Duration retryAfter;

    public RateLimitedException(String venueId, Duration retryAfter) {
        super(venueId, "rate limited, retry after " + retryAfter.toMillis() + "ms");
        this.retryAfter = retryAfter;
    }
}
