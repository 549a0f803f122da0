package com.crossvenue.arb.risk;

import java.math.BigDecimal;

/**
 * Remaining dollar capacity per venue at one point in time.
 */
@FunctionalInterface
public interface VenueCapacity {

    BigDecimal remaining(String venueId);

    static VenueCapacity unlimited() {
        BigDecimal max = BigDecimal.valueOf(Long.MAX_VALUE);
        return venueId -> max;
    }
}
