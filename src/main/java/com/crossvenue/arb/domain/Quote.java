package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Quote {
    String venueId;
    String instrumentId;
    Side side;
    BigDecimal price; // native: American odds or probability
    PriceFormat priceFormat;
    Instant timestamp;
    BigDecimal availableSize; // null when the venue does not publish depth

    public boolean isOlderThan(Duration bound, Instant now) {
        return timestamp == null || Duration.between(timestamp, now).compareTo(bound) > 0;
    }
}
