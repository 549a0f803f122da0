package com.crossvenue.arb.domain;

import lombok.Value;

import java.time.Instant;

@Value
public class OrderHandle {
    String venueId;
    String orderId;
    String instrumentId;
    Instant submittedAt;
}
