package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Venue-reported state of a single order. {@code SUBMITTED} means still resting; a resting
 * order with {@code filledSize > 0} is {@code PARTIALLY_FILLED}.
 */
@Value
@Builder
public class OrderStatus {
    LegState state;
    BigDecimal filledSize;
    BigDecimal averagePrice;
    String message;

    public static OrderStatus resting() {
        return OrderStatus.builder().state(LegState.SUBMITTED).filledSize(BigDecimal.ZERO).build();
    }

    public boolean hasFill() {
        return filledSize != null && filledSize.signum() > 0;
    }
}
