package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class LegPlan {
    int sequence; // 1 or 2
    String venueId;
    String instrumentId;
    Side side;
    BigDecimal targetPrice;
    PriceFormat priceFormat;
    BigDecimal targetSize;
    double probabilityCost; // fee-adjusted cost per unit of payout

    public LegPlan withSize(BigDecimal size) {
        return toBuilder().targetSize(size).build();
    }

    /** Dollar amount at risk for this leg at its target size. */
    public BigDecimal notional() {
        return targetSize.multiply(BigDecimal.valueOf(probabilityCost));
    }
}
