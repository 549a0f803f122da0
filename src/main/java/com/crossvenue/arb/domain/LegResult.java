package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class LegResult {
    LegPlan plan;
    LegState state;
    OrderHandle handle;
    BigDecimal filledSize;
    BigDecimal averagePrice;
    String message;
    Instant completedAt;

    public boolean hasFill() {
        return filledSize != null && filledSize.signum() > 0;
    }

    public static LegResult notFilled(LegPlan plan, LegState state, OrderHandle handle, String message, Instant at) {
        return LegResult.builder()
                .plan(plan)
                .state(state)
                .handle(handle)
                .filledSize(BigDecimal.ZERO)
                .message(message)
                .completedAt(at)
                .build();
    }
}
