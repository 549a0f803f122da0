package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Holdings produced by one execution attempt. Owned by the portfolio ledger.
 */
@Data
@Builder
public class Position {
    private String positionId;
    private String attemptId;
    private String pairKey;
    private String description;
    private List<Leg> legs;
    private Status status;
    private BigDecimal expectedPnl; // locked-in margin for hedged size
    private BigDecimal realizedPnl;
    private Instant openedAt;
    private Instant closedAt;

    @Data
    @Builder
    public static class Leg {
        private String venueId;
        private String instrumentId;
        private Side side; // outcome backed, same orientation on both venues
        private BigDecimal size;
        private BigDecimal cost; // fee-adjusted probability paid per unit

        public BigDecimal notional() {
            return size.multiply(cost);
        }

        public BigDecimal payoff(Side winner) {
            BigDecimal received = side == winner ? size : BigDecimal.ZERO;
            return received.subtract(notional());
        }
    }

    public enum Status {
        HEDGED,
        RESIDUAL, // hedged in part, the unhedged remainder is tracked here
        NAKED,    // leg 2 failed after leg 1 filled
        SETTLED,
        VOID,     // event cancelled or pushed, stakes refunded
        UNWOUND
    }

    public boolean isOpen() {
        return status == Status.HEDGED || status == Status.RESIDUAL || status == Status.NAKED;
    }

    public boolean isUnhedged() {
        return status == Status.NAKED || status == Status.RESIDUAL;
    }

    public BigDecimal notional() {
        return legs.stream().map(Leg::notional).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
