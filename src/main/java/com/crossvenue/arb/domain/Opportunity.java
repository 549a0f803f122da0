package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A detected arbitrage window for one matched pair. Consumed at most once by the
 * execution coordinator; dropped when older than the staleness bound.
 */
@Value
@Builder(toBuilder = true)
public class Opportunity {
    String id;
    MatchedPair pair;
    OddsLine line;
    EdgeDirection direction;
    double netEdge;
    double exchangeCost;
    double oddsProbability;
    BigDecimal maxFillSize;
    Instant detectedAt;
    List<LegPlan> plan; // ordered, leg 1 first

    public String pairKey() {
        return pair.key();
    }

    public LegPlan leg1() {
        return plan.get(0);
    }

    public LegPlan leg2() {
        return plan.get(1);
    }

    public Duration age(Instant now) {
        return Duration.between(detectedAt, now);
    }

    public boolean isStale(Instant now, Duration bound) {
        return age(now).compareTo(bound) > 0;
    }

    /** Loss if leg 1 fills in full and the hedge never does. */
    public BigDecimal worstCaseLoss() {
        return leg1().notional();
    }

    public BigDecimal totalNotional() {
        return plan.stream().map(LegPlan::notional).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
