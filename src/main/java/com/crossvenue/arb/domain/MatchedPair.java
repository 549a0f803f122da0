package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * An exchange instrument together with the odds venues' lines believed to price the same
 * event outcome. Rebuilt from scratch every scan cycle.
 */
@Value
@Builder
public class MatchedPair {
    ExchangeInstrument instrument;
    @Singular
    List<OddsLine> lines;
    double confidence;
    MatchBasis basis;
    Instant matchedAt;

    /** Stable key used for dedup and for the one-attempt-per-pair rule. */
    public String key() {
        return instrument.getInstrumentId();
    }
}
