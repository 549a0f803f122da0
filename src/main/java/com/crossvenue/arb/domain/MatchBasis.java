package com.crossvenue.arb.domain;

import lombok.Value;

/**
 * Evidence behind a match: the component scores that make up the confidence.
 */
@Value
public class MatchBasis {
    double nameSimilarity;
    double timeProximity;
    boolean marketTypeCompatible;
    String notes;
}
