package com.crossvenue.arb.domain;

import lombok.Value;

/**
 * A {@link Quote} expressed in probability space. Derived on demand, never stored on its own.
 */
@Value
public class NormalizedQuote {
    Quote source;
    double impliedProbability;
    double fairProbability;
    double feeAdjustedProbability;
}
