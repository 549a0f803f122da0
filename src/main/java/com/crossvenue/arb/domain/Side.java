package com.crossvenue.arb.domain;

/**
 * One side of a binary event. For an exchange instrument, A is the YES side of the
 * contract; for an odds line, A is the outcome the line is keyed on and B its complement.
 */
public enum Side {
    A, B;

    public Side opposite() {
        return this == A ? B : A;
    }
}
