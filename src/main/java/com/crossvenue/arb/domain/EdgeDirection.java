package com.crossvenue.arb.domain;

/**
 * Which side is bought on the exchange; the odds venue leg always backs the opposite outcome.
 * <p>
 * Edge for a direction = fee-adjusted fair probability of the opposite outcome at the odds
 * venue minus fee-adjusted cost of the exchange side. Positive means the odds venue prices
 * the opposite outcome above what the exchange charges for our side.
 */
public enum EdgeDirection {
    EXCHANGE_A_ODDS_B(Side.A),
    EXCHANGE_B_ODDS_A(Side.B);

    private final Side exchangeSide;

    EdgeDirection(Side exchangeSide) {
        this.exchangeSide = exchangeSide;
    }

    public Side exchangeSide() {
        return exchangeSide;
    }

    public Side oddsSide() {
        return exchangeSide.opposite();
    }
}
