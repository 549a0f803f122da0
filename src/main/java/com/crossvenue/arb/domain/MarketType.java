package com.crossvenue.arb.domain;

/**
 * Market types on both sides of a match. Only types of the same family can be paired:
 * moneyline with a binary winner contract, a spread line with a spread contract, a total
 * with a total contract.
 */
public enum MarketType {
    MONEYLINE(Family.WINNER, false),
    SPREAD(Family.SPREAD, false),
    TOTAL(Family.TOTAL, false),
    BINARY_WINNER(Family.WINNER, true),
    SPREAD_CONTRACT(Family.SPREAD, true),
    TOTAL_CONTRACT(Family.TOTAL, true);

    public enum Family {
        WINNER, SPREAD, TOTAL
    }

    private final Family family;
    private final boolean exchangeContract;

    MarketType(Family family, boolean exchangeContract) {
        this.family = family;
        this.exchangeContract = exchangeContract;
    }

    public Family getFamily() {
        return family;
    }

    public boolean isExchangeContract() {
        return exchangeContract;
    }

    public boolean isCompatibleWith(MarketType other) {
        return other != null
                && family == other.family
                && exchangeContract != other.exchangeContract;
    }

    /** Maps TheOddsAPI market keys (h2h, spreads, totals). */
    public static MarketType fromOddsApiKey(String key) {
        if (key == null) {
            return null;
        }
        return switch (key) {
            case "h2h" -> MONEYLINE;
            case "spreads" -> SPREAD;
            case "totals" -> TOTAL;
            default -> null;
        };
    }

    /** The exchange contract type that settles like this odds-venue market type. */
    public MarketType exchangeCounterpart() {
        return switch (this) {
            case MONEYLINE, BINARY_WINNER -> BINARY_WINNER;
            case SPREAD, SPREAD_CONTRACT -> SPREAD_CONTRACT;
            case TOTAL, TOTAL_CONTRACT -> TOTAL_CONTRACT;
        };
    }

    public String toOddsApiKey() {
        return switch (this) {
            case MONEYLINE, BINARY_WINNER -> "h2h";
            case SPREAD, SPREAD_CONTRACT -> "spreads";
            case TOTAL, TOTAL_CONTRACT -> "totals";
        };
    }
}
