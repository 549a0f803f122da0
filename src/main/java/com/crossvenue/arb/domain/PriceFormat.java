package com.crossvenue.arb.domain;

public enum PriceFormat {
    AMERICAN,    // sportsbook moneyline, e.g. -150 / +240
    PROBABILITY  // exchange contract price in [0, 1]
}
