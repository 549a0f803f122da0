package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.LegResult;
import com.crossvenue.arb.domain.NormalizedQuote;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Quote;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Price conversions and fee models. Pure functions.
 * <ul>
 *   <li>American odds: {@code -150} means risk 150 to win 100, {@code +240} risk 100 to win 240.</li>
 *   <li>De-vig is proportional: {@code fair_i = implied_i / sum(implied)}.</li>
 *   <li>Exchange taker fee per contract: {@code rate * p * (1 - p)}, added to the cost.</li>
 *   <li>Odds venue commission {@code c}: value received scales by {@code (1 - c)}.</li>
 * </ul>
 */
public final class OddsConverter {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private OddsConverter() {
    }

    public static double americanToImplied(BigDecimal american) {
        if (american == null || american.signum() == 0) {
            throw new IllegalArgumentException("American odds must be non-zero: " + american);
        }
        double odds = american.doubleValue();
        if (odds < 0) {
            double risk = -odds;
            return risk / (risk + 100.0);
        }
        return 100.0 / (odds + 100.0);
    }

    /**
     * Inverse of {@link #americanToImplied}. Not rounded to whole odds, so a round trip is exact
     * up to floating point.
     */
    public static BigDecimal impliedToAmerican(double probability) {
        if (!(probability > 0.0 && probability < 1.0)) {
            throw new IllegalArgumentException("Probability must be in (0, 1): " + probability);
        }
        BigDecimal p = BigDecimal.valueOf(probability);
        BigDecimal q = BigDecimal.ONE.subtract(p);
        if (probability >= 0.5) {
            return p.multiply(HUNDRED).divide(q, MathContext.DECIMAL64).negate();
        }
        return q.multiply(HUNDRED).divide(p, MathContext.DECIMAL64);
    }

    public static double impliedProbability(Quote quote) {
        if (quote.getPriceFormat() == PriceFormat.AMERICAN) {
            return americanToImplied(quote.getPrice());
        }
        return quote.getPrice().doubleValue();
    }

    /** Proportional de-vig of a two-way market. Returns {fairA, fairB}. */
    public static double[] devig(double impliedA, double impliedB) {
        double overround = impliedA + impliedB;
        if (overround <= 0.0) {
            throw new IllegalArgumentException("Implied probabilities must sum to a positive value");
        }
        return new double[]{impliedA / overround, impliedB / overround};
    }

    public static double exchangeFee(double price, double takerRate) {
        return takerRate * price * (1.0 - price);
    }

    public static double exchangeCost(double price, double takerRate) {
        return price + exchangeFee(price, takerRate);
    }

    public static double oddsValue(double fairProbability, double commission) {
        return fairProbability * (1.0 - commission);
    }

    /**
     * Normalizes both sides of a two-way odds line. Index 0 is {@code quote}, index 1 is
     * {@code complement}.
     */
    public static NormalizedQuote[] normalizeTwoWay(Quote quote, Quote complement, double commission) {
        double impliedA = impliedProbability(quote);
        double impliedB = impliedProbability(complement);
        double[] fair = devig(impliedA, impliedB);
        return new NormalizedQuote[]{
                new NormalizedQuote(quote, impliedA, fair[0], oddsValue(fair[0], commission)),
                new NormalizedQuote(complement, impliedB, fair[1], oddsValue(fair[1], commission))
        };
    }

    /**
     * Probability cost per unit actually paid on a leg, from the fill's average price. Falls back
     * to the planned cost when the venue reported no average price.
     */
    public static double achievedCost(LegResult leg, double exchangeTakerRate) {
        BigDecimal average = leg.getAveragePrice();
        if (average == null || average.signum() == 0) {
            return leg.getPlan().getProbabilityCost();
        }
        if (leg.getPlan().getPriceFormat() == PriceFormat.AMERICAN) {
            return americanToImplied(average);
        }
        return exchangeCost(average.doubleValue(), exchangeTakerRate);
    }
}
