package com.crossvenue.arb.support;

import com.crossvenue.arb.domain.EdgeDirection;
import com.crossvenue.arb.domain.ExchangeInstrument;
import com.crossvenue.arb.domain.LegPlan;
import com.crossvenue.arb.domain.MarketType;
import com.crossvenue.arb.domain.MatchedPair;
import com.crossvenue.arb.domain.OddsLine;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.OrderBook;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Quote;
import com.crossvenue.arb.domain.Side;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Shared test data: one NBA game (Oklahoma City at Denver) seen from the exchange and from
 * the odds venues.
 */
public final class Fixtures {

    public static final String SPORT = "basketball_nba";
    public static final String EXCHANGE = "kalshi";
    public static final String BOOKMAKER = "draftkings";
    public static final String HOME = "Denver Nuggets";
    public static final String AWAY = "Oklahoma City Thunder";
    public static final String INSTRUMENT_ID = "KXNBAGAME-26FEB01OKCDEN-DEN";
    public static final String EVENT_ID = "evt-okc-den";
    public static final Instant START = Instant.parse("2026-02-01T02:00:00Z");

    private Fixtures() {
    }

    public static ExchangeInstrument instrument(String instrumentId) {
        return ExchangeInstrument.builder()
                .instrumentId(instrumentId)
                .eventId("KXNBAGAME-26FEB01OKCDEN")
                .category(SPORT)
                .title("Oklahoma City at Denver Winner?")
                .homeParticipant(HOME)
                .awayParticipant(AWAY)
                .subject(HOME)
                .scheduledStart(START)
                .marketType(MarketType.BINARY_WINNER)
                .volume24h(new BigDecimal("12000"))
                .build();
    }

    /** Moneyline for the home team (side A) against the away team (side B). */
    public static OddsLine line(String venueId, BigDecimal americanHome, BigDecimal americanAway, Instant at) {
        return OddsLine.builder()
                .venueId(venueId)
                .eventId(EVENT_ID)
                .category(SPORT)
                .homeTeam(HOME)
                .awayTeam(AWAY)
                .commenceTime(START)
                .marketType(MarketType.MONEYLINE)
                .outcome(HOME)
                .complementOutcome(AWAY)
                .quote(quote(venueId, HOME, Side.A, americanHome, at))
                .complement(quote(venueId, AWAY, Side.B, americanAway, at))
                .build();
    }

    public static Quote quote(String venueId, String outcome, Side side, BigDecimal american, Instant at) {
        return Quote.builder()
                .venueId(venueId)
                .instrumentId(EVENT_ID + ":h2h:" + outcome)
                .side(side)
                .price(american)
                .priceFormat(PriceFormat.AMERICAN)
                .timestamp(at)
                .build();
    }

    public static OrderBook book(String instrumentId, String bid, String bidSize, String ask, String askSize, Instant at) {
        return OrderBook.builder()
                .instrumentId(instrumentId)
                .timestamp(at)
                .bids(List.of(OrderBook.OrderLevel.builder().price(new BigDecimal(bid)).size(new BigDecimal(bidSize)).build()))
                .asks(List.of(OrderBook.OrderLevel.builder().price(new BigDecimal(ask)).size(new BigDecimal(askSize)).build()))
                .build();
    }

    public static MatchedPair pair(ExchangeInstrument instrument, OddsLine... lines) {
        return MatchedPair.builder()
                .instrument(instrument)
                .lines(List.of(lines))
                .confidence(0.95)
                .matchedAt(START.minusSeconds(3600))
                .build();
    }

    /**
     * Exchange-first opportunity: buy the home team at 0.35 on the exchange, back the away
     * team at +122 on the bookmaker, 10 units each.
     */
    public static Opportunity opportunity(String instrumentId, double edge, Instant detectedAt) {
        return opportunity(instrumentId, edge, new BigDecimal("10"), detectedAt);
    }

    public static Opportunity opportunity(String instrumentId, double edge, BigDecimal size, Instant detectedAt) {
        ExchangeInstrument instrument = instrument(instrumentId);
        OddsLine line = line(BOOKMAKER, new BigDecimal("-122"), new BigDecimal("122"), detectedAt);
        LegPlan exchangeLeg = LegPlan.builder()
                .sequence(1)
                .venueId(EXCHANGE)
                .instrumentId(instrumentId)
                .side(Side.A)
                .targetPrice(new BigDecimal("0.35"))
                .priceFormat(PriceFormat.PROBABILITY)
                .targetSize(size)
                .probabilityCost(0.365925)
                .build();
        LegPlan oddsLeg = LegPlan.builder()
                .sequence(2)
                .venueId(BOOKMAKER)
                .instrumentId(line.getComplement().getInstrumentId())
                .side(Side.B)
                .targetPrice(new BigDecimal("122"))
                .priceFormat(PriceFormat.AMERICAN)
                .targetSize(size)
                .probabilityCost(0.45)
                .build();
        return Opportunity.builder()
                .id(UUID.randomUUID().toString())
                .pair(pair(instrument, line))
                .line(line)
                .direction(EdgeDirection.EXCHANGE_A_ODDS_B)
                .netEdge(edge)
                .exchangeCost(0.365925)
                .oddsProbability(0.45)
                .maxFillSize(size)
                .detectedAt(detectedAt)
                .plan(List.of(exchangeLeg, oddsLeg))
                .build();
    }
}
