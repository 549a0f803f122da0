package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One odds venue's two-way price for one outcome of an event: {@code quote} is side A
 * (the {@code outcome} named here), {@code complement} is the opposing outcome (side B).
 */
@Value
@Builder(toBuilder = true)
public class OddsLine {
    String venueId;
    String eventId;
    String category;
    String homeTeam;
    String awayTeam;
    Instant commenceTime;
    MarketType marketType;
    String outcome;
    String complementOutcome;
    BigDecimal point;
    Quote quote;
    Quote complement;

    public String lineKey() {
        return eventId + "|" + marketType + "|" + outcome + (point != null ? "|" + point.stripTrailingZeros().toPlainString() : "");
    }

    public String otherParticipant() {
        if (outcome == null) {
            return null;
        }
        if (outcome.equals(homeTeam)) {
            return awayTeam;
        }
        if (outcome.equals(awayTeam)) {
            return homeTeam;
        }
        return complementOutcome;
    }
}
