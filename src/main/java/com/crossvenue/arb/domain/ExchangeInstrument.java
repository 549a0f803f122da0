package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A binary contract on the exchange venue. The YES side of the contract is side A and
 * refers to {@code subject} (e.g. "Denver" for "Oklahoma City at Denver Winner?").
 */
@Value
@Builder(toBuilder = true)
public class ExchangeInstrument {
    String instrumentId;
    String eventId;
    String category;
    String title;
    String homeParticipant;
    String awayParticipant;
    String subject;
    Instant scheduledStart;
    MarketType marketType;
    BigDecimal point; // spread / total line, null for winner contracts
    BigDecimal volume24h;

    public String opponentOf(String participant) {
        if (participant == null) {
            return null;
        }
        if (participant.equals(homeParticipant)) {
            return awayParticipant;
        }
        if (participant.equals(awayParticipant)) {
            return homeParticipant;
        }
        return null;
    }
}
