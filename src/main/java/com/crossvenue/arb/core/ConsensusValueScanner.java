package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.OddsLine;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags bookmaker lines priced better than the market consensus.
 * <p>
 * Lines for the same event outcome (and point, for spreads and totals) are compared across
 * bookmakers. The consensus is the average implied probability; a line whose own implied
 * probability is at least {@code minEdge} below it pays more than the market thinks the
 * outcome is worth. These are one-sided bets with no hedge, so they are reported and never
 * executed.
 */
@Slf4j
public class ConsensusValueScanner {

    public record Signal(OddsLine line, double impliedProbability, double consensus, double edge,
                         int books, BigDecimal suggestedStake) {
    }

    private static final double FULL_STAKE_EDGE = 0.10;

    private final double minEdge;
    private final int minBooks;
    private final Duration quoteFreshness;
    private final ArbProperties.Risk limits;

    public ConsensusValueScanner(ArbProperties.ValueSignal settings, Duration quoteFreshness, ArbProperties.Risk limits) {
        this.minEdge = settings.minEdge();
        this.minBooks = settings.minBooks();
        this.quoteFreshness = quoteFreshness;
        this.limits = limits;
    }

    /** @return signals best edge first */
    public List<Signal> scan(Collection<OddsLine> lines, Instant now) {
        Map<String, List<OddsLine>> byOutcome = new LinkedHashMap<>();
        for (OddsLine line : lines) {
            if (line.getQuote() == null || line.getQuote().isOlderThan(quoteFreshness, now)) {
                continue;
            }
            byOutcome.computeIfAbsent(line.lineKey(), k -> new ArrayList<>()).add(line);
        }

        List<Signal> signals = new ArrayList<>();
        for (List<OddsLine> group : byOutcome.values()) {
            if (group.size() < minBooks) {
                continue;
            }
            double consensus = group.stream()
                    .mapToDouble(l -> OddsConverter.impliedProbability(l.getQuote()))
                    .average()
                    .orElse(0.0);
            for (OddsLine line : group) {
                double implied = OddsConverter.impliedProbability(line.getQuote());
                double edge = consensus - implied;
                if (edge >= minEdge) {
                    signals.add(new Signal(line, implied, consensus, edge, group.size(), stake(line.getVenueId(), edge)));
                }
            }
        }
        signals.sort(Comparator.comparingDouble(Signal::edge).reversed());
        if (!signals.isEmpty()) {
            log.debug("[VALUE] {} lines beat consensus by {} or more", signals.size(), minEdge);
        }
        return signals;
    }

    // scales with the edge, full per-bet cap from a 10 point edge
    private BigDecimal stake(String venueId, double edge) {
        double fraction = Math.min(edge / FULL_STAKE_EDGE, 1.0);
        return limits.perBetCapFor(venueId)
                .multiply(BigDecimal.valueOf(fraction))
                .setScale(2, RoundingMode.HALF_UP);
    }
}
