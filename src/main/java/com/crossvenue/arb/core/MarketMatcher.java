package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.ExchangeInstrument;
import com.crossvenue.arb.domain.MarketType;
import com.crossvenue.arb.domain.MatchBasis;
import com.crossvenue.arb.domain.MatchedPair;
import com.crossvenue.arb.domain.OddsLine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pairs each exchange instrument with the odds lines that price the same event outcome.
 * <p>
 * Candidates must share the category and a compatible market type (spreads and totals also
 * need the same line point). Each surviving line is scored as a weighted sum of participant
 * name similarity, start-time proximity and market-type compatibility. Lines are grouped by
 * event outcome across bookmakers and the best group at or above the threshold wins; ties go
 * to the higher time score, then the higher name score. Nothing is carried between calls.
 */
@Slf4j
public class MarketMatcher {

    private final NameSimilarity names;
    private final double threshold;
    private final double nameWeight;
    private final double timeWeight;
    private final double typeWeight;
    private final Duration timeTolerance;

    public MarketMatcher(NameSimilarity names, ArbProperties.Matching matching) {
        this.names = names;
        this.threshold = matching.threshold();
        this.nameWeight = matching.nameWeight();
        this.timeWeight = matching.timeWeight();
        this.typeWeight = matching.marketTypeWeight();
        this.timeTolerance = matching.timeTolerance();
    }

    public List<MatchedPair> match(Collection<ExchangeInstrument> instruments, Collection<OddsLine> lines, Instant now) {
        List<MatchedPair> pairs = new ArrayList<>();
        for (ExchangeInstrument instrument : instruments) {
            match(instrument, lines, now).ifPresent(pairs::add);
        }
        log.debug("[MATCH] {} of {} instruments matched against {} lines", pairs.size(), instruments.size(), lines.size());
        return pairs;
    }

    public Optional<MatchedPair> match(ExchangeInstrument instrument, Collection<OddsLine> lines, Instant now) {
        Map<String, Group> groups = new LinkedHashMap<>();
        for (OddsLine line : lines) {
            if (!isCandidate(instrument, line)) {
                continue;
            }
            MatchBasis basis = basis(instrument, line);
            double confidence = confidence(basis);
            if (confidence < threshold) {
                continue;
            }
            groups.computeIfAbsent(line.lineKey(), k -> new Group(confidence, basis)).lines.add(line);
        }

        return groups.values().stream()
                .max(Comparator.<Group>comparingDouble(g -> g.confidence)
                        .thenComparingDouble(g -> g.basis.getTimeProximity())
                        .thenComparingDouble(g -> g.basis.getNameSimilarity()))
                .map(g -> MatchedPair.builder()
                        .instrument(instrument)
                        .lines(g.lines)
                        .confidence(g.confidence)
                        .basis(g.basis)
                        .matchedAt(now)
                        .build());
    }

    boolean isCandidate(ExchangeInstrument instrument, OddsLine line) {
        if (instrument.getCategory() != null && line.getCategory() != null
                && !instrument.getCategory().equals(line.getCategory())) {
            return false;
        }
        if (instrument.getMarketType() == null || !instrument.getMarketType().isCompatibleWith(line.getMarketType())) {
            return false;
        }
        if (instrument.getMarketType().getFamily() != MarketType.Family.WINNER) {
            return instrument.getPoint() != null && line.getPoint() != null
                    && instrument.getPoint().compareTo(line.getPoint()) == 0;
        }
        return true;
    }

    MatchBasis basis(ExchangeInstrument instrument, OddsLine line) {
        String sport = instrument.getCategory();
        double subject = names.score(sport, instrument.getSubject(), line.getOutcome());

        double straight = (names.score(sport, instrument.getHomeParticipant(), line.getHomeTeam())
                + names.score(sport, instrument.getAwayParticipant(), line.getAwayTeam())) / 2.0;
        double swapped = (names.score(sport, instrument.getHomeParticipant(), line.getAwayTeam())
                + names.score(sport, instrument.getAwayParticipant(), line.getHomeTeam())) / 2.0;
        double event = Math.max(straight, swapped);

        double name = (subject + event) / 2.0;
        double time = timeProximity(instrument.getScheduledStart(), line.getCommenceTime());
        boolean typeOk = instrument.getMarketType().isCompatibleWith(line.getMarketType());

        String notes = String.format("subject=%.2f event=%.2f%s", subject, event, straight < swapped ? " (home/away swapped)" : "");
        return new MatchBasis(name, time, typeOk, notes);
    }

    double timeProximity(Instant a, Instant b) {
        if (a == null || b == null) {
            return 0.0;
        }
        long delta = Math.abs(Duration.between(a, b).toMillis());
        long tolerance = timeTolerance.toMillis();
        if (delta >= tolerance) {
            return 0.0;
        }
        return 1.0 - (double) delta / tolerance;
    }

    /** Weighted mean of the components, so it stays in [0, 1] and grows with each of them. */
    public double confidence(MatchBasis basis) {
        double total = nameWeight + timeWeight + typeWeight;
        double score = nameWeight * basis.getNameSimilarity()
                + timeWeight * basis.getTimeProximity()
                + typeWeight * (basis.isMarketTypeCompatible() ? 1.0 : 0.0);
        return score / total;
    }

    private static final class Group {
        final double confidence;
        final MatchBasis basis;
        final List<OddsLine> lines = new ArrayList<>();

        Group(double confidence, MatchBasis basis) {
            this.confidence = confidence;
            this.basis = basis;
        }
    }
}
