package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.EdgeDirection;
import com.crossvenue.arb.domain.ExchangeInstrument;
import com.crossvenue.arb.domain.LegPlan;
import com.crossvenue.arb.domain.MatchedPair;
import com.crossvenue.arb.domain.NormalizedQuote;
import com.crossvenue.arb.domain.OddsLine;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.OrderBook;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Quote;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.exception.StaleDataException;
import com.crossvenue.arb.risk.ExposureSnapshot;
import com.crossvenue.arb.risk.VenueCapacity;
import com.crossvenue.arb.risk.VenueRotation;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns matched pairs plus current exchange books into sized, ordered {@link Opportunity}s.
 * <p>
 * For each line of a pair both directions are priced:
 * {@code edge = oddsValue(fair(opposite side)) - exchangeCost(ask(our side))}. Lines whose
 * edge is within the noise threshold of the best one are treated as equivalent and the odds
 * venue among them is picked by {@link VenueRotation}. At most one opportunity per pair.
 */
@Slf4j
public class ArbitrageDetectionEngine {

    private final double minEdge;
    private final double noiseThreshold;
    private final BigDecimal maxBetUnits;
    private final ArbProperties.Fees fees;
    private final Duration quoteFreshness;
    private final VenueRotation rotation;
    private final String exchangeVenueId;
    private final Clock clock;

    public ArbitrageDetectionEngine(ArbProperties.Detection detection, ArbProperties.Fees fees, Duration quoteFreshness,
                                    VenueRotation rotation, String exchangeVenueId, Clock clock) {
        this.minEdge = detection.minEdge();
        this.noiseThreshold = detection.noiseThreshold();
        this.maxBetUnits = detection.maxBetUnits();
        this.fees = fees;
        this.quoteFreshness = quoteFreshness;
        this.rotation = rotation;
        this.exchangeVenueId = exchangeVenueId;
        this.clock = clock;
    }

    record Candidate(OddsLine line, EdgeDirection direction, OrderBook.OrderLevel ask, double exchangeCost,
                     NormalizedQuote odds, double edge) {

        Quote oddsQuote() {
            return odds.getSource();
        }
    }

    public List<Opportunity> detect(Collection<MatchedPair> pairs, Map<String, OrderBook> books,
                                    ExposureSnapshot exposure, VenueCapacity capacity) {
        Instant now = clock.instant();
        List<Opportunity> found = new ArrayList<>();
        for (MatchedPair pair : pairs) {
            OrderBook book = books.get(pair.key());
            if (book == null) {
                log.debug("[DETECT] No order book for {}", pair.key());
                continue;
            }
            try {
                detect(pair, book, exposure, capacity, now).ifPresent(found::add);
            } catch (StaleDataException e) {
                log.debug("[DETECT] Skipping {}: {}", pair.key(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[DETECT] Skipping {}: {}", pair.key(), e.getMessage());
            }
        }
        if (!found.isEmpty()) {
            log.info("[DETECT] {} opportunities across {} matched pairs", found.size(), pairs.size());
        }
        return found;
    }

    Optional<Opportunity> detect(MatchedPair pair, OrderBook book, ExposureSnapshot exposure,
                                 VenueCapacity capacity, Instant now) {
        if (exposure.isThrottled(exchangeVenueId)) {
            return Optional.empty();
        }
        requireFresh("order book " + book.getInstrumentId(), book.getTimestamp(), now);

        List<Candidate> candidates = new ArrayList<>();
        for (OddsLine line : pair.getLines()) {
            if (exposure.isThrottled(line.getVenueId())) {
                continue;
            }
            if (line.getQuote().isOlderThan(quoteFreshness, now) || line.getComplement().isOlderThan(quoteFreshness, now)) {
                log.debug("[DETECT] Stale line {} at {}", line.lineKey(), line.getVenueId());
                continue;
            }
            candidates.addAll(price(line, book));
        }

        Optional<Candidate> best = candidates.stream().max(Comparator.comparingDouble(Candidate::edge));
        if (best.isEmpty() || best.get().edge() < minEdge) {
            return Optional.empty();
        }

        double floor = best.get().edge() - noiseThreshold;
        List<Candidate> equivalent = candidates.stream()
                .filter(c -> c.edge() >= minEdge && c.edge() >= floor)
                .toList();
        Candidate chosen = choose(equivalent, exposure);

        BigDecimal size = maxFill(chosen, capacity);
        if (size.compareTo(BigDecimal.ONE) < 0) {
            log.debug("[DETECT] {} edge {} has no fillable size", pair.key(), chosen.edge());
            return Optional.empty();
        }

        Opportunity opportunity = Opportunity.builder()
                .id(UUID.randomUUID().toString())
                .pair(pair)
                .line(chosen.line())
                .direction(chosen.direction())
                .netEdge(chosen.edge())
                .exchangeCost(chosen.exchangeCost())
                .oddsProbability(chosen.odds().getFeeAdjustedProbability())
                .maxFillSize(size)
                .detectedAt(now)
                .plan(plan(pair.getInstrument(), chosen, size))
                .build();
        log.info("[DETECT] {} {} edge={} size={} via {}", pair.key(), chosen.direction(),
                String.format("%.4f", chosen.edge()), size, chosen.line().getVenueId());
        return Optional.of(opportunity);
    }

    List<Candidate> price(OddsLine line, OrderBook book) {
        NormalizedQuote[] normalized = OddsConverter.normalizeTwoWay(line.getQuote(), line.getComplement(),
                fees.commissionFor(line.getVenueId()));
        List<Candidate> out = new ArrayList<>(2);
        for (EdgeDirection direction : EdgeDirection.values()) {
            Optional<OrderBook.OrderLevel> ask = book.bestAsk(direction.exchangeSide());
            if (ask.isEmpty() || ask.get().getPrice().signum() <= 0 || ask.get().getPrice().compareTo(BigDecimal.ONE) >= 0) {
                continue;
            }
            double cost = OddsConverter.exchangeCost(ask.get().getPrice().doubleValue(), fees.exchangeTakerRate());
            NormalizedQuote odds = direction.oddsSide() == Side.A ? normalized[0] : normalized[1];
            double edge = odds.getFeeAdjustedProbability() - cost;
            out.add(new Candidate(line, direction, ask.get(), cost, odds, edge));
        }
        return out;
    }

    private Candidate choose(List<Candidate> equivalent, ExposureSnapshot exposure) {
        if (equivalent.size() == 1) {
            return equivalent.get(0);
        }
        List<String> ranked = rotation.rank(equivalent.stream().map(c -> c.line().getVenueId()).toList(), exposure);
        String venue = ranked.get(0);
        return equivalent.stream()
                .filter(c -> c.line().getVenueId().equals(venue))
                .max(Comparator.comparingDouble(Candidate::edge))
                .orElseThrow();
    }

    /**
     * Whole units limited by displayed exchange depth, published odds depth, the per-bet unit
     * cap, each venue's remaining capacity and the hard attempt total.
     */
    BigDecimal maxFill(Candidate c, VenueCapacity capacity) {
        BigDecimal exchangeCost = BigDecimal.valueOf(c.exchangeCost());
        BigDecimal stake = BigDecimal.valueOf(c.odds().getImpliedProbability());

        BigDecimal size = c.ask().getSize().min(maxBetUnits);
        BigDecimal oddsDepth = c.oddsQuote().getAvailableSize();
        if (oddsDepth != null) {
            size = size.min(oddsDepth);
        }
        size = size.min(capacity.remaining(exchangeVenueId).divide(exchangeCost, MathContext.DECIMAL64));
        size = size.min(capacity.remaining(c.line().getVenueId()).divide(stake, MathContext.DECIMAL64));
        size = size.min(ArbProperties.MAX_ATTEMPT_TOTAL.divide(exchangeCost.add(stake), MathContext.DECIMAL64));
        return size.max(BigDecimal.ZERO).setScale(0, RoundingMode.FLOOR);
    }

    /** Less liquid leg first; the exchange goes first on ties or when odds depth is unknown. */
    List<LegPlan> plan(ExchangeInstrument instrument, Candidate c, BigDecimal size) {
        Quote oddsQuote = c.oddsQuote();
        LegPlan.LegPlanBuilder exchange = LegPlan.builder()
                .venueId(exchangeVenueId)
                .instrumentId(instrument.getInstrumentId())
                .side(c.direction().exchangeSide())
                .targetPrice(c.ask().getPrice())
                .priceFormat(PriceFormat.PROBABILITY)
                .targetSize(size)
                .probabilityCost(c.exchangeCost());
        LegPlan.LegPlanBuilder odds = LegPlan.builder()
                .venueId(c.line().getVenueId())
                .instrumentId(oddsQuote.getInstrumentId())
                .side(c.direction().oddsSide())
                .targetPrice(oddsQuote.getPrice())
                .priceFormat(oddsQuote.getPriceFormat())
                .targetSize(size)
                .probabilityCost(c.odds().getImpliedProbability());

        BigDecimal oddsDepth = oddsQuote.getAvailableSize();
        boolean oddsFirst = oddsDepth != null && oddsDepth.compareTo(c.ask().getSize()) < 0;
        if (oddsFirst) {
            return List.of(odds.sequence(1).build(), exchange.sequence(2).build());
        }
        return List.of(exchange.sequence(1).build(), odds.sequence(2).build());
    }

    private void requireFresh(String what, Instant timestamp, Instant now) {
        if (timestamp == null) {
            throw new StaleDataException(what, quoteFreshness.plusMillis(1), quoteFreshness);
        }
        Duration age = Duration.between(timestamp, now);
        if (age.compareTo(quoteFreshness) > 0) {
            throw new StaleDataException(what, age, quoteFreshness);
        }
    }
}
