package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.ExchangeInstrument;
import com.crossvenue.arb.domain.ExecutionAttempt;
import com.crossvenue.arb.domain.LegPlan;
import com.crossvenue.arb.domain.MatchedPair;
import com.crossvenue.arb.domain.OddsLine;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.OrderBook;
import com.crossvenue.arb.exception.StaleDataException;
import com.crossvenue.arb.infra.JournalRecord;
import com.crossvenue.arb.infra.TradeJournal;
import com.crossvenue.arb.infra.VenueRegistry;
import com.crossvenue.arb.risk.ExposureSnapshot;
import com.crossvenue.arb.risk.PortfolioManager;
import com.crossvenue.arb.risk.RiskDecision;
import com.crossvenue.arb.risk.RiskManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The scan cycle: refresh catalogs and books, match, detect, dedup in the arena, then hand
 * each fresh opportunity that passes risk to the execution coordinator. While the kill switch
 * is engaged the cycle still scans but dispatches nothing, and attempts still waiting on leg 1
 * when it trips are asked to cancel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArbitrageOrchestrator {

    public record CycleSummary(int instruments, int lines, int pairs, int opportunities, int dispatched) {
    }

    private final SnapshotIngestor ingestor;
    private final MarketSnapshotCache cache;
    private final MarketMatcher matcher;
    private final ArbitrageDetectionEngine detectionEngine;
    private final ConsensusValueScanner valueScanner;
    private final OpportunityArena arena;
    private final LeggingExecutionCoordinator coordinator;
    private final PortfolioManager portfolio;
    private final RiskManager riskManager;
    private final VenueRegistry venues;
    private final TradeJournal journal;
    private final ArbProperties properties;
    private final Clock clock;

    private final Set<String> reportedSignals = new HashSet<>();

    @Scheduled(fixedDelayString = "${arb.scan.interval-millis:2000}")
    public void runLoop() {
        try {
            runCycle();
        } catch (Exception e) {
            log.error("[SCAN] Cycle failed", e);
        }
    }

    public CycleSummary runCycle() {
        Instant now = clock.instant();
        if (portfolio.evaluateKillSwitch()) {
            cancelOpenAttempts();
        }
        ingestor.refreshCatalogs(now);

        int instruments = 0;
        int lines = 0;
        List<MatchedPair> pairs = new ArrayList<>();
        List<ConsensusValueScanner.Signal> signals = new ArrayList<>();
        for (String sport : properties.scan().sports()) {
            List<ExchangeInstrument> sportInstruments = cache.getInstruments(sport);
            List<OddsLine> sportLines = cache.getLines(sport);
            instruments += sportInstruments.size();
            lines += sportLines.size();
            pairs.addAll(matcher.match(sportInstruments, sportLines, now));
            if (properties.valueSignal().enabled()) {
                signals.addAll(valueScanner.scan(sportLines, now));
            }
        }
        reportValueSignals(signals, now);

        Map<String, OrderBook> books = ingestor.refreshBooks(pairs);
        ExposureSnapshot exposure = portfolio.snapshot();
        List<Opportunity> detected = detectionEngine.detect(pairs, books, exposure, riskManager.capacity(exposure));
        List<Opportunity> inserted = arena.replaceCycle(detected);
        for (Opportunity o : inserted) {
            journal.append(JournalRecord.of(o.getDetectedAt(), JournalRecord.OPPORTUNITY, describe(o)));
        }

        int dispatched = 0;
        if (portfolio.isHalted()) {
            if (!detected.isEmpty()) {
                log.warn("[SCAN] Trading halted, {} opportunities not dispatched", detected.size());
            }
        } else {
            for (Opportunity o : arena.pending()) {
                if (dispatch(o)) {
                    dispatched++;
                }
            }
        }

        CycleSummary summary = new CycleSummary(instruments, lines, pairs.size(), detected.size(), dispatched);
        journal.append(JournalRecord.of(now, JournalRecord.SCAN, Map.of(
                "instruments", instruments,
                "lines", lines,
                "pairs", pairs.size(),
                "opportunities", detected.size(),
                "dispatched", dispatched)));
        log.debug("[SCAN] {}", summary);
        return summary;
    }

    /** Journals each value signal once while it persists; signals are never executed. */
    private void reportValueSignals(List<ConsensusValueScanner.Signal> signals, Instant now) {
        Set<String> current = new HashSet<>();
        for (ConsensusValueScanner.Signal s : signals) {
            OddsLine line = s.line();
            String key = line.getVenueId() + "|" + line.lineKey();
            current.add(key);
            if (reportedSignals.contains(key)) {
                continue;
            }
            log.info("[VALUE] {} {} {} at {}: implied {} vs consensus {} over {} books", line.getVenueId(),
                    line.getEventId(), line.getOutcome(), line.getQuote().getPrice(),
                    String.format("%.4f", s.impliedProbability()), String.format("%.4f", s.consensus()), s.books());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("venue", line.getVenueId());
            data.put("event", line.getEventId());
            data.put("marketType", line.getMarketType().name());
            data.put("outcome", line.getOutcome());
            if (line.getPoint() != null) {
                data.put("point", line.getPoint());
            }
            data.put("price", line.getQuote().getPrice());
            data.put("consensus", s.consensus());
            data.put("edge", s.edge());
            data.put("books", s.books());
            data.put("suggestedStake", s.suggestedStake());
            journal.append(JournalRecord.of(now, JournalRecord.VALUE_SIGNAL, data));
        }
        reportedSignals.retainAll(current);
        reportedSignals.addAll(current);
    }

    private void cancelOpenAttempts() {
        for (ExecutionAttempt attempt : coordinator.openAttempts()) {
            String pairKey = attempt.getOpportunity().pairKey();
            if (coordinator.requestCancel(pairKey)) {
                log.warn("[SCAN] Kill switch engaged, cancel requested for attempt {} on {}", attempt.getId(), pairKey);
            }
        }
    }

    private boolean dispatch(Opportunity candidate) {
        if (coordinator.isInFlight(candidate.pairKey())) {
            return false;
        }
        Opportunity o = arena.take(candidate.pairKey()).orElse(null);
        if (o == null) {
            return false;
        }
        if (o.isStale(clock.instant(), properties.detection().staleness())) {
            drop(o, "stale");
            return false;
        }
        for (LegPlan leg : o.getPlan()) {
            if (!venues.canPlaceOrders(leg.getVenueId())) {
                drop(o, "venue " + leg.getVenueId() + " is read-only");
                return false;
            }
        }

        RiskDecision decision = portfolio.checkAndReserve(o);
        if (!decision.approved()) {
            Map<String, Object> data = describe(o);
            data.put("violations", decision.violations().stream().map(v -> v.type().name()).toList());
            journal.append(JournalRecord.of(clock.instant(), JournalRecord.RISK_REJECTED, data));
            return false;
        }

        try {
            if (coordinator.submit(o).isPresent()) {
                return true;
            }
        } catch (StaleDataException e) {
            log.debug("[SCAN] {} went stale before submission", o.pairKey());
        }
        portfolio.releaseReservation(o);
        return false;
    }

    private void drop(Opportunity o, String reason) {
        log.debug("[SCAN] Dropped {} on {}: {}", o.getId(), o.pairKey(), reason);
        Map<String, Object> data = describe(o);
        data.put("reason", reason);
        journal.append(JournalRecord.of(clock.instant(), JournalRecord.DROPPED, data));
    }

    private static Map<String, Object> describe(Opportunity o) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("opportunityId", o.getId());
        data.put("pair", o.pairKey());
        data.put("direction", o.getDirection().name());
        data.put("oddsVenue", o.getLine().getVenueId());
        data.put("edge", o.getNetEdge());
        data.put("size", o.getMaxFillSize());
        return data;
    }
}
