package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.ExecutionAttempt;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.exception.StaleDataException;
import com.crossvenue.arb.infra.JournalRecord;
import com.crossvenue.arb.infra.TradeJournal;
import com.crossvenue.arb.infra.VenueRegistry;
import com.crossvenue.arb.risk.PortfolioManager;
import com.crossvenue.arb.risk.RiskDecision;
import com.crossvenue.arb.risk.RiskManager;
import com.crossvenue.arb.risk.RiskViolation;
import com.crossvenue.arb.support.Fixtures;
import com.crossvenue.arb.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ArbitrageOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    private MutableClock clock;
    private SnapshotIngestor ingestor;
    private MarketSnapshotCache cache;
    private MarketMatcher matcher;
    private ArbitrageDetectionEngine detectionEngine;
    private LeggingExecutionCoordinator coordinator;
    private PortfolioManager portfolio;
    private RiskManager riskManager;
    private VenueRegistry venues;
    private TradeJournal journal;
    private ArbitrageOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        ingestor = mock(SnapshotIngestor.class);
        cache = new MarketSnapshotCache();
        matcher = mock(MarketMatcher.class);
        detectionEngine = mock(ArbitrageDetectionEngine.class);
        coordinator = mock(LeggingExecutionCoordinator.class);
        portfolio = mock(PortfolioManager.class);
        riskManager = mock(RiskManager.class);
        venues = mock(VenueRegistry.class);
        journal = mock(TradeJournal.class);
        ArbProperties defaults = ArbProperties.defaults();

        when(venues.canPlaceOrders(anyString())).thenReturn(true);
        when(portfolio.checkAndReserve(any())).thenReturn(RiskDecision.approve());
        Future<ExecutionAttempt> done = CompletableFuture.completedFuture(null);
        when(coordinator.submit(any())).thenReturn(Optional.of(done));

        orchestrator = new ArbitrageOrchestrator(ingestor, cache, matcher, detectionEngine,
                new ConsensusValueScanner(defaults.valueSignal(), Duration.ofSeconds(60), defaults.risk()),
                new OpportunityArena(0.005), coordinator, portfolio, riskManager, venues, journal,
                defaults, clock);
    }

    @Test
    void testFreshOpportunityIsDispatchedOnce() {
        // 1. Same window detected on two consecutive cycles
        Opportunity o = Fixtures.opportunity("KX-A", 0.06, NOW);
        when(detectionEngine.detect(any(), any(), any(), any())).thenReturn(List.of(o));

        // 2. Run twice
        ArbitrageOrchestrator.CycleSummary first = orchestrator.runCycle();
        when(detectionEngine.detect(any(), any(), any(), any()))
                .thenReturn(List.of(o.toBuilder().detectedAt(NOW.plusMillis(500)).build()));
        ArbitrageOrchestrator.CycleSummary second = orchestrator.runCycle();

        // 3. Submitted on the first cycle only
        assertEquals(1, first.dispatched());
        assertEquals(0, second.dispatched());
        verify(portfolio, times(1)).checkAndReserve(o);
        verify(coordinator, times(1)).submit(o);
        verify(portfolio, times(2)).evaluateKillSwitch();
    }

    @Test
    void testStaleOpportunityIsDropped() {
        Opportunity old = Fixtures.opportunity("KX-A", 0.06, NOW.minus(Duration.ofSeconds(3)));
        when(detectionEngine.detect(any(), any(), any(), any())).thenReturn(List.of(old));

        ArbitrageOrchestrator.CycleSummary summary = orchestrator.runCycle();

        assertEquals(0, summary.dispatched());
        verify(coordinator, never()).submit(any());
        verify(portfolio, never()).checkAndReserve(any());
        assertTrue(journalTypes().contains(JournalRecord.DROPPED));
    }

    @Test
    void testReadOnlyVenueIsNeverDispatched() {
        when(venues.canPlaceOrders(Fixtures.BOOKMAKER)).thenReturn(false);
        when(detectionEngine.detect(any(), any(), any(), any()))
                .thenReturn(List.of(Fixtures.opportunity("KX-A", 0.06, NOW)));

        orchestrator.runCycle();

        verify(portfolio, never()).checkAndReserve(any());
        verify(coordinator, never()).submit(any());
        assertTrue(journalTypes().contains(JournalRecord.DROPPED));
    }

    @Test
    void testRiskRejectionIsJournaled() {
        when(portfolio.checkAndReserve(any())).thenReturn(RiskDecision.reject(List.of(
                new RiskViolation(RiskViolation.Type.DAILY_LOSS_LIMIT, null, "limit"))));
        when(detectionEngine.detect(any(), any(), any(), any()))
                .thenReturn(List.of(Fixtures.opportunity("KX-A", 0.06, NOW)));

        orchestrator.runCycle();

        verify(coordinator, never()).submit(any());
        assertTrue(journalTypes().contains(JournalRecord.RISK_REJECTED));
    }

    @Test
    void testHaltedCycleScansButDoesNotDispatch() {
        when(portfolio.isHalted()).thenReturn(true);
        when(detectionEngine.detect(any(), any(), any(), any()))
                .thenReturn(List.of(Fixtures.opportunity("KX-A", 0.06, NOW)));

        ArbitrageOrchestrator.CycleSummary summary = orchestrator.runCycle();

        assertEquals(1, summary.opportunities());
        assertEquals(0, summary.dispatched());
        verify(ingestor).refreshCatalogs(NOW);
        verify(portfolio, never()).checkAndReserve(any());
        verify(coordinator, never()).submit(any());
    }

    @Test
    void testReservationReleasedWhenSubmissionRefused() {
        Opportunity o = Fixtures.opportunity("KX-A", 0.06, NOW);
        when(detectionEngine.detect(any(), any(), any(), any())).thenReturn(List.of(o));
        when(coordinator.submit(any())).thenReturn(Optional.empty());

        orchestrator.runCycle();

        verify(portfolio).releaseReservation(o);
    }

    @Test
    void testReservationReleasedWhenStaleAtSubmission() {
        Opportunity o = Fixtures.opportunity("KX-A", 0.06, NOW);
        when(detectionEngine.detect(any(), any(), any(), any())).thenReturn(List.of(o));
        when(coordinator.submit(any())).thenThrow(new StaleDataException("opportunity", Duration.ofSeconds(3),
                Duration.ofSeconds(2)));

        ArbitrageOrchestrator.CycleSummary summary = orchestrator.runCycle();

        assertEquals(0, summary.dispatched());
        verify(portfolio).releaseReservation(o);
    }

    @Test
    void testPairAlreadyInFlightIsSkipped() {
        when(coordinator.isInFlight("KX-A")).thenReturn(true);
        when(detectionEngine.detect(any(), any(), any(), any()))
                .thenReturn(List.of(Fixtures.opportunity("KX-A", 0.06, NOW)));

        orchestrator.runCycle();

        verify(portfolio, never()).checkAndReserve(any());
        verify(coordinator, never()).submit(any());
    }

    @Test
    void testHeldWhileInFlightThenRefreshedIsDispatched() {
        // 1. Pair busy on the first cycle, so the window stays pending
        Opportunity first = Fixtures.opportunity("KX-A", 0.060, NOW);
        when(coordinator.isInFlight("KX-A")).thenReturn(true);
        when(detectionEngine.detect(any(), any(), any(), any())).thenReturn(List.of(first));
        orchestrator.runCycle();

        // 2. Six seconds later the pair is free and the same window is seen again within noise
        clock.advance(Duration.ofSeconds(6));
        Opportunity fresh = Fixtures.opportunity("KX-A", 0.061, NOW.plusSeconds(6));
        when(coordinator.isInFlight("KX-A")).thenReturn(false);
        when(detectionEngine.detect(any(), any(), any(), any())).thenReturn(List.of(fresh));
        ArbitrageOrchestrator.CycleSummary second = orchestrator.runCycle();

        // 3. The fresh detection goes out instead of being dropped as stale
        assertEquals(1, second.dispatched());
        verify(coordinator).submit(fresh);
        verify(coordinator, never()).submit(first);
        List<String> types = journalTypes();
        assertFalse(types.contains(JournalRecord.DROPPED));
        assertEquals(1, types.stream().filter(JournalRecord.OPPORTUNITY::equals).count());
    }

    @Test
    void testKillSwitchTripCancelsOpenAttempts() {
        // 1. An attempt is in flight when the switch trips
        ExecutionAttempt open = new ExecutionAttempt(Fixtures.opportunity("KX-A", 0.06, NOW), NOW);
        when(coordinator.openAttempts()).thenReturn(List.of(open));
        when(coordinator.requestCancel("KX-A")).thenReturn(true);
        when(portfolio.evaluateKillSwitch()).thenReturn(true, false);
        when(portfolio.isHalted()).thenReturn(true);

        // 2. Two cycles
        orchestrator.runCycle();
        orchestrator.runCycle();

        // 3. Cancel requested once, on the cycle the switch tripped
        verify(coordinator, times(1)).requestCancel("KX-A");
        verify(coordinator, never()).submit(any());
    }

    @Test
    void testValueSignalJournaledOnceAndNeverExecuted() {
        // 1. Four books on the same outcome, one well off the consensus
        cache.putLines(Fixtures.SPORT, "the-odds-api", List.of(
                Fixtures.line("draftkings", new BigDecimal("-150"), new BigDecimal("130"), NOW),
                Fixtures.line("fanduel", new BigDecimal("-150"), new BigDecimal("130"), NOW),
                Fixtures.line("betmgm", new BigDecimal("-150"), new BigDecimal("130"), NOW),
                Fixtures.line("caesars", new BigDecimal("110"), new BigDecimal("-130"), NOW)), NOW);

        // 2. Two cycles see the same signal
        orchestrator.runCycle();
        orchestrator.runCycle();

        // 3. Journaled on the first only, nothing submitted
        assertEquals(1, journalTypes().stream().filter(JournalRecord.VALUE_SIGNAL::equals).count());
        verify(coordinator, never()).submit(any());
        verify(portfolio, never()).checkAndReserve(any());
    }

    @Test
    void testEveryCycleIsJournaled() {
        orchestrator.runCycle();

        assertEquals(List.of(JournalRecord.SCAN), journalTypes());
    }

    private List<String> journalTypes() {
        ArgumentCaptor<JournalRecord> records = ArgumentCaptor.forClass(JournalRecord.class);
        verify(journal, atLeastOnce()).append(records.capture());
        return records.getAllValues().stream().map(JournalRecord::type).toList();
    }
}
