package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.AttemptState;
import com.crossvenue.arb.domain.ExecutionAttempt;
import com.crossvenue.arb.domain.LegResult;
import com.crossvenue.arb.domain.LegState;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.OrderHandle;
import com.crossvenue.arb.domain.OrderStatus;
import com.crossvenue.arb.domain.Position;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.exception.RejectedOrderException;
import com.crossvenue.arb.exception.StaleDataException;
import com.crossvenue.arb.infra.AlertSeverity;
import com.crossvenue.arb.infra.AlertSink;
import com.crossvenue.arb.infra.RetryPolicy;
import com.crossvenue.arb.infra.TradeJournal;
import com.crossvenue.arb.infra.TradingVenue;
import com.crossvenue.arb.infra.VenueRegistry;
import com.crossvenue.arb.risk.ExposureLedger;
import com.crossvenue.arb.risk.KillSwitch;
import com.crossvenue.arb.risk.PortfolioManager;
import com.crossvenue.arb.risk.RiskManager;
import com.crossvenue.arb.risk.ThrottleDetector;
import com.crossvenue.arb.support.Fixtures;
import com.crossvenue.arb.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.crossvenue.arb.support.Fixtures.BOOKMAKER;
import static com.crossvenue.arb.support.Fixtures.EXCHANGE;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LeggingExecutionCoordinatorTest {

    private static final Instant T0 = Instant.parse("2026-02-01T00:00:00Z");
    private static final String PAIR = "KXNBAGAME-26FEB01OKCDEN-DEN";
    private static final BigDecimal TEN = new BigDecimal("10");

    private MutableClock clock;
    private TradingVenue exchange;
    private TradingVenue odds;
    private AlertSink alerts;
    private PortfolioManager portfolio;
    private ExecutorService workers;
    private VenueRegistry venues;
    private LeggingExecutionCoordinator coordinator;

    private final OrderHandle exchangeOrder = new OrderHandle(EXCHANGE, "ex-1", PAIR, T0);
    private final OrderHandle oddsOrder = new OrderHandle(BOOKMAKER, "dk-1", "evt", T0);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        exchange = mock(TradingVenue.class);
        when(exchange.venueId()).thenReturn(EXCHANGE);
        odds = mock(TradingVenue.class);
        when(odds.venueId()).thenReturn(BOOKMAKER);
        alerts = mock(AlertSink.class);

        ArbProperties.Risk risk = ArbProperties.defaults().risk();
        portfolio = new PortfolioManager(new ExposureLedger(clock, ZoneOffset.UTC), new RiskManager(risk),
                new ThrottleDetector(risk.throttleRejections(), risk.throttleWindow()),
                new KillSwitch(risk.dailyLossLimit(), risk.maxDrawdown()),
                alerts, TradeJournal.noop(), clock, 0.07);

        workers = Executors.newFixedThreadPool(2);
        venues = new VenueRegistry().register(exchange).register(odds);
        coordinator = new LeggingExecutionCoordinator(venues, portfolio, RetryPolicy.none(), workers, clock,
                clock::advance, ArbProperties.defaults().execution(), Duration.ofSeconds(2), 0.07);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void testBothLegsFill() {
        // 1. Both venues fill at the planned price
        whenPlaced(exchange, exchangeOrder);
        whenPlaced(odds, oddsOrder);
        when(exchange.getOrderStatus(exchangeOrder)).thenReturn(filled(TEN, "0.35"));
        when(odds.getOrderStatus(oddsOrder)).thenReturn(filled(TEN, null));

        // 2. Execute
        ExecutionAttempt attempt = coordinator.execute(Fixtures.opportunity(PAIR, 0.084, T0));

        // 3. Hedged position, realized edge equals planned edge
        assertEquals(AttemptState.BOTH_FILLED, attempt.getState());
        assertEquals(List.of(AttemptState.PLANNED, AttemptState.LEG1_SUBMITTED, AttemptState.LEG1_FILLED,
                AttemptState.LEG2_SUBMITTED, AttemptState.BOTH_FILLED), states(attempt));
        assertEquals(0.084, attempt.getRealizedEdge().orElseThrow(), 1e-9);
        assertFalse(coordinator.isInFlight(PAIR));

        List<Position> positions = portfolio.positions();
        assertEquals(1, positions.size());
        assertEquals(Position.Status.HEDGED, positions.get(0).getStatus());
        verify(alerts, never()).notify(any(), anyString(), anyMap());
    }

    @Test
    void testLeg1RejectedNeverPlacesLeg2() {
        when(exchange.placeOrder(anyString(), any(), any(), any(), any()))
                .thenThrow(new RejectedOrderException(EXCHANGE, "insufficient balance"));

        ExecutionAttempt attempt = coordinator.execute(Fixtures.opportunity(PAIR, 0.084, T0));

        assertEquals(AttemptState.ABANDONED, attempt.getState());
        assertTrue(states(attempt).contains(AttemptState.LEG1_REJECTED));
        assertEquals(LegState.REJECTED, attempt.getLeg1().orElseThrow().getState());
        verify(odds, never()).placeOrder(anyString(), any(), any(), any(), any());
        assertTrue(portfolio.positions().isEmpty());
    }

    @Test
    void testLeg1TimeoutCancelsAndNeverPlacesLeg2() {
        // 1. Leg 1 rests without a fill
        whenPlaced(exchange, exchangeOrder);
        when(exchange.getOrderStatus(exchangeOrder)).thenReturn(OrderStatus.resting());

        // 2. Execute; polling advances the clock past the 3s leg 1 timeout
        ExecutionAttempt attempt = coordinator.execute(Fixtures.opportunity(PAIR, 0.084, T0));

        // 3. Cancelled once, abandoned, no hedge
        assertEquals(AttemptState.ABANDONED, attempt.getState());
        assertTrue(states(attempt).contains(AttemptState.LEG1_TIMED_OUT));
        assertEquals(LegState.TIMED_OUT, attempt.getLeg1().orElseThrow().getState());
        assertFalse(clock.instant().isBefore(T0.plusSeconds(3)));
        verify(exchange, times(1)).cancelOrder(exchangeOrder);
        verify(odds, never()).placeOrder(anyString(), any(), any(), any(), any());
    }

    @Test
    void testFillLandingAtCancelIsHedged() {
        // 1. Resting until the cancel, then the final read shows a full fill
        whenPlaced(exchange, exchangeOrder);
        whenPlaced(odds, oddsOrder);
        AtomicBoolean cancelled = new AtomicBoolean();
        when(exchange.getOrderStatus(exchangeOrder))
                .thenAnswer(inv -> cancelled.get() ? filled(TEN, "0.35") : OrderStatus.resting());
        doAnswer(inv -> {
            cancelled.set(true);
            return null;
        }).when(exchange).cancelOrder(exchangeOrder);
        when(odds.getOrderStatus(oddsOrder)).thenReturn(filled(TEN, null));

        // 2. Execute
        ExecutionAttempt attempt = coordinator.execute(Fixtures.opportunity(PAIR, 0.084, T0));

        // 3. Leg 2 still follows
        assertEquals(AttemptState.BOTH_FILLED, attempt.getState());
        verify(odds).placeOrder(anyString(), eq(Side.B), any(), eq(PriceFormat.AMERICAN), eq(TEN));
    }

    @Test
    void testLeg2SizedToLeg1PartialFill() {
        // 1. Leg 1 fills 8 of 10 and then stops
        BigDecimal eight = new BigDecimal("8");
        whenPlaced(exchange, exchangeOrder);
        whenPlaced(odds, oddsOrder);
        when(exchange.getOrderStatus(exchangeOrder)).thenReturn(OrderStatus.builder()
                .state(LegState.PARTIALLY_FILLED)
                .filledSize(eight)
                .averagePrice(new BigDecimal("0.35"))
                .build());
        when(odds.getOrderStatus(oddsOrder)).thenReturn(filled(eight, null));

        // 2. Execute
        ExecutionAttempt attempt = coordinator.execute(Fixtures.opportunity(PAIR, 0.084, T0));

        // 3. Leg 2 placed for exactly 8
        verify(odds).placeOrder(eq(Fixtures.EVENT_ID + ":h2h:" + Fixtures.AWAY), eq(Side.B),
                eq(new BigDecimal("122")), eq(PriceFormat.AMERICAN), eq(eight));
        assertTrue(states(attempt).contains(AttemptState.LEG1_PARTIAL_FILL));
        assertEquals(AttemptState.BOTH_FILLED, attempt.getState());
        assertEquals(0, attempt.leg1FilledSize().compareTo(eight));
        assertEquals(0, attempt.leg2FilledSize().compareTo(eight));
    }

    @Test
    void testLeg2RejectionIsNakedExposure() {
        // 1. Leg 1 fills, the bookmaker refuses the hedge
        whenPlaced(exchange, exchangeOrder);
        when(exchange.getOrderStatus(exchangeOrder)).thenReturn(filled(TEN, "0.35"));
        when(odds.placeOrder(anyString(), any(), any(), any(), any()))
                .thenThrow(new RejectedOrderException(BOOKMAKER, "stake limited"));

        // 2. Execute
        ExecutionAttempt attempt = coordinator.execute(Fixtures.opportunity(PAIR, 0.084, T0));

        // 3. One naked position and exactly one critical alert
        assertEquals(AttemptState.NAKED_EXPOSURE, attempt.getState());
        assertEquals(List.of(AttemptState.PLANNED, AttemptState.LEG1_SUBMITTED, AttemptState.LEG1_FILLED,
                AttemptState.LEG2_SUBMITTED, AttemptState.LEG2_REJECTED, AttemptState.NAKED_EXPOSURE), states(attempt));
        assertEquals(LegState.REJECTED, attempt.getLeg2().orElseThrow().getState());
        List<Position> positions = portfolio.positions();
        assertEquals(1, positions.size());
        assertEquals(Position.Status.NAKED, positions.get(0).getStatus());
        verify(alerts, times(1)).notify(eq(AlertSeverity.CRITICAL), anyString(), anyMap());
        assertFalse(coordinator.isInFlight(PAIR));
    }

    @Test
    void testLeg2TimeoutIsNakedExposure() {
        // 1. Leg 1 fills, the hedge rests without a fill
        whenPlaced(exchange, exchangeOrder);
        whenPlaced(odds, oddsOrder);
        when(exchange.getOrderStatus(exchangeOrder)).thenReturn(filled(TEN, "0.35"));
        when(odds.getOrderStatus(oddsOrder)).thenReturn(OrderStatus.resting());

        // 2. Execute; polling advances the clock past the 10s leg 2 timeout
        ExecutionAttempt attempt = coordinator.execute(Fixtures.opportunity(PAIR, 0.084, T0));

        // 3. Hedge cancelled, attempt naked, exactly one critical alert
        assertEquals(AttemptState.NAKED_EXPOSURE, attempt.getState());
        assertTrue(states(attempt).contains(AttemptState.LEG2_TIMED_OUT));
        assertEquals(LegState.TIMED_OUT, attempt.getLeg2().orElseThrow().getState());
        assertFalse(clock.instant().isBefore(T0.plusSeconds(10)));
        verify(odds, times(1)).cancelOrder(oddsOrder);
        verify(alerts, times(1)).notify(eq(AlertSeverity.CRITICAL), anyString(), anyMap());
        assertEquals(Position.Status.NAKED, portfolio.positions().get(0).getStatus());
    }

    @Test
    void testCancelWhileLeg1RestsAbandons() {
        // 1. Leg 1 rests; a cancel request arrives during the first poll pause
        whenPlaced(exchange, exchangeOrder);
        when(exchange.getOrderStatus(exchangeOrder)).thenReturn(OrderStatus.resting());
        AtomicReference<LeggingExecutionCoordinator> self = new AtomicReference<>();
        LeggingExecutionCoordinator cancelling = new LeggingExecutionCoordinator(venues, portfolio,
                RetryPolicy.none(), workers, clock, pause -> {
                    clock.advance(pause);
                    assertTrue(self.get().requestCancel(PAIR));
                }, ArbProperties.defaults().execution(), Duration.ofSeconds(2), 0.07);
        self.set(cancelling);

        // 2. Execute
        ExecutionAttempt attempt = cancelling.execute(Fixtures.opportunity(PAIR, 0.084, T0));

        // 3. Leg 1 cancelled before its timeout, no hedge placed
        assertEquals(AttemptState.ABANDONED, attempt.getState());
        assertEquals(LegState.CANCELLED, attempt.getLeg1().orElseThrow().getState());
        assertTrue(clock.instant().isBefore(T0.plusSeconds(3)));
        verify(exchange, times(1)).cancelOrder(exchangeOrder);
        verify(odds, never()).placeOrder(anyString(), any(), any(), any(), any());
        assertTrue(portfolio.positions().isEmpty());
        assertFalse(cancelling.requestCancel(PAIR));
    }

    @Test
    void testStaleOpportunityNeverReachesVenue() {
        Opportunity old = Fixtures.opportunity(PAIR, 0.084, T0);
        clock.advance(Duration.ofMillis(2_001));

        assertThrows(StaleDataException.class, () -> coordinator.execute(old));
        assertThrows(StaleDataException.class, () -> coordinator.submit(old));
        verify(exchange, never()).placeOrder(anyString(), any(), any(), any(), any());
        verify(odds, never()).placeOrder(anyString(), any(), any(), any(), any());
        assertFalse(coordinator.isInFlight(PAIR));
    }

    @Test
    void testOneAttemptPerPairInFlight() throws Exception {
        // 1. Leg 1 placement blocks until released
        CountDownLatch release = new CountDownLatch(1);
        when(exchange.placeOrder(anyString(), any(), any(), any(), any())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return exchangeOrder;
        });
        whenPlaced(odds, oddsOrder);
        when(exchange.getOrderStatus(exchangeOrder)).thenReturn(filled(TEN, "0.35"));
        when(odds.getOrderStatus(oddsOrder)).thenReturn(filled(TEN, null));

        // 2. Second submission for the same pair is refused while the first runs
        Optional<Future<ExecutionAttempt>> first = coordinator.submit(Fixtures.opportunity(PAIR, 0.084, T0));
        assertTrue(first.isPresent());
        assertTrue(coordinator.isInFlight(PAIR));
        assertTrue(coordinator.submit(Fixtures.opportunity(PAIR, 0.090, T0)).isEmpty());
        assertThrows(IllegalStateException.class, () -> coordinator.execute(Fixtures.opportunity(PAIR, 0.090, T0)));
        assertEquals(1, coordinator.openAttempts().size());

        // 3. Release; the pair frees up once terminal
        release.countDown();
        ExecutionAttempt attempt = first.get().get(5, TimeUnit.SECONDS);
        assertEquals(AttemptState.BOTH_FILLED, attempt.getState());
        assertFalse(coordinator.isInFlight(PAIR));
        verify(exchange, times(1)).placeOrder(anyString(), any(), any(), any(), any());
    }

    @Test
    void testRealizedEdgeSubtractsSlippage() {
        Opportunity o = Fixtures.opportunity(PAIR, 0.084, T0);
        LegResult leg1 = LegResult.builder()
                .plan(o.leg1())
                .state(LegState.FILLED)
                .filledSize(TEN)
                .averagePrice(new BigDecimal("0.36"))
                .build();
        LegResult leg2 = LegResult.builder()
                .plan(o.leg2())
                .state(LegState.FILLED)
                .filledSize(TEN)
                .averagePrice(new BigDecimal("122"))
                .build();

        double realized = coordinator.realizedEdge(o, leg1, leg2);

        double leg1Slippage = OddsConverter.exchangeCost(0.36, 0.07) - 0.365925;
        double leg2Slippage = OddsConverter.americanToImplied(new BigDecimal("122")) - 0.45;
        assertEquals(0.084 - leg1Slippage - leg2Slippage, realized, 1e-9);
        assertTrue(realized < 0.084);
    }

    private static void whenPlaced(TradingVenue venue, OrderHandle handle) {
        when(venue.placeOrder(anyString(), any(), any(), any(), any())).thenReturn(handle);
    }

    private static OrderStatus filled(BigDecimal size, String averagePrice) {
        return OrderStatus.builder()
                .state(LegState.FILLED)
                .filledSize(size)
                .averagePrice(averagePrice != null ? new BigDecimal(averagePrice) : null)
                .build();
    }

    private static List<AttemptState> states(ExecutionAttempt attempt) {
        return attempt.getHistory().stream().map(ExecutionAttempt.Transition::state).toList();
    }
}
