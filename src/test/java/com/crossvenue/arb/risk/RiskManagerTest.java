package com.crossvenue.arb.risk;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.crossvenue.arb.support.Fixtures.BOOKMAKER;
import static com.crossvenue.arb.support.Fixtures.EXCHANGE;
import static org.junit.jupiter.api.Assertions.*;

class RiskManagerTest {

    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    private final RiskManager riskManager = new RiskManager(ArbProperties.defaults().risk());

    @Test
    void testWorstCaseLossBreachingDailyLimitIsRejected() {
        // 1. Down 48 on the day with a 50 limit
        ExposureSnapshot exposure = snapshot(new BigDecimal("-48")).build();

        // 2. Leg 1 notional (worst case) is 10 x 0.50 = 5
        Opportunity o = withLeg1Cost(Fixtures.opportunity("KX-A", 0.06, NOW), 0.50);
        assertEquals(0, o.worstCaseLoss().compareTo(new BigDecimal("5")));

        // 3. Rejected for the daily loss limit only
        RiskDecision decision = riskManager.evaluate(o, exposure);
        assertFalse(decision.approved());
        assertTrue(decision.hasViolation(RiskViolation.Type.DAILY_LOSS_LIMIT));
        assertEquals(1, decision.violations().size());
    }

    @Test
    void testWithinLimitsIsApproved() {
        ExposureSnapshot exposure = snapshot(new BigDecimal("-40")).build();
        Opportunity o = withLeg1Cost(Fixtures.opportunity("KX-A", 0.06, NOW), 0.50);

        RiskDecision decision = riskManager.evaluate(o, exposure);

        assertTrue(decision.approved());
        assertTrue(decision.violations().isEmpty());
    }

    @Test
    void testHaltShortCircuits() {
        ExposureSnapshot exposure = snapshot(BigDecimal.ZERO).halted(true).haltReason("daily loss").build();

        RiskDecision decision = riskManager.evaluate(Fixtures.opportunity("KX-A", 0.06, new BigDecimal("1"), NOW), exposure);

        assertEquals(List.of(RiskViolation.Type.KILL_SWITCH), types(decision));
    }

    @Test
    void testPerBetCapAndMinimumSize() {
        ExposureSnapshot exposure = snapshot(BigDecimal.ZERO).build();

        RiskDecision tooBig = riskManager.evaluate(Fixtures.opportunity("KX-A", 0.06, new BigDecimal("100"), NOW), exposure);
        RiskDecision tooSmall = riskManager.evaluate(Fixtures.opportunity("KX-A", 0.06, new BigDecimal("1"), NOW), exposure);

        assertTrue(tooBig.hasViolation(RiskViolation.Type.PER_BET_CAP));
        assertEquals(List.of(EXCHANGE, BOOKMAKER), tooBig.violations().stream()
                .filter(v -> v.type() == RiskViolation.Type.PER_BET_CAP)
                .map(RiskViolation::venueId)
                .toList());
        assertEquals(List.of(RiskViolation.Type.BELOW_MIN_SIZE), types(tooSmall));
    }

    @Test
    void testThrottledVenueAndGlobalCap() {
        ExposureSnapshot exposure = snapshot(BigDecimal.ZERO)
                .totalOpenExposure(new BigDecimal("295"))
                .venue(BOOKMAKER, view(BOOKMAKER, BigDecimal.ZERO, true))
                .build();

        RiskDecision decision = riskManager.evaluate(Fixtures.opportunity("KX-A", 0.06, NOW), exposure);

        assertTrue(decision.hasViolation(RiskViolation.Type.VENUE_THROTTLED));
        assertTrue(decision.hasViolation(RiskViolation.Type.GLOBAL_EXPOSURE_CAP));
    }

    @Test
    void testDailyVolumeCapCountsReservations() {
        ExposureSnapshot exposure = snapshot(BigDecimal.ZERO)
                .venue(EXCHANGE, view(EXCHANGE, new BigDecimal("498"), false))
                .build();

        RiskDecision decision = riskManager.evaluate(Fixtures.opportunity("KX-A", 0.06, NOW), exposure);

        assertEquals(List.of(RiskViolation.Type.DAILY_VOLUME_CAP), types(decision));
    }

    @Test
    void testPerVenueCapIsClampedToHardLimit() {
        ArbProperties.Risk limits = new ArbProperties.Risk(null, null, null, null, null, null, null, null, null, null,
                Map.of(BOOKMAKER, new ArbProperties.VenueLimits(new BigDecimal("80"), new BigDecimal("1000"))));

        assertEquals(0, limits.perBetCapFor(BOOKMAKER).compareTo(ArbProperties.MAX_SINGLE_LEG));
        assertEquals(0, limits.perBetCapFor(EXCHANGE).compareTo(new BigDecimal("25")));
        assertEquals(0, limits.dailyVolumeCapFor(BOOKMAKER).compareTo(new BigDecimal("1000")));
    }

    @Test
    void testRemainingCapacity() {
        ExposureSnapshot exposure = snapshot(BigDecimal.ZERO)
                .venue(EXCHANGE, view(EXCHANGE, new BigDecimal("490"), false))
                .venue(BOOKMAKER, view(BOOKMAKER, BigDecimal.ZERO, true))
                .build();

        assertEquals(0, riskManager.remainingCapacity(EXCHANGE, exposure).compareTo(new BigDecimal("10")));
        assertEquals(0, riskManager.remainingCapacity("fanduel", exposure).compareTo(new BigDecimal("25")));
        assertEquals(0, riskManager.remainingCapacity(BOOKMAKER, exposure).signum());

        ExposureSnapshot halted = snapshot(BigDecimal.ZERO).halted(true).build();
        assertEquals(0, riskManager.capacity(halted).remaining("fanduel").signum());
    }

    private static Opportunity withLeg1Cost(Opportunity o, double cost) {
        return o.toBuilder()
                .plan(List.of(o.leg1().toBuilder().probabilityCost(cost).build(), o.leg2()))
                .build();
    }

    private static List<RiskViolation.Type> types(RiskDecision decision) {
        return decision.violations().stream().map(RiskViolation::type).toList();
    }

    static ExposureSnapshot.ExposureSnapshotBuilder snapshot(BigDecimal dailyPnl) {
        return ExposureSnapshot.builder()
                .takenAt(NOW)
                .totalOpenExposure(BigDecimal.ZERO)
                .totalReserved(BigDecimal.ZERO)
                .dailyRealizedPnl(dailyPnl)
                .cumulativeRealizedPnl(dailyPnl)
                .highWaterMark(BigDecimal.ZERO)
                .unrealizedPnl(BigDecimal.ZERO);
    }

    static ExposureSnapshot.VenueView view(String venueId, BigDecimal dailyVolume, boolean throttled) {
        return ExposureSnapshot.VenueView.builder()
                .venueId(venueId)
                .openExposure(BigDecimal.ZERO)
                .dailyVolume(dailyVolume)
                .dailyRealizedPnl(BigDecimal.ZERO)
                .unrealizedPnl(BigDecimal.ZERO)
                .reserved(BigDecimal.ZERO)
                .throttled(throttled)
                .build();
    }
}
