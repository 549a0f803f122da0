package com.crossvenue.arb.risk;

import com.crossvenue.arb.config.ArbProperties;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VenueRotationTest {

    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    @Test
    void testMostHeadroomFirst() {
        VenueRotation rotation = new VenueRotation(ArbProperties.defaults().risk());
        ExposureSnapshot exposure = RiskManagerTest.snapshot(BigDecimal.ZERO)
                .venue("draftkings", view("draftkings", "300", null))
                .venue("fanduel", view("fanduel", "100", null))
                .build();

        assertEquals(List.of("betmgm", "fanduel", "draftkings"),
                rotation.rank(List.of("draftkings", "fanduel", "betmgm"), exposure));
    }

    @Test
    void testLeastRecentlyUsedBreaksTie() {
        VenueRotation rotation = new VenueRotation(ArbProperties.defaults().risk());
        ExposureSnapshot exposure = RiskManagerTest.snapshot(BigDecimal.ZERO)
                .venue("draftkings", view("draftkings", "0", NOW))
                .venue("fanduel", view("fanduel", "0", NOW.minusSeconds(600)))
                .build();

        assertEquals(List.of("fanduel", "draftkings"), rotation.rank(List.of("draftkings", "fanduel"), exposure));
    }

    @Test
    void testHigherPerBetCapBreaksRemainingTie() {
        ArbProperties.Risk limits = new ArbProperties.Risk(null, null, null, null, null, null, null, null, null, null,
                Map.of("fanduel", new ArbProperties.VenueLimits(new BigDecimal("40"), null)));
        VenueRotation rotation = new VenueRotation(limits);
        ExposureSnapshot exposure = RiskManagerTest.snapshot(BigDecimal.ZERO).build();

        assertEquals(List.of("fanduel", "draftkings"),
                rotation.rank(List.of("draftkings", "fanduel", "draftkings"), exposure));
    }

    @Test
    void testPerBetCapBoundedByHeadroomFallsBackToName() {
        // 1. fanduel allows 40 per bet, draftkings 25, but both have only 10 left today
        ArbProperties.Risk limits = new ArbProperties.Risk(null, null, null, null, null, null, null, null, null, null,
                Map.of("fanduel", new ArbProperties.VenueLimits(new BigDecimal("40"), null),
                        "draftkings", new ArbProperties.VenueLimits(new BigDecimal("25"), null)));
        VenueRotation rotation = new VenueRotation(limits);
        ExposureSnapshot exposure = RiskManagerTest.snapshot(BigDecimal.ZERO)
                .venue("draftkings", view("draftkings", "490", NOW))
                .venue("fanduel", view("fanduel", "490", NOW))
                .build();

        // 2. Remaining per-bet capacity ties at 10, so the name decides
        assertEquals(0, rotation.remainingPerBet("fanduel", exposure).compareTo(BigDecimal.TEN));
        assertEquals(List.of("draftkings", "fanduel"), rotation.rank(List.of("fanduel", "draftkings"), exposure));
    }

    private static ExposureSnapshot.VenueView view(String venueId, String dailyVolume, Instant lastActivity) {
        return ExposureSnapshot.VenueView.builder()
                .venueId(venueId)
                .openExposure(BigDecimal.ZERO)
                .dailyVolume(new BigDecimal(dailyVolume))
                .dailyRealizedPnl(BigDecimal.ZERO)
                .unrealizedPnl(BigDecimal.ZERO)
                .reserved(BigDecimal.ZERO)
                .lastActivity(lastActivity)
                .build();
    }
}
