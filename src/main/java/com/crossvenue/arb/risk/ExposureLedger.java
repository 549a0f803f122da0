package com.crossvenue.arb.risk;

import com.crossvenue.arb.domain.Position;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutable exposure state. Every read and write happens under one lock; daily counters roll
 * over lazily on the first access after the trading-day boundary.
 * <p>
 * Written only by {@link PortfolioManager}; everyone else reads {@link #snapshot()}.
 */
@Slf4j
public class ExposureLedger {

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final ZoneId zone;

    private final Map<String, VenueExposure> venues = new HashMap<>();
    private final Map<String, Map<String, BigDecimal>> reservations = new HashMap<>();
    private final Map<String, Position> positions = new LinkedHashMap<>();

    private LocalDate tradingDay;
    private BigDecimal cumulativeRealizedPnl = BigDecimal.ZERO;
    private BigDecimal highWaterMark = BigDecimal.ZERO;
    private boolean halted;
    private String haltReason;

    public ExposureLedger(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
        this.tradingDay = LocalDate.now(clock.withZone(zone));
    }

    private static final class VenueExposure {
        BigDecimal openExposure = BigDecimal.ZERO;
        BigDecimal dailyVolume = BigDecimal.ZERO;
        BigDecimal dailyRealizedPnl = BigDecimal.ZERO;
        BigDecimal unrealizedPnl = BigDecimal.ZERO;
        BigDecimal reserved = BigDecimal.ZERO;
        Instant lastActivity;
        boolean throttled;
    }

    /** Runs {@code action} atomically with respect to every other ledger access. */
    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            rollIfNewDay();
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public ExposureSnapshot snapshot() {
        return locked(() -> {
            ExposureSnapshot.ExposureSnapshotBuilder builder = ExposureSnapshot.builder()
                    .takenAt(clock.instant())
                    .tradingDay(tradingDay)
                    .cumulativeRealizedPnl(cumulativeRealizedPnl)
                    .highWaterMark(highWaterMark)
                    .halted(halted)
                    .haltReason(haltReason);

            BigDecimal open = BigDecimal.ZERO;
            BigDecimal reserved = BigDecimal.ZERO;
            BigDecimal daily = BigDecimal.ZERO;
            BigDecimal unrealized = BigDecimal.ZERO;
            for (Map.Entry<String, VenueExposure> e : venues.entrySet()) {
                VenueExposure v = e.getValue();
                builder.venue(e.getKey(), ExposureSnapshot.VenueView.builder()
                        .venueId(e.getKey())
                        .openExposure(v.openExposure)
                        .dailyVolume(v.dailyVolume)
                        .dailyRealizedPnl(v.dailyRealizedPnl)
                        .unrealizedPnl(v.unrealizedPnl)
                        .reserved(v.reserved)
                        .lastActivity(v.lastActivity)
                        .throttled(v.throttled)
                        .build());
                open = open.add(v.openExposure);
                reserved = reserved.add(v.reserved);
                daily = daily.add(v.dailyRealizedPnl);
                unrealized = unrealized.add(v.unrealizedPnl);
            }
            for (Position p : positions.values()) {
                if (p.isOpen()) {
                    builder.openPosition(copy(p));
                }
            }
            return builder
                    .totalOpenExposure(open)
                    .totalReserved(reserved)
                    .dailyRealizedPnl(daily)
                    .unrealizedPnl(unrealized)
                    .build();
        });
    }

    // --- writes, called by PortfolioManager ---

    void reserve(String key, Map<String, BigDecimal> amountsByVenue) {
        locked(() -> {
            if (reservations.containsKey(key)) {
                throw new IllegalStateException("Reservation already held for " + key);
            }
            reservations.put(key, Map.copyOf(amountsByVenue));
            amountsByVenue.forEach((venue, amount) -> venue(venue).reserved = venue(venue).reserved.add(amount));
            return null;
        });
    }

    boolean release(String key) {
        return locked(() -> {
            Map<String, BigDecimal> held = reservations.remove(key);
            if (held == null) {
                return false;
            }
            held.forEach((venue, amount) -> {
                VenueExposure v = venue(venue);
                v.reserved = v.reserved.subtract(amount).max(BigDecimal.ZERO);
            });
            return true;
        });
    }

    void bookFill(String venueId, BigDecimal notional, Instant at) {
        locked(() -> {
            VenueExposure v = venue(venueId);
            v.openExposure = v.openExposure.add(notional);
            v.dailyVolume = v.dailyVolume.add(notional);
            v.lastActivity = at;
            return null;
        });
    }

    void adjustUnrealized(String venueId, BigDecimal delta) {
        locked(() -> {
            VenueExposure v = venue(venueId);
            v.unrealizedPnl = v.unrealizedPnl.add(delta);
            return null;
        });
    }

    /** Moves a leg from open exposure to realized P&L. */
    void realize(String venueId, BigDecimal releasedNotional, BigDecimal pnl) {
        locked(() -> {
            VenueExposure v = venue(venueId);
            v.openExposure = v.openExposure.subtract(releasedNotional).max(BigDecimal.ZERO);
            v.dailyRealizedPnl = v.dailyRealizedPnl.add(pnl);
            cumulativeRealizedPnl = cumulativeRealizedPnl.add(pnl);
            if (cumulativeRealizedPnl.compareTo(highWaterMark) > 0) {
                highWaterMark = cumulativeRealizedPnl;
            }
            return null;
        });
    }

    void putPosition(Position position) {
        locked(() -> positions.put(position.getPositionId(), position));
    }

    Optional<Position> position(String positionId) {
        return locked(() -> Optional.ofNullable(positions.get(positionId)));
    }

    List<Position> positions() {
        return locked(() -> new ArrayList<>(positions.values()));
    }

    void setThrottled(String venueId, boolean throttled) {
        locked(() -> {
            venue(venueId).throttled = throttled;
            return null;
        });
    }

    void halt(String reason) {
        locked(() -> {
            halted = true;
            haltReason = reason;
            return null;
        });
    }

    /** Clears the halt and restarts drawdown measurement from the current P&L. */
    void resume() {
        locked(() -> {
            halted = false;
            haltReason = null;
            highWaterMark = cumulativeRealizedPnl;
            return null;
        });
    }

    public boolean isHalted() {
        return locked(() -> halted);
    }

    private VenueExposure venue(String venueId) {
        return venues.computeIfAbsent(venueId, k -> new VenueExposure());
    }

    private void rollIfNewDay() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        if (!today.equals(tradingDay)) {
            log.info("[RISK] Trading day rolled {} -> {}, resetting daily volume and P&L", tradingDay, today);
            for (VenueExposure v : venues.values()) {
                v.dailyVolume = BigDecimal.ZERO;
                v.dailyRealizedPnl = BigDecimal.ZERO;
            }
            tradingDay = today;
        }
    }

    private static Position copy(Position p) {
        List<Position.Leg> legs = new ArrayList<>();
        for (Position.Leg leg : p.getLegs()) {
            legs.add(Position.Leg.builder()
                    .venueId(leg.getVenueId())
                    .instrumentId(leg.getInstrumentId())
                    .side(leg.getSide())
                    .size(leg.getSize())
                    .cost(leg.getCost())
                    .build());
        }
        return Position.builder()
                .positionId(p.getPositionId())
                .attemptId(p.getAttemptId())
                .pairKey(p.getPairKey())
                .description(p.getDescription())
                .legs(legs)
                .status(p.getStatus())
                .expectedPnl(p.getExpectedPnl())
                .realizedPnl(p.getRealizedPnl())
                .openedAt(p.getOpenedAt())
                .closedAt(p.getClosedAt())
                .build();
    }
}
