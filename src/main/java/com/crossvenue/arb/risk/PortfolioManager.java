package com.crossvenue.arb.risk;

import com.crossvenue.arb.core.OddsConverter;
import com.crossvenue.arb.domain.ExecutionAttempt;
import com.crossvenue.arb.domain.LegPlan;
import com.crossvenue.arb.domain.LegResult;
import com.crossvenue.arb.domain.LegState;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.Position;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.infra.AlertSeverity;
import com.crossvenue.arb.infra.AlertSink;
import com.crossvenue.arb.infra.JournalRecord;
import com.crossvenue.arb.infra.TradeJournal;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single writer of the {@link ExposureLedger}: reserves exposure for approved attempts,
 * books fills when attempts finish, realizes P&L on settlement or unwind and trips the kill
 * switch.
 */
@Slf4j
public class PortfolioManager {

    private final ExposureLedger ledger;
    private final RiskManager riskManager;
    private final ThrottleDetector throttleDetector;
    private final KillSwitch killSwitch;
    private final AlertSink alerts;
    private final TradeJournal journal;
    private final Clock clock;
    private final double exchangeTakerRate;

    public PortfolioManager(ExposureLedger ledger, RiskManager riskManager, ThrottleDetector throttleDetector,
                            KillSwitch killSwitch, AlertSink alerts, TradeJournal journal, Clock clock,
                            double exchangeTakerRate) {
        this.ledger = ledger;
        this.riskManager = riskManager;
        this.throttleDetector = throttleDetector;
        this.killSwitch = killSwitch;
        this.alerts = alerts;
        this.journal = journal;
        this.clock = clock;
        this.exchangeTakerRate = exchangeTakerRate;
    }

    /**
     * Evaluates the opportunity and, when approved, reserves its notional per venue in the same
     * critical section, so two concurrent approvals cannot both pass against stale numbers.
     */
    public RiskDecision checkAndReserve(Opportunity opportunity) {
        return ledger.locked(() -> {
            RiskDecision decision = riskManager.evaluate(opportunity, ledger.snapshot());
            if (decision.approved()) {
                Map<String, BigDecimal> amounts = new LinkedHashMap<>();
                for (LegPlan leg : opportunity.getPlan()) {
                    amounts.merge(leg.getVenueId(), leg.notional(), BigDecimal::add);
                }
                ledger.reserve(opportunity.getId(), amounts);
            } else {
                log.info("[RISK] Rejected {} on {}: {}", opportunity.getId(), opportunity.pairKey(), decision.violations());
            }
            return decision;
        });
    }

    /** Drops a reservation for an opportunity that never started executing. */
    public void releaseReservation(Opportunity opportunity) {
        ledger.release(opportunity.getId());
    }

    /**
     * Books a terminal attempt: releases its reservation, records actual fills at their achieved
     * prices and opens the resulting position. Naked exposure raises exactly one critical alert.
     */
    public Optional<Position> recordAttempt(ExecutionAttempt attempt) {
        if (!attempt.isTerminal()) {
            throw new IllegalStateException("Attempt " + attempt.getId() + " is not terminal: " + attempt.getState());
        }
        Opportunity opportunity = attempt.getOpportunity();
        Instant now = clock.instant();

        Optional<Position> position = ledger.locked(() -> {
            ledger.release(opportunity.getId());

            BigDecimal filled1 = attempt.leg1FilledSize();
            BigDecimal filled2 = attempt.leg2FilledSize();
            if (filled1.signum() <= 0) {
                return Optional.<Position>empty();
            }

            List<Position.Leg> legs = new ArrayList<>();
            legs.add(leg(attempt.getLeg1().orElseThrow(), filled1));
            if (filled2.signum() > 0) {
                legs.add(leg(attempt.getLeg2().orElseThrow(), filled2));
            }
            for (Position.Leg leg : legs) {
                ledger.bookFill(leg.getVenueId(), leg.notional(), now);
            }

            Position.Status status = switch (attempt.getState()) {
                case BOTH_FILLED -> Position.Status.HEDGED;
                case LEG2_PARTIAL_FILL -> Position.Status.RESIDUAL;
                default -> Position.Status.NAKED;
            };
            BigDecimal hedged = filled1.min(filled2);
            BigDecimal expected = BigDecimal.ZERO;
            if (legs.size() == 2) {
                BigDecimal margin = BigDecimal.ONE.subtract(legs.get(0).getCost()).subtract(legs.get(1).getCost());
                expected = hedged.multiply(margin).setScale(4, RoundingMode.HALF_UP);
                allocateUnrealized(legs, expected);
            }

            Position p = Position.builder()
                    .positionId(UUID.randomUUID().toString())
                    .attemptId(attempt.getId())
                    .pairKey(opportunity.pairKey())
                    .description(describe(opportunity))
                    .legs(legs)
                    .status(status)
                    .expectedPnl(expected)
                    .realizedPnl(BigDecimal.ZERO)
                    .openedAt(now)
                    .build();
            ledger.putPosition(p);
            return Optional.of(p);
        });

        trackHedgeRejection(attempt, now);
        position.ifPresent(p -> {
            if (p.getStatus() == Position.Status.NAKED) {
                raiseNaked(attempt, p);
            } else if (p.getStatus() == Position.Status.RESIDUAL) {
                log.warn("[RISK] Position {} partially hedged: {} of {} units unhedged on {}", p.getPositionId(),
                        attempt.leg1FilledSize().subtract(attempt.leg2FilledSize()), attempt.leg1FilledSize(),
                        opportunity.leg1().getVenueId());
            }
        });

        journal.append(JournalRecord.of(now, JournalRecord.ATTEMPT, attemptRecord(attempt, position.orElse(null))));
        return position;
    }

    /**
     * Realizes P&L when the event resolves.
     */
    public Position settle(String positionId, Side winningSide) {
        Instant now = clock.instant();
        Position settled = ledger.locked(() -> {
            Position p = openPosition(positionId);
            BigDecimal realized = BigDecimal.ZERO;
            for (Position.Leg leg : p.getLegs()) {
                BigDecimal payoff = leg.payoff(winningSide);
                ledger.realize(leg.getVenueId(), leg.notional(), payoff);
                realized = realized.add(payoff);
            }
            clearUnrealized(p);
            p.setRealizedPnl(p.getRealizedPnl().add(realized));
            p.setStatus(Position.Status.SETTLED);
            p.setClosedAt(now);
            return p;
        });
        log.info("[RISK] Settled {} ({}) winner={} realized={}", positionId, settled.getDescription(), winningSide,
                settled.getRealizedPnl());
        journal.append(JournalRecord.of(now, JournalRecord.SETTLEMENT, Map.of(
                "positionId", positionId,
                "winner", winningSide.name(),
                "realizedPnl", settled.getRealizedPnl())));
        evaluateKillSwitch();
        return settled;
    }

    /**
     * Closes a position whose event was voided (cancelled, postponed or pushed). Every leg's
     * stake comes back, so exposure is released with no P&L.
     */
    public Position settleVoid(String positionId) {
        Instant now = clock.instant();
        Position voided = ledger.locked(() -> {
            Position p = openPosition(positionId);
            for (Position.Leg leg : p.getLegs()) {
                ledger.realize(leg.getVenueId(), leg.notional(), BigDecimal.ZERO);
            }
            clearUnrealized(p);
            p.setStatus(Position.Status.VOID);
            p.setClosedAt(now);
            return p;
        });
        log.info("[RISK] Voided {} ({}), stakes returned", positionId, voided.getDescription());
        journal.append(JournalRecord.of(now, JournalRecord.SETTLEMENT, Map.of(
                "positionId", positionId,
                "result", "VOID",
                "realizedPnl", voided.getRealizedPnl())));
        return voided;
    }

    /**
     * Closes the unhedged part of a NAKED or RESIDUAL position by selling it back at
     * {@code exitPrice} (probability per unit). A residual position keeps its hedged part open.
     */
    public Position recordUnwind(String positionId, BigDecimal exitPrice) {
        Instant now = clock.instant();
        Position unwound = ledger.locked(() -> {
            Position p = openPosition(positionId);
            if (!p.isUnhedged()) {
                throw new IllegalStateException("Position " + positionId + " has no unhedged exposure");
            }
            Position.Leg first = p.getLegs().get(0);
            BigDecimal hedgedSize = p.getLegs().size() > 1 ? p.getLegs().get(1).getSize() : BigDecimal.ZERO;
            BigDecimal excess = first.getSize().subtract(hedgedSize);
            BigDecimal releasedNotional = excess.multiply(first.getCost());
            BigDecimal realized = excess.multiply(exitPrice.subtract(first.getCost()));

            ledger.realize(first.getVenueId(), releasedNotional, realized);
            p.setRealizedPnl(p.getRealizedPnl().add(realized));
            if (hedgedSize.signum() > 0) {
                first.setSize(hedgedSize);
                p.setStatus(Position.Status.HEDGED);
            } else {
                clearUnrealized(p);
                p.setStatus(Position.Status.UNWOUND);
                p.setClosedAt(now);
            }
            return p;
        });
        log.warn("[RISK] Unwound {} at {} realized={} status={}", positionId, exitPrice, unwound.getRealizedPnl(),
                unwound.getStatus());
        journal.append(JournalRecord.of(now, JournalRecord.SETTLEMENT, Map.of(
                "positionId", positionId,
                "unwindPrice", exitPrice,
                "realizedPnl", unwound.getRealizedPnl(),
                "status", unwound.getStatus().name())));
        evaluateKillSwitch();
        return unwound;
    }

    /** Halts trading when a loss limit is breached. Returns true when the switch tripped now. */
    public boolean evaluateKillSwitch() {
        Optional<String> reason = ledger.locked(() -> {
            if (ledger.isHalted()) {
                return Optional.<String>empty();
            }
            Optional<String> trip = killSwitch.evaluate(ledger.snapshot());
            trip.ifPresent(ledger::halt);
            return trip;
        });
        reason.ifPresent(r -> {
            log.error("[RISK] KILL SWITCH ENGAGED: {}", r);
            alerts.notify(AlertSeverity.CRITICAL, "Kill switch engaged: " + r, Map.of());
            journal.append(JournalRecord.of(clock.instant(), JournalRecord.KILL_SWITCH, Map.of("action", "HALT", "reason", r)));
        });
        return reason.isPresent();
    }

    public void resetKillSwitch() {
        ledger.resume();
        log.warn("[RISK] Kill switch reset by operator");
        journal.append(JournalRecord.of(clock.instant(), JournalRecord.KILL_SWITCH, Map.of("action", "RESET")));
    }

    public void clearThrottle(String venueId) {
        throttleDetector.clear(venueId);
        ledger.setThrottled(venueId, false);
        log.info("[RISK] Throttle flag cleared for {}", venueId);
    }

    public boolean isHalted() {
        return ledger.isHalted();
    }

    public ExposureSnapshot snapshot() {
        return ledger.snapshot();
    }

    public List<Position> positions() {
        return ledger.positions();
    }

    private void trackHedgeRejection(ExecutionAttempt attempt, Instant now) {
        attempt.getLeg2()
                .filter(r -> r.getState() == LegState.REJECTED)
                .ifPresent(r -> {
                    String venue = r.getPlan().getVenueId();
                    if (throttleDetector.recordRejection(venue, now)) {
                        ledger.setThrottled(venue, true);
                    }
                });
    }

    private void raiseNaked(ExecutionAttempt attempt, Position position) {
        Opportunity opportunity = attempt.getOpportunity();
        LegPlan leg1 = opportunity.leg1();
        String reason = attempt.getLeg2().map(r -> r.getState() + (r.getMessage() != null ? " (" + r.getMessage() + ")" : ""))
                .orElse("hedge never submitted");
        log.error("[RISK] NAKED EXPOSURE attempt={} position={} {} x{} at {} unhedged: {}", attempt.getId(),
                position.getPositionId(), leg1.getInstrumentId(), attempt.leg1FilledSize(), leg1.getVenueId(), reason);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("attemptId", attempt.getId());
        context.put("positionId", position.getPositionId());
        context.put("pair", opportunity.pairKey());
        context.put("venue", leg1.getVenueId());
        context.put("instrument", leg1.getInstrumentId());
        context.put("side", leg1.getSide());
        context.put("unhedgedSize", attempt.leg1FilledSize());
        context.put("hedgeVenue", opportunity.leg2().getVenueId());
        context.put("reason", reason);
        alerts.notify(AlertSeverity.CRITICAL, "Naked exposure: hedge leg failed after leg 1 filled", context);
    }

    private Position openPosition(String positionId) {
        Position p = ledger.position(positionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown position " + positionId));
        if (!p.isOpen()) {
            throw new IllegalStateException("Position " + positionId + " is already " + p.getStatus());
        }
        return p;
    }

    private void allocateUnrealized(List<Position.Leg> legs, BigDecimal expected) {
        BigDecimal total = legs.stream().map(Position.Leg::notional).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.signum() == 0) {
            return;
        }
        for (Position.Leg leg : legs) {
            ledger.adjustUnrealized(leg.getVenueId(),
                    expected.multiply(leg.notional()).divide(total, 4, RoundingMode.HALF_UP));
        }
    }

    private void clearUnrealized(Position p) {
        if (p.getExpectedPnl() != null && p.getExpectedPnl().signum() != 0) {
            allocateUnrealized(p.getLegs(), p.getExpectedPnl().negate());
        }
    }

    private Position.Leg leg(LegResult result, BigDecimal filled) {
        LegPlan plan = result.getPlan();
        BigDecimal cost = BigDecimal.valueOf(OddsConverter.achievedCost(result, exchangeTakerRate));
        return Position.Leg.builder()
                .venueId(plan.getVenueId())
                .instrumentId(plan.getInstrumentId())
                .side(plan.getSide())
                .size(filled)
                .cost(cost)
                .build();
    }

    private static String describe(Opportunity opportunity) {
        return opportunity.getPair().getInstrument().getTitle() + " " + opportunity.getDirection();
    }

    private static Map<String, Object> attemptRecord(ExecutionAttempt attempt, Position position) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attemptId", attempt.getId());
        data.put("opportunityId", attempt.getOpportunity().getId());
        data.put("pair", attempt.getOpportunity().pairKey());
        data.put("state", attempt.getState().name());
        data.put("success", attempt.getState().isSuccess());
        data.put("leg1Filled", attempt.leg1FilledSize());
        data.put("leg2Filled", attempt.leg2FilledSize());
        attempt.getRealizedEdge().ifPresent(e -> data.put("realizedEdge", e));
        if (position != null) {
            data.put("positionId", position.getPositionId());
            data.put("positionStatus", position.getStatus().name());
        }
        return data;
    }
}
