package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.AttemptState;
import com.crossvenue.arb.domain.ExecutionAttempt;
import com.crossvenue.arb.domain.LegPlan;
import com.crossvenue.arb.domain.LegResult;
import com.crossvenue.arb.domain.LegState;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.OrderHandle;
import com.crossvenue.arb.domain.OrderStatus;
import com.crossvenue.arb.exception.NakedExposureException;
import com.crossvenue.arb.exception.RejectedOrderException;
import com.crossvenue.arb.exception.StaleDataException;
import com.crossvenue.arb.exception.VenueException;
import com.crossvenue.arb.infra.RetryPolicy;
import com.crossvenue.arb.infra.TradingVenue;
import com.crossvenue.arb.infra.VenueRegistry;
import com.crossvenue.arb.risk.PortfolioManager;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives an {@link Opportunity} through the two-leg protocol.
 * <p>
 * Leg 1 is placed and polled until it fills, is rejected or times out (then it is cancelled
 * and its final fill re-read). Only a filled amount moves on: leg 2 is sized to exactly what
 * leg 1 filled. If leg 2 then fails the attempt ends in {@link AttemptState#NAKED_EXPOSURE}.
 * Every terminal attempt is handed to the {@link PortfolioManager}. At most one attempt per
 * pair key is in flight; independent pairs run concurrently on the worker pool.
 */
@Slf4j
public class LeggingExecutionCoordinator {

    private final VenueRegistry venues;
    private final PortfolioManager portfolio;
    private final RetryPolicy retryPolicy;
    private final ExecutorService workers;
    private final Clock clock;
    private final RetryPolicy.Sleeper sleeper;
    private final Duration leg1Timeout;
    private final Duration leg2Timeout;
    private final Duration pollInterval;
    private final Duration staleness;
    private final double exchangeTakerRate;

    private final ConcurrentHashMap<String, ExecutionAttempt> inFlight = new ConcurrentHashMap<>();

    public LeggingExecutionCoordinator(VenueRegistry venues, PortfolioManager portfolio, RetryPolicy retryPolicy,
                                       ExecutorService workers, Clock clock, RetryPolicy.Sleeper sleeper,
                                       ArbProperties.Execution execution, Duration staleness, double exchangeTakerRate) {
        this.venues = venues;
        this.portfolio = portfolio;
        this.retryPolicy = retryPolicy;
        this.workers = workers;
        this.clock = clock;
        this.sleeper = sleeper;
        this.leg1Timeout = execution.leg1Timeout();
        this.leg2Timeout = execution.leg2Timeout();
        this.pollInterval = execution.pollInterval();
        this.staleness = staleness;
        this.exchangeTakerRate = exchangeTakerRate;
    }

    /**
     * Starts the attempt on the worker pool.
     *
     * @return empty when the pair already has an attempt in flight or the pool refused the task
     * @throws StaleDataException when the opportunity is older than the staleness bound
     */
    public Optional<Future<ExecutionAttempt>> submit(Opportunity opportunity) {
        ExecutionAttempt attempt = claim(opportunity);
        if (attempt == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(workers.submit(() -> runClaimed(attempt)));
        } catch (RejectedExecutionException e) {
            inFlight.remove(opportunity.pairKey(), attempt);
            log.warn("[EXECUTION] Worker pool refused {}: {}", opportunity.pairKey(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Runs the attempt on the calling thread.
     *
     * @throws IllegalStateException when the pair already has an attempt in flight
     */
    public ExecutionAttempt execute(Opportunity opportunity) {
        ExecutionAttempt attempt = claim(opportunity);
        if (attempt == null) {
            throw new IllegalStateException("Attempt already in flight for " + opportunity.pairKey());
        }
        return runClaimed(attempt);
    }

    public boolean isInFlight(String pairKey) {
        return inFlight.containsKey(pairKey);
    }

    public Collection<ExecutionAttempt> openAttempts() {
        return List.copyOf(inFlight.values());
    }

    /**
     * Requests cancellation of the in-flight attempt for a pair. Honoured only while leg 1 has no
     * fill: a resting leg 1 order is cancelled and the attempt abandoned.
     */
    public boolean requestCancel(String pairKey) {
        ExecutionAttempt attempt = inFlight.get(pairKey);
        if (attempt == null) {
            return false;
        }
        attempt.requestCancel();
        return true;
    }

    private ExecutionAttempt claim(Opportunity opportunity) {
        Instant now = clock.instant();
        if (opportunity.isStale(now, staleness)) {
            throw new StaleDataException("opportunity " + opportunity.getId(), opportunity.age(now), staleness);
        }
        ExecutionAttempt attempt = new ExecutionAttempt(opportunity, now);
        if (inFlight.putIfAbsent(opportunity.pairKey(), attempt) != null) {
            log.debug("[EXECUTION] {} already has an attempt in flight", opportunity.pairKey());
            return null;
        }
        return attempt;
    }

    private ExecutionAttempt runClaimed(ExecutionAttempt attempt) {
        try {
            try {
                run(attempt);
            } catch (NakedExposureException e) {
                log.error("[EXECUTION] {}", e.getMessage());
            } catch (RuntimeException e) {
                log.error("[EXECUTION] Unexpected failure in attempt {}", attempt.getId(), e);
                if (!attempt.isTerminal()) {
                    attempt.transition(attempt.leg1FilledSize().signum() > 0
                            ? AttemptState.NAKED_EXPOSURE : AttemptState.ABANDONED, clock.instant());
                }
            }
            portfolio.recordAttempt(attempt);
            return attempt;
        } finally {
            inFlight.remove(attempt.getOpportunity().pairKey(), attempt);
        }
    }

    private void run(ExecutionAttempt attempt) {
        Opportunity opportunity = attempt.getOpportunity();
        LegPlan plan1 = opportunity.leg1();
        log.info("[EXECUTION] Attempt {} on {}: leg 1 {} {} x{} @ {} on {}", attempt.getId(), opportunity.pairKey(),
                plan1.getSide(), plan1.getInstrumentId(), plan1.getTargetSize(), plan1.getTargetPrice(), plan1.getVenueId());

        if (attempt.isCancelRequested()) {
            attempt.recordLeg1(LegResult.notFilled(plan1, LegState.CANCELLED, null, "cancelled before submission", clock.instant()));
            attempt.transition(AttemptState.ABANDONED, clock.instant());
            return;
        }

        attempt.transition(AttemptState.LEG1_SUBMITTED, clock.instant());
        LegResult leg1 = runLeg(plan1, leg1Timeout, attempt);
        attempt.recordLeg1(leg1);

        if (!leg1.hasFill()) {
            if (leg1.getState() == LegState.REJECTED) {
                attempt.transition(AttemptState.LEG1_REJECTED, clock.instant());
            } else if (leg1.getState() == LegState.TIMED_OUT) {
                attempt.transition(AttemptState.LEG1_TIMED_OUT, clock.instant());
            }
            attempt.transition(AttemptState.ABANDONED, clock.instant());
            log.info("[EXECUTION] Attempt {} abandoned, leg 1 {} ({})", attempt.getId(), leg1.getState(), leg1.getMessage());
            return;
        }

        attempt.transition(leg1.getState() == LegState.FILLED
                ? AttemptState.LEG1_FILLED : AttemptState.LEG1_PARTIAL_FILL, clock.instant());

        LegPlan plan2 = opportunity.leg2().withSize(leg1.getFilledSize());
        attempt.transition(AttemptState.LEG2_SUBMITTED, clock.instant());
        LegResult leg2 = runLeg(plan2, leg2Timeout, null);
        attempt.recordLeg2(leg2);

        if (!leg2.hasFill()) {
            if (leg2.getState() == LegState.REJECTED) {
                attempt.transition(AttemptState.LEG2_REJECTED, clock.instant());
            } else if (leg2.getState() == LegState.TIMED_OUT) {
                attempt.transition(AttemptState.LEG2_TIMED_OUT, clock.instant());
            }
            attempt.transition(AttemptState.NAKED_EXPOSURE, clock.instant());
            throw new NakedExposureException(attempt.getId(), plan1.getVenueId(), plan1.getInstrumentId(),
                    leg1.getFilledSize(), "leg 2 " + leg2.getState() + ": " + leg2.getMessage());
        }

        attempt.recordRealizedEdge(realizedEdge(opportunity, leg1, leg2));
        boolean complete = leg2.getFilledSize().compareTo(plan2.getTargetSize()) >= 0;
        attempt.transition(complete ? AttemptState.BOTH_FILLED : AttemptState.LEG2_PARTIAL_FILL, clock.instant());
        log.info("[EXECUTION] Attempt {} {}: {} / {} hedged, realized edge {}", attempt.getId(), attempt.getState(),
                leg2.getFilledSize(), leg1.getFilledSize(), attempt.getRealizedEdge().map(e -> String.format("%.4f", e)).orElse("n/a"));
    }

    /**
     * Places one leg and polls until a terminal venue state, the target fill or the deadline.
     * On the deadline the order is cancelled and its final status re-read, since fills can land
     * between the last poll and the cancel. {@code cancellable} is the attempt whose cancel
     * request may stop the leg, or null.
     */
    private LegResult runLeg(LegPlan plan, Duration timeout, ExecutionAttempt cancellable) {
        TradingVenue venue;
        OrderHandle handle;
        try {
            venue = venues.require(plan.getVenueId());
            handle = venue.placeOrder(plan.getInstrumentId(), plan.getSide(), plan.getTargetPrice(),
                    plan.getPriceFormat(), plan.getTargetSize());
        } catch (RejectedOrderException e) {
            log.warn("[EXECUTION] Leg {} rejected by {}: {}", plan.getSequence(), plan.getVenueId(), e.getMessage());
            return LegResult.notFilled(plan, LegState.REJECTED, null, e.getMessage(), clock.instant());
        } catch (VenueException e) {
            log.warn("[EXECUTION] Leg {} could not be placed on {}: {}", plan.getSequence(), plan.getVenueId(), e.getMessage());
            return LegResult.notFilled(plan, LegState.REJECTED, null, e.getMessage(), clock.instant());
        }

        Instant deadline = clock.instant().plus(timeout);
        OrderStatus last = OrderStatus.resting();
        boolean cancelRequested = false;
        while (true) {
            Optional<OrderStatus> polled = poll(venue, handle);
            if (polled.isPresent()) {
                last = polled.get();
                if (last.getState() == LegState.FILLED || last.getFilledSize().compareTo(plan.getTargetSize()) >= 0) {
                    return result(plan, LegState.FILLED, handle, last, null);
                }
                if (last.getState() == LegState.REJECTED || last.getState() == LegState.CANCELLED) {
                    LegState state = last.hasFill() ? LegState.PARTIALLY_FILLED : last.getState();
                    return result(plan, state, handle, last, last.getMessage());
                }
            }
            if (cancellable != null && cancellable.isCancelRequested() && !last.hasFill()) {
                cancelRequested = true;
                break;
            }
            if (!clock.instant().isBefore(deadline)) {
                break;
            }
            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[EXECUTION] Interrupted while polling {}", handle.getOrderId());
                break;
            }
        }

        try {
            retryPolicy.run("cancel " + handle.getOrderId(), () -> venue.cancelOrder(handle));
        } catch (VenueException e) {
            log.warn("[EXECUTION] Cancel of {} on {} failed: {}", handle.getOrderId(), plan.getVenueId(), e.getMessage());
        }
        OrderStatus fin = poll(venue, handle).orElse(last);
        if (fin.getFilledSize().compareTo(plan.getTargetSize()) >= 0) {
            return result(plan, LegState.FILLED, handle, fin, null);
        }
        if (fin.hasFill()) {
            return result(plan, LegState.PARTIALLY_FILLED, handle, fin, "partial fill before cancel");
        }
        LegState state = cancelRequested ? LegState.CANCELLED : LegState.TIMED_OUT;
        return LegResult.notFilled(plan, state, handle, cancelRequested ? "cancel requested" : "timed out after " + timeout.toMillis() + "ms", clock.instant());
    }

    private Optional<OrderStatus> poll(TradingVenue venue, OrderHandle handle) {
        try {
            OrderStatus status = retryPolicy.execute("status " + handle.getOrderId(), () -> venue.getOrderStatus(handle));
            if (status.getFilledSize() == null) {
                status = OrderStatus.builder()
                        .state(status.getState())
                        .filledSize(BigDecimal.ZERO)
                        .averagePrice(status.getAveragePrice())
                        .message(status.getMessage())
                        .build();
            }
            return Optional.of(status);
        } catch (VenueException e) {
            log.warn("[EXECUTION] Status of {} unavailable: {}", handle.getOrderId(), e.getMessage());
            return Optional.empty();
        }
    }

    private LegResult result(LegPlan plan, LegState state, OrderHandle handle, OrderStatus status, String message) {
        return LegResult.builder()
                .plan(plan)
                .state(state)
                .handle(handle)
                .filledSize(status.getFilledSize().min(plan.getTargetSize()))
                .averagePrice(status.getAveragePrice())
                .message(message)
                .completedAt(clock.instant())
                .build();
    }

    /** Planned edge less the slippage of both legs, in probability cost per unit. */
    double realizedEdge(Opportunity opportunity, LegResult leg1, LegResult leg2) {
        double slippage = 0.0;
        for (LegResult leg : List.of(leg1, leg2)) {
            slippage += OddsConverter.achievedCost(leg, exchangeTakerRate) - leg.getPlan().getProbabilityCost();
        }
        return opportunity.getNetEdge() - slippage;
    }
}
