package com.crossvenue.arb.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Record of driving one {@link Opportunity} through the two-leg protocol. Mutated only by the
 * execution coordinator while running; any mutation after a terminal state throws.
 */
public class ExecutionAttempt {

    public record Transition(AttemptState state, Instant at) {
    }

    private final String id;
    private final Opportunity opportunity;
    private final Instant startedAt;
    private final List<Transition> history = new ArrayList<>();

    private AttemptState state;
    private LegResult leg1;
    private LegResult leg2;
    private Double realizedEdge;
    private Instant completedAt;
    private volatile boolean cancelRequested;

    public ExecutionAttempt(Opportunity opportunity, Instant startedAt) {
        this.id = UUID.randomUUID().toString();
        this.opportunity = opportunity;
        this.startedAt = startedAt;
        this.state = AttemptState.PLANNED;
        this.history.add(new Transition(AttemptState.PLANNED, startedAt));
    }

    public synchronized void transition(AttemptState next, Instant at) {
        ensureOpen();
        this.state = next;
        this.history.add(new Transition(next, at));
        if (next.isTerminal()) {
            this.completedAt = at;
        }
    }

    public synchronized void recordLeg1(LegResult result) {
        ensureOpen();
        this.leg1 = result;
    }

    public synchronized void recordLeg2(LegResult result) {
        ensureOpen();
        this.leg2 = result;
    }

    public synchronized void recordRealizedEdge(double edge) {
        ensureOpen();
        this.realizedEdge = edge;
    }

    /** Only honoured while leg 1 has no fill. */
    public void requestCancel() {
        this.cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    private void ensureOpen() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Execution attempt " + id + " is terminal (" + state + ")");
        }
    }

    public String getId() {
        return id;
    }

    public Opportunity getOpportunity() {
        return opportunity;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized AttemptState getState() {
        return state;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    public synchronized List<Transition> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public synchronized Optional<LegResult> getLeg1() {
        return Optional.ofNullable(leg1);
    }

    public synchronized Optional<LegResult> getLeg2() {
        return Optional.ofNullable(leg2);
    }

    public synchronized Optional<Double> getRealizedEdge() {
        return Optional.ofNullable(realizedEdge);
    }

    public synchronized Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public synchronized BigDecimal leg1FilledSize() {
        return leg1 != null && leg1.getFilledSize() != null ? leg1.getFilledSize() : BigDecimal.ZERO;
    }

    public synchronized BigDecimal leg2FilledSize() {
        return leg2 != null && leg2.getFilledSize() != null ? leg2.getFilledSize() : BigDecimal.ZERO;
    }

    @Override
    public synchronized String toString() {
        return "ExecutionAttempt{id=" + id + ", pair=" + opportunity.pairKey() + ", state=" + state + "}";
    }
}
