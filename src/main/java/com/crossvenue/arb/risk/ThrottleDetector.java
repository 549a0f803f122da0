package com.crossvenue.arb.risk;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Flags a venue that rejected our hedge leg {@code threshold} times within {@code window}.
 * Sportsbooks limit winning accounts this way. A flag stays until cleared by an operator.
 */
@Slf4j
public class ThrottleDetector {

    private final int threshold;
    private final Duration window;
    private final Map<String, Deque<Instant>> rejections = new HashMap<>();
    private final Set<String> flagged = new HashSet<>();

    public ThrottleDetector(int threshold, Duration window) {
        this.threshold = threshold;
        this.window = window;
    }

    /** @return true when this rejection newly flags the venue */
    public synchronized boolean recordRejection(String venueId, Instant at) {
        Deque<Instant> recent = rejections.computeIfAbsent(venueId, k -> new ArrayDeque<>());
        recent.addLast(at);
        Instant cutoff = at.minus(window);
        while (!recent.isEmpty() && recent.peekFirst().isBefore(cutoff)) {
            recent.removeFirst();
        }
        if (recent.size() >= threshold && flagged.add(venueId)) {
            log.warn("[RISK] Venue {} throttled: {} hedge rejections within {}s", venueId, recent.size(), window.toSeconds());
            return true;
        }
        return false;
    }

    public synchronized boolean isFlagged(String venueId) {
        return flagged.contains(venueId);
    }

    public synchronized void clear(String venueId) {
        flagged.remove(venueId);
        rejections.remove(venueId);
    }
}
