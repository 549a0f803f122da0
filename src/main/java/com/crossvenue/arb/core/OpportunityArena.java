package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.Opportunity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Latest opportunity per pair key, rebuilt every scan cycle.
 * <p>
 * A fresh detection is reported as inserted only when its edge moved by more than the noise
 * threshold. Within the threshold a consumed entry survives as is, so the same window is not
 * dispatched twice, while an unconsumed one is refreshed in place and stays pending with the
 * new detection time. Pairs that were not re-detected are dropped.
 */
public class OpportunityArena {

    private static final class Entry {
        final Opportunity opportunity;
        boolean consumed;

        Entry(Opportunity opportunity) {
            this.opportunity = opportunity;
        }
    }

    private final double noiseThreshold;
    private Map<String, Entry> entries = new HashMap<>();

    public OpportunityArena(double noiseThreshold) {
        this.noiseThreshold = noiseThreshold;
    }

    /** @return the opportunities that were inserted this cycle (new pairs or moved edges) */
    public synchronized List<Opportunity> replaceCycle(List<Opportunity> detected) {
        Map<String, Entry> next = new HashMap<>();
        List<Opportunity> inserted = new ArrayList<>();
        for (Opportunity fresh : detected) {
            String key = fresh.pairKey();
            Entry held = entries.get(key);
            if (held != null && Math.abs(fresh.getNetEdge() - held.opportunity.getNetEdge()) <= noiseThreshold) {
                next.put(key, held.consumed ? held : new Entry(fresh));
            } else {
                next.put(key, new Entry(fresh));
                inserted.add(fresh);
            }
        }
        entries = next;
        return inserted;
    }

    /** Consumes the opportunity for {@code pairKey}; each one can be taken once. */
    public synchronized Optional<Opportunity> take(String pairKey) {
        Entry entry = entries.get(pairKey);
        if (entry == null || entry.consumed) {
            return Optional.empty();
        }
        entry.consumed = true;
        return Optional.of(entry.opportunity);
    }

    /** Unconsumed opportunities, best edge first. */
    public synchronized List<Opportunity> pending() {
        return entries.values().stream()
                .filter(e -> !e.consumed)
                .map(e -> e.opportunity)
                .sorted(Comparator.comparingDouble(Opportunity::getNetEdge).reversed())
                .toList();
    }

    public synchronized List<Opportunity> snapshot() {
        return entries.values().stream()
                .map(e -> e.opportunity)
                .sorted(Comparator.comparingDouble(Opportunity::getNetEdge).reversed())
                .toList();
    }

    public synchronized int size() {
        return entries.size();
    }
}
