package com.crossvenue.arb.risk;

import com.crossvenue.arb.config.ArbProperties;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Spreads volume across venues so no single account stands out: most remaining daily
 * headroom first, then least recently used, then the largest single bet the venue can still
 * take today (its per-bet cap bounded by that headroom).
 */
public class VenueRotation {

    private final ArbProperties.Risk limits;

    public VenueRotation(ArbProperties.Risk limits) {
        this.limits = limits;
    }

    public List<String> rank(Collection<String> venueIds, ExposureSnapshot exposure) {
        Comparator<String> byHeadroom = Comparator.comparing((String v) -> headroom(v, exposure)).reversed();
        Comparator<String> byIdleness = Comparator.comparing(
                (String v) -> exposure.venue(v).getLastActivity(),
                Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));
        Comparator<String> byPerBetCap = Comparator.comparing((String v) -> remainingPerBet(v, exposure)).reversed();

        return venueIds.stream()
                .distinct()
                .sorted(byHeadroom.thenComparing(byIdleness).thenComparing(byPerBetCap).thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    BigDecimal remainingPerBet(String venueId, ExposureSnapshot exposure) {
        return limits.perBetCapFor(venueId).min(headroom(venueId, exposure)).max(BigDecimal.ZERO);
    }

    BigDecimal headroom(String venueId, ExposureSnapshot exposure) {
        ExposureSnapshot.VenueView v = exposure.venue(venueId);
        return limits.dailyVolumeCapFor(venueId).subtract(v.getDailyVolume()).subtract(v.getReserved());
    }
}
