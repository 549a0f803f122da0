package com.crossvenue.arb.infra;

import com.crossvenue.arb.exception.VenueException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Capability-based dispatch by venue id. Venues without a registered {@link TradingVenue}
 * are read-only unless a fallback factory (paper trading) is installed.
 */
@Slf4j
public class VenueRegistry {

    public enum Capability {
        CAN_PLACE_ORDERS,
        READ_ONLY
    }

    private final Map<String, TradingVenue> venues = new ConcurrentHashMap<>();
    private final Function<String, TradingVenue> fallback;

    public VenueRegistry() {
        this(null);
    }

    public VenueRegistry(Function<String, TradingVenue> fallback) {
        this.fallback = fallback;
    }

    public VenueRegistry register(TradingVenue venue) {
        TradingVenue previous = venues.put(venue.venueId(), venue);
        if (previous != null && previous != venue) {
            log.warn("Replaced trading venue registration for {}", venue.venueId());
        }
        return this;
    }

    public Capability capabilityOf(String venueId) {
        return venues.containsKey(venueId) || fallback != null ? Capability.CAN_PLACE_ORDERS : Capability.READ_ONLY;
    }

    public boolean canPlaceOrders(String venueId) {
        return capabilityOf(venueId) == Capability.CAN_PLACE_ORDERS;
    }

    public Optional<TradingVenue> find(String venueId) {
        TradingVenue venue = venues.get(venueId);
        if (venue == null && fallback != null) {
            venue = venues.computeIfAbsent(venueId, fallback);
        }
        return Optional.ofNullable(venue);
    }

    public TradingVenue require(String venueId) {
        return find(venueId).orElseThrow(() -> new VenueException(venueId, "venue is read-only, no order placement registered"));
    }
}
