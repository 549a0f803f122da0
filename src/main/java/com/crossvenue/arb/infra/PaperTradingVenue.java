package com.crossvenue.arb.infra;

import com.crossvenue.arb.domain.LegState;
import com.crossvenue.arb.domain.OrderHandle;
import com.crossvenue.arb.domain.OrderStatus;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.exception.VenueException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dry-run venue. Each order either fills in full at its limit price (with the configured
 * probability) or rests until cancelled.
 */
@Slf4j
public class PaperTradingVenue implements TradingVenue {

    private final String venueId;
    private final double fillProbability;
    private final Random random;
    private final Clock clock;
    private final Map<String, OrderStatus> orders = new ConcurrentHashMap<>();

    public PaperTradingVenue(String venueId, double fillProbability, Random random, Clock clock) {
        this.venueId = venueId;
        this.fillProbability = fillProbability;
        this.random = random;
        this.clock = clock;
    }

    @Override
    public String venueId() {
        return venueId;
    }

    @Override
    public OrderHandle placeOrder(String instrumentId, Side side, BigDecimal price, PriceFormat priceFormat, BigDecimal size) {
        String orderId = "paper-" + UUID.randomUUID();
        boolean fills;
        synchronized (random) {
            fills = random.nextDouble() < fillProbability;
        }
        OrderStatus status = fills
                ? OrderStatus.builder().state(LegState.FILLED).filledSize(size).averagePrice(price).build()
                : OrderStatus.resting();
        orders.put(orderId, status);
        log.info("[PAPER] {} {} {} x{} @ {} {} -> {}", venueId, instrumentId, side, size, price, priceFormat,
                status.getState());
        return new OrderHandle(venueId, orderId, instrumentId, clock.instant());
    }

    @Override
    public OrderStatus getOrderStatus(OrderHandle handle) {
        OrderStatus status = orders.get(handle.getOrderId());
        if (status == null) {
            throw new VenueException(venueId, "unknown paper order " + handle.getOrderId());
        }
        return status;
    }

    @Override
    public void cancelOrder(OrderHandle handle) {
        orders.computeIfPresent(handle.getOrderId(), (id, status) -> status.getState() == LegState.SUBMITTED
                ? OrderStatus.builder().state(LegState.CANCELLED).filledSize(BigDecimal.ZERO).message("cancelled").build()
                : status);
    }
}
