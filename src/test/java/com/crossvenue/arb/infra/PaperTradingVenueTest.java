package com.crossvenue.arb.infra;

import com.crossvenue.arb.domain.LegState;
import com.crossvenue.arb.domain.OrderHandle;
import com.crossvenue.arb.domain.OrderStatus;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.exception.VenueException;
import com.crossvenue.arb.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PaperTradingVenueTest {

    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    @Test
    void testCertainFillAtLimitPrice() {
        PaperTradingVenue venue = new PaperTradingVenue("draftkings", 1.0, new Random(1), new MutableClock(NOW));

        OrderHandle handle = venue.placeOrder("evt-1:h2h:Denver Nuggets", Side.B, new BigDecimal("122"),
                PriceFormat.AMERICAN, BigDecimal.TEN);
        OrderStatus status = venue.getOrderStatus(handle);

        assertEquals(LegState.FILLED, status.getState());
        assertEquals(0, status.getFilledSize().compareTo(BigDecimal.TEN));
        assertEquals(0, status.getAveragePrice().compareTo(new BigDecimal("122")));
        assertEquals(NOW, handle.getSubmittedAt());
        assertTrue(handle.getOrderId().startsWith("paper-"));

        // cancelling a filled order changes nothing
        venue.cancelOrder(handle);
        assertEquals(LegState.FILLED, venue.getOrderStatus(handle).getState());
    }

    @Test
    void testRestingOrderCanBeCancelled() {
        PaperTradingVenue venue = new PaperTradingVenue("kalshi", 0.0, new Random(1), new MutableClock(NOW));

        OrderHandle handle = venue.placeOrder("KX-A", Side.A, new BigDecimal("0.35"), PriceFormat.PROBABILITY, BigDecimal.TEN);
        assertEquals(LegState.SUBMITTED, venue.getOrderStatus(handle).getState());

        venue.cancelOrder(handle);

        OrderStatus cancelled = venue.getOrderStatus(handle);
        assertEquals(LegState.CANCELLED, cancelled.getState());
        assertFalse(cancelled.hasFill());
    }

    @Test
    void testUnknownOrder() {
        PaperTradingVenue venue = new PaperTradingVenue("kalshi", 1.0, new Random(1), new MutableClock(NOW));

        assertThrows(VenueException.class,
                () -> venue.getOrderStatus(new OrderHandle("kalshi", "nope", "KX-A", NOW)));
    }
}
