package com.crossvenue.arb.infra;

import com.crossvenue.arb.domain.OrderHandle;
import com.crossvenue.arb.domain.OrderStatus;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Side;

import java.math.BigDecimal;

/**
 * Order placement capability of one venue. Registered per venue id in {@link VenueRegistry}.
 */
public interface TradingVenue {

    String venueId();

    OrderHandle placeOrder(String instrumentId, Side side, BigDecimal price, PriceFormat priceFormat, BigDecimal size);

    OrderStatus getOrderStatus(OrderHandle handle);

    void cancelOrder(OrderHandle handle);
}
