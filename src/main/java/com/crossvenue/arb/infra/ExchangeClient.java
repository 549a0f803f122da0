package com.crossvenue.arb.infra;

import com.crossvenue.arb.domain.ExchangeInstrument;
import com.crossvenue.arb.domain.OrderBook;
import com.crossvenue.arb.domain.OrderHandle;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Side;

import java.math.BigDecimal;
import java.util.List;

/**
 * Binary-contract exchange. Prices are probabilities in [0, 1].
 */
public interface ExchangeClient extends TradingVenue {

    List<ExchangeInstrument> getInstruments(InstrumentFilter filter);

    OrderBook getOrderBook(String instrumentId);

    default OrderHandle placeOrder(String instrumentId, Side side, BigDecimal price, BigDecimal size) {
        return placeOrder(instrumentId, side, price, PriceFormat.PROBABILITY, size);
    }
}
