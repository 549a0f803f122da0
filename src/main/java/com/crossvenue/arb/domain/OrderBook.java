package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Exchange order book for one binary instrument, expressed from the YES side.
 * Buying NO at {@code 1 - p} is equivalent to hitting a YES bid at {@code p}.
 */
@Data
@Builder
public class OrderBook {
    private String instrumentId;
    private Instant timestamp;

    private List<OrderLevel> bids;
    private List<OrderLevel> asks;

    @Data
    @Builder
    public static class OrderLevel {
        private BigDecimal price;
        private BigDecimal size;
    }

    /** Best level at which we can buy the given side, in probability terms. */
    public Optional<OrderLevel> bestAsk(Side side) {
        if (side == Side.A) {
            return best(asks, true);
        }
        return best(bids, false).map(bid -> OrderLevel.builder()
                .price(BigDecimal.ONE.subtract(bid.getPrice()))
                .size(bid.getSize())
                .build());
    }

    private static Optional<OrderLevel> best(List<OrderLevel> levels, boolean lowest) {
        if (levels == null || levels.isEmpty()) {
            return Optional.empty();
        }
        Comparator<OrderLevel> byPrice = Comparator.comparing(OrderLevel::getPrice);
        return lowest ? levels.stream().min(byPrice) : levels.stream().max(byPrice);
    }
}
