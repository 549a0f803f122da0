package com.crossvenue.arb.risk;

import com.crossvenue.arb.domain.Position;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Consistent read view of the {@link ExposureLedger}, taken under its lock.
 */
@Value
@Builder
public class ExposureSnapshot {
    Instant takenAt;
    LocalDate tradingDay;
    @Singular
    Map<String, VenueView> venues;
    BigDecimal totalOpenExposure;
    BigDecimal totalReserved;
    BigDecimal dailyRealizedPnl;
    BigDecimal cumulativeRealizedPnl;
    BigDecimal highWaterMark;
    BigDecimal unrealizedPnl;
    boolean halted;
    String haltReason;
    @Singular
    List<Position> openPositions;

    @Value
    @Builder
    public static class VenueView {
        String venueId;
        BigDecimal openExposure;
        BigDecimal dailyVolume;
        BigDecimal dailyRealizedPnl;
        BigDecimal unrealizedPnl;
        BigDecimal reserved;
        Instant lastActivity;
        boolean throttled;

        public static VenueView empty(String venueId) {
            return VenueView.builder()
                    .venueId(venueId)
                    .openExposure(BigDecimal.ZERO)
                    .dailyVolume(BigDecimal.ZERO)
                    .dailyRealizedPnl(BigDecimal.ZERO)
                    .unrealizedPnl(BigDecimal.ZERO)
                    .reserved(BigDecimal.ZERO)
                    .build();
        }
    }

    public VenueView venue(String venueId) {
        VenueView view = venues.get(venueId);
        return view != null ? view : VenueView.empty(venueId);
    }

    public boolean isThrottled(String venueId) {
        return venue(venueId).isThrottled();
    }

    public BigDecimal drawdown() {
        return highWaterMark.subtract(cumulativeRealizedPnl).max(BigDecimal.ZERO);
    }
}
