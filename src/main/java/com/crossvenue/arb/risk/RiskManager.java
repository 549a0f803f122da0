package com.crossvenue.arb.risk;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.LegPlan;
import com.crossvenue.arb.domain.Opportunity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Pre-trade checks over an {@link ExposureSnapshot}. Holds no state of its own; atomicity of
 * check-then-reserve is provided by {@link PortfolioManager}.
 * <p>
 * Order: kill switch (short-circuits), throttled venue, minimum size, per-bet cap, daily
 * volume, global exposure, per-attempt hard cap, daily loss limit against worst-case loss.
 */
public class RiskManager {

    private final ArbProperties.Risk limits;

    public RiskManager(ArbProperties.Risk limits) {
        this.limits = limits;
    }

    public RiskDecision evaluate(Opportunity opportunity, ExposureSnapshot exposure) {
        if (exposure.isHalted()) {
            return RiskDecision.reject(List.of(new RiskViolation(RiskViolation.Type.KILL_SWITCH, null,
                    "trading halted: " + exposure.getHaltReason())));
        }

        List<RiskViolation> violations = new ArrayList<>();
        for (LegPlan leg : opportunity.getPlan()) {
            if (exposure.isThrottled(leg.getVenueId())) {
                violations.add(new RiskViolation(RiskViolation.Type.VENUE_THROTTLED, leg.getVenueId(),
                        "venue flagged after repeated rejections"));
            }
        }

        BigDecimal size = opportunity.getMaxFillSize();
        if (size == null || size.compareTo(limits.minActionableSize()) < 0) {
            violations.add(new RiskViolation(RiskViolation.Type.BELOW_MIN_SIZE, null,
                    "size " + size + " < " + limits.minActionableSize()));
        }

        for (LegPlan leg : opportunity.getPlan()) {
            String venue = leg.getVenueId();
            BigDecimal notional = leg.notional();
            BigDecimal perBet = limits.perBetCapFor(venue);
            if (notional.compareTo(perBet) > 0) {
                violations.add(new RiskViolation(RiskViolation.Type.PER_BET_CAP, venue,
                        "leg notional " + money(notional) + " > " + perBet));
            }
            ExposureSnapshot.VenueView v = exposure.venue(venue);
            BigDecimal projected = v.getDailyVolume().add(v.getReserved()).add(notional);
            BigDecimal dailyCap = limits.dailyVolumeCapFor(venue);
            if (projected.compareTo(dailyCap) > 0) {
                violations.add(new RiskViolation(RiskViolation.Type.DAILY_VOLUME_CAP, venue,
                        "daily volume would reach " + money(projected) + " > " + dailyCap));
            }
        }

        BigDecimal total = opportunity.totalNotional();
        BigDecimal projectedGlobal = exposure.getTotalOpenExposure().add(exposure.getTotalReserved()).add(total);
        if (projectedGlobal.compareTo(limits.globalExposureCap()) > 0) {
            violations.add(new RiskViolation(RiskViolation.Type.GLOBAL_EXPOSURE_CAP, null,
                    "global exposure would reach " + money(projectedGlobal) + " > " + limits.globalExposureCap()));
        }
        if (total.compareTo(limits.effectiveMaxAttemptNotional()) > 0) {
            violations.add(new RiskViolation(RiskViolation.Type.ATTEMPT_CAP, null,
                    "attempt notional " + money(total) + " > " + limits.effectiveMaxAttemptNotional()));
        }

        BigDecimal worstCase = opportunity.worstCaseLoss();
        BigDecimal afterWorstCase = exposure.getDailyRealizedPnl().subtract(worstCase);
        if (afterWorstCase.compareTo(limits.dailyLossLimit().negate()) < 0) {
            violations.add(new RiskViolation(RiskViolation.Type.DAILY_LOSS_LIMIT, null,
                    "daily P&L " + money(exposure.getDailyRealizedPnl()) + " minus worst case " + money(worstCase)
                            + " breaches -" + limits.dailyLossLimit()));
        }

        return violations.isEmpty() ? RiskDecision.approve() : RiskDecision.reject(violations);
    }

    /**
     * Dollars a new leg at {@code venueId} may still commit: the smallest of the per-bet cap,
     * the daily volume headroom and the global headroom. Zero for throttled venues or while halted.
     */
    public BigDecimal remainingCapacity(String venueId, ExposureSnapshot exposure) {
        if (exposure.isHalted() || exposure.isThrottled(venueId)) {
            return BigDecimal.ZERO;
        }
        ExposureSnapshot.VenueView v = exposure.venue(venueId);
        BigDecimal daily = limits.dailyVolumeCapFor(venueId).subtract(v.getDailyVolume()).subtract(v.getReserved());
        BigDecimal global = limits.globalExposureCap()
                .subtract(exposure.getTotalOpenExposure())
                .subtract(exposure.getTotalReserved());
        return limits.perBetCapFor(venueId).min(daily).min(global).max(BigDecimal.ZERO);
    }

    public VenueCapacity capacity(ExposureSnapshot exposure) {
        return venueId -> remainingCapacity(venueId, exposure);
    }

    public ArbProperties.Risk getLimits() {
        return limits;
    }

    private static String money(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
