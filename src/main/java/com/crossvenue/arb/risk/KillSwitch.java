package com.crossvenue.arb.risk;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Trip conditions for halting new attempts: realized daily loss at or beyond the limit, or
 * drawdown from the running high-water mark beyond the maximum.
 */
public class KillSwitch {

    private final BigDecimal dailyLossLimit;
    private final BigDecimal maxDrawdown;

    public KillSwitch(BigDecimal dailyLossLimit, BigDecimal maxDrawdown) {
        this.dailyLossLimit = dailyLossLimit;
        this.maxDrawdown = maxDrawdown;
    }

    public Optional<String> evaluate(ExposureSnapshot exposure) {
        BigDecimal dailyLoss = exposure.getDailyRealizedPnl().negate();
        if (dailyLoss.compareTo(dailyLossLimit) >= 0) {
            return Optional.of("daily realized loss " + dailyLoss.toPlainString() + " reached limit " + dailyLossLimit);
        }
        BigDecimal drawdown = exposure.drawdown();
        if (drawdown.compareTo(maxDrawdown) > 0) {
            return Optional.of("drawdown " + drawdown.toPlainString() + " from high-water mark "
                    + exposure.getHighWaterMark().toPlainString() + " exceeds " + maxDrawdown);
        }
        return Optional.empty();
    }
}
