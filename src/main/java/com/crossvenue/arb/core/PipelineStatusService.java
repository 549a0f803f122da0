package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.ExecutionAttempt;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.Position;
import com.crossvenue.arb.risk.ExposureSnapshot;
import com.crossvenue.arb.risk.PortfolioManager;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only queries over the running pipeline, plus a periodic status line in the log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineStatusService {

    private final OpportunityArena arena;
    private final LeggingExecutionCoordinator coordinator;
    private final PortfolioManager portfolio;

    @Value
    @Builder
    public static class PipelineStatus {
        Instant takenAt;
        List<Opportunity> opportunities;
        int openAttempts;
        Map<String, ExposureSnapshot.VenueView> venues;
        BigDecimal totalOpenExposure;
        BigDecimal cumulativeRealizedPnl;
        BigDecimal unrealizedPnl;
        boolean halted;
        String haltReason;
    }

    public List<Opportunity> currentOpportunities() {
        return arena.snapshot();
    }

    public Collection<ExecutionAttempt> openAttempts() {
        return coordinator.openAttempts();
    }

    public Map<String, ExposureSnapshot.VenueView> venueExposure() {
        return portfolio.snapshot().getVenues();
    }

    public BigDecimal cumulativePnl() {
        return portfolio.snapshot().getCumulativeRealizedPnl();
    }

    public List<Position> positions() {
        return portfolio.positions();
    }

    public PipelineStatus status() {
        ExposureSnapshot exposure = portfolio.snapshot();
        return PipelineStatus.builder()
                .takenAt(exposure.getTakenAt())
                .opportunities(arena.snapshot())
                .openAttempts(coordinator.openAttempts().size())
                .venues(exposure.getVenues())
                .totalOpenExposure(exposure.getTotalOpenExposure())
                .cumulativeRealizedPnl(exposure.getCumulativeRealizedPnl())
                .unrealizedPnl(exposure.getUnrealizedPnl())
                .halted(exposure.isHalted())
                .haltReason(exposure.getHaltReason())
                .build();
    }

    @Scheduled(fixedDelayString = "${arb.status.log-interval-millis:60000}")
    public void logStatus() {
        PipelineStatus s = status();
        log.info("[STATUS] opportunities={} openAttempts={} openExposure={} realizedPnl={} unrealizedPnl={} halted={}",
                s.getOpportunities().size(), s.getOpenAttempts(), s.getTotalOpenExposure().toPlainString(),
                s.getCumulativeRealizedPnl().toPlainString(), s.getUnrealizedPnl().toPlainString(),
                s.isHalted() ? "yes (" + s.getHaltReason() + ")" : "no");
    }
}
