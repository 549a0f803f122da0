package com.crossvenue.arb.config;

import com.crossvenue.arb.exception.ConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix = "arb")
public record ArbProperties(
        TradingMode mode,
        @Valid Scan scan,
        @Valid Matching matching,
        @Valid Detection detection,
        @Valid Fees fees,
        @Valid Execution execution,
        @Valid Risk risk,
        @Valid Retry retry,
        @Valid Venues venues,
        @Valid Alerts alerts,
        @Valid Journal journal,
        @Valid ValueSignal valueSignal
) {

    /** Hard limits that configuration cannot raise. */
    public static final BigDecimal MAX_SINGLE_LEG = new BigDecimal("50");
    public static final BigDecimal MAX_ATTEMPT_TOTAL = new BigDecimal("100");

    public ArbProperties {
        if (mode == null) {
            mode = TradingMode.PAPER;
        }
        if (scan == null) {
            scan = new Scan(null, null, null, null, null, null, null);
        }
        if (matching == null) {
            matching = new Matching(null, null, null, null, null);
        }
        if (detection == null) {
            detection = new Detection(null, null, null, null);
        }
        if (fees == null) {
            fees = new Fees(null, null, null);
        }
        if (execution == null) {
            execution = new Execution(null, null, null, null);
        }
        if (risk == null) {
            risk = new Risk(null, null, null, null, null, null, null, null, null, null, null);
        }
        if (retry == null) {
            retry = new Retry(null, null, null, null);
        }
        if (venues == null) {
            venues = new Venues(null, null, null, null);
        }
        if (alerts == null) {
            alerts = new Alerts(null);
        }
        if (journal == null) {
            journal = new Journal(null, null);
        }
        if (valueSignal == null) {
            valueSignal = new ValueSignal(null, null, null);
        }
    }

    public static ArbProperties defaults() {
        return new ArbProperties(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public enum TradingMode {
        PAPER,
        LIVE
    }

    public record Scan(
            @Min(100) Long intervalMillis,
            List<String> sports,
            List<String> regions,
            List<String> marketTypes,
            List<String> bookmakers,
            @Min(1) Long quoteFreshnessMillis,
            @Min(0) Long oddsRefreshMillis
    ) {
        public Scan {
            if (intervalMillis == null) {
                intervalMillis = 2_000L;
            }
            sports = sanitize(sports, List.of("basketball_nba", "icehockey_nhl", "americanfootball_nfl"));
            regions = sanitize(regions, List.of("us"));
            marketTypes = sanitize(marketTypes, List.of("h2h"));
            bookmakers = sanitize(bookmakers, List.of());
            if (quoteFreshnessMillis == null) {
                quoteFreshnessMillis = 60_000L;
            }
            // odds aggregators bill per request, so their lines are cached between scans
            if (oddsRefreshMillis == null) {
                oddsRefreshMillis = 30_000L;
            }
        }

        public Duration oddsRefresh() {
            return Duration.ofMillis(oddsRefreshMillis);
        }

        public Duration quoteFreshness() {
            return Duration.ofMillis(quoteFreshnessMillis);
        }
    }

    public record Matching(
            Double threshold,
            Double nameWeight,
            Double timeWeight,
            Double marketTypeWeight,
            @Min(1) Long timeToleranceMinutes
    ) {
        public Matching {
            if (threshold == null) {
                threshold = 0.85;
            }
            if (nameWeight == null) {
                nameWeight = 0.6;
            }
            if (timeWeight == null) {
                timeWeight = 0.3;
            }
            if (marketTypeWeight == null) {
                marketTypeWeight = 0.1;
            }
            if (timeToleranceMinutes == null) {
                timeToleranceMinutes = 720L;
            }
        }

        public Duration timeTolerance() {
            return Duration.ofMinutes(timeToleranceMinutes);
        }
    }

    public record Detection(
            Double minEdge,
            @Min(1) Long staleMillis,
            Double noiseThreshold,
            BigDecimal maxBetUnits
    ) {
        public Detection {
            if (minEdge == null) {
                minEdge = 0.01;
            }
            if (staleMillis == null) {
                staleMillis = 2_000L;
            }
            if (noiseThreshold == null) {
                noiseThreshold = 0.005;
            }
            if (maxBetUnits == null) {
                maxBetUnits = new BigDecimal("100");
            }
        }

        public Duration staleness() {
            return Duration.ofMillis(staleMillis);
        }
    }

    /**
     * Exchange taker fee is {@code rate * p * (1 - p)} per contract; odds venues charge a
     * commission applied to the fair probability.
     */
    public record Fees(
            Double exchangeTakerRate,
            Double defaultOddsCommission,
            Map<String, Double> oddsCommission
    ) {
        public Fees {
            if (exchangeTakerRate == null) {
                exchangeTakerRate = 0.07;
            }
            if (defaultOddsCommission == null) {
                defaultOddsCommission = 0.0;
            }
            oddsCommission = oddsCommission == null ? Map.of() : Map.copyOf(oddsCommission);
        }

        public double commissionFor(String venueId) {
            return oddsCommission.getOrDefault(venueId, defaultOddsCommission);
        }
    }

    public record Execution(
            @Min(1) Long leg1TimeoutMillis,
            @Min(1) Long leg2TimeoutMillis,
            @Min(1) Long pollIntervalMillis,
            @Min(1) Integer workerThreads
    ) {
        public Execution {
            if (leg1TimeoutMillis == null) {
                leg1TimeoutMillis = 3_000L;
            }
            if (leg2TimeoutMillis == null) {
                leg2TimeoutMillis = 10_000L;
            }
            if (pollIntervalMillis == null) {
                pollIntervalMillis = 250L;
            }
            if (workerThreads == null) {
                workerThreads = 4;
            }
        }

        public Duration leg1Timeout() {
            return Duration.ofMillis(leg1TimeoutMillis);
        }

        public Duration leg2Timeout() {
            return Duration.ofMillis(leg2TimeoutMillis);
        }

        public Duration pollInterval() {
            return Duration.ofMillis(pollIntervalMillis);
        }
    }

    public record VenueLimits(BigDecimal perBetCap, BigDecimal dailyVolumeCap) {
    }

    public record Risk(
            BigDecimal perBetCap,
            BigDecimal dailyVolumeCap,
            BigDecimal globalExposureCap,
            BigDecimal maxAttemptNotional,
            BigDecimal minActionableSize,
            BigDecimal dailyLossLimit,
            BigDecimal maxDrawdown,
            @Min(1) Integer throttleRejections,
            @Min(1) Long throttleWindowSeconds,
            String tradingDayZone,
            Map<String, VenueLimits> venueLimits
    ) {
        public Risk {
            if (perBetCap == null) {
                perBetCap = new BigDecimal("25");
            }
            if (dailyVolumeCap == null) {
                dailyVolumeCap = new BigDecimal("500");
            }
            if (globalExposureCap == null) {
                globalExposureCap = new BigDecimal("300");
            }
            if (maxAttemptNotional == null) {
                maxAttemptNotional = MAX_ATTEMPT_TOTAL;
            }
            if (minActionableSize == null) {
                minActionableSize = new BigDecimal("2");
            }
            if (dailyLossLimit == null) {
                dailyLossLimit = new BigDecimal("50");
            }
            if (maxDrawdown == null) {
                maxDrawdown = new BigDecimal("100");
            }
            if (throttleRejections == null) {
                throttleRejections = 3;
            }
            if (throttleWindowSeconds == null) {
                throttleWindowSeconds = 300L;
            }
            if (tradingDayZone == null || tradingDayZone.isBlank()) {
                tradingDayZone = "UTC";
            }
            venueLimits = venueLimits == null ? Map.of() : Map.copyOf(venueLimits);
        }

        public BigDecimal perBetCapFor(String venueId) {
            VenueLimits limits = venueLimits.get(venueId);
            BigDecimal cap = limits != null && limits.perBetCap() != null ? limits.perBetCap() : perBetCap;
            return cap.min(MAX_SINGLE_LEG);
        }

        public BigDecimal dailyVolumeCapFor(String venueId) {
            VenueLimits limits = venueLimits.get(venueId);
            return limits != null && limits.dailyVolumeCap() != null ? limits.dailyVolumeCap() : dailyVolumeCap;
        }

        public BigDecimal effectiveMaxAttemptNotional() {
            return maxAttemptNotional.min(MAX_ATTEMPT_TOTAL);
        }

        public Duration throttleWindow() {
            return Duration.ofSeconds(throttleWindowSeconds);
        }

        public ZoneId zone() {
            return ZoneId.of(tradingDayZone);
        }
    }

    public record Retry(
            @Min(1) Integer maxAttempts,
            @PositiveOrZero Long initialBackoffMillis,
            @PositiveOrZero Long maxBackoffMillis,
            @PositiveOrZero Integer maxRateLimitWaits
    ) {
        public Retry {
            if (maxAttempts == null) {
                maxAttempts = 3;
            }
            if (initialBackoffMillis == null) {
                initialBackoffMillis = 200L;
            }
            if (maxBackoffMillis == null) {
                maxBackoffMillis = 2_000L;
            }
            if (maxRateLimitWaits == null) {
                maxRateLimitWaits = 3;
            }
        }
    }

    public record Venues(
            String exchangeVenueId,
            @Valid Kalshi kalshi,
            @Valid OddsApi oddsApi,
            @Valid Paper paper
    ) {
        public Venues {
            if (exchangeVenueId == null || exchangeVenueId.isBlank()) {
                exchangeVenueId = "kalshi";
            }
            if (kalshi == null) {
                kalshi = new Kalshi(null, null, null, null);
            }
            if (oddsApi == null) {
                oddsApi = new OddsApi(null, null, null, null, null);
            }
            if (paper == null) {
                paper = new Paper(null, null);
            }
        }
    }

    public record Kalshi(
            String baseUrl,
            Map<String, String> series,
            Double requestsPerSecond,
            @Min(1) Long timeoutMillis
    ) {
        public Kalshi {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://api.elections.kalshi.com/trade-api/v2";
            }
            if (series == null || series.isEmpty()) {
                series = Map.of(
                        "KXNBAGAME", "basketball_nba",
                        "KXNHLGAME", "icehockey_nhl",
                        "KXNFLGAME", "americanfootball_nfl");
            } else {
                series = Map.copyOf(series);
            }
            if (requestsPerSecond == null) {
                requestsPerSecond = 10.0;
            }
            if (timeoutMillis == null) {
                timeoutMillis = 5_000L;
            }
        }
    }

    public record OddsApi(
            String baseUrl,
            String apiKey,
            @PositiveOrZero Integer minCreditsRemaining,
            Double requestsPerSecond,
            @Min(1) Long timeoutMillis
    ) {
        public OddsApi {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://api.the-odds-api.com/v4";
            }
            if (minCreditsRemaining == null) {
                minCreditsRemaining = 10;
            }
            if (requestsPerSecond == null) {
                requestsPerSecond = 2.0;
            }
            if (timeoutMillis == null) {
                timeoutMillis = 10_000L;
            }
        }
    }

    /** Simulated fills for {@link TradingMode#PAPER}. */
    public record Paper(Double fillProbability, Long seed) {
        public Paper {
            if (fillProbability == null) {
                fillProbability = 0.8;
            }
        }
    }

    public record Alerts(String webhookUrl) {
    }

    public record Journal(Boolean enabled, String path) {
        public Journal {
            if (enabled == null) {
                enabled = true;
            }
            if (path == null || path.isBlank()) {
                path = "logs/journal.jsonl";
            }
        }
    }

    /**
     * Consensus value signal: a bookmaker line whose implied probability sits at least
     * {@code minEdge} below the average across {@code minBooks} or more books. Reported only.
     */
    public record ValueSignal(Boolean enabled, Double minEdge, @Min(2) Integer minBooks) {
        public ValueSignal {
            if (enabled == null) {
                enabled = true;
            }
            if (minEdge == null) {
                minEdge = 0.05;
            }
            if (minBooks == null) {
                minBooks = 3;
            }
        }
    }

    /**
     * Cross-field checks Bean Validation cannot express. All violations are collected into a
     * single {@link ConfigurationException}.
     */
    public ArbProperties validate() {
        List<String> problems = new ArrayList<>();

        if (matching.threshold() <= 0 || matching.threshold() > 1) {
            problems.add("arb.matching.threshold must be in (0, 1]");
        }
        if (matching.nameWeight() < 0 || matching.timeWeight() < 0 || matching.marketTypeWeight() < 0) {
            problems.add("arb.matching weights must be non-negative");
        }
        if (matching.nameWeight() + matching.timeWeight() + matching.marketTypeWeight() <= 0) {
            problems.add("arb.matching weights must not all be zero");
        }
        if (detection.minEdge() < 0 || detection.minEdge() >= 1) {
            problems.add("arb.detection.min-edge must be in [0, 1)");
        }
        if (valueSignal.minEdge() <= 0 || valueSignal.minEdge() >= 1) {
            problems.add("arb.value-signal.min-edge must be in (0, 1)");
        }
        if (detection.noiseThreshold() < 0) {
            problems.add("arb.detection.noise-threshold must be non-negative");
        }
        if (detection.maxBetUnits().signum() <= 0) {
            problems.add("arb.detection.max-bet-units must be positive");
        }
        if (fees.exchangeTakerRate() < 0 || fees.exchangeTakerRate() >= 1) {
            problems.add("arb.fees.exchange-taker-rate must be in [0, 1)");
        }
        fees.oddsCommission().forEach((venue, rate) -> {
            if (rate == null || rate < 0 || rate >= 1) {
                problems.add("arb.fees.odds-commission." + venue + " must be in [0, 1)");
            }
        });
        if (fees.defaultOddsCommission() < 0 || fees.defaultOddsCommission() >= 1) {
            problems.add("arb.fees.default-odds-commission must be in [0, 1)");
        }
        requirePositive(problems, "arb.risk.per-bet-cap", risk.perBetCap());
        requirePositive(problems, "arb.risk.daily-volume-cap", risk.dailyVolumeCap());
        requirePositive(problems, "arb.risk.global-exposure-cap", risk.globalExposureCap());
        requirePositive(problems, "arb.risk.max-attempt-notional", risk.maxAttemptNotional());
        requirePositive(problems, "arb.risk.daily-loss-limit", risk.dailyLossLimit());
        requirePositive(problems, "arb.risk.max-drawdown", risk.maxDrawdown());
        if (risk.minActionableSize().signum() < 0) {
            problems.add("arb.risk.min-actionable-size must be non-negative");
        }
        risk.venueLimits().forEach((venue, limits) -> {
            if (limits != null) {
                requirePositive(problems, "arb.risk.venue-limits." + venue + ".per-bet-cap", limits.perBetCap());
                requirePositive(problems, "arb.risk.venue-limits." + venue + ".daily-volume-cap", limits.dailyVolumeCap());
            }
        });
        try {
            risk.zone();
        } catch (Exception e) {
            problems.add("arb.risk.trading-day-zone is not a valid zone id: " + risk.tradingDayZone());
        }
        if (scan.oddsRefreshMillis() >= scan.quoteFreshnessMillis()) {
            problems.add("arb.scan.odds-refresh-millis must be below quote-freshness-millis");
        }
        if (execution.pollIntervalMillis() > execution.leg1TimeoutMillis()) {
            problems.add("arb.execution.poll-interval-millis must not exceed leg1-timeout-millis");
        }
        double fillProbability = venues.paper().fillProbability();
        if (fillProbability < 0 || fillProbability > 1) {
            problems.add("arb.venues.paper.fill-probability must be in [0, 1]");
        }
        if (retry.maxBackoffMillis() < retry.initialBackoffMillis()) {
            problems.add("arb.retry.max-backoff-millis must be >= initial-backoff-millis");
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
        return this;
    }

    private static void requirePositive(List<String> problems, String name, BigDecimal value) {
        if (value != null && value.signum() <= 0) {
            problems.add(name + " must be positive");
        }
    }

    private static List<String> sanitize(List<String> values, List<String> fallback) {
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        List<String> cleaned = values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return cleaned.isEmpty() ? fallback : cleaned;
    }
}
