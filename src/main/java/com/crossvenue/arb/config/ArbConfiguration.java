package com.crossvenue.arb.config;

import com.crossvenue.arb.core.ArbitrageDetectionEngine;
import com.crossvenue.arb.core.ConsensusValueScanner;
import com.crossvenue.arb.core.LeggingExecutionCoordinator;
import com.crossvenue.arb.core.MarketMatcher;
import com.crossvenue.arb.core.NameSimilarity;
import com.crossvenue.arb.core.OpportunityArena;
import com.crossvenue.arb.core.TeamAliasResolver;
import com.crossvenue.arb.infra.AlertDispatcher;
import com.crossvenue.arb.infra.AlertSink;
import com.crossvenue.arb.infra.ExchangeClient;
import com.crossvenue.arb.infra.JsonHttpTransport;
import com.crossvenue.arb.infra.JsonLinesTradeJournal;
import com.crossvenue.arb.infra.KalshiExchangeClient;
import com.crossvenue.arb.infra.LoggingAlertSink;
import com.crossvenue.arb.infra.OddsVenueClient;
import com.crossvenue.arb.infra.PaperTradingVenue;
import com.crossvenue.arb.infra.RequestAuthenticator;
import com.crossvenue.arb.infra.RequestRateLimiter;
import com.crossvenue.arb.infra.RetryPolicy;
import com.crossvenue.arb.infra.TheOddsApiClient;
import com.crossvenue.arb.infra.TradeJournal;
import com.crossvenue.arb.infra.VenueRegistry;
import com.crossvenue.arb.infra.WebhookAlertSink;
import com.crossvenue.arb.risk.ExposureLedger;
import com.crossvenue.arb.risk.KillSwitch;
import com.crossvenue.arb.risk.PortfolioManager;
import com.crossvenue.arb.risk.RiskManager;
import com.crossvenue.arb.risk.ThrottleDetector;
import com.crossvenue.arb.risk.VenueRotation;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires venues, matching, detection, execution and risk from {@link ArbProperties}. Invalid
 * caps or thresholds fail here, before any bean that trades is created.
 */
@Slf4j
@Configuration
public class ArbConfiguration {

    private final ArbProperties properties;

    public ArbConfiguration(ArbProperties properties) {
        this.properties = properties.validate();
        log.info("[CONFIG] Mode {} | exchange {} | sports {} | min edge {}", properties.mode(),
                properties.venues().exchangeVenueId(), properties.scan().sports(), properties.detection().minEdge());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        ArbProperties.Retry retry = properties.retry();
        return new RetryPolicy(retry.maxAttempts(), Duration.ofMillis(retry.initialBackoffMillis()),
                Duration.ofMillis(retry.maxBackoffMillis()), retry.maxRateLimitWaits());
    }

    // --- venues ---

    @Bean
    public TeamAliasResolver teamAliasResolver(ObjectMapper objectMapper) {
        return TeamAliasResolver.fromClasspath(objectMapper);
    }

    @Bean
    public ExchangeClient exchangeClient(OkHttpClient okHttpClient, ObjectMapper objectMapper, RetryPolicy retryPolicy,
                                         TeamAliasResolver aliases, ObjectProvider<RequestAuthenticator> authenticator,
                                         Clock clock) {
        ArbProperties.Kalshi kalshi = properties.venues().kalshi();
        String venueId = properties.venues().exchangeVenueId();
        OkHttpClient http = okHttpClient.newBuilder().callTimeout(Duration.ofMillis(kalshi.timeoutMillis())).build();
        JsonHttpTransport transport = new JsonHttpTransport(venueId, http, objectMapper,
                RequestRateLimiter.perSecond(kalshi.requestsPerSecond()),
                authenticator.getIfAvailable(RequestAuthenticator::none));
        return new KalshiExchangeClient(venueId, kalshi.baseUrl(), kalshi.series(), transport, retryPolicy, aliases, clock);
    }

    @Bean
    public OddsVenueClient oddsVenueClient(OkHttpClient okHttpClient, ObjectMapper objectMapper, RetryPolicy retryPolicy,
                                           Clock clock) {
        ArbProperties.OddsApi oddsApi = properties.venues().oddsApi();
        OkHttpClient http = okHttpClient.newBuilder().callTimeout(Duration.ofMillis(oddsApi.timeoutMillis())).build();
        JsonHttpTransport transport = new JsonHttpTransport(TheOddsApiClient.SOURCE_ID, http, objectMapper,
                RequestRateLimiter.perSecond(oddsApi.requestsPerSecond()), RequestAuthenticator.none());
        return new TheOddsApiClient(oddsApi.baseUrl(), oddsApi.apiKey(), properties.scan().bookmakers(),
                oddsApi.minCreditsRemaining(), transport, retryPolicy, clock);
    }

    /**
     * PAPER simulates every venue. LIVE places orders on the exchange only; odds venues stay
     * read-only until a placement adapter is registered for them.
     */
    @Bean
    public VenueRegistry venueRegistry(ExchangeClient exchangeClient, Clock clock) {
        if (properties.mode() == ArbProperties.TradingMode.PAPER) {
            ArbProperties.Paper paper = properties.venues().paper();
            Random random = paper.seed() != null ? new Random(paper.seed()) : new Random();
            log.warn("[CONFIG] PAPER mode: orders are simulated (fill probability {})", paper.fillProbability());
            return new VenueRegistry(id -> new PaperTradingVenue(id, paper.fillProbability(), random, clock));
        }
        return new VenueRegistry().register(exchangeClient);
    }

    // --- alerts & journal ---

    @Bean(destroyMethod = "shutdown")
    public ExecutorService alertExecutor() {
        return Executors.newSingleThreadExecutor(named("arb-alert"));
    }

    @Bean
    public AlertSink alertSink(OkHttpClient okHttpClient, ObjectMapper objectMapper,
                                @Qualifier("alertExecutor") ExecutorService alertExecutor) {
        List<AlertSink> sinks = new ArrayList<>();
        sinks.add(new LoggingAlertSink());
        String webhook = properties.alerts().webhookUrl();
        if (webhook != null && !webhook.isBlank()) {
            sinks.add(new WebhookAlertSink(webhook, okHttpClient, objectMapper));
        }
        return new AlertDispatcher(sinks, alertExecutor);
    }

    @Bean
    public TradeJournal tradeJournal(ObjectMapper objectMapper) {
        ArbProperties.Journal journal = properties.journal();
        if (!journal.enabled()) {
            return TradeJournal.noop();
        }
        return new JsonLinesTradeJournal(Path.of(journal.path()), objectMapper);
    }

    // --- matching & detection ---

    @Bean
    public MarketMatcher marketMatcher(TeamAliasResolver aliases) {
        return new MarketMatcher(new NameSimilarity(aliases), properties.matching());
    }

    @Bean
    public VenueRotation venueRotation() {
        return new VenueRotation(properties.risk());
    }

    @Bean
    public ArbitrageDetectionEngine arbitrageDetectionEngine(VenueRotation venueRotation, Clock clock) {
        return new ArbitrageDetectionEngine(properties.detection(), properties.fees(), properties.scan().quoteFreshness(),
                venueRotation, properties.venues().exchangeVenueId(), clock);
    }

    @Bean
    public ConsensusValueScanner consensusValueScanner() {
        return new ConsensusValueScanner(properties.valueSignal(), properties.scan().quoteFreshness(), properties.risk());
    }

    @Bean
    public OpportunityArena opportunityArena() {
        return new OpportunityArena(properties.detection().noiseThreshold());
    }

    // --- risk ---

    @Bean
    public ExposureLedger exposureLedger(Clock clock) {
        return new ExposureLedger(clock, properties.risk().zone());
    }

    @Bean
    public RiskManager riskManager() {
        return new RiskManager(properties.risk());
    }

    @Bean
    public PortfolioManager portfolioManager(ExposureLedger ledger, RiskManager riskManager, AlertSink alertSink,
                                             TradeJournal tradeJournal, Clock clock) {
        ArbProperties.Risk risk = properties.risk();
        return new PortfolioManager(ledger, riskManager,
                new ThrottleDetector(risk.throttleRejections(), risk.throttleWindow()),
                new KillSwitch(risk.dailyLossLimit(), risk.maxDrawdown()),
                alertSink, tradeJournal, clock, properties.fees().exchangeTakerRate());
    }

    // --- execution ---

    @Bean(destroyMethod = "shutdown")
    public ExecutorService attemptWorkers() {
        int threads = properties.execution().workerThreads();
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(threads * 4), named("arb-exec"), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public LeggingExecutionCoordinator leggingExecutionCoordinator(VenueRegistry venueRegistry,
                                                                   PortfolioManager portfolioManager,
                                                                   RetryPolicy retryPolicy,
                                                                   @Qualifier("attemptWorkers") ExecutorService attemptWorkers,
                                                                   Clock clock) {
        return new LeggingExecutionCoordinator(venueRegistry, portfolioManager, retryPolicy, attemptWorkers, clock,
                RetryPolicy.THREAD_SLEEPER, properties.execution(), properties.detection().staleness(),
                properties.fees().exchangeTakerRate());
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
