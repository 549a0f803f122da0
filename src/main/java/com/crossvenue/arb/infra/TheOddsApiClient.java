package com.crossvenue.arb.infra;

import com.crossvenue.arb.domain.MarketType;
import com.crossvenue.arb.domain.OddsLine;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Quote;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.exception.VenueException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.HttpUrl;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * TheOddsAPI v4 aggregator. Every request costs credits, reported back in the
 * {@code X-Requests-Remaining} / {@code X-Requests-Used} headers; calls are refused once the
 * remaining balance drops below the configured floor.
 */
@Slf4j
public class TheOddsApiClient implements OddsVenueClient {

    public static final String SOURCE_ID = "the-odds-api";

    private static final int UNKNOWN = -1;

    private final String baseUrl;
    private final String apiKey;
    private final List<String> bookmakers;
    private final int minCreditsRemaining;
    private final JsonHttpTransport transport;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    private final AtomicInteger creditsRemaining = new AtomicInteger(UNKNOWN);
    private final AtomicInteger creditsUsed = new AtomicInteger(UNKNOWN);

    public TheOddsApiClient(String baseUrl, String apiKey, List<String> bookmakers, int minCreditsRemaining,
                            JsonHttpTransport transport, RetryPolicy retryPolicy, Clock clock) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.bookmakers = List.copyOf(bookmakers);
        this.minCreditsRemaining = minCreditsRemaining;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public List<OddsLine> getLines(String sport, List<String> regions, List<MarketType> marketTypes) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new VenueException(SOURCE_ID, "no API key configured (set ODDS_API_KEY)");
        }
        checkCredits();

        HttpUrl.Builder url = HttpUrl.get(baseUrl + "/sports/" + sport + "/odds").newBuilder()
                .addQueryParameter("apiKey", apiKey)
                .addQueryParameter("regions", String.join(",", regions))
                .addQueryParameter("markets", marketTypes.stream()
                        .map(MarketType::toOddsApiKey)
                        .distinct()
                        .collect(Collectors.joining(",")))
                .addQueryParameter("oddsFormat", "american");
        if (!bookmakers.isEmpty()) {
            url.addQueryParameter("bookmakers", String.join(",", bookmakers));
        }
        String target = url.build().toString();

        JsonHttpTransport.JsonResponse response = retryPolicy.execute("odds " + sport, () -> transport.get(target));
        updateCredits(response.headers());

        Instant observedAt = clock.instant();
        List<OddsLine> lines = new ArrayList<>();
        for (JsonNode event : response.body()) {
            lines.addAll(parseEvent(event, sport, observedAt));
        }
        log.debug("[{}] {} lines for {} (credits remaining {})", SOURCE_ID, lines.size(), sport, creditsRemaining.get());
        return lines;
    }

    List<OddsLine> parseEvent(JsonNode event, String sport, Instant observedAt) {
        String eventId = event.path("id").asText();
        String home = event.path("home_team").asText(null);
        String away = event.path("away_team").asText(null);
        Instant commence = parseInstant(event.path("commence_time").asText(""));

        List<OddsLine> lines = new ArrayList<>();
        for (JsonNode bookmaker : event.path("bookmakers")) {
            String venueId = bookmaker.path("key").asText();
            for (JsonNode market : bookmaker.path("markets")) {
                MarketType type = MarketType.fromOddsApiKey(market.path("key").asText());
                JsonNode outcomes = market.path("outcomes");
                // two-way markets only; three-way (draw) markets have no single complement
                if (type == null || outcomes.size() != 2) {
                    continue;
                }
                for (int i = 0; i < 2; i++) {
                    JsonNode outcome = outcomes.get(i);
                    JsonNode other = outcomes.get(1 - i);
                    String marketKey = market.path("key").asText();
                    BigDecimal point = outcome.hasNonNull("point") ? new BigDecimal(outcome.path("point").asText()) : null;

                    lines.add(OddsLine.builder()
                            .venueId(venueId)
                            .eventId(eventId)
                            .category(sport)
                            .homeTeam(home)
                            .awayTeam(away)
                            .commenceTime(commence)
                            .marketType(type)
                            .outcome(outcome.path("name").asText())
                            .complementOutcome(other.path("name").asText())
                            .point(point)
                            .quote(quote(venueId, eventId, marketKey, outcome, Side.A, observedAt))
                            .complement(quote(venueId, eventId, marketKey, other, Side.B, observedAt))
                            .build());
                }
            }
        }
        return lines;
    }

    private static Quote quote(String venueId, String eventId, String marketKey, JsonNode outcome, Side side, Instant at) {
        String instrumentId = eventId + ":" + marketKey + ":" + outcome.path("name").asText()
                + (outcome.hasNonNull("point") ? ":" + outcome.path("point").asText() : "");
        return Quote.builder()
                .venueId(venueId)
                .instrumentId(instrumentId)
                .side(side)
                .price(new BigDecimal(outcome.path("price").asText()))
                .priceFormat(PriceFormat.AMERICAN)
                .timestamp(at)
                .build();
    }

    private static Instant parseInstant(String raw) {
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private void checkCredits() {
        int remaining = creditsRemaining.get();
        if (remaining != UNKNOWN && remaining < minCreditsRemaining) {
            throw new VenueException(SOURCE_ID, "API credits nearly exhausted: " + remaining + " remaining");
        }
    }

    private void updateCredits(Headers headers) {
        parseInt(headers.get("X-Requests-Remaining")).ifPresent(creditsRemaining::set);
        parseInt(headers.get("X-Requests-Used")).ifPresent(creditsUsed::set);
    }

    private static OptionalInt parseInt(String header) {
        if (header == null || header.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            // the API sometimes reports fractional credits
            return OptionalInt.of((int) Double.parseDouble(header.trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public OptionalInt getCreditsRemaining() {
        int v = creditsRemaining.get();
        return v == UNKNOWN ? OptionalInt.empty() : OptionalInt.of(v);
    }

    public OptionalInt getCreditsUsed() {
        int v = creditsUsed.get();
        return v == UNKNOWN ? OptionalInt.empty() : OptionalInt.of(v);
    }
}
