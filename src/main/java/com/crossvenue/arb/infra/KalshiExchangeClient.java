package com.crossvenue.arb.infra;

import com.crossvenue.arb.core.TeamAliasResolver;
import com.crossvenue.arb.domain.ExchangeInstrument;
import com.crossvenue.arb.domain.LegState;
import com.crossvenue.arb.domain.MarketType;
import com.crossvenue.arb.domain.OrderBook;
import com.crossvenue.arb.domain.OrderHandle;
import com.crossvenue.arb.domain.OrderStatus;
import com.crossvenue.arb.domain.PriceFormat;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.exception.VenueException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Kalshi-style binary exchange. Prices travel in cents (0-100); the order book lists resting
 * YES and NO bids, so the YES ask is {@code 100 - best NO bid}.
 * <p>
 * Game contracts come in pairs per event, one per team, titled {@code "Away at Home Winner?"}
 * with the team code as the ticker suffix ({@code KXNBAGAME-26FEB01OKCDEN-OKC}).
 */
@Slf4j
public class KalshiExchangeClient implements ExchangeClient {

    private static final BigDecimal CENTS = new BigDecimal("100");
    private static final int PAGE_LIMIT = 500;
    private static final int MAX_PAGES = 10;

    private final String venueId;
    private final String baseUrl;
    private final Map<String, String> seriesToSport;
    private final JsonHttpTransport transport;
    private final RetryPolicy retryPolicy;
    private final TeamAliasResolver aliases;
    private final Clock clock;

    public KalshiExchangeClient(String venueId, String baseUrl, Map<String, String> seriesToSport,
                                JsonHttpTransport transport, RetryPolicy retryPolicy,
                                TeamAliasResolver aliases, Clock clock) {
        this.venueId = venueId;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.seriesToSport = Map.copyOf(seriesToSport);
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.aliases = aliases;
        this.clock = clock;
    }

    @Override
    public String venueId() {
        return venueId;
    }

    @Override
    public List<ExchangeInstrument> getInstruments(InstrumentFilter filter) {
        if (!filter.accepts(MarketType.BINARY_WINNER)) {
            return List.of();
        }
        List<ExchangeInstrument> result = new ArrayList<>();
        seriesToSport.forEach((series, sport) -> {
            if (filter.getCategory() == null || filter.getCategory().equals(sport)) {
                result.addAll(fetchSeries(series, sport, filter.isOpenOnly()));
            }
        });
        return result;
    }

    private List<ExchangeInstrument> fetchSeries(String series, String sport, boolean openOnly) {
        List<ExchangeInstrument> instruments = new ArrayList<>();
        String cursor = null;
        for (int page = 0; page < MAX_PAGES; page++) {
            HttpUrl.Builder url = HttpUrl.get(baseUrl + "/markets").newBuilder()
                    .addQueryParameter("series_ticker", series)
                    .addQueryParameter("limit", String.valueOf(PAGE_LIMIT));
            if (openOnly) {
                url.addQueryParameter("status", "open");
            }
            if (cursor != null) {
                url.addQueryParameter("cursor", cursor);
            }
            String target = url.build().toString();
            JsonNode body = retryPolicy.execute("kalshi markets " + series, () -> transport.get(target).body());

            for (JsonNode market : body.path("markets")) {
                parseInstrument(market, series, sport).ifPresent(instruments::add);
            }
            cursor = body.path("cursor").asText("");
            if (cursor.isEmpty() || body.path("markets").size() < PAGE_LIMIT) {
                break;
            }
        }
        log.debug("[{}] {} instruments in series {}", venueId, instruments.size(), series);
        return instruments;
    }

    Optional<ExchangeInstrument> parseInstrument(JsonNode market, String series, String sport) {
        String ticker = market.path("ticker").asText("");
        String title = market.path("title").asText("");
        String[] teams = parseMatchup(title);
        if (ticker.isEmpty() || teams == null) {
            log.debug("[{}] skipping {}: unrecognised title '{}'", venueId, ticker, title);
            return Optional.empty();
        }
        String away = aliases.canonicalOrSelf(sport, teams[0]);
        String home = aliases.canonicalOrSelf(sport, teams[1]);

        String subject = resolveSubject(ticker, market.path("yes_sub_title").asText(null), sport, home, away);
        if (subject == null) {
            log.debug("[{}] skipping {}: cannot tell which team YES refers to", venueId, ticker);
            return Optional.empty();
        }

        return Optional.of(ExchangeInstrument.builder()
                .instrumentId(ticker)
                .eventId(market.path("event_ticker").asText(ticker))
                .category(sport)
                .title(title)
                .homeParticipant(home)
                .awayParticipant(away)
                .subject(subject)
                .scheduledStart(parseTime(market, "expected_expiration_time", "close_time"))
                .marketType(MarketType.BINARY_WINNER)
                .volume24h(new BigDecimal(market.path("volume_24h").asText("0")))
                .build());
    }

    /** "Oklahoma City at Denver Winner?" to {away, home}. */
    static String[] parseMatchup(String title) {
        String matchup = title.endsWith(" Winner?") ? title.substring(0, title.length() - " Winner?".length()) : title;
        int at = matchup.indexOf(" at ");
        if (at <= 0) {
            return null;
        }
        String away = matchup.substring(0, at).trim();
        String home = matchup.substring(at + 4).trim();
        return away.isEmpty() || home.isEmpty() ? null : new String[]{away, home};
    }

    private String resolveSubject(String ticker, String yesSubTitle, String sport, String home, String away) {
        String[] parts = ticker.split("-");
        String code = parts.length >= 3 ? parts[parts.length - 1] : "";

        for (String hint : new String[]{code, yesSubTitle}) {
            Optional<String> team = aliases.resolve(sport, hint);
            if (team.isPresent()) {
                if (team.get().equals(home)) {
                    return home;
                }
                if (team.get().equals(away)) {
                    return away;
                }
            }
        }
        if (!code.isEmpty()) {
            String upper = code.toUpperCase(Locale.ROOT);
            if (compact(home).contains(upper)) {
                return home;
            }
            if (compact(away).contains(upper)) {
                return away;
            }
        }
        return null;
    }

    private static String compact(String name) {
        return name.toUpperCase(Locale.ROOT).replace(" ", "").replace(".", "");
    }

    private static Instant parseTime(JsonNode market, String... fields) {
        for (String field : fields) {
            String raw = market.path(field).asText("");
            if (!raw.isEmpty()) {
                try {
                    return Instant.parse(raw);
                } catch (DateTimeParseException e) {
                    log.debug("Unparseable {} '{}'", field, raw);
                }
            }
        }
        return null;
    }

    @Override
    public OrderBook getOrderBook(String instrumentId) {
        String url = baseUrl + "/markets/" + instrumentId + "/orderbook";
        JsonNode book = retryPolicy.execute("kalshi orderbook " + instrumentId, () -> transport.get(url).body())
                .path("orderbook");

        List<OrderBook.OrderLevel> bids = parseLevels(book.path("yes"), false);
        List<OrderBook.OrderLevel> asks = parseLevels(book.path("no"), true);
        return OrderBook.builder()
                .instrumentId(instrumentId)
                .timestamp(clock.instant())
                .bids(bids)
                .asks(asks)
                .build();
    }

    /** Levels arrive as {@code [priceCents, quantity]}; NO bids become YES asks at 100 - p. */
    private static List<OrderBook.OrderLevel> parseLevels(JsonNode levels, boolean invert) {
        List<OrderBook.OrderLevel> list = new ArrayList<>();
        if (levels.isArray()) {
            for (JsonNode l : levels) {
                BigDecimal cents = new BigDecimal(l.path(0).asText("0"));
                BigDecimal price = (invert ? CENTS.subtract(cents) : cents).divide(CENTS, 4, RoundingMode.HALF_UP);
                list.add(OrderBook.OrderLevel.builder()
                        .price(price)
                        .size(new BigDecimal(l.path(1).asText("0")))
                        .build());
            }
        }
        return list;
    }

    @Override
    public OrderHandle placeOrder(String instrumentId, Side side, BigDecimal price, PriceFormat priceFormat, BigDecimal size) {
        if (priceFormat != PriceFormat.PROBABILITY) {
            throw new VenueException(venueId, "exchange orders must be priced as probabilities, got " + priceFormat);
        }
        int count = size.setScale(0, RoundingMode.FLOOR).intValueExact();
        if (count <= 0) {
            throw new VenueException(venueId, "order size " + size + " is below one contract");
        }
        int cents = price.multiply(CENTS).setScale(0, RoundingMode.HALF_UP).intValueExact();
        String sideName = side == Side.A ? "yes" : "no";

        ObjectNode payload = transport.getObjectMapper().createObjectNode();
        payload.put("ticker", instrumentId);
        payload.put("client_order_id", UUID.randomUUID().toString());
        payload.put("action", "buy");
        payload.put("side", sideName);
        payload.put("type", "limit");
        payload.put("count", count);
        payload.put(sideName + "_price", cents);

        // same client_order_id on every retry, so the venue deduplicates a resend
        JsonNode order = retryPolicy.execute("kalshi place " + instrumentId,
                () -> transport.postOrder(baseUrl + "/portfolio/orders", payload).body()).path("order");
        String orderId = order.path("order_id").asText("");
        if (orderId.isEmpty()) {
            throw new VenueException(venueId, "order response carried no order_id");
        }
        log.info("[{}] placed {} {} x{} @ {}c -> {}", venueId, sideName, instrumentId, count, cents, orderId);
        return new OrderHandle(venueId, orderId, instrumentId, clock.instant());
    }

    @Override
    public OrderStatus getOrderStatus(OrderHandle handle) {
        String url = baseUrl + "/portfolio/orders/" + handle.getOrderId();
        JsonNode order = retryPolicy.execute("kalshi order status", () -> transport.get(url).body()).path("order");
        return parseStatus(order);
    }

    static OrderStatus parseStatus(JsonNode order) {
        String status = order.path("status").asText("");
        BigDecimal filled;
        if (order.has("fill_count")) {
            filled = new BigDecimal(order.path("fill_count").asText("0"));
        } else {
            BigDecimal initial = new BigDecimal(order.path("initial_count").asText(order.path("count").asText("0")));
            filled = initial.subtract(new BigDecimal(order.path("remaining_count").asText("0"))).max(BigDecimal.ZERO);
        }

        BigDecimal averagePrice = null;
        if (filled.signum() > 0 && order.has("taker_fill_cost")) {
            averagePrice = new BigDecimal(order.path("taker_fill_cost").asText("0"))
                    .divide(filled.multiply(CENTS), 4, RoundingMode.HALF_UP);
        }

        LegState state = switch (status) {
            case "executed" -> LegState.FILLED;
            case "canceled", "cancelled" -> filled.signum() > 0 ? LegState.PARTIALLY_FILLED : LegState.CANCELLED;
            case "rejected" -> LegState.REJECTED;
            default -> filled.signum() > 0 ? LegState.PARTIALLY_FILLED : LegState.SUBMITTED;
        };
        return OrderStatus.builder()
                .state(state)
                .filledSize(filled)
                .averagePrice(averagePrice)
                .message(status)
                .build();
    }

    @Override
    public void cancelOrder(OrderHandle handle) {
        String url = baseUrl + "/portfolio/orders/" + handle.getOrderId();
        retryPolicy.execute("kalshi cancel", () -> transport.delete(url));
        log.info("[{}] cancel requested for {}", venueId, handle.getOrderId());
    }
}
