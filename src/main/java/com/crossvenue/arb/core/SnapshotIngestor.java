package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbProperties;
import com.crossvenue.arb.domain.ExchangeInstrument;
import com.crossvenue.arb.domain.MarketType;
import com.crossvenue.arb.domain.MatchedPair;
import com.crossvenue.arb.domain.OddsLine;
import com.crossvenue.arb.domain.OrderBook;
import com.crossvenue.arb.infra.ExchangeClient;
import com.crossvenue.arb.infra.InstrumentFilter;
import com.crossvenue.arb.infra.OddsVenueClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pulls venue data into the {@link MarketSnapshotCache}. Catalogs (instruments and odds lines)
 * refresh on the odds cadence; order books refresh every cycle for matched instruments only.
 * A failing venue or sport is logged and skipped, the rest of the cycle goes on with whatever
 * the cache still holds.
 */
@Slf4j
@Service
public class SnapshotIngestor {

    private final ExchangeClient exchange;
    private final List<OddsVenueClient> oddsClients;
    private final MarketSnapshotCache cache;
    private final ArbProperties.Scan scan;
    private final List<MarketType> marketTypes;

    public SnapshotIngestor(ExchangeClient exchange, List<OddsVenueClient> oddsClients, MarketSnapshotCache cache,
                            ArbProperties properties) {
        this.exchange = exchange;
        this.oddsClients = List.copyOf(oddsClients);
        this.cache = cache;
        this.scan = properties.scan();
        this.marketTypes = scan.marketTypes().stream()
                .map(MarketType::fromOddsApiKey)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    public void refreshCatalogs(Instant now) {
        for (String sport : scan.sports()) {
            if (cache.isInstrumentRefreshDue(sport, now, scan.oddsRefresh())) {
                refreshInstruments(sport, now);
            }
            for (OddsVenueClient client : oddsClients) {
                if (cache.isLineRefreshDue(sport, client.sourceId(), now, scan.oddsRefresh())) {
                    refreshLines(client, sport, now);
                }
            }
        }
    }

    private void refreshInstruments(String sport, Instant now) {
        InstrumentFilter.InstrumentFilterBuilder filter = InstrumentFilter.builder().category(sport);
        marketTypes.forEach(t -> filter.marketType(t.exchangeCounterpart()));
        try {
            List<ExchangeInstrument> list = exchange.getInstruments(filter.build());
            cache.putInstruments(sport, list, now);
            log.info("[INGEST] {} {} instruments from {}", list.size(), sport, exchange.venueId());
        } catch (RuntimeException e) {
            log.warn("[INGEST] Instruments for {} from {} unavailable: {}", sport, exchange.venueId(), e.getMessage());
        }
    }

    private void refreshLines(OddsVenueClient client, String sport, Instant now) {
        try {
            List<OddsLine> lines = client.getLines(sport, scan.regions(), marketTypes);
            cache.putLines(sport, client.sourceId(), lines, now);
            log.info("[INGEST] {} {} lines from {}", lines.size(), sport, client.sourceId());
        } catch (RuntimeException e) {
            log.warn("[INGEST] Lines for {} from {} unavailable: {}", sport, client.sourceId(), e.getMessage());
        }
    }

    /** Fetches the current book of every matched instrument; pairs whose fetch fails are left out. */
    public Map<String, OrderBook> refreshBooks(Collection<MatchedPair> pairs) {
        Map<String, OrderBook> books = new HashMap<>();
        for (MatchedPair pair : pairs) {
            String id = pair.key();
            try {
                OrderBook book = exchange.getOrderBook(id);
                cache.putBook(book);
                books.put(id, book);
            } catch (RuntimeException e) {
                log.warn("[INGEST] Order book for {} unavailable: {}", id, e.getMessage());
            }
        }
        cache.retainBooks(books.keySet());
        return books;
    }
}
