package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.ExchangeInstrument;
import com.crossvenue.arb.domain.OddsLine;
import com.crossvenue.arb.domain.OrderBook;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest catalog data per sport (exchange instruments, odds lines per source) and latest
 * order book per instrument. Written by the {@link SnapshotIngestor}, read by the scan cycle.
 */
@Component
public class MarketSnapshotCache {

    private final ConcurrentHashMap<String, List<ExchangeInstrument>> instruments = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<OddsLine>> lines = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> refreshedAt = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, OrderBook> books = new ConcurrentHashMap<>();

    public void putInstruments(String sport, List<ExchangeInstrument> list, Instant at) {
        instruments.put(sport, List.copyOf(list));
        refreshedAt.put("exchange|" + sport, at);
    }

    public void putLines(String sport, String sourceId, List<OddsLine> list, Instant at) {
        lines.put(sport + "|" + sourceId, List.copyOf(list));
        refreshedAt.put(sourceId + "|" + sport, at);
    }

    public void putBook(OrderBook book) {
        books.put(book.getInstrumentId(), book);
    }

    /** True when the exchange catalog for {@code sport} was never fetched or is older than {@code every}. */
    public boolean isInstrumentRefreshDue(String sport, Instant now, Duration every) {
        return isDue("exchange|" + sport, now, every);
    }

    public boolean isLineRefreshDue(String sport, String sourceId, Instant now, Duration every) {
        return isDue(sourceId + "|" + sport, now, every);
    }

    private boolean isDue(String key, Instant now, Duration every) {
        Instant last = refreshedAt.get(key);
        return last == null || Duration.between(last, now).compareTo(every) >= 0;
    }

    public List<ExchangeInstrument> getInstruments(String sport) {
        return instruments.getOrDefault(sport, List.of());
    }

    public List<OddsLine> getLines(String sport) {
        List<OddsLine> out = new ArrayList<>();
        String prefix = sport + "|";
        lines.forEach((key, value) -> {
            if (key.startsWith(prefix)) {
                out.addAll(value);
            }
        });
        return out;
    }

    public OrderBook getBook(String instrumentId) {
        return books.get(instrumentId);
    }

    /** Drops books for instruments no longer matched. */
    public void retainBooks(Collection<String> instrumentIds) {
        books.keySet().retainAll(instrumentIds);
    }
}
