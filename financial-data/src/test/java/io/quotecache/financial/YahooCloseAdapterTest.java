package io.quotecache.financial;

import com.codahale.metrics.MetricRegistry;
import io.quotecache.error.FetchException;
import io.quotecache.store.PartitionKey;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YahooCloseAdapterTest {
    static String chart(String zone, List<Long> ts, String closes) {
        return "{\"chart\":{\"result\":[{\"meta\":{\"exchangeTimezoneName\":\"" + zone + "\"},\"timestamp\":" + ts
                + ",\"indicators\":{\"quote\":[{\"close\":" + closes + "}]}}],\"error\":null}}";
    }

    static long marketOpen(LocalDate d) {
        return d.atTime(9, 30).atZone(ZoneId.of("America/New_York")).toEpochSecond();
    }

    @Test
    void mapsTimestampsToExchangeDatesAndSkipsNulls() {
        List<Long> ts = List.of(
                marketOpen(LocalDate.of(2024, 1, 2)),
                marketOpen(LocalDate.of(2024, 1, 3)),
                marketOpen(LocalDate.of(2024, 1, 4)));
        var adapter = new YahooCloseAdapter(uri -> chart("America/New_York", ts, "[185.64,null,181.91]"), null, null);
        Map<LocalDate, Double> closes = adapter.fetch(PartitionKey.of("yahoo", "AAPL", 2024));
        assertEquals(2, closes.size());
        assertEquals(185.64, closes.get(LocalDate.of(2024, 1, 2)));
        assertEquals(181.91, closes.get(LocalDate.of(2024, 1, 4)));
    }

    @Test
    void requestsYearWindowForTicker() {
        List<URI> seen = new ArrayList<>();
        MetricRegistry registry = new MetricRegistry();
        var adapter = new YahooCloseAdapter(uri -> { seen.add(uri); return chart("", List.of(), "[]"); }, "http://yahoo.test/", registry);
        adapter.fetch(PartitionKey.of("yahoo", "USDCNY=X", 2023));
        long p1 = LocalDate.of(2022, 12, 31).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        long p2 = LocalDate.of(2024, 1, 2).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        assertEquals("http://yahoo.test/v8/finance/chart/USDCNY%3DX?interval=1d&period1=" + p1 + "&period2=" + p2, seen.get(0).toString());
        assertEquals(1, registry.counter("yahoo.fetch.windows").getCount());
    }

    @Test
    void upstreamErrorObjectIsAFetchError() {
        String body = "{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\",\"description\":\"No data found, symbol may be delisted\"}}}";
        MetricRegistry registry = new MetricRegistry();
        var adapter = new YahooCloseAdapter(uri -> body, null, registry);
        FetchException e = assertThrows(FetchException.class, () -> adapter.fetch(PartitionKey.of("yahoo", "ZZZZ", 2023)));
        assertTrue(e.getMessage().contains("Not Found"));
        assertEquals(1, registry.counter("yahoo.fetch.failures").getCount());
    }

    @Test
    void garbageIsAFetchError() {
        var adapter = new YahooCloseAdapter(uri -> "<html>", null, null);
        assertThrows(FetchException.class, () -> adapter.fetch(PartitionKey.of("yahoo", "AAPL", 2023)));
    }

    @Test
    void needsTicker() {
        var adapter = new YahooCloseAdapter(uri -> "{}", null, null);
        assertThrows(IllegalArgumentException.class, () -> adapter.fetch(PartitionKey.of("yahoo", 2023)));
    }
}
