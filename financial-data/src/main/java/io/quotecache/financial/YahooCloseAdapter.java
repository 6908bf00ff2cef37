package io.quotecache.financial;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quotecache.core.FetchAdapter;
import io.quotecache.error.FetchException;
import io.quotecache.store.PartitionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Daily closes for one ticker and calendar year from the Yahoo Finance v8 chart API. Timestamps are mapped to
 * dates in the exchange's own time zone when the answer names one.
 */
public class YahooCloseAdapter implements FetchAdapter {
    private static final Logger log = LoggerFactory.getLogger(YahooCloseAdapter.class);
    public static final String DEFAULT_BASE_URL = "https://query1.finance.yahoo.com";

    private final UpstreamClient client;
    private final String baseUrl;
    private final MetricRegistry registry; // optional
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();

    public YahooCloseAdapter(UpstreamClient client, String baseUrl, MetricRegistry registry) {
        this.client = client;
        this.baseUrl = baseUrl == null ? DEFAULT_BASE_URL : baseUrl.replaceAll("/+$", "");
        this.registry = registry;
    }

    @Override
    public Map<LocalDate, Double> fetch(PartitionKey partition) {
        String ticker = partition.ticker();
        if (ticker == null) throw new IllegalArgumentException("yahoo partitions need a ticker: " + partition);
        int year = partition.year();
        // widen by a day on each side; dates outside the year are dropped on merge
        long p1 = LocalDate.of(year, 1, 1).minusDays(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        long p2 = LocalDate.of(year + 1, 1, 1).plusDays(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        URI uri = URI.create(String.format("%s/v8/finance/chart/%s?interval=1d&period1=%d&period2=%d",
                baseUrl, URLEncoder.encode(ticker, StandardCharsets.UTF_8), p1, p2));
        if (registry != null) registry.counter("yahoo.fetch.windows").inc();
        try {
            Map<LocalDate, Double> closes = parse(client.get(uri));
            consecutiveFailures.remove(ticker);
            if (registry != null) registry.counter("yahoo.rows.fetched").inc(closes.size());
            return closes;
        } catch (FetchException e) {
            if (registry != null) registry.counter("yahoo.fetch.failures").inc();
            int streak = consecutiveFailures.merge(ticker, 1, Integer::sum);
            if (streak >= 5 && streak % 5 == 0) {
                log.warn("Yahoo failure streak={} ticker={} year={} err={}", streak, ticker, year, e.getMessage());
            }
            throw e;
        }
    }

    Map<LocalDate, Double> parse(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException("unreadable Yahoo answer", e);
        }
        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new FetchException("Yahoo error: " + error.path("code").asText() + " " + error.path("description").asText());
        }
        JsonNode result = chart.path("result").path(0);
        if (result.isMissingNode()) throw new FetchException("Yahoo answer has no result");
        ZoneId zone = zoneOf(result.path("meta").path("exchangeTimezoneName").asText(""));
        JsonNode timestamps = result.path("timestamp");
        JsonNode closes = result.path("indicators").path("quote").path(0).path("close");
        Map<LocalDate, Double> out = new TreeMap<>();
        int n = Math.min(timestamps.size(), closes.size());
        for (int i = 0; i < n; i++) {
            JsonNode close = closes.get(i);
            if (close == null || !close.isNumber()) continue; // null for halted days
            LocalDate d = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(zone).toLocalDate();
            out.put(d, close.asDouble());
        }
        return out;
    }

    private static ZoneId zoneOf(String name) {
        if (name.isEmpty()) return ZoneOffset.UTC;
        try {
            return ZoneId.of(name);
        } catch (DateTimeException e) {
            log.debug("Unknown exchange zone {}, using UTC", name);
            return ZoneOffset.UTC;
        }
    }
}
