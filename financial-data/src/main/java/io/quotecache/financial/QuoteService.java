package io.quotecache.financial;

import io.quotecache.config.SourceConfig;
import io.quotecache.core.CacheFetchCoordinator;
import io.quotecache.core.LookupResult;
import io.quotecache.core.RefreshOutcome;
import io.quotecache.error.QuoteCacheException;
import io.quotecache.store.PartitionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Public entry points: per-date lookups, cache flush and the periodic refresh, dispatched to the coordinator
 * registered for each source id.
 */
public class QuoteService {
    private static final Logger log = LoggerFactory.getLogger(QuoteService.class);
    private static final Pattern TICKER = Pattern.compile("[A-Za-z0-9.^=_-]{1,20}");

    private final Map<String, CacheFetchCoordinator> coordinators;

    public QuoteService(Map<String, CacheFetchCoordinator> coordinators) {
        this.coordinators = Collections.unmodifiableMap(new LinkedHashMap<>(coordinators));
    }

    public Set<String> sourceIds() { return coordinators.keySet(); }

    public LookupResult getValue(String sourceId, String isoDate) {
        return getValue(sourceId, parseDate(isoDate));
    }

    public LookupResult getValue(String sourceId, LocalDate date) {
        CacheFetchCoordinator c = coordinator(sourceId);
        if (c.config().perTicker()) throw new IllegalArgumentException(sourceId + " needs a ticker");
        return c.resolve(c.keyFor(date), date);
    }

    public LookupResult getValue(String sourceId, String ticker, String isoDate) {
        return getValue(sourceId, ticker, parseDate(isoDate));
    }

    public LookupResult getValue(String sourceId, String ticker, LocalDate date) {
        CacheFetchCoordinator c = coordinator(sourceId);
        if (!c.config().perTicker()) throw new IllegalArgumentException(sourceId + " takes no ticker");
        return c.resolve(c.keyFor(normalizeTicker(ticker), date), date);
    }

    /** Removes every cached partition of the source and returns how many there were. */
    public int flushCache(String sourceId) {
        return coordinator(sourceId).flush();
    }

    /**
     * Refreshes every partition the source knows about: those in the store, the current year (per configured
     * ticker for ticker sources) and absent past years from the configured backfill year. A failing partition is
     * logged and counted; the others still run.
     */
    public RefreshSummary refreshAll(String sourceId) {
        CacheFetchCoordinator c = coordinator(sourceId);
        Map<RefreshOutcome, Integer> outcomes = new EnumMap<>(RefreshOutcome.class);
        int failed = 0;
        for (PartitionKey key : refreshTargets(c)) {
            try {
                outcomes.merge(c.refresh(key), 1, Integer::sum);
            } catch (QuoteCacheException e) {
                failed++;
                log.warn("Refresh of {} failed: {}", key, e.getMessage());
            }
        }
        RefreshSummary summary = new RefreshSummary(sourceId, outcomes, failed);
        log.info("Refreshed {}: {}", sourceId, summary);
        return summary;
    }

    Set<PartitionKey> refreshTargets(CacheFetchCoordinator c) {
        SourceConfig config = c.config();
        int currentYear = c.today().getYear();
        Set<PartitionKey> targets = new TreeSet<>((a, b) -> a.storeKey().compareTo(b.storeKey()));
        for (PartitionKey k : c.knownPartitions()) {
            if (k.hasTicker() == config.perTicker()) {
                targets.add(k);
            } else {
                log.warn("Ignoring stored partition {} whose layout does not match source {}", k, config.sourceId());
            }
        }
        Set<String> tickers = new TreeSet<>();
        if (config.perTicker()) {
            config.tickers().forEach(t -> tickers.add(normalizeTicker(t)));
            targets.forEach(k -> tickers.add(k.ticker()));
        }
        int firstYear = config.backfillFromYear() > 0 ? Math.min(config.backfillFromYear(), currentYear) : currentYear;
        for (int year = firstYear; year <= currentYear; year++) {
            if (config.perTicker()) {
                for (String t : tickers) targets.add(PartitionKey.of(config.sourceId(), t, year));
            } else {
                targets.add(PartitionKey.of(config.sourceId(), year));
            }
        }
        return targets;
    }

    private CacheFetchCoordinator coordinator(String sourceId) {
        CacheFetchCoordinator c = sourceId == null ? null : coordinators.get(sourceId);
        if (c == null) throw new IllegalArgumentException("unknown source: " + sourceId);
        return c;
    }

    static LocalDate parseDate(String isoDate) {
        if (isoDate == null) throw new IllegalArgumentException("date is required");
        try {
            return LocalDate.parse(isoDate.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("not a yyyy-MM-dd date: " + isoDate, e);
        }
    }

    static String normalizeTicker(String ticker) {
        if (ticker == null || !TICKER.matcher(ticker.trim()).matches()) {
            throw new IllegalArgumentException("bad ticker: " + ticker);
        }
        return ticker.trim().toUpperCase(Locale.ROOT);
    }
}
