package io.quotecache.store;

import java.util.Objects;
import java.util.Optional;

/**
 * Identifies one calendar year of a source's data, optionally per ticker.
 * Rendered as {@code <sourceId>:<year>} or {@code <sourceId>:<ticker>:<year>}.
 */
public record PartitionKey(String sourceId, String ticker, int year) {
    private static final String LOCK_PREFIX = "lock:";

    public PartitionKey {
        Objects.requireNonNull(sourceId, "sourceId");
        if (sourceId.isBlank() || sourceId.contains(":")) throw new IllegalArgumentException("bad source id: " + sourceId);
        if (ticker != null && (ticker.isBlank() || ticker.contains(":"))) throw new IllegalArgumentException("bad ticker: " + ticker);
        if (year < 1 || year > 9999) throw new IllegalArgumentException("bad year: " + year);
    }

    public static PartitionKey of(String sourceId, int year) { return new PartitionKey(sourceId, null, year); }
    public static PartitionKey of(String sourceId, String ticker, int year) { return new PartitionKey(sourceId, ticker, year); }

    /** Key prefix shared by all partitions of a source. */
    public static String prefix(String sourceId) { return sourceId + ":"; }

    /** Parses a rendered key; empty when the text is not a partition key. */
    public static Optional<PartitionKey> parse(String key) {
        if (key == null || key.startsWith(LOCK_PREFIX)) return Optional.empty();
        String[] parts = key.split(":", -1);
        try {
            if (parts.length == 2) return Optional.of(of(parts[0], Integer.parseInt(parts[1])));
            if (parts.length == 3) return Optional.of(of(parts[0], parts[1], Integer.parseInt(parts[2])));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    public boolean hasTicker() { return ticker != null; }

    public PartitionKey withYear(int otherYear) { return new PartitionKey(sourceId, ticker, otherYear); }

    public String storeKey() {
        return ticker == null ? sourceId + ":" + year : sourceId + ":" + ticker + ":" + year;
    }

    public String lockKey() { return LOCK_PREFIX + storeKey(); }

    @Override
    public String toString() { return storeKey(); }
}
