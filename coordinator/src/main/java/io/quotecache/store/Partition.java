package io.quotecache.store;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Cached values of one partition plus the time of the fetch that last wrote it. Immutable.
 */
public record Partition(SortedMap<LocalDate, Double> dates, long fetchedAt) {

    public Partition {
        dates = Collections.unmodifiableSortedMap(new TreeMap<>(dates));
    }

    public static Partition empty() { return new Partition(new TreeMap<>(), 0L); }

    public int size() { return dates.size(); }

    public boolean contains(LocalDate date) { return dates.containsKey(date); }

    public OptionalDouble value(LocalDate date) {
        Double v = dates.get(date);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    /** True when a value exists for a date strictly after {@code date}. */
    public boolean hasDateAfter(LocalDate date) {
        return !dates.tailMap(date.plusDays(1)).isEmpty();
    }

    public Optional<LocalDate> latestDate() {
        return dates.isEmpty() ? Optional.empty() : Optional.of(dates.lastKey());
    }

    /**
     * Returns a copy with {@code fetched} merged over the existing entries. Dates outside {@code year} are dropped,
     * as are non-finite values.
     */
    public Partition mergedWith(Map<LocalDate, Double> fetched, int year, long fetchedAtMillis) {
        TreeMap<LocalDate, Double> merged = new TreeMap<>(dates);
        for (Map.Entry<LocalDate, Double> e : fetched.entrySet()) {
            if (e.getKey() == null || e.getKey().getYear() != year) continue;
            Double v = e.getValue();
            if (v == null || v.isNaN() || v.isInfinite()) continue;
            merged.put(e.getKey(), v);
        }
        return new Partition(merged, fetchedAtMillis);
    }
}
