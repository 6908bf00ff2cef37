package io.quotecache.core;

import io.quotecache.store.Partition;
import io.quotecache.store.PartitionKey;

import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Outcome of a lookup. An empty value is the "no data" answer: upstream publishes nothing for that date.
 */
public record LookupResult(PartitionKey partition, LocalDate date, OptionalDouble value, Origin origin) {

    public enum Origin {
        /** Served from the store without fetching. */
        CACHE,
        /** Served after this call fetched the partition. */
        FETCH,
        /** Lease was busy; served whatever the store held. */
        FALLBACK
    }

    static LookupResult from(PartitionKey key, LocalDate date, Optional<Partition> partition, Origin origin) {
        OptionalDouble v = partition.map(p -> p.value(date)).orElse(OptionalDouble.empty());
        return new LookupResult(key, date, v, origin);
    }

    public boolean isNoData() { return value.isEmpty(); }
}
