package io.quotecache.core;

import io.quotecache.error.FetchException;
import io.quotecache.store.PartitionKey;

import java.time.LocalDate;
import java.util.Map;

/**
 * Retrieves every published value of one partition from the upstream source.
 */
@FunctionalInterface
public interface FetchAdapter {
    Map<LocalDate, Double> fetch(PartitionKey partition) throws FetchException;
}
