package io.quotecache.core;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import io.quotecache.config.AdmissionPolicy;
import io.quotecache.config.SourceConfig;
import io.quotecache.error.FetchException;
import io.quotecache.error.FetchUnavailableException;
import io.quotecache.error.NotYetAvailableException;
import io.quotecache.lease.Lease;
import io.quotecache.lease.LeaseLock;
import io.quotecache.lease.LockTimeoutException;
import io.quotecache.metrics.Metrics;
import io.quotecache.ratelimit.SlidingWindowRateLimiter;
import io.quotecache.retry.RetryPolicy;
import io.quotecache.store.Partition;
import io.quotecache.store.PartitionKey;
import io.quotecache.store.PartitionStore;
import io.quotecache.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Serves lookups for one source from year partitions in the shared store, fetching a whole partition from upstream
 * when the cached copy cannot answer.
 *
 * <p>Per call: check the store; on a miss take the partition lease according to the source's
 * {@link AdmissionPolicy}; re-check the store under the lease; pass the shared rate limiter; fetch; merge into
 * the latest stored copy; write back. A non-blocking caller that finds the lease busy never fetches and answers
 * from whatever the store holds.
 *
 * <p>Past-year partitions fetched after their year ended are final and never refetched on demand. A current-year
 * partition is refetched only when the requested date is missing and nothing later is cached, since a later date
 * means the requested one simply has no published value.
 */
public class CacheFetchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(CacheFetchCoordinator.class);

    private final SourceConfig config;
    private final FetchAdapter adapter;
    private final PartitionStore store;
    private final LeaseLock leaseLock;
    private final SlidingWindowRateLimiter rateLimiter;
    private final RetryPolicy lockRetry;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Counter hits;
    private final Counter misses;
    private final Counter fetches;
    private final Counter fallbacks;
    private final Counter lockTimeouts;
    private final Timer fetchTimer;

    public CacheFetchCoordinator(SourceConfig config,
                                 FetchAdapter adapter,
                                 PartitionStore store,
                                 LeaseLock leaseLock,
                                 SlidingWindowRateLimiter rateLimiter,
                                 RetryPolicy lockRetry,
                                 Clock clock,
                                 Sleeper sleeper,
                                 Metrics metrics) {
        this.config = Objects.requireNonNull(config);
        this.adapter = Objects.requireNonNull(adapter);
        this.store = Objects.requireNonNull(store);
        this.leaseLock = Objects.requireNonNull(leaseLock);
        this.rateLimiter = Objects.requireNonNull(rateLimiter);
        this.lockRetry = Objects.requireNonNull(lockRetry);
        this.clock = Objects.requireNonNull(clock);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.hits = metrics.counter("cache.hits");
        this.misses = metrics.counter("cache.misses");
        this.fetches = metrics.counter("fetches");
        this.fallbacks = metrics.counter("fallbacks");
        this.lockTimeouts = metrics.counter("lock.timeouts");
        this.fetchTimer = metrics.timer("fetch.time");
    }

    public SourceConfig config() { return config; }

    /** Today in the source's reference zone. */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(config.zone()));
    }

    /** Partition key holding {@code date}, for single-instrument sources. */
    public PartitionKey keyFor(LocalDate date) {
        return PartitionKey.of(config.sourceId(), date.getYear());
    }

    /** Partition key holding {@code date} for {@code ticker}. */
    public PartitionKey keyFor(String ticker, LocalDate date) {
        return PartitionKey.of(config.sourceId(), ticker, date.getYear());
    }

    /**
     * Value of {@code date} inside {@code key}.
     *
     * @throws NotYetAvailableException  date is today or later in the source zone; nothing is read or fetched
     * @throws FetchException            upstream failed or returned nothing for the partition
     * @throws FetchUnavailableException blocking policy could not get the lease within its retry budget
     */
    public LookupResult resolve(PartitionKey key, LocalDate date) {
        checkKey(key);
        if (date.getYear() != key.year()) {
            throw new IllegalArgumentException(date + " is outside partition " + key);
        }
        LocalDate today = today();
        if (!date.isBefore(today)) throw new NotYetAvailableException(config.sourceId(), date, today);
        return withLockRetry("resolve " + key, () -> resolveOnce(key, date, today));
    }

    /**
     * Periodic refresh of one partition: a current-year partition is refetched and replaced, a past-year partition
     * is fetched only while it is absent or was cached before its year ended. Future years are skipped.
     */
    public RefreshOutcome refresh(PartitionKey key) {
        checkKey(key);
        LocalDate today = today();
        if (key.year() > today.getYear()) return RefreshOutcome.SKIPPED;
        return withLockRetry("refresh " + key, () -> refreshOnce(key, today));
    }

    /** Removes every cached partition of this source; returns how many were removed. */
    public int flush() {
        int removed = 0;
        for (PartitionKey key : knownPartitions()) {
            store.delete(key);
            removed++;
        }
        log.info("Flushed {} partitions of {}", removed, config.sourceId());
        return removed;
    }

    /** Partitions of this source currently in the store. */
    public List<PartitionKey> knownPartitions() {
        List<PartitionKey> out = new ArrayList<>();
        for (String k : store.listKeys(PartitionKey.prefix(config.sourceId()))) {
            PartitionKey.parse(k).filter(p -> p.sourceId().equals(config.sourceId())).ifPresent(out::add);
        }
        return out;
    }

    private LookupResult resolveOnce(PartitionKey key, LocalDate date, LocalDate today)
            throws LockTimeoutException, InterruptedException {
        Optional<Partition> cached = store.load(key);
        if (isHit(cached, key, date, today)) {
            hits.inc();
            return LookupResult.from(key, date, cached, LookupResult.Origin.CACHE);
        }
        misses.inc();
        Optional<Lease> admitted = admit(key);
        if (admitted.isEmpty()) return fallback(key, date, cached);
        try (Lease lease = admitted.get()) {
            Optional<Partition> latest = store.load(key);
            if (isHit(latest, key, date, today)) {
                hits.inc();
                return LookupResult.from(key, date, latest, LookupResult.Origin.CACHE);
            }
            try {
                rateLimiter.acquire();
            } catch (LockTimeoutException e) {
                if (config.admissionPolicy() == AdmissionPolicy.BLOCKING) throw e;
                log.debug("Rate window of {} busy; answering {} from cache", config.sourceId(), key);
                return fallback(key, date, latest);
            }
            // the rate wait can outlast the lease, so another holder may have stored the partition meanwhile
            latest = store.load(key);
            if (isHit(latest, key, date, today)) {
                hits.inc();
                return LookupResult.from(key, date, latest, LookupResult.Origin.CACHE);
            }
            Partition fetched = fetchAndStore(key, false);
            return LookupResult.from(key, date, Optional.of(fetched), LookupResult.Origin.FETCH);
        }
    }

    private RefreshOutcome refreshOnce(PartitionKey key, LocalDate today) throws LockTimeoutException, InterruptedException {
        boolean currentYear = key.year() == today.getYear();
        if (!currentYear && store.load(key).filter(p -> isSealed(p, key)).isPresent()) return RefreshOutcome.SKIPPED;
        Optional<Lease> admitted = admit(key);
        if (admitted.isEmpty()) {
            log.info("Refresh of {} skipped; lease held elsewhere", key);
            return RefreshOutcome.BUSY;
        }
        try (Lease lease = admitted.get()) {
            if (!currentYear && store.load(key).filter(p -> isSealed(p, key)).isPresent()) return RefreshOutcome.SKIPPED;
            rateLimiter.acquire();
            if (!currentYear) {
                if (store.load(key).filter(p -> isSealed(p, key)).isPresent()) return RefreshOutcome.SKIPPED;
                fetchAndStore(key, false);
                return RefreshOutcome.FETCHED;
            }
            fetchAndStore(key, true);
            return RefreshOutcome.REPLACED;
        }
    }

    private Optional<Lease> admit(PartitionKey key) throws LockTimeoutException, InterruptedException {
        if (config.admissionPolicy() == AdmissionPolicy.BLOCKING) {
            return Optional.of(leaseLock.acquire(key.lockKey(), config.lockWait()));
        }
        return leaseLock.tryAcquire(key.lockKey());
    }

    private LookupResult fallback(PartitionKey key, LocalDate date, Optional<Partition> cached) {
        fallbacks.inc();
        log.debug("Lease on {} busy; answering {} from {} cached entries", key, date, cached.map(Partition::size).orElse(0));
        return LookupResult.from(key, date, cached, LookupResult.Origin.FALLBACK);
    }

    /**
     * Runs under the partition lease once the rate gate has admitted the call. Replacing discards previously cached
     * entries of the partition.
     */
    private Partition fetchAndStore(PartitionKey key, boolean replace) {
        Map<LocalDate, Double> values;
        try (Timer.Context ignored = fetchTimer.time()) {
            values = adapter.fetch(key);
        }
        fetches.inc();
        if (values == null || values.isEmpty()) throw new FetchException("upstream returned no data for " + key);
        long now = clock.millis();
        Partition base = replace ? Partition.empty() : store.load(key).orElse(Partition.empty());
        Partition updated = base.mergedWith(values, key.year(), now);
        if (updated.size() == 0) throw new FetchException("upstream returned no dates inside " + key.year() + " for " + key);
        store.store(key, updated);
        log.info("Stored {} ({} entries, {} fetched, latest {})", key, updated.size(), values.size(),
                updated.latestDate().map(LocalDate::toString).orElse("-"));
        return updated;
    }

    private boolean isHit(Optional<Partition> cached, PartitionKey key, LocalDate date, LocalDate today) {
        if (cached.isEmpty()) return false;
        Partition p = cached.get();
        if (key.year() < today.getYear() && isSealed(p, key)) return true;
        if (p.contains(date) || p.hasDateAfter(date)) return true;
        return !config.freshness().isZero() && clock.millis() - p.fetchedAt() < config.freshness().toMillis();
    }

    /** Fetched once its year had fully elapsed in the source zone, so upstream can add nothing more. */
    private boolean isSealed(Partition p, PartitionKey key) {
        long yearEnd = LocalDate.of(key.year() + 1, 1, 1).atStartOfDay(config.zone()).toInstant().toEpochMilli();
        return p.fetchedAt() >= yearEnd;
    }

    private void checkKey(PartitionKey key) {
        if (!key.sourceId().equals(config.sourceId())) {
            throw new IllegalArgumentException("partition " + key + " does not belong to " + config.sourceId());
        }
        if (key.hasTicker() != config.perTicker()) {
            throw new IllegalArgumentException(config.perTicker()
                    ? config.sourceId() + " needs a ticker" : config.sourceId() + " takes no ticker");
        }
    }

    private <T> T withLockRetry(String what, LockedStep<T> step) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return step.run();
            } catch (LockTimeoutException e) {
                lockTimeouts.inc();
                if (!lockRetry.shouldRetry(attempt, e)) {
                    throw new FetchUnavailableException(what + " gave up after " + attempt + " lease attempts", e);
                }
                long backoff = lockRetry.backoffMillis(attempt);
                log.debug("{}: {} (attempt {}), retrying in {}ms", what, e.getMessage(), attempt, backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FetchUnavailableException(what + " interrupted", ie);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchUnavailableException(what + " interrupted", e);
            }
        }
    }

    @FunctionalInterface
    private interface LockedStep<T> {
        T run() throws LockTimeoutException, InterruptedException;
    }
}
