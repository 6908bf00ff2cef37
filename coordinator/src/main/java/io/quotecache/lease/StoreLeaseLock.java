package io.quotecache.lease;

import io.quotecache.store.KeyValueStore;
import io.quotecache.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lease kept as a store entry holding {@code <acquiredAtMillis>|<holder>}. An entry older than the lease timeout
 * is treated as free whether or not its holder released it.
 */
public class StoreLeaseLock implements LeaseLock {
    private static final Logger log = LoggerFactory.getLogger(StoreLeaseLock.class);

    private final KeyValueStore store;
    private final long leaseTimeoutMillis;
    private final long pollMillis;
    private final Clock clock;
    private final Sleeper sleeper;
    private final String holderId;
    private final AtomicLong seq = new AtomicLong();

    public StoreLeaseLock(KeyValueStore store, Duration leaseTimeout, Duration pollInterval, Clock clock, Sleeper sleeper) {
        this.store = store;
        this.leaseTimeoutMillis = Math.max(1, leaseTimeout.toMillis());
        this.pollMillis = Math.max(1, pollInterval.toMillis());
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.holderId = UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public Optional<Lease> tryAcquire(String key) {
        long now = clock.millis();
        String current = store.get(key).orElse(null);
        if (current != null && !isExpired(current, now)) return Optional.empty();
        String marker = now + "|" + holderId + "-" + seq.incrementAndGet();
        if (!store.compareAndSet(key, current, marker)) return Optional.empty();
        // stores without a real compare-and-set may let a concurrent writer overwrite us
        if (!marker.equals(store.get(key).orElse(null))) return Optional.empty();
        if (current != null) log.debug("Took over expired lease {} ({})", key, current);
        return Optional.of(new Lease(this, key, marker, now));
    }

    @Override
    public Lease acquire(String key, Duration waitTimeout) throws LockTimeoutException, InterruptedException {
        long deadline = clock.millis() + waitTimeout.toMillis();
        while (true) {
            Optional<Lease> lease = tryAcquire(key);
            if (lease.isPresent()) return lease.get();
            long remaining = deadline - clock.millis();
            if (remaining <= 0) throw new LockTimeoutException(key, waitTimeout);
            sleeper.sleep(Math.min(pollMillis, remaining));
        }
    }

    @Override
    public void release(Lease lease) {
        try {
            if (!store.compareAndDelete(lease.key(), lease.marker())) {
                log.debug("Lease {} expired before release; left to its new holder", lease.key());
            }
        } catch (RuntimeException e) {
            log.warn("Ignoring failed release of lease {}: {}", lease.key(), e.toString());
        }
    }

    boolean isExpired(String marker, long now) {
        int sep = marker.indexOf('|');
        String ts = sep < 0 ? marker : marker.substring(0, sep);
        try {
            return now - Long.parseLong(ts) > leaseTimeoutMillis;
        } catch (NumberFormatException e) {
            return true;
        }
    }
}
