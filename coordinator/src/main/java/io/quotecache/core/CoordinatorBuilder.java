package io.quotecache.core;

import com.codahale.metrics.MetricRegistry;
import io.quotecache.config.SourceConfig;
import io.quotecache.lease.LeaseLock;
import io.quotecache.lease.StoreLeaseLock;
import io.quotecache.metrics.Metrics;
import io.quotecache.ratelimit.SlidingWindowRateLimiter;
import io.quotecache.retry.FixedBackoffRetryPolicy;
import io.quotecache.retry.RetryPolicy;
import io.quotecache.store.KeyValueStore;
import io.quotecache.store.PartitionStore;
import io.quotecache.time.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public class CoordinatorBuilder {
    private static final Duration RATE_LEASE_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration RATE_LEASE_WAIT = Duration.ofSeconds(10);

    private SourceConfig config;
    private FetchAdapter adapter;
    private KeyValueStore store;
    private LeaseLock leaseLock;
    private RetryPolicy lockRetry;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.SYSTEM;
    private Duration pollInterval = Duration.ofMillis(200);
    private MetricRegistry metricRegistry = new MetricRegistry();

    public CoordinatorBuilder config(SourceConfig c) { this.config = c; return this; }
    public CoordinatorBuilder adapter(FetchAdapter a) { this.adapter = a; return this; }
    public CoordinatorBuilder store(KeyValueStore s) { this.store = s; return this; }
    public CoordinatorBuilder leaseLock(LeaseLock l) { this.leaseLock = l; return this; }
    public CoordinatorBuilder lockRetry(RetryPolicy r) { this.lockRetry = r; return this; }
    public CoordinatorBuilder clock(Clock c) { this.clock = c; return this; }
    public CoordinatorBuilder sleeper(Sleeper s) { this.sleeper = s; return this; }
    public CoordinatorBuilder pollInterval(Duration d) { this.pollInterval = d; return this; }
    public CoordinatorBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public CacheFetchCoordinator build() {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(adapter, "adapter");
        Objects.requireNonNull(store, "store");
        Metrics metrics = Metrics.forSource(metricRegistry, config.sourceId());
        LeaseLock partitionLock = leaseLock != null ? leaseLock
                : new StoreLeaseLock(store, config.leaseTimeout(), pollInterval, clock, sleeper);
        LeaseLock rateLock = new StoreLeaseLock(store, RATE_LEASE_TIMEOUT, pollInterval, clock, sleeper);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(store, rateLock, config.sourceId(),
                config.rateLimit(), config.rateWindow(), config.rateBuffer(), RATE_LEASE_WAIT, clock, sleeper, metrics);
        RetryPolicy retry = lockRetry != null ? lockRetry
                : new FixedBackoffRetryPolicy(config.lockRetries(), config.lockBackoff().toMillis());
        return new CacheFetchCoordinator(config, adapter, new PartitionStore(store), partitionLock, limiter, retry,
                clock, sleeper, metrics);
    }
}
