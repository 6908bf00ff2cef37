package io.quotecache.core;

import com.codahale.metrics.MetricRegistry;
import io.quotecache.config.AdmissionPolicy;
import io.quotecache.config.SourceConfig;
import io.quotecache.store.InMemoryKeyValueStore;
import io.quotecache.store.PartitionKey;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Real threads and the system clock; each coordinator stands in for an independent execution sharing one store.
 */
public class ConcurrentResolveTest {
    static final LocalDate DATE = LocalDate.of(2023, 6, 15);

    final InMemoryKeyValueStore kv = new InMemoryKeyValueStore();

    CacheFetchCoordinator execution(SourceConfig config, FetchAdapter adapter) {
        return new CoordinatorBuilder()
                .config(config)
                .adapter(adapter)
                .store(kv)
                .pollInterval(Duration.ofMillis(10))
                .metrics(new MetricRegistry())
                .build();
    }

    @Test
    void blocking_racers_share_one_fetch() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        FetchAdapter slow = key -> {
            fetches.incrementAndGet();
            try { Thread.sleep(200); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
            return Map.of(DATE, 1.0875);
        };
        SourceConfig config = SourceConfig.builder("ecb-usd")
                .admissionPolicy(AdmissionPolicy.BLOCKING)
                .lockWait(Duration.ofSeconds(5))
                .build();

        int racers = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        try {
            List<Future<LookupResult>> results = new ArrayList<>();
            for (int i = 0; i < racers; i++) {
                CacheFetchCoordinator c = execution(config, slow);
                results.add(pool.submit(() -> {
                    start.await();
                    return c.resolve(c.keyFor(DATE), DATE);
                }));
            }
            start.countDown();
            int fetched = 0;
            for (Future<LookupResult> f : results) {
                LookupResult r = f.get(10, TimeUnit.SECONDS);
                assertEquals(1.0875, r.value().getAsDouble());
                if (r.origin() == LookupResult.Origin.FETCH) fetched++;
            }
            assertEquals(1, fetched);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, fetches.get());
        assertTrue(kv.get(PartitionKey.of("ecb-usd", 2023).lockKey()).isEmpty());
    }

    @Test
    void non_blocking_caller_falls_back_while_another_fetches() throws Exception {
        CountDownLatch inFetch = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        AtomicInteger fetches = new AtomicInteger();
        FetchAdapter gated = key -> {
            fetches.incrementAndGet();
            inFetch.countDown();
            try { finish.await(5, TimeUnit.SECONDS); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
            return Map.of(DATE, 1.0875);
        };
        SourceConfig config = SourceConfig.defaults("ecb-usd");
        CacheFetchCoordinator fetcher = execution(config, gated);
        CacheFetchCoordinator reader = execution(config, gated);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<LookupResult> first = pool.submit(() -> fetcher.resolve(fetcher.keyFor(DATE), DATE));
            assertTrue(inFetch.await(5, TimeUnit.SECONDS));

            LookupResult meanwhile = reader.resolve(reader.keyFor(DATE), DATE);
            assertEquals(LookupResult.Origin.FALLBACK, meanwhile.origin());
            assertTrue(meanwhile.isNoData());

            finish.countDown();
            assertEquals(LookupResult.Origin.FETCH, first.get(5, TimeUnit.SECONDS).origin());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, fetches.get());
        assertEquals(LookupResult.Origin.CACHE, reader.resolve(reader.keyFor(DATE), DATE).origin());
    }

    @Test
    void lease_lost_during_rate_wait_does_not_cause_second_fetch() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        FetchAdapter counting = key -> {
            fetches.incrementAndGet();
            return Map.of(DATE, 1.0875);
        };
        // one call per second and the window already spent, so the first holder sleeps past its 300ms lease
        SourceConfig config = SourceConfig.builder("ecb-usd")
                .admissionPolicy(AdmissionPolicy.BLOCKING)
                .rateLimit(1, Duration.ofMillis(1000))
                .rateBuffer(Duration.ofMillis(20))
                .leaseTimeout(Duration.ofMillis(300))
                .lockWait(Duration.ofSeconds(5))
                .build();
        kv.set("ratelimit:ecb-usd", "[" + System.currentTimeMillis() + "]");

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<LookupResult>> results = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                CacheFetchCoordinator c = execution(config, counting);
                results.add(pool.submit(() -> {
                    start.await();
                    return c.resolve(c.keyFor(DATE), DATE);
                }));
            }
            start.countDown();
            for (Future<LookupResult> f : results) {
                assertEquals(1.0875, f.get(15, TimeUnit.SECONDS).value().getAsDouble());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, fetches.get());
    }
}
