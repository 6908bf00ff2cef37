package io.quotecache.ratelimit;

import com.codahale.metrics.MetricRegistry;
import io.quotecache.ManualTime;
import io.quotecache.lease.StoreLeaseLock;
import io.quotecache.metrics.Metrics;
import io.quotecache.store.InMemoryKeyValueStore;
import io.quotecache.time.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class SlidingWindowRateLimiterTest {
    final InMemoryKeyValueStore kv = new InMemoryKeyValueStore();
    final MetricRegistry registry = new MetricRegistry();

    SlidingWindowRateLimiter limiter(int limit, Duration window, Duration buffer, Clock clock, Sleeper sleeper) {
        var lock = new StoreLeaseLock(kv, Duration.ofSeconds(5), Duration.ofMillis(10), clock, sleeper);
        return new SlidingWindowRateLimiter(kv, lock, "ecb", limit, window, buffer, Duration.ofSeconds(10),
                clock, sleeper, Metrics.forSource(registry, "ecb"));
    }

    @Test
    void sleeps_until_oldest_call_leaves_window() throws Exception {
        ManualTime time = ManualTime.at("2025-06-12T10:00:00Z");
        var rl = limiter(2, Duration.ofSeconds(1), Duration.ofMillis(50), time, time);
        assertEquals(0, rl.acquire());
        time.advance(Duration.ofMillis(300));
        assertEquals(0, rl.acquire());
        time.advance(Duration.ofMillis(100));
        // oldest call is 400ms old: wait 1000 - 400 + 50
        assertEquals(650, rl.acquire());
        assertEquals(List.of(650L), time.sleeps());
        assertEquals(1, registry.counter("quotecache.ecb.ratelimit.waits").getCount());
        assertEquals(2, rl.recentCalls().size());
    }

    @Test
    void stored_window_never_exceeds_limit() throws Exception {
        ManualTime time = ManualTime.at("2025-06-12T10:00:00Z");
        var rl = limiter(3, Duration.ofSeconds(10), Duration.ZERO, time, time);
        for (int i = 0; i < 10; i++) {
            rl.acquire();
            time.advance(Duration.ofSeconds(1));
        }
        String raw = kv.get("ratelimit:ecb").orElseThrow();
        assertEquals(3, raw.split(",").length, raw);
        assertTrue(kv.get("lock:ratelimit:ecb").isEmpty(), "limiter lease must be released");
    }

    @Test
    void unlimited_when_limit_is_zero() throws Exception {
        ManualTime time = ManualTime.at("2025-06-12T10:00:00Z");
        var rl = limiter(0, Duration.ofSeconds(1), Duration.ZERO, time, time);
        for (int i = 0; i < 100; i++) assertEquals(0, rl.acquire());
        assertTrue(kv.get("ratelimit:ecb").isEmpty());
    }

    @Test
    void corrupt_window_is_reset() throws Exception {
        ManualTime time = ManualTime.at("2025-06-12T10:00:00Z");
        kv.set("ratelimit:ecb", "{oops");
        var rl = limiter(1, Duration.ofSeconds(1), Duration.ZERO, time, time);
        assertEquals(0, rl.acquire());
        assertEquals("[" + time.millis() + "]", kv.get("ratelimit:ecb").orElseThrow());
    }

    @Test
    void concurrent_callers_respect_the_window() throws Exception {
        var rl = limiter(3, Duration.ofMillis(300), Duration.ofMillis(100), Clock.systemUTC(), Sleeper.SYSTEM);
        List<Long> admitted = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                futures.add(pool.submit(() -> {
                    rl.acquire();
                    admitted.add(System.currentTimeMillis());
                    return null;
                }));
            }
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        List<Long> sorted = new ArrayList<>(admitted);
        Collections.sort(sorted);
        assertEquals(6, sorted.size());
        // 4th admission cannot happen before the 1st leaves the 300ms window
        for (int i = 0; i + 3 < sorted.size(); i++) {
            assertTrue(sorted.get(i + 3) - sorted.get(i) >= 300, "window violated: " + sorted);
        }
    }
}
