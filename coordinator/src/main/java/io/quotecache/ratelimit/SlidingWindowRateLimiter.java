package io.quotecache.ratelimit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quotecache.lease.Lease;
import io.quotecache.lease.LeaseLock;
import io.quotecache.lease.LockTimeoutException;
import io.quotecache.metrics.Metrics;
import io.quotecache.store.KeyValueStore;
import io.quotecache.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Sliding-window limiter shared through the store: at most {@code limit} admissions per rolling window per source.
 * The window lives at {@code ratelimit:<sourceId>} as a JSON array of epoch millis and is only read and rewritten
 * while holding the short lease {@code lock:ratelimit:<sourceId>}.
 */
public class SlidingWindowRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final KeyValueStore store;
    private final LeaseLock lock;
    private final String windowKey;
    private final String lockKey;
    private final int limit;
    private final long windowMillis;
    private final long bufferMillis;
    private final Duration lockWait;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Metrics metrics;
    private final ObjectMapper mapper = new ObjectMapper();

    public SlidingWindowRateLimiter(KeyValueStore store, LeaseLock lock, String sourceId, int limit, Duration window,
                                    Duration buffer, Duration lockWait, Clock clock, Sleeper sleeper, Metrics metrics) {
        this.store = store;
        this.lock = lock;
        this.windowKey = "ratelimit:" + sourceId;
        this.lockKey = "lock:ratelimit:" + sourceId;
        this.limit = limit;
        this.windowMillis = Math.max(1, window.toMillis());
        this.bufferMillis = Math.max(0, buffer.toMillis());
        this.lockWait = lockWait;
        this.clock = clock;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Blocks until a slot in the window is free and records the call. Returns the time spent sleeping for capacity.
     * A limit of zero or less disables limiting.
     */
    public long acquire() throws LockTimeoutException, InterruptedException {
        if (limit <= 0) return 0;
        long waited = 0;
        while (true) {
            long waitMs;
            try (Lease ignored = lock.acquire(lockKey, lockWait)) {
                long now = clock.millis();
                Deque<Long> recent = retained(now);
                if (recent.size() < limit) {
                    recent.addLast(now);
                    while (recent.size() > limit) recent.removeFirst();
                    write(recent);
                    return waited;
                }
                waitMs = windowMillis - (now - recent.peekFirst()) + bufferMillis;
            }
            waitMs = Math.max(1, waitMs);
            metrics.counter("ratelimit.waits").inc();
            log.debug("Rate window {} full ({} calls); sleeping {}ms", windowKey, limit, waitMs);
            sleeper.sleep(waitMs);
            waited += waitMs;
        }
    }

    /** Calls recorded within the current window, oldest first. Read without the lease. */
    public List<Long> recentCalls() {
        return List.copyOf(retained(clock.millis()));
    }

    private Deque<Long> retained(long now) {
        Deque<Long> out = new ArrayDeque<>();
        for (long ts : read()) {
            if (now - ts < windowMillis) out.addLast(ts);
        }
        return out;
    }

    private long[] read() {
        Optional<String> raw = store.get(windowKey);
        if (raw.isEmpty()) return new long[0];
        try {
            long[] ts = mapper.readValue(raw.get(), long[].class);
            Arrays.sort(ts);
            return ts;
        } catch (JsonProcessingException e) {
            log.warn("Resetting unreadable rate window {}: {}", windowKey, e.getOriginalMessage());
            return new long[0];
        }
    }

    private void write(Deque<Long> timestamps) {
        try {
            store.set(windowKey, mapper.writeValueAsString(timestamps));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode rate window", e);
        }
    }
}
