package io.quotecache.lease;

import io.quotecache.ManualTime;
import io.quotecache.store.InMemoryKeyValueStore;
import io.quotecache.store.KeyValueStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class StoreLeaseLockTest {
    final ManualTime time = ManualTime.at("2025-06-12T10:00:00Z");
    final InMemoryKeyValueStore kv = new InMemoryKeyValueStore();

    StoreLeaseLock lock(Duration leaseTimeout) {
        return new StoreLeaseLock(kv, leaseTimeout, Duration.ofMillis(200), time, time);
    }

    @Test
    void second_holder_is_refused_until_release() {
        StoreLeaseLock a = lock(Duration.ofSeconds(30));
        StoreLeaseLock b = lock(Duration.ofSeconds(30));
        Lease held = a.tryAcquire("lock:ecb:2025").orElseThrow();
        assertTrue(b.tryAcquire("lock:ecb:2025").isEmpty());
        held.close();
        assertTrue(kv.get("lock:ecb:2025").isEmpty());
        assertTrue(b.tryAcquire("lock:ecb:2025").isPresent());
    }

    @Test
    void record_holds_acquire_timestamp() {
        Lease held = lock(Duration.ofSeconds(30)).tryAcquire("lock:ecb:2025").orElseThrow();
        String raw = kv.get("lock:ecb:2025").orElseThrow();
        assertTrue(raw.startsWith(time.millis() + "|"), raw);
        assertEquals(time.millis(), held.acquiredAt());
    }

    @Test
    void expired_lease_is_taken_over_and_stale_release_is_harmless() {
        StoreLeaseLock a = lock(Duration.ofSeconds(30));
        StoreLeaseLock b = lock(Duration.ofSeconds(30));
        Lease crashed = a.tryAcquire("lock:ecb:2025").orElseThrow();
        time.advance(Duration.ofSeconds(31));
        Lease taken = b.tryAcquire("lock:ecb:2025").orElseThrow();
        crashed.close();
        assertEquals(taken.marker(), kv.get("lock:ecb:2025").orElseThrow(), "late release must not drop the new holder");
        taken.close();
        assertTrue(kv.get("lock:ecb:2025").isEmpty());
    }

    @Test
    void unreadable_record_counts_as_expired() {
        kv.set("lock:ecb:2025", "garbage");
        assertTrue(lock(Duration.ofSeconds(30)).tryAcquire("lock:ecb:2025").isPresent());
    }

    @Test
    void blocking_acquire_times_out_after_wait() {
        lock(Duration.ofMinutes(5)).tryAcquire("lock:ecb:2025").orElseThrow();
        StoreLeaseLock waiter = lock(Duration.ofMinutes(5));
        long start = time.millis();
        assertThrows(LockTimeoutException.class, () -> waiter.acquire("lock:ecb:2025", Duration.ofSeconds(2)));
        assertEquals(2000, time.millis() - start);
        assertTrue(time.sleeps().stream().allMatch(ms -> ms <= 200));
    }

    @Test
    void blocking_acquire_wins_once_holder_expires() throws Exception {
        lock(Duration.ofSeconds(1)).tryAcquire("lock:ecb:2025").orElseThrow();
        Lease lease = lock(Duration.ofSeconds(1)).acquire("lock:ecb:2025", Duration.ofSeconds(5));
        assertFalse(lease.isReleased());
        assertTrue(time.sleeps().size() >= 5);
    }

    @Test
    void close_is_idempotent() {
        Lease held = lock(Duration.ofSeconds(30)).tryAcquire("k").orElseThrow();
        held.close();
        kv.set("k", "someone-else");
        held.close();
        assertEquals("someone-else", kv.get("k").orElseThrow());
    }

    @Test
    void release_failure_is_swallowed() {
        KeyValueStore failingDeletes = new KeyValueStore() {
            @Override public Optional<String> get(String key) { return kv.get(key); }
            @Override public void set(String key, String value) { kv.set(key, value); }
            @Override public void delete(String key) { throw new IllegalStateException("store down"); }
            @Override public Set<String> keys(String prefix) { return kv.keys(prefix); }
        };
        StoreLeaseLock l = new StoreLeaseLock(failingDeletes, Duration.ofSeconds(30), Duration.ofMillis(200), time, time);
        Lease held = l.tryAcquire("k").orElseThrow();
        assertDoesNotThrow(held::close);
        assertTrue(held.isReleased());
    }
}
