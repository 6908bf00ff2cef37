package io.quotecache.store;

import io.quotecache.error.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcKeyValueStoreTest {
    JdbcKeyValueStore kv;

    @BeforeEach
    void setUp() {
        String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        kv = new JdbcKeyValueStore(url, null, null, "kv_store").initSchema();
    }

    @Test
    void set_overwrites_and_delete_removes() {
        assertTrue(kv.get("a").isEmpty());
        kv.set("a", "1");
        kv.set("a", "2");
        assertEquals("2", kv.get("a").orElseThrow());
        kv.delete("a");
        assertTrue(kv.get("a").isEmpty());
    }

    @Test
    void keys_treat_like_wildcards_literally() {
        kv.set("fx_usd:2024", "{}");
        kv.set("fxXusd:2024", "{}");
        kv.set("fx_usd:2023", "{}");
        assertEquals(Set.of("fx_usd:2023", "fx_usd:2024"), kv.keys("fx_usd:"));
    }

    @Test
    void compare_and_set_is_atomic_per_row() {
        assertTrue(kv.compareAndSet("lock:k", null, "100|a"));
        assertFalse(kv.compareAndSet("lock:k", null, "200|b"));
        assertFalse(kv.compareAndSet("lock:k", "999|z", "200|b"));
        assertTrue(kv.compareAndSet("lock:k", "100|a", "200|b"));
        assertFalse(kv.compareAndDelete("lock:k", "100|a"));
        assertTrue(kv.compareAndDelete("lock:k", "200|b"));
        assertTrue(kv.get("lock:k").isEmpty());
    }

    @Test
    void survives_a_new_instance_on_the_same_database() {
        String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        new JdbcKeyValueStore(url, null, null, "kv").initSchema().set("ecb:2023", "{\"dates\":{},\"fetchedAt\":1}");
        var reopened = new JdbcKeyValueStore(url, null, null, "kv").initSchema();
        assertEquals("{\"dates\":{},\"fetchedAt\":1}", reopened.get("ecb:2023").orElseThrow());
    }

    @Test
    void missing_table_surfaces_as_store_exception() {
        var broken = new JdbcKeyValueStore("jdbc:h2:mem:" + UUID.randomUUID(), null, null, "nothing_here");
        assertThrows(StoreException.class, () -> broken.get("x"));
    }

    @Test
    void rejects_unsafe_table_names() {
        assertThrows(IllegalArgumentException.class, () -> new JdbcKeyValueStore("jdbc:h2:mem:x", null, null, "t; DROP TABLE t"));
    }
}
