package io.quotecache.store;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shared, durable string key-value store used as the only coordination substrate between executions.
 * No multi-key transactions are assumed.
 */
public interface KeyValueStore {
    Optional<String> get(String key);

    void set(String key, String value);

    void delete(String key);

    /** Keys starting with the given prefix. */
    Set<String> keys(String prefix);

    /**
     * Sets {@code key} to {@code value} only if it currently holds {@code expected} ({@code null} meaning absent).
     * The default is a plain read-then-write and therefore racy; stores that can do better override it.
     */
    default boolean compareAndSet(String key, String expected, String value) {
        String current = get(key).orElse(null);
        if (!Objects.equals(current, expected)) return false;
        set(key, value);
        return true;
    }

    /** Deletes {@code key} only if it currently holds {@code expected}. Racy by default, like {@link #compareAndSet}. */
    default boolean compareAndDelete(String key, String expected) {
        String current = get(key).orElse(null);
        if (current == null || !current.equals(expected)) return false;
        delete(key);
        return true;
    }
}
