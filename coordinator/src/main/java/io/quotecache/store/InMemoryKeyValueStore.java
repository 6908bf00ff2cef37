package io.quotecache.store;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Process-local store. Shared by every coordinator handed the same instance; does not survive restarts.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void set(String key, String value) {
        entries.put(key, value);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public Set<String> keys(String prefix) {
        return entries.keySet().stream().filter(k -> k.startsWith(prefix)).collect(Collectors.toSet());
    }

    @Override
    public boolean compareAndSet(String key, String expected, String value) {
        if (expected == null) return entries.putIfAbsent(key, value) == null;
        return entries.replace(key, expected, value);
    }

    @Override
    public boolean compareAndDelete(String key, String expected) {
        return expected != null && entries.remove(key, expected);
    }

    public int size() { return entries.size(); }
}
