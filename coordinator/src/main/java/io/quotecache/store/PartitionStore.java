package io.quotecache.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Partition-level view over a {@link KeyValueStore}. Load and store are independent calls; concurrent
 * load-then-store round trips race and the later write wins.
 */
public class PartitionStore {
    private static final Logger log = LoggerFactory.getLogger(PartitionStore.class);

    private final KeyValueStore kv;
    private final PartitionCodec codec;

    public PartitionStore(KeyValueStore kv) { this(kv, new PartitionCodec()); }

    public PartitionStore(KeyValueStore kv, PartitionCodec codec) {
        this.kv = kv;
        this.codec = codec;
    }

    /** Unreadable payloads count as absent so the next fetch overwrites them. */
    public Optional<Partition> load(PartitionKey key) {
        Optional<String> raw = kv.get(key.storeKey());
        if (raw.isEmpty()) return Optional.empty();
        try {
            return Optional.of(codec.decode(raw.get()));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable partition {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public void store(PartitionKey key, Partition partition) {
        kv.set(key.storeKey(), codec.encode(partition));
    }

    public void delete(PartitionKey key) {
        kv.delete(key.storeKey());
    }

    /** Rendered partition keys under {@code prefix}, sorted; lease and rate-limit records are excluded. */
    public Set<String> listKeys(String prefix) {
        Set<String> out = new TreeSet<>();
        for (String k : kv.keys(prefix)) {
            if (PartitionKey.parse(k).isPresent()) out.add(k);
        }
        return out;
    }
}
