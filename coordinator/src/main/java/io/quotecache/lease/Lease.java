package io.quotecache.lease;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held lease. Closing it releases the lease once; later closes do nothing.
 */
public final class Lease implements AutoCloseable {
    private final LeaseLock owner;
    private final String key;
    private final String marker;
    private final long acquiredAt;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public Lease(LeaseLock owner, String key, String marker, long acquiredAt) {
        this.owner = owner;
        this.key = key;
        this.marker = marker;
        this.acquiredAt = acquiredAt;
    }

    public String key() { return key; }
    public String marker() { return marker; }
    public long acquiredAt() { return acquiredAt; }
    public boolean isReleased() { return released.get(); }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) owner.release(this);
    }
}
