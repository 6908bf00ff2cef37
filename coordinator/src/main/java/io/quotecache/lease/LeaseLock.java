package io.quotecache.lease;

import java.time.Duration;
import java.util.Optional;

/**
 * Best-effort mutual exclusion keyed by string. A lease that is never released expires on its own.
 */
public interface LeaseLock {
    /** Returns immediately; empty when another holder has a live lease on {@code key}. */
    Optional<Lease> tryAcquire(String key);

    /** Polls until the lease is obtained or {@code waitTimeout} elapses. */
    Lease acquire(String key, Duration waitTimeout) throws LockTimeoutException, InterruptedException;

    /** Never throws; failures are harmless because the lease expires anyway. */
    void release(Lease lease);
}
