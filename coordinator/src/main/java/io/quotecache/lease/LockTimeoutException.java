package io.quotecache.lease;

import java.time.Duration;

/**
 * A blocking lease acquisition did not succeed within its wait timeout.
 */
public class LockTimeoutException extends Exception {
    public LockTimeoutException(String key, Duration waited) {
        super("lease " + key + " still held after " + waited.toMillis() + "ms");
    }
}
