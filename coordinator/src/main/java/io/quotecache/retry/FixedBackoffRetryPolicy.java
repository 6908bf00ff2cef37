package io.quotecache.retry;

/**
 * Retries up to {@code maxAttempts} total attempts, sleeping the same delay between each.
 */
public class FixedBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long backoffMillis;

    public FixedBackoffRetryPolicy(int maxAttempts, long backoffMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = Math.max(0, backoffMillis);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt) {
        return backoffMillis;
    }

    public int maxAttempts() { return maxAttempts; }
}
