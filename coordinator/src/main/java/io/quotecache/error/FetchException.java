package io.quotecache.error;

/**
 * Upstream answered with a non-success status, an unreadable payload, or no data at all.
 * Not retried within the failing call.
 */
public class FetchException extends QuoteCacheException {
    private final int status;

    public FetchException(String message) { this(message, -1, null); }
    public FetchException(String message, Throwable cause) { this(message, -1, cause); }

    public FetchException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /** HTTP status of the failed call, or -1 when the failure was not an HTTP status. */
    public int status() { return status; }
}
