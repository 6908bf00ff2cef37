package io.quotecache.error;

/**
 * Root of the caller-visible failures raised by a lookup.
 */
public class QuoteCacheException extends RuntimeException {
    public QuoteCacheException(String message) { super(message); }
    public QuoteCacheException(String message, Throwable cause) { super(message, cause); }
}
