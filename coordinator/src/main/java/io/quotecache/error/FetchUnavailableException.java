package io.quotecache.error;

/**
 * The partition lease could not be obtained within the retry budget, or the wait was interrupted.
 */
public class FetchUnavailableException extends QuoteCacheException {
    public FetchUnavailableException(String message, Throwable cause) { super(message, cause); }
}
