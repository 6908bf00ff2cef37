package io.quotecache.error;

/**
 * The shared key-value store could not be read or written.
 */
public class StoreException extends QuoteCacheException {
    public StoreException(String message, Throwable cause) { super(message, cause); }
}
