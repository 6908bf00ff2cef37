package io.quotecache.error;

import java.time.LocalDate;

/**
 * The requested date is today or later in the source's reference zone; upstream cannot have a value yet.
 */
public class NotYetAvailableException extends QuoteCacheException {
    private final LocalDate requested;

    public NotYetAvailableException(String sourceId, LocalDate requested, LocalDate today) {
        super("No " + sourceId + " data for " + requested + " yet (today is " + today + ")");
        this.requested = requested;
    }

    public LocalDate requested() { return requested; }
}
