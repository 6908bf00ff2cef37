package io.quotecache.financial;

import io.quotecache.error.FetchException;

import java.net.URI;

/**
 * Issues one GET to an upstream data provider and returns the body of a successful answer.
 */
public interface UpstreamClient {
    String get(URI uri) throws FetchException;
}
