package io.quotecache.financial;

import io.quotecache.error.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * JDK HttpClient based upstream client. A single attempt per call: non-2xx answers and I/O failures become
 * {@link FetchException}; the next lookup or the daily refresh is the retry.
 */
final class HttpUpstreamClient implements UpstreamClient {
    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamClient.class);

    private final HttpClient http;
    private final Duration timeout;

    HttpUpstreamClient(Duration timeout) {
        this.timeout = timeout == null ? Duration.ofSeconds(20) : timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String get(URI uri) {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", "Mozilla/5.0")
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FetchException("GET " + uri.getHost() + uri.getPath() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("GET " + uri.getHost() + uri.getPath() + " interrupted", e);
        }
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("GET {} answered {}", uri, status);
            throw new FetchException("GET " + uri.getHost() + uri.getPath() + " answered HTTP " + status, status, null);
        }
        return resp.body();
    }
}
