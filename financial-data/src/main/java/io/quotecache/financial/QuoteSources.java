package io.quotecache.financial;

import com.codahale.metrics.MetricRegistry;
import io.quotecache.config.SourceConfig;
import io.quotecache.core.CacheFetchCoordinator;
import io.quotecache.core.CoordinatorBuilder;
import io.quotecache.core.FetchAdapter;
import io.quotecache.store.KeyValueStore;
import io.quotecache.time.Sleeper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Builds the source registry from properties:
 * <pre>
 * sources=ecb-usd,yahoo
 * source.ecb-usd.adapter=ecb
 * source.ecb-usd.currency=USD
 * source.yahoo.adapter=yahoo
 * source.yahoo.perTicker=true
 * </pre>
 * plus the coordination fields read by {@link SourceConfig#fromProperties}.
 */
public final class QuoteSources {
    private QuoteSources() {}

    public static Properties load(String resource) {
        Properties props = new Properties();
        try (InputStream in = QuoteSources.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("missing sources resource " + resource);
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + resource, e);
        }
        return props;
    }

    public static QuoteService build(Properties props, KeyValueStore store, UpstreamClient client,
                                     MetricRegistry registry, Clock clock, Sleeper sleeper) {
        Map<String, CacheFetchCoordinator> coordinators = new LinkedHashMap<>();
        for (String raw : props.getProperty("sources", "").split(",")) {
            String id = raw.trim();
            if (id.isEmpty()) continue;
            SourceConfig config = SourceConfig.fromProperties(id, props);
            CacheFetchCoordinator c = new CoordinatorBuilder()
                    .config(config)
                    .adapter(adapter(id, props, client, registry))
                    .store(store)
                    .clock(clock)
                    .sleeper(sleeper)
                    .metrics(registry)
                    .build();
            coordinators.put(id, c);
        }
        if (coordinators.isEmpty()) throw new IllegalStateException("no sources configured");
        return new QuoteService(coordinators);
    }

    static FetchAdapter adapter(String id, Properties props, UpstreamClient client, MetricRegistry registry) {
        String p = "source." + id + ".";
        String kind = props.getProperty(p + "adapter", "");
        String baseUrl = props.getProperty(p + "baseUrl");
        switch (kind) {
            case "ecb":
                return new EcbReferenceRateAdapter(client, baseUrl, props.getProperty(p + "currency"));
            case "yahoo":
                if (!Boolean.parseBoolean(props.getProperty(p + "perTicker", "false"))) {
                    throw new IllegalStateException("source " + id + ": yahoo sources must set perTicker=true");
                }
                return new YahooCloseAdapter(client, baseUrl, registry);
            default:
                throw new IllegalStateException("source " + id + ": unknown adapter '" + kind + "'");
        }
    }
}
