package io.quotecache.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Registry view that prefixes every metric name, e.g. {@code quotecache.ecb-usd.fetches}.
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
    }

    public static Metrics forSource(MetricRegistry registry, String sourceId) {
        return new Metrics(registry, MetricRegistry.name("quotecache", sourceId));
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(MetricRegistry.name(prefix, name)); }
    public Timer timer(String name) { return registry.timer(MetricRegistry.name(prefix, name)); }
}
