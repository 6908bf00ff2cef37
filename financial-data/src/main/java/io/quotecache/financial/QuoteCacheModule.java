package io.quotecache.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.quotecache.config.CacheConfig;
import io.quotecache.store.JdbcKeyValueStore;
import io.quotecache.store.KeyValueStore;
import io.quotecache.time.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.Properties;

public class QuoteCacheModule extends AbstractModule {
    private final CacheConfig config;

    public QuoteCacheModule(CacheConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(CacheConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton KeyValueStore store() {
        return new JdbcKeyValueStore(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword(), config.table()).initSchema();
    }

    @Provides @Singleton Properties sources() { return QuoteSources.load(config.sourcesResource()); }

    @Provides @Singleton UpstreamClient upstreamClient() { return new HttpUpstreamClient(Duration.ofSeconds(20)); }

    @Provides @Singleton QuoteService quoteService(Properties sources, KeyValueStore store, UpstreamClient client,
                                                   MetricRegistry registry, Clock clock, Sleeper sleeper) {
        return QuoteSources.build(sources, store, client, registry, clock, sleeper);
    }

    @Provides @Singleton DailyRefreshScheduler scheduler(QuoteService service, Clock clock) {
        return new DailyRefreshScheduler(service, config.refreshHourUtc(), clock);
    }
}
