package io.quotecache.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.quotecache.config.CacheConfig;
import io.quotecache.core.LookupResult;
import io.quotecache.core.RefreshOutcome;
import io.quotecache.error.QuoteCacheException;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI over the quote cache: single lookups, flush, refresh, and a long-running daily refresher.
 */
@CommandLine.Command(name = "quotecache", mixinStandardHelpOptions = true,
        description = "Cached per-day financial data lookups",
        subcommands = {QuoteCacheMain.Get.class, QuoteCacheMain.Flush.class, QuoteCacheMain.Refresh.class, QuoteCacheMain.Serve.class})
public final class QuoteCacheMain implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Injector injector;

    public QuoteCacheMain() {}

    QuoteCacheMain(Injector injector) { this.injector = injector; }

    public static void main(String[] args) {
        int code = new CommandLine(new QuoteCacheMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(out());
        return 0;
    }

    synchronized Injector injector() {
        if (injector == null) injector = Guice.createInjector(new QuoteCacheModule(CacheConfig.fromEnv()));
        return injector;
    }

    QuoteService service() { return injector().getInstance(QuoteService.class); }

    PrintWriter out() { return spec.commandLine().getOut(); }

    PrintWriter err() { return spec.commandLine().getErr(); }

    /** Bad input exits with 2, a failed lookup or fetch with 1; both print only the message. */
    int run(Callable<Integer> action) {
        try {
            return action.call();
        } catch (IllegalArgumentException e) {
            err().println(e.getMessage());
            return 2;
        } catch (QuoteCacheException e) {
            err().println(e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @CommandLine.Command(name = "get", description = "Look up one value (prints NA when the source has none for that date)")
    static final class Get implements Callable<Integer> {
        @CommandLine.ParentCommand QuoteCacheMain parent;

        @CommandLine.Parameters(index = "0", description = "Source id")
        String source;

        @CommandLine.Parameters(index = "1", description = "Date (yyyy-MM-dd)")
        String date;

        @CommandLine.Option(names = {"-t", "--ticker"}, description = "Ticker, for per-ticker sources")
        String ticker;

        @Override
        public Integer call() {
            return parent.run(() -> {
                QuoteService service = parent.service();
                LookupResult r = ticker == null ? service.getValue(source, date) : service.getValue(source, ticker, date);
                parent.out().println(r.isNoData() ? "NA" : Double.toString(r.value().getAsDouble()));
                return 0;
            });
        }
    }

    @CommandLine.Command(name = "flush", description = "Delete all cached partitions of a source")
    static final class Flush implements Callable<Integer> {
        @CommandLine.ParentCommand QuoteCacheMain parent;

        @CommandLine.Parameters(index = "0", description = "Source id")
        String source;

        @Override
        public Integer call() {
            return parent.run(() -> {
                int removed = parent.service().flushCache(source);
                parent.out().println("Removed " + removed + " partitions of " + source);
                return 0;
            });
        }
    }

    @CommandLine.Command(name = "refresh", description = "Run the daily refresh now")
    static final class Refresh implements Callable<Integer> {
        @CommandLine.ParentCommand QuoteCacheMain parent;

        @CommandLine.Parameters(arity = "0..*", description = "Source ids (default: all)")
        List<String> sources = new ArrayList<>();

        @Override
        public Integer call() {
            return parent.run(() -> {
                QuoteService service = parent.service();
                List<String> ids = sources.isEmpty() ? new ArrayList<>(service.sourceIds()) : sources;
                int failed = 0;
                for (String id : ids) {
                    RefreshSummary s = service.refreshAll(id);
                    failed += s.failed();
                    parent.out().println("  " + id + ": replaced=" + s.count(RefreshOutcome.REPLACED)
                            + " fetched=" + s.count(RefreshOutcome.FETCHED)
                            + " skipped=" + s.count(RefreshOutcome.SKIPPED)
                            + " busy=" + s.count(RefreshOutcome.BUSY)
                            + " failed=" + s.failed());
                }
                return failed == 0 ? 0 : 1;
            });
        }
    }

    @CommandLine.Command(name = "serve", description = "Keep running and refresh every source once a day")
    static final class Serve implements Callable<Integer> {
        @CommandLine.ParentCommand QuoteCacheMain parent;

        @CommandLine.Option(names = "--now", description = "Also refresh once at startup")
        boolean now;

        @Override
        public Integer call() throws Exception {
            Injector injector = parent.injector();
            try (DailyRefreshScheduler scheduler = injector.getInstance(DailyRefreshScheduler.class)) {
                if (now) scheduler.runOnce();
                scheduler.start();
                MetricRegistry registry = injector.getInstance(MetricRegistry.class);
                PrintWriter out = parent.out();
                Runtime.getRuntime().addShutdownHook(new Thread(() ->
                        out.println("fetches so far: " + registry.getCounters().entrySet().stream()
                                .filter(e -> e.getKey().endsWith(".fetches"))
                                .mapToLong(e -> e.getValue().getCount()).sum())));
                Thread.currentThread().join();
            }
            return 0;
        }
    }
}
