package io.quotecache.financial;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link QuoteService#refreshAll} for every source once a day at a fixed UTC hour.
 */
public class DailyRefreshScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DailyRefreshScheduler.class);

    private final QuoteService service;
    private final int hourUtc;
    private final Clock clock;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "quotecache-daily-refresh");
        t.setDaemon(true);
        return t;
    });

    public DailyRefreshScheduler(QuoteService service, int hourUtc, Clock clock) {
        this.service = service;
        this.hourUtc = hourUtc;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public void start() {
        long delay = initialDelay().toMillis();
        log.info("Daily refresh at {}:00 UTC, first run in {} min", hourUtc, TimeUnit.MILLISECONDS.toMinutes(delay));
        scheduler.scheduleAtFixedRate(this::runOnce, delay, TimeUnit.DAYS.toMillis(1), TimeUnit.MILLISECONDS);
    }

    /** Refreshes every source; a failing source does not stop the others. */
    public List<RefreshSummary> runOnce() {
        List<RefreshSummary> out = new ArrayList<>();
        for (String id : service.sourceIds()) {
            try {
                out.add(service.refreshAll(id));
            } catch (RuntimeException e) {
                log.error("Daily refresh of {} failed", id, e);
            }
        }
        return out;
    }

    Duration initialDelay() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        ZonedDateTime next = now.withHour(hourUtc).withMinute(0).withSecond(0).withNano(0);
        if (!next.isAfter(now)) next = next.plusDays(1);
        return Duration.between(now, next);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
