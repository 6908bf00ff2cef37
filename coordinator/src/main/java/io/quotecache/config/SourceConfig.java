package io.quotecache.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Per-source coordination settings. Loaded from {@code source.<id>.<field>} properties; every field has a default.
 *
 * @param zone             reference time zone deciding what "today" is for the source
 * @param freshness        how long a current-year partition is trusted after a fetch; zero disables the horizon
 * @param rateLimit        upstream calls allowed per {@code rateWindow}; zero or less disables limiting
 * @param leaseTimeout     age after which a partition lease counts as abandoned; should exceed a full rate wait
 * @param lockWait         how long a blocking lookup polls for the lease per attempt
 * @param lockRetries      attempts of a blocking lookup before it fails
 * @param backfillFromYear first past year the periodic refresh fills in; zero for known partitions only
 * @param perTicker        partitions are keyed by ticker as well as year
 * @param tickers          tickers the periodic refresh keeps warm
 */
public record SourceConfig(
        String sourceId,
        ZoneId zone,
        AdmissionPolicy admissionPolicy,
        Duration freshness,
        int rateLimit,
        Duration rateWindow,
        Duration rateBuffer,
        Duration leaseTimeout,
        Duration lockWait,
        int lockRetries,
        Duration lockBackoff,
        int backfillFromYear,
        boolean perTicker,
        List<String> tickers
) {
    private static final Logger log = LoggerFactory.getLogger(SourceConfig.class);

    public SourceConfig {
        Objects.requireNonNull(sourceId, "sourceId");
        if (sourceId.isBlank() || sourceId.contains(":")) throw new IllegalArgumentException("bad source id: " + sourceId);
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(admissionPolicy, "admissionPolicy");
        Objects.requireNonNull(rateWindow, "rateWindow");
        Objects.requireNonNull(rateBuffer, "rateBuffer");
        Objects.requireNonNull(leaseTimeout, "leaseTimeout");
        tickers = List.copyOf(tickers);
        if (leaseOutlivedByRateWait(leaseTimeout, rateLimit, rateWindow, rateBuffer)) {
            log.warn("source {}: lease timeout {} is not longer than a full rate wait ({} + {}); a slow fetch may lose its lease",
                    sourceId, leaseTimeout, rateWindow, rateBuffer);
        }
    }

    static boolean leaseOutlivedByRateWait(Duration leaseTimeout, int rateLimit, Duration rateWindow, Duration rateBuffer) {
        return rateLimit > 0 && leaseTimeout.compareTo(rateWindow.plus(rateBuffer)) <= 0;
    }

    public static Builder builder(String sourceId) { return new Builder(sourceId); }

    public static SourceConfig defaults(String sourceId) { return builder(sourceId).build(); }

    public static SourceConfig fromProperties(String sourceId, Properties props) {
        String p = "source." + sourceId + ".";
        Builder b = builder(sourceId);
        String v;
        if ((v = props.getProperty(p + "zone")) != null) b.zone(ZoneId.of(v.trim()));
        if ((v = props.getProperty(p + "admissionPolicy")) != null) b.admissionPolicy(AdmissionPolicy.valueOf(v.trim().toUpperCase(Locale.ROOT)));
        if ((v = props.getProperty(p + "freshnessMs")) != null) b.freshness(Duration.ofMillis(Long.parseLong(v.trim())));
        if ((v = props.getProperty(p + "rateLimit")) != null) b.rateLimit = Integer.parseInt(v.trim());
        if ((v = props.getProperty(p + "rateWindowMs")) != null) b.rateWindow = Duration.ofMillis(Long.parseLong(v.trim()));
        if ((v = props.getProperty(p + "rateBufferMs")) != null) b.rateBuffer = Duration.ofMillis(Long.parseLong(v.trim()));
        if ((v = props.getProperty(p + "leaseTimeoutMs")) != null) b.leaseTimeout(Duration.ofMillis(Long.parseLong(v.trim())));
        if ((v = props.getProperty(p + "lockWaitMs")) != null) b.lockWait = Duration.ofMillis(Long.parseLong(v.trim()));
        if ((v = props.getProperty(p + "lockRetries")) != null) b.lockRetries = Integer.parseInt(v.trim());
        if ((v = props.getProperty(p + "lockBackoffMs")) != null) b.lockBackoff = Duration.ofMillis(Long.parseLong(v.trim()));
        if ((v = props.getProperty(p + "backfillFromYear")) != null) b.backfillFromYear(Integer.parseInt(v.trim()));
        if ((v = props.getProperty(p + "perTicker")) != null) b.perTicker(Boolean.parseBoolean(v.trim()));
        if ((v = props.getProperty(p + "tickers")) != null) {
            b.tickers(Arrays.stream(v.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList());
        }
        return b.build();
    }

    public static final class Builder {
        private final String sourceId;
        private ZoneId zone = ZoneId.of("UTC");
        private AdmissionPolicy admissionPolicy = AdmissionPolicy.NON_BLOCKING;
        private Duration freshness = Duration.ZERO;
        private int rateLimit = 10;
        private Duration rateWindow = Duration.ofMinutes(1);
        private Duration rateBuffer = Duration.ofMillis(100);
        private Duration leaseTimeout = Duration.ofMinutes(2);
        private Duration lockWait = Duration.ofSeconds(10);
        private int lockRetries = 5;
        private Duration lockBackoff = Duration.ofMillis(500);
        private int backfillFromYear = 0;
        private boolean perTicker = false;
        private List<String> tickers = new ArrayList<>();

        private Builder(String sourceId) { this.sourceId = sourceId; }

        public Builder zone(ZoneId z) { this.zone = z; return this; }
        public Builder admissionPolicy(AdmissionPolicy p) { this.admissionPolicy = p; return this; }
        public Builder freshness(Duration d) { this.freshness = d; return this; }
        public Builder rateLimit(int limit, Duration window) { this.rateLimit = limit; this.rateWindow = window; return this; }
        public Builder rateBuffer(Duration d) { this.rateBuffer = d; return this; }
        public Builder leaseTimeout(Duration d) { this.leaseTimeout = d; return this; }
        public Builder lockWait(Duration d) { this.lockWait = d; return this; }
        public Builder lockRetries(int retries, Duration backoff) { this.lockRetries = retries; this.lockBackoff = backoff; return this; }
        public Builder backfillFromYear(int y) { this.backfillFromYear = y; return this; }
        public Builder perTicker(boolean b) { this.perTicker = b; return this; }
        public Builder tickers(List<String> t) { this.tickers = new ArrayList<>(t); return this; }

        public SourceConfig build() {
            return new SourceConfig(sourceId, zone, admissionPolicy, freshness, rateLimit, rateWindow, rateBuffer,
                    leaseTimeout, lockWait, Math.max(1, lockRetries), lockBackoff, backfillFromYear, perTicker, tickers);
        }
    }
}
