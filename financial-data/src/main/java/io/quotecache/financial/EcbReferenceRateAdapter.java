package io.quotecache.financial;

import io.quotecache.core.FetchAdapter;
import io.quotecache.error.FetchException;
import io.quotecache.store.PartitionKey;

import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily ECB euro reference rate for one currency (units of currency per EUR), one calendar year per call.
 * Reads the {@code csvdata} format of the ECB data API and picks the TIME_PERIOD and OBS_VALUE columns.
 */
public class EcbReferenceRateAdapter implements FetchAdapter {
    public static final String DEFAULT_BASE_URL = "https://data-api.ecb.europa.eu";

    private final UpstreamClient client;
    private final String baseUrl;
    private final String currency;

    public EcbReferenceRateAdapter(UpstreamClient client, String baseUrl, String currency) {
        if (currency == null || !currency.matches("[A-Za-z]{3}")) throw new IllegalArgumentException("bad currency: " + currency);
        this.client = client;
        this.baseUrl = stripSlash(baseUrl == null ? DEFAULT_BASE_URL : baseUrl);
        this.currency = currency.toUpperCase(Locale.ROOT);
    }

    @Override
    public Map<LocalDate, Double> fetch(PartitionKey partition) {
        int year = partition.year();
        URI uri = URI.create(String.format("%s/service/data/EXR/D.%s.EUR.SP00.A?startPeriod=%d-01-01&endPeriod=%d-12-31&format=csvdata",
                baseUrl, currency, year, year));
        return parse(client.get(uri));
    }

    static Map<LocalDate, Double> parse(String csv) {
        Map<LocalDate, Double> out = new TreeMap<>();
        if (csv == null || csv.isBlank()) return out;
        List<String> lines = csv.lines().filter(l -> !l.isBlank()).toList();
        List<String> header = splitCsv(lines.get(0));
        int dateCol = header.indexOf("TIME_PERIOD");
        int valueCol = header.indexOf("OBS_VALUE");
        if (dateCol < 0 || valueCol < 0) throw new FetchException("ECB answer has no TIME_PERIOD/OBS_VALUE columns");
        for (String line : lines.subList(1, lines.size())) {
            List<String> cols = splitCsv(line);
            if (cols.size() <= Math.max(dateCol, valueCol)) continue;
            String value = cols.get(valueCol).trim();
            if (value.isEmpty() || value.equalsIgnoreCase("NaN")) continue;
            try {
                out.put(LocalDate.parse(cols.get(dateCol).trim()), Double.parseDouble(value));
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new FetchException("unreadable ECB row: " + line, e);
            }
        }
        return out;
    }

    // Quote-aware split; ECB title columns carry commas inside quotes.
    static List<String> splitCsv(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') { cur.append('"'); i++; }
                else if (c == '"') quoted = false;
                else cur.append(c);
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        out.add(cur.toString());
        return out;
    }

    private static String stripSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
