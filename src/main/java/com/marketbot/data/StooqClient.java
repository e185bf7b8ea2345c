package com.marketbot.data;

import com.marketbot.config.Config;
import com.marketbot.data.http.HttpClientEx;
import com.marketbot.model.Bar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * US secondary provider: Stooq daily CSV download.
 */
public class StooqClient extends RetryingProvider {
    public static final String NAME = "stooq";
    private static final Logger LOG = LogManager.getLogger(StooqClient.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;

    public StooqClient(Config config, HttpClientEx http) {
        this(config, http, Sleeper.SYSTEM);
    }

    public StooqClient(Config config, HttpClientEx http, Sleeper sleeper) {
        super(
                NAME,
                config.getInt("stooq.max_attempts", 3),
                Math.max(0L, config.getLong("stooq.retry_sleep_ms", 2000L)),
                sleeper
        );
        this.http = http;
        this.baseUrl = config.getString("stooq.base_url");
        this.timeoutSec = Math.max(3, config.getInt("stooq.request_timeout_sec", 20));
    }

    @Override
    protected List<Bar> fetchOnce(String symbol, LocalDate start, LocalDate end) throws IOException, InterruptedException {
        String url = String.format(Locale.ROOT, baseUrl, toStooqSymbol(symbol), start.format(DAY), end.format(DAY));
        return parseCsv(http.getText(url, timeoutSec), start, end);
    }

    static String toStooqSymbol(String symbol) {
        String s = symbol.trim().toLowerCase(Locale.ROOT);
        return s.contains(".") ? s : s + ".us";
    }

    List<Bar> parseCsv(String body, LocalDate start, LocalDate end) {
        if (body == null) {
            return List.of();
        }
        String text = body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            return List.of();
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new IllegalStateException("stooq_rate_limit");
        }

        String[] lines = text.split("\\r?\\n");
        String header = lines[0].trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("date,open,high,low,close")) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new IllegalStateException("unexpected_stooq_payload:" + sample);
        }

        List<Bar> all = new ArrayList<>(Math.max(64, lines.length));
        int malformed = 0;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",");
            if (cols.length < 5) {
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(cols[0].trim());
                if (date.isBefore(start) || date.isAfter(end)) {
                    continue;
                }
                double close = parseDouble(cols[4]);
                if (!(close > 0.0)) {
                    continue;
                }
                double volume = cols.length >= 6 ? parseDouble(cols[5]) : 0.0;
                all.add(new Bar(date.atStartOfDay(), parseDouble(cols[1]), parseDouble(cols[2]),
                        parseDouble(cols[3]), close, volume));
            } catch (DateTimeParseException | NumberFormatException e) {
                malformed++;
            }
        }
        if (malformed > 0) {
            LOG.debug("stooq skipped {} malformed lines", malformed);
        }
        all.sort(Comparator.comparing(b -> b.timestamp));
        return all;
    }

    private double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return Double.NaN;
        }
        return Double.parseDouble(v);
    }
}
