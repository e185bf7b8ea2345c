package com.marketbot.data;

import com.marketbot.config.Config;
import com.marketbot.data.http.HttpClientEx;
import com.marketbot.model.Bar;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Primary provider: Yahoo v8 chart API, daily interval, prices adjusted by {@code adjclose}.
 */
public class YahooChartClient extends RetryingProvider {
    public static final String NAME = "yahoo";

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;

    public YahooChartClient(Config config, HttpClientEx http) {
        this(config, http, Sleeper.SYSTEM);
    }

    public YahooChartClient(Config config, HttpClientEx http, Sleeper sleeper) {
        super(
                NAME,
                config.getInt("yahoo.max_attempts", 3),
                Math.max(0L, config.getLong("yahoo.retry_sleep_ms", 5000L)),
                sleeper
        );
        this.http = http;
        this.baseUrl = config.getString("yahoo.base_url");
        this.timeoutSec = Math.max(3, config.getInt("yahoo.request_timeout_sec", 30));
    }

    @Override
    protected List<Bar> fetchOnce(String symbol, LocalDate start, LocalDate end) throws IOException, InterruptedException {
        long period1 = start.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        long period2 = end.plusDays(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        String url = String.format(Locale.ROOT, baseUrl, symbol.toUpperCase(Locale.ROOT), period1, period2);
        return parseChart(http.getText(url, timeoutSec), start, end);
    }

    /**
     * Rows with a missing or non-positive close are skipped; high/low are widened to cover open and close.
     */
    List<Bar> parseChart(String body, LocalDate start, LocalDate end) {
        List<Bar> out = new ArrayList<>();
        JSONObject root = new JSONObject(body);
        JSONObject chart = root.optJSONObject("chart");
        if (chart == null) {
            return out;
        }
        JSONObject error = chart.optJSONObject("error");
        if (error != null) {
            throw new IllegalStateException("yahoo error: " + error.optString("code", "")
                    + " " + error.optString("description", ""));
        }
        JSONArray result = chart.optJSONArray("result");
        if (result == null || result.length() == 0) {
            return out;
        }
        JSONObject r0 = result.optJSONObject(0);
        if (r0 == null) {
            return out;
        }
        JSONObject meta = r0.optJSONObject("meta");
        long gmtOffset = meta == null ? 0L : meta.optLong("gmtoffset", 0L);

        JSONArray timestamps = r0.optJSONArray("timestamp");
        JSONObject indicators = r0.optJSONObject("indicators");
        JSONArray quoteArr = indicators == null ? null : indicators.optJSONArray("quote");
        JSONObject quote0 = (quoteArr == null || quoteArr.length() == 0) ? null : quoteArr.optJSONObject(0);
        if (timestamps == null || quote0 == null) {
            return out;
        }
        JSONArray adjArr = indicators.optJSONArray("adjclose");
        JSONObject adj0 = (adjArr == null || adjArr.length() == 0) ? null : adjArr.optJSONObject(0);
        JSONArray adjCloses = adj0 == null ? null : adj0.optJSONArray("adjclose");

        JSONArray opens = quote0.optJSONArray("open");
        JSONArray highs = quote0.optJSONArray("high");
        JSONArray lows = quote0.optJSONArray("low");
        JSONArray closes = quote0.optJSONArray("close");
        JSONArray volumes = quote0.optJSONArray("volume");
        if (closes == null) {
            return out;
        }

        int n = Math.min(timestamps.length(), closes.length());
        for (int i = 0; i < n; i++) {
            if (closes.isNull(i)) {
                continue;
            }
            long epoch = timestamps.optLong(i, 0L);
            double close = closes.optDouble(i, Double.NaN);
            if (epoch <= 0 || !Double.isFinite(close) || close <= 0.0) {
                continue;
            }

            double open = valueOrFallback(opens, i, close);
            double high = valueOrFallback(highs, i, Math.max(open, close));
            double low = valueOrFallback(lows, i, Math.min(open, close));
            if (high < Math.max(open, close)) {
                high = Math.max(open, close);
            }
            if (low > Math.min(open, close)) {
                low = Math.min(open, close);
            }
            double volume = valueOrFallback(volumes, i, 0.0);
            if (volume < 0.0) {
                volume = 0.0;
            }

            double ratio = 1.0;
            double adjusted = valueOrFallback(adjCloses, i, Double.NaN);
            if (Double.isFinite(adjusted) && adjusted > 0.0) {
                ratio = adjusted / close;
            }

            LocalDate date = Instant.ofEpochSecond(epoch + gmtOffset).atOffset(ZoneOffset.UTC).toLocalDate();
            if (date.isBefore(start) || date.isAfter(end)) {
                continue;
            }
            LocalDateTime ts = date.atStartOfDay();
            out.add(new Bar(ts, open * ratio, high * ratio, low * ratio, close * ratio, volume));
        }
        out.sort(Comparator.comparing(b -> b.timestamp));
        return out;
    }

    private double valueOrFallback(JSONArray arr, int index, double fallback) {
        if (arr == null || index < 0 || index >= arr.length() || arr.isNull(index)) {
            return fallback;
        }
        double value = arr.optDouble(index, Double.NaN);
        if (!Double.isFinite(value)) {
            return fallback;
        }
        return value;
    }
}
