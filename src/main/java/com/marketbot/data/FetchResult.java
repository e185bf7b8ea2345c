package com.marketbot.data;

import com.marketbot.model.Bar;

import java.util.List;
import java.util.Locale;

/**
 * Tagged outcome of one provider call, including every retry it made.
 */
public final class FetchResult {
    public enum Status {
        SUCCESS,
        EMPTY,
        ERROR
    }

    public final Status status;
    public final String provider;
    public final String symbol;
    public final List<Bar> bars;
    public final int attempts;
    public final String error;
    public final String errorCategory;

    private FetchResult(
            Status status,
            String provider,
            String symbol,
            List<Bar> bars,
            int attempts,
            String error,
            String errorCategory
    ) {
        this.status = status;
        this.provider = provider == null ? "" : provider;
        this.symbol = symbol == null ? "" : symbol;
        this.bars = bars == null ? List.of() : List.copyOf(bars);
        this.attempts = Math.max(0, attempts);
        this.error = error == null ? "" : error;
        this.errorCategory = errorCategory == null ? "" : errorCategory;
    }

    public static FetchResult success(String provider, String symbol, List<Bar> bars, int attempts) {
        return new FetchResult(Status.SUCCESS, provider, symbol, bars, attempts, "", "");
    }

    public static FetchResult empty(String provider, String symbol, int attempts) {
        return new FetchResult(Status.EMPTY, provider, symbol, List.of(), attempts, "no_data", "no_data");
    }

    public static FetchResult failed(String provider, String symbol, String error, String errorCategory, int attempts) {
        return new FetchResult(Status.ERROR, provider, symbol, List.of(), attempts, error, errorCategory);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public String describe() {
        if (status == Status.SUCCESS) {
            return provider + ":" + symbol + " rows=" + bars.size();
        }
        return provider + ":" + symbol + " " + status.name().toLowerCase(Locale.ROOT)
                + (error.isEmpty() ? "" : " (" + error + ")");
    }
}
