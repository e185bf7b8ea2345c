package com.marketbot.core;

import java.util.List;

/**
 * Every provider attempt for a ticker came back empty or failed.
 */
public class DownloadException extends MarketDataException {
    private final List<String> attemptErrors;

    public DownloadException(String message, List<String> attemptErrors) {
        super("download", message);
        this.attemptErrors = attemptErrors == null ? List.of() : List.copyOf(attemptErrors);
    }

    public List<String> attemptErrors() {
        return attemptErrors;
    }
}
