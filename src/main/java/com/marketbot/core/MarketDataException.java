package com.marketbot.core;

/**
 * Base checked failure of the pipeline. The stage names the pipeline step that raised it.
 */
public class MarketDataException extends Exception {
    private final String stage;

    public MarketDataException(String stage, String message) {
        super(message);
        this.stage = stage == null ? "" : stage;
    }

    public MarketDataException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage == null ? "" : stage;
    }

    public String stage() {
        return stage;
    }
}
