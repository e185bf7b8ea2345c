package com.marketbot.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of processing one ticker. Never persisted.
 */
public final class ProcessingResult {
    public static final String SOURCE_EXISTING = "existing";
    public static final String SOURCE_DOWNLOAD = "download";

    public final boolean success;
    public final boolean skipped;
    public final String ticker;
    public final Market market;
    public final String dataSource;
    public final PipelineStage failedStage;
    public final String errorMessage;
    public final Duration elapsed;
    public final int dataRows;
    public final int indicatorRows;
    public final int indicatorSuccessCount;
    public final int indicatorTotalCount;
    private final Map<String, Path> artifacts;

    private ProcessingResult(Builder b) {
        this.success = b.success;
        this.skipped = b.skipped;
        this.ticker = b.ticker == null ? "" : b.ticker;
        this.market = b.market;
        this.dataSource = b.dataSource == null ? "" : b.dataSource;
        this.failedStage = b.failedStage;
        this.errorMessage = b.errorMessage == null ? "" : b.errorMessage;
        this.elapsed = b.elapsed == null ? Duration.ZERO : b.elapsed;
        this.dataRows = Math.max(0, b.dataRows);
        this.indicatorRows = Math.max(0, b.indicatorRows);
        this.indicatorSuccessCount = Math.max(0, b.indicatorSuccessCount);
        this.indicatorTotalCount = Math.max(0, b.indicatorTotalCount);
        this.artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(b.artifacts));
    }

    public static Builder builder(String ticker, Market market) {
        return new Builder(ticker, market);
    }

    public Path artifact(ArtifactKind kind, Timeframe timeframe) {
        return artifacts.get(key(kind, timeframe));
    }

    public Map<String, Path> artifacts() {
        return artifacts;
    }

    public String failedStageLabel() {
        return failedStage == null ? "" : failedStage.label;
    }

    static String key(ArtifactKind kind, Timeframe timeframe) {
        return kind.token + "_" + timeframe.code;
    }

    @Override
    public String toString() {
        if (skipped) {
            return ticker + " [" + market + "] skipped";
        }
        if (!success) {
            return ticker + " [" + market + "] failed stage=" + failedStageLabel() + " error=" + errorMessage;
        }
        return ticker + " [" + market + "] ok source=" + dataSource
                + " rows=" + dataRows
                + " indicators=" + indicatorSuccessCount + "/" + indicatorTotalCount
                + " elapsed_ms=" + elapsed.toMillis();
    }

    public static final class Builder {
        private final String ticker;
        private final Market market;
        private boolean success;
        private boolean skipped;
        private String dataSource;
        private PipelineStage failedStage;
        private String errorMessage;
        private Duration elapsed;
        private int dataRows;
        private int indicatorRows;
        private int indicatorSuccessCount;
        private int indicatorTotalCount;
        private final Map<String, Path> artifacts = new LinkedHashMap<>();

        private Builder(String ticker, Market market) {
            this.ticker = ticker;
            this.market = market;
        }

        public Builder dataSource(String dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder artifact(ArtifactKind kind, Timeframe timeframe, Path path) {
            if (path != null) {
                artifacts.put(key(kind, timeframe), path);
            }
            return this;
        }

        public Builder dataRows(int dataRows) {
            this.dataRows = dataRows;
            return this;
        }

        public Builder indicatorRows(int indicatorRows) {
            this.indicatorRows = indicatorRows;
            return this;
        }

        public Builder indicatorCounts(int successCount, int totalCount) {
            this.indicatorSuccessCount = successCount;
            this.indicatorTotalCount = totalCount;
            return this;
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        public ProcessingResult succeeded() {
            this.success = true;
            this.skipped = false;
            this.failedStage = null;
            return new ProcessingResult(this);
        }

        public ProcessingResult skipped(String reason) {
            this.success = true;
            this.skipped = true;
            this.errorMessage = reason;
            return new ProcessingResult(this);
        }

        public ProcessingResult failed(PipelineStage stage, String message) {
            this.success = false;
            this.failedStage = stage;
            this.errorMessage = message;
            return new ProcessingResult(this);
        }
    }
}
