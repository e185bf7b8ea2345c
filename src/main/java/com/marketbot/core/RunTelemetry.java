package com.marketbot.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a batch run's per-step counters and prints a summary.
 */
public final class RunTelemetry {
    public static final String STEP_SWEEP = "RETENTION_SWEEP";
    public static final String STEP_PROCESS = "TICKER_PROCESS";
    public static final String STEP_EXISTING = "USE_EXISTING";
    public static final String STEP_DOWNLOAD = "DOWNLOAD";
    public static final String STEP_INDICATORS = "INDICATORS";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runId;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;

    private int tickersOk;
    private int tickersSkipped;
    private int tickersFailed;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Integer> failuresByStage = new LinkedHashMap<>();

    public RunTelemetry(String runId, String trigger, Instant startedAt) {
        this.runId = blankTo(runId, "run");
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String runId() {
        return runId;
    }

    public synchronized String trigger() {
        return trigger;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    /**
     * Adds one completed unit of work to a step. Steps run concurrently across tickers,
     * so elapsed time is passed in rather than measured from a start marker.
     */
    public synchronized void recordStep(String name, long elapsedMs, long itemsIn, long itemsOut, long errorCount, String note) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        stat.elapsedMs += Math.max(0L, elapsedMs);
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        String trimmed = note == null ? "" : note.trim();
        if (!trimmed.isEmpty()) {
            if (stat.optionalNote.isEmpty()) {
                stat.optionalNote = trimmed;
            } else if (!stat.optionalNote.contains(trimmed)) {
                stat.optionalNote = stat.optionalNote + "; " + trimmed;
            }
        }
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    public synchronized void recordTickerOk() {
        tickersOk++;
    }

    public synchronized void recordTickerSkipped() {
        tickersSkipped++;
    }

    public synchronized void recordTickerFailed(String stage) {
        tickersFailed++;
        failuresByStage.merge(blankTo(stage, "unknown"), 1, Integer::sum);
    }

    public synchronized int tickersOk() {
        return tickersOk;
    }

    public synchronized int tickersSkipped() {
        return tickersSkipped;
    }

    public synchronized int tickersFailed() {
        return tickersFailed;
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized Map<String, Integer> failuresByStage() {
        return new LinkedHashMap<>(failuresByStage);
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount, stat.optionalNote));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_id=").append(runId).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("tickers_ok=").append(tickersOk)
                .append(" skipped=").append(tickersSkipped)
                .append(" failed=").append(tickersFailed).append('\n');
        if (!failuresByStage.isEmpty()) {
            sb.append("failures_by_stage=").append(failuresByStage).append('\n');
        }
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (!stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote = "";

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
