package com.marketbot.data;

import com.marketbot.core.EventLog;
import com.marketbot.model.Bar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * 模块说明：RetryingProvider（abstract class）。
 * 主要职责：为各数据源提供统一的“固定间隔重试 + 结构化日志 + 标记结果”流程，子类只负责单次请求与解析。
 * 维护提示：空结果不休眠直接进入下一次尝试；异常后按固定间隔休眠。
 */
public abstract class RetryingProvider implements MarketDataProvider {
    private static final Logger LOG = LogManager.getLogger(RetryingProvider.class);

    @FunctionalInterface
    public interface Sleeper {
        Sleeper SYSTEM = Thread::sleep;

        void sleep(long millis) throws InterruptedException;
    }

    private final String name;
    private final int maxAttempts;
    private final long retrySleepMs;
    private final Sleeper sleeper;

    protected RetryingProvider(String name, int maxAttempts, long retrySleepMs, Sleeper sleeper) {
        this.name = name;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retrySleepMs = Math.max(0L, retrySleepMs);
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final FetchResult fetch(String symbol, LocalDate start, LocalDate end) {
        String normalized = symbol == null ? "" : symbol.trim();
        if (normalized.isEmpty()) {
            return FetchResult.failed(name, "", "blank symbol", "other", 0);
        }
        String lastError = "";
        String lastCategory = "other";
        boolean lastWasEmpty = false;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            EventLog.info(LOG, "download.call", "provider", name, "ticker", normalized, "attempt", attempt,
                    "start", String.valueOf(start), "end", String.valueOf(end));
            try {
                List<Bar> bars = fetchOnce(normalized, start, end);
                if (bars != null && !bars.isEmpty()) {
                    EventLog.info(LOG, "download.result", "provider", name, "ticker", normalized,
                            "attempt", attempt, "rows", bars.size(), "status", "success");
                    return FetchResult.success(name, normalized, bars, attempt);
                }
                EventLog.info(LOG, "download.result", "provider", name, "ticker", normalized,
                        "attempt", attempt, "rows", 0, "status", "empty");
                lastWasEmpty = true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failed(name, normalized, "interrupted", "other", attempt);
            } catch (IOException | RuntimeException e) {
                lastWasEmpty = false;
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                lastCategory = classifyFailureMessage(lastError);
                EventLog.warn(LOG, "download.retry", "provider", name, "ticker", normalized,
                        "attempt", attempt, "error", lastError, "category", lastCategory);
                if (attempt < maxAttempts) {
                    try {
                        sleeper.sleep(retrySleepMs);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return FetchResult.failed(name, normalized, "interrupted", "other", attempt);
                    }
                }
            }
        }
        if (lastWasEmpty) {
            return FetchResult.empty(name, normalized, maxAttempts);
        }
        return FetchResult.failed(name, normalized, lastError, lastCategory, maxAttempts);
    }

    /**
     * One request plus parse. An empty list means the provider answered without rows.
     */
    protected abstract List<Bar> fetchOnce(String symbol, LocalDate start, LocalDate end)
            throws IOException, InterruptedException;

    public static String classifyFailureMessage(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return "timeout";
        }
        if (msg.contains("rate_limit")
                || msg.contains("too many requests")
                || msg.contains("daily hits limit")
                || msg.contains("http status=429")) {
            return "rate_limit";
        }
        if (msg.contains("no data") || msg.contains("no_data") || msg.contains("delisted")) {
            return "no_data";
        }
        return "other";
    }
}
