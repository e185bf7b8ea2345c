package com.marketbot.pipeline;

import com.marketbot.config.Config;
import com.marketbot.core.DownloadException;
import com.marketbot.core.EventLog;
import com.marketbot.core.StorageException;
import com.marketbot.core.ValidationException;
import com.marketbot.data.ProviderResolver;
import com.marketbot.indicator.IndicatorEngine;
import com.marketbot.model.ArtifactKind;
import com.marketbot.model.BarSeries;
import com.marketbot.model.IndicatorSeries;
import com.marketbot.model.Market;
import com.marketbot.model.PipelineStage;
import com.marketbot.model.ProcessingResult;
import com.marketbot.model.Timeframe;
import com.marketbot.quality.QualityGate;
import com.marketbot.session.FreshnessDecision;
import com.marketbot.session.FreshnessPolicy;
import com.marketbot.session.SessionClock;
import com.marketbot.storage.ArtifactLocator;
import com.marketbot.storage.ArtifactName;
import com.marketbot.storage.ArtifactReader;
import com.marketbot.storage.ArtifactStore;
import com.marketbot.transform.TimeframeDeriver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 模块说明：PipelineOrchestrator（class）。
 * 主要职责：单只股票的处理状态机：预检 → 策略判定 →（复用已有数据 | 下载 → 校验 → 保存日线并派生周/月线）→ 三个周期的指标 → 汇总结果。
 * 维护提示：各阶段失败都转换为带阶段名的 ProcessingResult，不向调用方抛出；本类不做重试。
 */
public class PipelineOrchestrator {
    private static final Logger LOG = LogManager.getLogger(PipelineOrchestrator.class);

    private static final Timeframe[] TIMEFRAMES = {Timeframe.DAILY, Timeframe.WEEKLY, Timeframe.MONTHLY};

    private final FreshnessPolicy freshnessPolicy;
    private final ProviderResolver resolver;
    private final QualityGate qualityGate;
    private final ArtifactStore store;
    private final ArtifactLocator locator;
    private final ArtifactReader reader;
    private final TimeframeDeriver deriver;
    private final IndicatorEngine indicatorEngine;
    private final SessionClock clock;
    private final TickerAllowList allowList;
    private final Settings settings;

    public PipelineOrchestrator(
            FreshnessPolicy freshnessPolicy,
            ProviderResolver resolver,
            QualityGate qualityGate,
            ArtifactStore store,
            ArtifactLocator locator,
            ArtifactReader reader,
            TimeframeDeriver deriver,
            IndicatorEngine indicatorEngine,
            SessionClock clock,
            TickerAllowList allowList,
            Settings settings
    ) {
        this.freshnessPolicy = freshnessPolicy;
        this.resolver = resolver;
        this.qualityGate = qualityGate;
        this.store = store;
        this.locator = locator;
        this.reader = reader;
        this.deriver = deriver;
        this.indicatorEngine = indicatorEngine;
        this.clock = clock;
        this.allowList = allowList == null ? TickerAllowList.ALLOW_ALL : allowList;
        this.settings = settings == null ? Settings.defaults() : settings;
    }

    public ProcessingResult process(String rawTicker, Market market) {
        long startedNanos = System.nanoTime();
        String ticker = rawTicker == null ? "" : rawTicker.trim();
        ProcessingResult.Builder result = ProcessingResult.builder(ticker, market);
        if (ticker.isEmpty() || market == null) {
            return elapsed(result, startedNanos).failed(PipelineStage.PRECHECK, "ticker and market are required");
        }
        String traceId = ticker + "-" + UUID.randomUUID().toString().substring(0, 8);
        try {
            if (!isActive(ticker, market)) {
                EventLog.info(LOG, "orchestrator.skip_inactive", "trace_id", traceId, "ticker", ticker, "market", market);
                return elapsed(result, startedNanos).skipped("inactive ticker");
            }
            EventLog.info(LOG, "orchestrator.start", "trace_id", traceId, "ticker", ticker, "market", market);

            FreshnessDecision decision = decideStrategy(ticker, market, traceId);
            if (decision.useExisting()) {
                Optional<ProcessingResult> existing = processExisting(ticker, market, traceId, result, startedNanos);
                if (existing.isPresent()) {
                    return existing.get();
                }
                EventLog.info(LOG, "orchestrator.existing_unusable", "trace_id", traceId, "ticker", ticker);
            }
            return processDownload(ticker, market, traceId, result, startedNanos);
        } catch (RuntimeException e) {
            LOG.error("unexpected failure trace_id={} ticker={} market={}", traceId, ticker, market, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return elapsed(result, startedNanos).failed(PipelineStage.EXCEPTION, message);
        }
    }

    private boolean isActive(String ticker, Market market) {
        try {
            return allowList.isActive(ticker, market);
        } catch (RuntimeException e) {
            LOG.warn("allow-list check failed for {} [{}], continuing: {}", ticker, market, e.getMessage());
            return true;
        }
    }

    private FreshnessDecision decideStrategy(String ticker, Market market, String traceId) {
        try {
            FreshnessDecision decision = freshnessPolicy.decide(ticker, market);
            EventLog.info(LOG, "orchestrator.strategy", "trace_id", traceId, "ticker", ticker,
                    "strategy", decision.strategy.name(), "reason", decision.reason);
            return decision;
        } catch (RuntimeException e) {
            LOG.warn("freshness check failed for {} [{}], downloading: {}", ticker, market, e.getMessage());
            return FreshnessDecision.downloadFresh("freshness_check_failed");
        }
    }

    private Optional<ProcessingResult> processExisting(
            String ticker,
            Market market,
            String traceId,
            ProcessingResult.Builder result,
            long startedNanos
    ) {
        BarSeries daily = reader.readBars(ticker, market, Timeframe.DAILY);
        if (!qualityGate.validate(daily, ticker, settings.minRows)) {
            return Optional.empty();
        }
        EventLog.info(LOG, "orchestrator.use_existing", "trace_id", traceId, "ticker", ticker, "rows", daily.size());

        LocalDateTime nameTimestamp = locator.locate(ticker, ArtifactKind.OHLCV, market, Timeframe.DAILY)
                .flatMap(p -> ArtifactName.parse(p.getFileName().toString()))
                .map(n -> n.timestamp)
                .orElse(daily.latestTimestamp());
        for (Timeframe tf : new Timeframe[]{Timeframe.WEEKLY, Timeframe.MONTHLY}) {
            if (locator.locate(ticker, ArtifactKind.OHLCV, market, tf).isPresent()) {
                continue;
            }
            BarSeries derived = deriver.resample(daily, tf);
            if (derived.isEmpty()) {
                continue;
            }
            try {
                store.saveDerived(ticker, market, tf, derived, nameTimestamp);
            } catch (StorageException e) {
                LOG.warn("regenerating {} failed for {} [{}]: {}", tf.label, ticker, market, e.getMessage());
            }
        }

        int success = 0;
        int rows = 0;
        for (Timeframe tf : TIMEFRAMES) {
            if (indicatorsCurrent(ticker, market, tf)) {
                success++;
                continue;
            }
            IndicatorSeries table = computeIndicators(ticker, market, tf, traceId);
            if (table != null) {
                success++;
                if (tf == Timeframe.DAILY) {
                    rows = table.size();
                }
            }
        }
        if (rows == 0) {
            rows = reader.readIndicators(ticker, market, Timeframe.DAILY).size();
        }

        result.dataSource(ProcessingResult.SOURCE_EXISTING)
                .dataRows(daily.size())
                .indicatorRows(rows)
                .indicatorCounts(success, TIMEFRAMES.length);
        collectArtifacts(ticker, market, result);
        EventLog.info(LOG, "orchestrator.done", "trace_id", traceId, "ticker", ticker, "source", "existing",
                "indicators_ok", success);
        return Optional.of(elapsed(result, startedNanos).succeeded());
    }

    private ProcessingResult processDownload(
            String ticker,
            Market market,
            String traceId,
            ProcessingResult.Builder result,
            long startedNanos
    ) {
        LocalDate end = clock.today(market);
        LocalDate start = end.minusDays(settings.lookbackDays);
        EventLog.info(LOG, "download.begin", "trace_id", traceId, "ticker", ticker, "start", start.toString(),
                "end", end.toString());
        BarSeries raw;
        try {
            raw = resolver.download(ticker, market, start, end);
        } catch (DownloadException e) {
            EventLog.warn(LOG, "download.end", "trace_id", traceId, "ticker", ticker, "status", "failed",
                    "error", e.getMessage());
            return elapsed(result, startedNanos).failed(PipelineStage.DOWNLOAD, e.getMessage());
        }
        EventLog.info(LOG, "download.end", "trace_id", traceId, "ticker", ticker, "rows", raw.size());

        BarSeries cleaned = qualityGate.clean(raw, ticker);
        try {
            qualityGate.requireValid(cleaned, ticker, settings.minRows);
        } catch (ValidationException e) {
            return elapsed(result, startedNanos).failed(PipelineStage.VALIDATE, e.getMessage());
        }

        EventLog.info(LOG, "save.daily.begin", "trace_id", traceId, "ticker", ticker, "rows", cleaned.size());
        Path dailyPath;
        try {
            dailyPath = store.saveBars(ticker, market, Timeframe.DAILY, cleaned);
        } catch (StorageException e) {
            return elapsed(result, startedNanos).failed(PipelineStage.SAVE_DAILY, e.getMessage());
        }
        EventLog.info(LOG, "save.daily.end", "trace_id", traceId, "ticker", ticker, "path", dailyPath.toString());

        int success = 0;
        int dailyRows = 0;
        for (Timeframe tf : TIMEFRAMES) {
            IndicatorSeries table = computeIndicators(ticker, market, tf, traceId);
            if (table != null) {
                success++;
                if (tf == Timeframe.DAILY) {
                    dailyRows = table.size();
                }
            }
        }

        result.dataSource(ProcessingResult.SOURCE_DOWNLOAD)
                .dataRows(cleaned.size())
                .indicatorRows(dailyRows)
                .indicatorCounts(success, TIMEFRAMES.length);
        collectArtifacts(ticker, market, result);
        EventLog.info(LOG, "orchestrator.done", "trace_id", traceId, "ticker", ticker, "source", "download",
                "indicators_ok", success);
        return elapsed(result, startedNanos).succeeded();
    }

    /**
     * Computes and saves one timeframe's indicators. Returns null when skipped or failed; never fatal.
     */
    private IndicatorSeries computeIndicators(String ticker, Market market, Timeframe tf, String traceId) {
        EventLog.info(LOG, "indicators.calculate.begin", "trace_id", traceId, "ticker", ticker, "timeframe", tf.code);
        try {
            BarSeries bars = reader.readBars(ticker, market, tf);
            int minRows = settings.indicatorMinRows.getOrDefault(tf, 1);
            if (bars.size() < minRows) {
                EventLog.info(LOG, "indicators.calculate.end", "trace_id", traceId, "ticker", ticker,
                        "timeframe", tf.code, "status", "skipped", "rows", bars.size(), "min_rows", minRows);
                return null;
            }
            IndicatorSeries table = indicatorEngine.compute(qualityGate.repairCloseRange(bars, ticker));
            Path path = store.saveTable(ticker, market, ArtifactKind.INDICATORS, tf, table);
            EventLog.info(LOG, "indicators.calculate.end", "trace_id", traceId, "ticker", ticker,
                    "timeframe", tf.code, "status", "success", "rows", table.size(), "path", path.toString());
            return table;
        } catch (StorageException | RuntimeException e) {
            EventLog.warn(LOG, "indicators.calculate.end", "trace_id", traceId, "ticker", ticker,
                    "timeframe", tf.code, "status", "failed", "error", e.getMessage());
            return null;
        }
    }

    /**
     * Current when both artifacts exist and the indicators carry a timestamp no older than their bars.
     */
    private boolean indicatorsCurrent(String ticker, Market market, Timeframe tf) {
        Optional<Path> bars = locator.locate(ticker, ArtifactKind.OHLCV, market, tf);
        Optional<Path> indicators = locator.locate(ticker, ArtifactKind.INDICATORS, market, tf);
        if (bars.isEmpty() || indicators.isEmpty()) {
            return false;
        }
        Optional<ArtifactName> barsName = ArtifactName.parse(bars.get().getFileName().toString());
        Optional<ArtifactName> indicatorName = ArtifactName.parse(indicators.get().getFileName().toString());
        if (barsName.isEmpty() || indicatorName.isEmpty()) {
            return false;
        }
        return !indicatorName.get().timestamp.isBefore(barsName.get().timestamp);
    }

    private void collectArtifacts(String ticker, Market market, ProcessingResult.Builder result) {
        for (Timeframe tf : TIMEFRAMES) {
            result.artifact(ArtifactKind.OHLCV, tf, locator.locate(ticker, ArtifactKind.OHLCV, market, tf).orElse(null));
            result.artifact(ArtifactKind.INDICATORS, tf,
                    locator.locate(ticker, ArtifactKind.INDICATORS, market, tf).orElse(null));
        }
    }

    private static ProcessingResult.Builder elapsed(ProcessingResult.Builder result, long startedNanos) {
        return result.elapsed(Duration.ofNanos(Math.max(0L, System.nanoTime() - startedNanos)));
    }

    public static final class Settings {
        public final int lookbackDays;
        public final int minRows;
        public final Map<Timeframe, Integer> indicatorMinRows;

        public Settings(int lookbackDays, int minRows, Map<Timeframe, Integer> indicatorMinRows) {
            this.lookbackDays = Math.max(1, lookbackDays);
            this.minRows = Math.max(1, minRows);
            Map<Timeframe, Integer> copy = new EnumMap<>(Timeframe.class);
            if (indicatorMinRows != null) {
                copy.putAll(indicatorMinRows);
            }
            this.indicatorMinRows = copy;
        }

        public static Settings defaults() {
            return new Settings(5 * 365, 20, Map.of(Timeframe.DAILY, 50, Timeframe.WEEKLY, 20, Timeframe.MONTHLY, 6));
        }

        public static Settings fromConfig(Config config) {
            Map<Timeframe, Integer> mins = new EnumMap<>(Timeframe.class);
            mins.put(Timeframe.DAILY, Math.max(1, config.getInt("indicators.min_rows.d", 50)));
            mins.put(Timeframe.WEEKLY, Math.max(1, config.getInt("indicators.min_rows.w", 20)));
            mins.put(Timeframe.MONTHLY, Math.max(1, config.getInt("indicators.min_rows.m", 6)));
            return new Settings(
                    config.getInt("download.lookback_days", 5 * 365),
                    config.getInt("validation.min_rows", 20),
                    mins
            );
        }
    }
}
