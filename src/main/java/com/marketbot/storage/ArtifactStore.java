package com.marketbot.storage;

import com.marketbot.core.StorageException;
import com.marketbot.model.ArtifactKind;
import com.marketbot.model.Bar;
import com.marketbot.model.BarSeries;
import com.marketbot.model.IndicatorSeries;
import com.marketbot.model.Market;
import com.marketbot.model.Timeframe;
import com.marketbot.transform.TimeframeDeriver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 模块说明：ArtifactStore（class）。
 * 主要职责：把 K 线或指标表写成“元数据头 + CSV”文件；日线保存时顺带派生并保存周线、月线。
 * 维护提示：先写同目录隐藏临时文件再原子改名，读者不会看到半写文件；本类不计算指标。
 */
public class ArtifactStore {
    private static final Logger LOG = LogManager.getLogger(ArtifactStore.class);

    private static final String BARS_HEADER = "Date,Open,High,Low,Close,Volume,Date_Index,Time_Index";

    private final Path dataRoot;
    private final TimeframeDeriver deriver;
    private final Clock clock;

    public ArtifactStore(Path dataRoot, TimeframeDeriver deriver, Clock clock) {
        this.dataRoot = dataRoot;
        this.deriver = deriver == null ? new TimeframeDeriver() : deriver;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Path dataRoot() {
        return dataRoot;
    }

    public Path ensureMarketDirectory(Market market) throws StorageException {
        Path dir = dataRoot.resolve(market.folder);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("cannot create market directory " + dir + ": " + e.getMessage(), e);
        }
        return dir;
    }

    /**
     * Persists bars. A daily save also derives weekly and monthly artifacts, named with the
     * daily series' latest timestamp; a failed derivation is logged and does not fail the save.
     */
    public Path saveBars(String ticker, Market market, Timeframe timeframe, BarSeries series) throws StorageException {
        if (series == null || series.isEmpty()) {
            throw new StorageException("refusing to save empty " + timeframe.label + " series for " + ticker);
        }
        LocalDateTime latest = series.latestTimestamp();
        Path saved = writeBars(ticker, market, timeframe, series, latest);
        if (timeframe == Timeframe.DAILY) {
            deriveAndSave(ticker, market, series, Timeframe.WEEKLY, latest);
            deriveAndSave(ticker, market, series, Timeframe.MONTHLY, latest);
        }
        return saved;
    }

    /**
     * Writes a derived series under the given name timestamp, for regenerating one missing timeframe.
     */
    public Path saveDerived(String ticker, Market market, Timeframe timeframe, BarSeries derived, LocalDateTime nameTimestamp)
            throws StorageException {
        if (derived == null || derived.isEmpty()) {
            throw new StorageException("refusing to save empty " + timeframe.label + " series for " + ticker);
        }
        return writeBars(ticker, market, timeframe, derived, nameTimestamp == null ? derived.latestTimestamp() : nameTimestamp);
    }

    public Path saveTable(String ticker, Market market, ArtifactKind kind, Timeframe timeframe, IndicatorSeries table)
            throws StorageException {
        if (kind == ArtifactKind.OHLCV) {
            throw new IllegalArgumentException("bars are saved with saveBars");
        }
        if (table == null || table.isEmpty()) {
            throw new StorageException("refusing to save empty " + kind.token + " table for " + ticker);
        }
        LocalDateTime latest = table.latestTimestamp();
        List<LocalDateTime> timestamps = table.timestamps();
        List<String> columns = table.columnNames();

        StringBuilder body = new StringBuilder();
        body.append("Date");
        for (String column : columns) {
            body.append(',').append(column);
        }
        body.append(",Date_Index,Time_Index\n");
        for (int row = 0; row < timestamps.size(); row++) {
            LocalDateTime ts = timestamps.get(row);
            body.append(CsvFormat.dateCell(ts));
            for (String column : columns) {
                body.append(',').append(CsvFormat.number(table.value(column, row)));
            }
            appendIndexCells(body, ts);
        }

        // External writers (crossinfo) may hand over unsorted rows.
        LocalDateTime earliest = timestamps.stream().filter(Objects::nonNull).min(LocalDateTime::compareTo).orElse(latest);
        Map<String, String> meta = metadata(ticker, market, kind.token + "_" + timeframe.code,
                earliest, latest, latest, timestamps.size());
        return write(market, ArtifactName.format(ticker, kind, timeframe, latest, market), kind, meta, body);
    }

    private void deriveAndSave(String ticker, Market market, BarSeries daily, Timeframe target, LocalDateTime nameTimestamp) {
        try {
            BarSeries derived = deriver.resample(daily, target);
            if (derived.isEmpty()) {
                LOG.info("skip {} derivation for {} [{}]: {} daily rows", target.label, ticker, market, daily.size());
                return;
            }
            writeBars(ticker, market, target, derived, nameTimestamp);
        } catch (StorageException | RuntimeException e) {
            LOG.warn("{} derivation failed for {} [{}]: {}", target.label, ticker, market, e.getMessage());
        }
    }

    private Path writeBars(String ticker, Market market, Timeframe timeframe, BarSeries series, LocalDateTime nameTimestamp)
            throws StorageException {
        StringBuilder body = new StringBuilder();
        body.append(BARS_HEADER).append('\n');
        for (Bar bar : series.bars()) {
            body.append(CsvFormat.dateCell(bar.timestamp))
                    .append(',').append(CsvFormat.number(bar.open))
                    .append(',').append(CsvFormat.number(bar.high))
                    .append(',').append(CsvFormat.number(bar.low))
                    .append(',').append(CsvFormat.number(bar.close))
                    .append(',').append(CsvFormat.number(bar.volume));
            appendIndexCells(body, bar.timestamp);
        }
        Map<String, String> meta = metadata(ticker, market, timeframe.label,
                series.first().timestamp, series.last().timestamp, nameTimestamp, series.size());
        String fileName = ArtifactName.format(ticker, ArtifactKind.OHLCV, timeframe, nameTimestamp, market);
        return write(market, fileName, ArtifactKind.OHLCV, meta, body);
    }

    private Map<String, String> metadata(
            String ticker,
            Market market,
            String timeframeLabel,
            LocalDateTime start,
            LocalDateTime end,
            LocalDateTime latest,
            int rows
    ) {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put(ArtifactMetadata.TICKER, ticker);
        meta.put(ArtifactMetadata.MARKET_TYPE, market.name());
        meta.put(ArtifactMetadata.TIMEFRAME, timeframeLabel);
        meta.put(ArtifactMetadata.DATA_START_DATE, CsvFormat.TIMESTAMP.format(start));
        meta.put(ArtifactMetadata.DATA_END_DATE, CsvFormat.TIMESTAMP.format(end));
        meta.put(ArtifactMetadata.LATEST_DATA_DATETIME, CsvFormat.TIMESTAMP.format(latest));
        meta.put(ArtifactMetadata.TOTAL_ROWS, Integer.toString(rows));
        meta.put(ArtifactMetadata.CREATED_AT, CsvFormat.TIMESTAMP.format(ZonedDateTime.ofInstant(clock.instant(), market.zone)));
        meta.put(ArtifactMetadata.TIMEZONE, market.timezoneLabel);
        return meta;
    }

    private static void appendIndexCells(StringBuilder body, LocalDateTime ts) {
        body.append(',').append(CsvFormat.DATE.format(ts))
                .append(',').append(CsvFormat.TIME.format(ts))
                .append('\n');
    }

    private Path write(Market market, String fileName, ArtifactKind kind, Map<String, String> meta, CharSequence body)
            throws StorageException {
        Path dir = ensureMarketDirectory(market);
        Path target = dir.resolve(fileName);
        Path tmp = dir.resolve("." + fileName + "." + UUID.randomUUID() + ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                writer.write("# " + kind.title + " Data Metadata\n");
                for (Map.Entry<String, String> entry : meta.entrySet()) {
                    writer.write("# " + entry.getKey() + ": " + entry.getValue() + "\n");
                }
                writer.write(CsvFormat.METADATA_END + "\n\n");
                writer.append(body);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            StorageException failure = new StorageException("failed to write " + target + ": " + e.getMessage(), e);
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
        LOG.info("saved {} rows={} path={}", kind.token, meta.get(ArtifactMetadata.TOTAL_ROWS), target);
        return target;
    }
}
