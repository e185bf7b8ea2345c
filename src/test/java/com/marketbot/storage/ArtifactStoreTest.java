package com.marketbot.storage;

import com.marketbot.core.ArtifactNotFoundException;
import com.marketbot.core.StorageException;
import com.marketbot.model.ArtifactKind;
import com.marketbot.model.Bar;
import com.marketbot.model.BarSeries;
import com.marketbot.model.IndicatorSeries;
import com.marketbot.model.Market;
import com.marketbot.model.Timeframe;
import com.marketbot.transform.TimeframeDeriver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-04T15:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dataRoot;

    @Test
    void saveBars_shouldRoundTripThroughReader() throws Exception {
        ArtifactStore store = new ArtifactStore(dataRoot, new TimeframeDeriver(), CLOCK);
        ArtifactReader reader = new ArtifactReader(new FileArtifactLocator(dataRoot));
        BarSeries daily = dailyBars(60, LocalDate.of(2024, 3, 1));

        Path saved = store.saveBars("AAPL", Market.US, Timeframe.DAILY, daily);

        assertEquals("AAPL_ohlcv_d_20240301_000000_EST.csv", saved.getFileName().toString());
        assertEquals(dataRoot.resolve("US"), saved.getParent());
        BarSeries back = reader.requireBars("AAPL", Market.US, Timeframe.DAILY);
        assertEquals(60, back.size());
        for (int i = 0; i < daily.size(); i++) {
            Bar expected = daily.get(i);
            Bar actual = back.get(i);
            assertEquals(expected.timestamp, actual.timestamp);
            assertEquals(expected.open, actual.open, 1e-9);
            assertEquals(expected.high, actual.high, 1e-9);
            assertEquals(expected.low, actual.low, 1e-9);
            assertEquals(expected.close, actual.close, 1e-9);
            assertEquals(expected.volume, actual.volume, 1e-9);
        }
    }

    @Test
    void saveBars_shouldWriteMetadataBlock() throws Exception {
        ArtifactStore store = new ArtifactStore(dataRoot, new TimeframeDeriver(), CLOCK);
        Path saved = store.saveBars("AAPL", Market.US, Timeframe.DAILY, dailyBars(60, LocalDate.of(2024, 3, 1)));

        List<String> lines = Files.readAllLines(saved, StandardCharsets.UTF_8);
        assertEquals("# OHLCV Data Metadata", lines.get(0));
        assertTrue(lines.contains("# End Metadata"));
        assertTrue(lines.contains("Date,Open,High,Low,Close,Volume,Date_Index,Time_Index"));
        assertTrue(lines.contains("2024-03-01,159,161,158,159.5,1059,2024-03-01,00:00:00"));

        ArtifactMetadata meta = new ArtifactReader(new FileArtifactLocator(dataRoot)).readMetadata(saved);
        assertEquals("AAPL", meta.get(ArtifactMetadata.TICKER));
        assertEquals("US", meta.get(ArtifactMetadata.MARKET_TYPE));
        assertEquals("daily", meta.get(ArtifactMetadata.TIMEFRAME));
        assertEquals("2024-01-02 00:00:00", meta.get(ArtifactMetadata.DATA_START_DATE));
        assertEquals("2024-03-01 00:00:00", meta.get(ArtifactMetadata.LATEST_DATA_DATETIME));
        assertEquals(60, meta.totalRows());
        assertEquals("2024-03-04 10:00:00", meta.get(ArtifactMetadata.CREATED_AT));
        assertEquals("EST", meta.get(ArtifactMetadata.TIMEZONE));
        assertEquals(LocalDateTime.of(2024, 3, 4, 10, 0), meta.createdAt().orElseThrow());
    }

    @Test
    void saveBars_shouldDeriveWeeklyAndMonthlyNamedAfterDailyLatest() throws Exception {
        ArtifactStore store = new ArtifactStore(dataRoot, new TimeframeDeriver(), CLOCK);
        store.saveBars("AAPL", Market.US, Timeframe.DAILY, dailyBars(60, LocalDate.of(2024, 3, 1)));

        assertTrue(Files.exists(dataRoot.resolve("US/AAPL_ohlcv_w_20240301_000000_EST.csv")));
        assertTrue(Files.exists(dataRoot.resolve("US/AAPL_ohlcv_m_20240301_000000_EST.csv")));

        ArtifactReader reader = new ArtifactReader(new FileArtifactLocator(dataRoot));
        BarSeries monthly = reader.readBars("AAPL", Market.US, Timeframe.MONTHLY);
        assertEquals(3, monthly.size());
        assertEquals(LocalDateTime.of(2024, 3, 31, 0, 0), monthly.last().timestamp);
        assertEquals("monthly", reader.latestMetadata("AAPL", Market.US, ArtifactKind.OHLCV, Timeframe.MONTHLY)
                .orElseThrow().get(ArtifactMetadata.TIMEFRAME));
    }

    @Test
    void saveBars_shouldSkipDerivationForShortSeries() throws Exception {
        ArtifactStore store = new ArtifactStore(dataRoot, new TimeframeDeriver(), CLOCK);
        store.saveBars("MSFT", Market.US, Timeframe.DAILY, dailyBars(10, LocalDate.of(2024, 3, 1)));

        FileArtifactLocator locator = new FileArtifactLocator(dataRoot);
        assertTrue(locator.locate("MSFT", ArtifactKind.OHLCV, Market.US, Timeframe.WEEKLY).isPresent());
        assertFalse(locator.locate("MSFT", ArtifactKind.OHLCV, Market.US, Timeframe.MONTHLY).isPresent());
    }

    @Test
    void saveBars_shouldRejectEmptySeriesAndLeaveNoTempFiles() throws Exception {
        ArtifactStore store = new ArtifactStore(dataRoot, new TimeframeDeriver(), CLOCK);

        assertThrows(StorageException.class,
                () -> store.saveBars("AAPL", Market.US, Timeframe.DAILY, BarSeries.empty()));

        store.saveBars("AAPL", Market.US, Timeframe.DAILY, dailyBars(20, LocalDate.of(2024, 3, 1)));
        try (Stream<Path> files = Files.list(dataRoot.resolve("US"))) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void saveTable_shouldWriteEmptyCellsForMissingValues() throws Exception {
        ArtifactStore store = new ArtifactStore(dataRoot, new TimeframeDeriver(), CLOCK);
        List<LocalDateTime> ts = List.of(
                LocalDateTime.of(2024, 2, 29, 0, 0),
                LocalDateTime.of(2024, 3, 1, 0, 0));
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("Close", new double[]{10.0, 10.5});
        columns.put("EMA5", new double[]{Double.NaN, 10.25});
        IndicatorSeries table = new IndicatorSeries(ts, columns);

        Path saved = store.saveTable("005930", Market.KOSPI, ArtifactKind.INDICATORS, Timeframe.DAILY, table);

        assertEquals("005930_indicators_d_20240301_000000_KST.csv", saved.getFileName().toString());
        List<String> lines = Files.readAllLines(saved, StandardCharsets.UTF_8);
        assertEquals("# Indicators Data Metadata", lines.get(0));
        assertTrue(lines.contains("# timeframe: indicators_d"));
        assertTrue(lines.contains("2024-02-29,10,,2024-02-29,00:00:00"));

        IndicatorSeries back = new ArtifactReader(new FileArtifactLocator(dataRoot))
                .readIndicators("005930", Market.KOSPI, Timeframe.DAILY);
        assertEquals(List.of("Close", "EMA5"), back.columnNames());
        assertTrue(Double.isNaN(back.value("EMA5", 0)));
        assertEquals(10.25, back.value("EMA5", 1), 1e-9);
    }

    @Test
    void saveTable_shouldDescribeUnorderedRowsByTheirRange() throws Exception {
        ArtifactStore store = new ArtifactStore(dataRoot, new TimeframeDeriver(), CLOCK);
        List<LocalDateTime> ts = List.of(
                LocalDateTime.of(2024, 2, 28, 0, 0),
                LocalDateTime.of(2024, 3, 1, 0, 0),
                LocalDateTime.of(2024, 2, 26, 0, 0),
                LocalDateTime.of(2024, 2, 29, 0, 0));
        IndicatorSeries crossInfo = new IndicatorSeries(ts, Map.of("Signal", new double[]{1, 0, -1, 1}));

        Path saved = store.saveTable("AAPL", Market.US, ArtifactKind.CROSSINFO, Timeframe.DAILY, crossInfo);

        ArtifactReader reader = new ArtifactReader(new FileArtifactLocator(dataRoot));
        ArtifactMetadata meta = reader.readMetadata(saved);
        assertEquals("2024-02-26 00:00:00", meta.get(ArtifactMetadata.DATA_START_DATE));
        assertEquals("2024-03-01 00:00:00", meta.get(ArtifactMetadata.DATA_END_DATE));
        assertEquals("2024-03-01 00:00:00", meta.get(ArtifactMetadata.LATEST_DATA_DATETIME));
        assertEquals("AAPL_crossinfo_d_20240301_000000_EST.csv", saved.getFileName().toString());
        assertTrue(reader.readMetadata(dataRoot.resolve("US").resolve("missing.csv")).isEmpty());
    }

    @Test
    void saveTable_shouldRefuseBars() {
        ArtifactStore store = new ArtifactStore(dataRoot, new TimeframeDeriver(), CLOCK);
        IndicatorSeries table = new IndicatorSeries(List.of(LocalDateTime.of(2024, 3, 1, 0, 0)),
                Map.of("Close", new double[]{1.0}));

        assertThrows(IllegalArgumentException.class,
                () -> store.saveTable("AAPL", Market.US, ArtifactKind.OHLCV, Timeframe.DAILY, table));
    }

    @Test
    void requireBars_shouldThrowWhenMissing() {
        ArtifactReader reader = new ArtifactReader(new FileArtifactLocator(dataRoot));

        assertThrows(ArtifactNotFoundException.class,
                () -> reader.requireBars("NVDA", Market.US, Timeframe.DAILY));
        assertTrue(reader.readBars("NVDA", Market.US, Timeframe.DAILY).isEmpty());
        assertTrue(reader.readCrossInfo("NVDA", Market.US, Timeframe.DAILY).isEmpty());
    }

    @Test
    void readBars_shouldSkipRowsWithWrongWidth() throws Exception {
        Path dir = Files.createDirectories(dataRoot.resolve("US"));
        Path file = dir.resolve("TSLA_ohlcv_d_20240301_000000_EST.csv");
        Files.writeString(file, String.join("\n",
                "# OHLCV Data Metadata",
                "# ticker: TSLA",
                "# End Metadata",
                "",
                "Date,Open,High,Low,Close,Volume,Date_Index,Time_Index",
                "2024-02-29,1,2,0.5,1.5,100,2024-02-29,00:00:00",
                "2024-03-01,1,2,0.5",
                "2024-03-01,1.5,2.5,1,2,200,2024-03-01,00:00:00",
                ""), StandardCharsets.UTF_8);

        BarSeries bars = new ArtifactReader(new FileArtifactLocator(dataRoot)).readBars(file);

        assertEquals(2, bars.size());
        assertEquals(2.0, bars.last().close, 1e-9);
    }

    static BarSeries dailyBars(int count, LocalDate lastDay) {
        List<Bar> bars = new ArrayList<>(count);
        LocalDate first = lastDay.minusDays(count - 1L);
        for (int i = 0; i < count; i++) {
            double open = 100.0 + i;
            bars.add(new Bar(first.plusDays(i).atStartOfDay(), open, open + 2.0, open - 1.0, open + 0.5, 1000.0 + i));
        }
        return BarSeries.of(bars);
    }
}
