package com.marketbot.storage;

import com.marketbot.core.ArtifactNotFoundException;
import com.marketbot.model.ArtifactKind;
import com.marketbot.model.Bar;
import com.marketbot.model.BarSeries;
import com.marketbot.model.IndicatorSeries;
import com.marketbot.model.Market;
import com.marketbot.model.Timeframe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads artifacts back through the locator. Absent or unreadable artifacts come back empty.
 */
public class ArtifactReader {
    private static final Logger LOG = LogManager.getLogger(ArtifactReader.class);

    private static final String[] BAR_COLUMNS = {"Open", "High", "Low", "Close", "Volume"};
    private static final String DATE_COLUMN = "Date";
    private static final String DATE_INDEX_COLUMN = "Date_Index";
    private static final String TIME_INDEX_COLUMN = "Time_Index";

    private final ArtifactLocator locator;

    public ArtifactReader(ArtifactLocator locator) {
        this.locator = locator;
    }

    public BarSeries readBars(String ticker, Market market, Timeframe timeframe) {
        Optional<Path> path = locator.locate(ticker, ArtifactKind.OHLCV, market, timeframe);
        return path.map(this::readBars).orElseGet(BarSeries::empty);
    }

    public BarSeries requireBars(String ticker, Market market, Timeframe timeframe) throws ArtifactNotFoundException {
        Path path = locator.locate(ticker, ArtifactKind.OHLCV, market, timeframe)
                .orElseThrow(() -> new ArtifactNotFoundException(
                        "no " + timeframe.label + " ohlcv artifact for " + ticker + " [" + market + "]"));
        BarSeries series = readBars(path);
        if (series.isEmpty()) {
            throw new ArtifactNotFoundException("unreadable ohlcv artifact " + path);
        }
        return series;
    }

    public IndicatorSeries readIndicators(String ticker, Market market, Timeframe timeframe) {
        return readTable(ticker, market, ArtifactKind.INDICATORS, timeframe);
    }

    public IndicatorSeries readCrossInfo(String ticker, Market market, Timeframe timeframe) {
        return readTable(ticker, market, ArtifactKind.CROSSINFO, timeframe);
    }

    public IndicatorSeries readTable(String ticker, Market market, ArtifactKind kind, Timeframe timeframe) {
        Optional<Path> path = locator.locate(ticker, kind, market, timeframe);
        return path.map(this::readTable).orElseGet(IndicatorSeries::empty);
    }

    public Optional<ArtifactMetadata> latestMetadata(String ticker, Market market, ArtifactKind kind, Timeframe timeframe) {
        return locator.locate(ticker, kind, market, timeframe).map(this::readMetadata);
    }

    public ArtifactMetadata readMetadata(Path path) {
        try {
            return parse(path).metadata;
        } catch (IOException e) {
            LOG.warn("cannot read metadata of {}: {}", path, e.getMessage());
            return ArtifactMetadata.empty();
        }
    }

    public BarSeries readBars(Path path) {
        ParsedFile parsed;
        try {
            parsed = parse(path);
        } catch (IOException e) {
            LOG.warn("cannot read bars from {}: {}", path, e.getMessage());
            return BarSeries.empty();
        }
        int dateIdx = parsed.indexOf(DATE_COLUMN);
        if (dateIdx < 0) {
            LOG.warn("no Date column in {}", path);
            return BarSeries.empty();
        }
        int[] idx = new int[BAR_COLUMNS.length];
        for (int i = 0; i < BAR_COLUMNS.length; i++) {
            idx[i] = parsed.indexOf(BAR_COLUMNS[i]);
        }
        List<Bar> bars = new ArrayList<>(parsed.rows.size());
        for (String[] row : parsed.rows) {
            Optional<LocalDateTime> ts = CsvFormat.parseTimestamp(row[dateIdx]);
            if (ts.isEmpty()) {
                continue;
            }
            bars.add(new Bar(
                    ts.get(),
                    cell(row, idx[0]),
                    cell(row, idx[1]),
                    cell(row, idx[2]),
                    cell(row, idx[3]),
                    cell(row, idx[4])
            ));
        }
        return BarSeries.of(bars);
    }

    public IndicatorSeries readTable(Path path) {
        ParsedFile parsed;
        try {
            parsed = parse(path);
        } catch (IOException e) {
            LOG.warn("cannot read table from {}: {}", path, e.getMessage());
            return IndicatorSeries.empty();
        }
        int dateIdx = parsed.indexOf(DATE_COLUMN);
        if (dateIdx < 0) {
            LOG.warn("no Date column in {}", path);
            return IndicatorSeries.empty();
        }
        List<LocalDateTime> timestamps = new ArrayList<>(parsed.rows.size());
        List<String[]> kept = new ArrayList<>(parsed.rows.size());
        for (String[] row : parsed.rows) {
            Optional<LocalDateTime> ts = CsvFormat.parseTimestamp(row[dateIdx]);
            if (ts.isPresent()) {
                timestamps.add(ts.get());
                kept.add(row);
            }
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (int c = 0; c < parsed.header.length; c++) {
            String name = parsed.header[c];
            if (c == dateIdx || DATE_INDEX_COLUMN.equals(name) || TIME_INDEX_COLUMN.equals(name)) {
                continue;
            }
            double[] values = new double[kept.size()];
            for (int r = 0; r < kept.size(); r++) {
                values[r] = cell(kept.get(r), c);
            }
            columns.put(name, values);
        }
        return new IndicatorSeries(timestamps, columns);
    }

    private static double cell(String[] row, int index) {
        if (index < 0 || index >= row.length) {
            return Double.NaN;
        }
        return CsvFormat.parseNumber(row[index]);
    }

    /**
     * Metadata lines run until {@code # End Metadata}; the first non-comment line is the CSV header.
     * Rows whose width differs from the header are skipped.
     */
    private ParsedFile parse(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        Map<String, String> meta = new LinkedHashMap<>();
        String[] header = null;
        List<String[]> rows = new ArrayList<>();
        int skipped = 0;
        boolean inMetadata = true;
        for (String line : lines) {
            if (header == null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (trimmed.startsWith("#")) {
                    if (trimmed.equals(CsvFormat.METADATA_END)) {
                        inMetadata = false;
                    } else if (inMetadata) {
                        int sep = trimmed.indexOf(':');
                        if (sep > 1) {
                            meta.put(trimmed.substring(1, sep).trim(), trimmed.substring(sep + 1).trim());
                        }
                    }
                    continue;
                }
                header = trimmed.split(",", -1);
                for (int i = 0; i < header.length; i++) {
                    header[i] = header[i].trim();
                }
                continue;
            }
            if (line.isBlank()) {
                continue;
            }
            String[] cols = line.split(",", -1);
            if (cols.length != header.length) {
                skipped++;
                continue;
            }
            rows.add(cols);
        }
        if (skipped > 0) {
            LOG.debug("skipped {} malformed rows in {}", skipped, path);
        }
        return new ParsedFile(new ArtifactMetadata(meta), header == null ? new String[0] : header, rows);
    }

    private static final class ParsedFile {
        private final ArtifactMetadata metadata;
        private final String[] header;
        private final List<String[]> rows;

        private ParsedFile(ArtifactMetadata metadata, String[] header, List<String[]> rows) {
            this.metadata = metadata;
            this.header = header;
            this.rows = rows;
        }

        private int indexOf(String column) {
            for (int i = 0; i < header.length; i++) {
                if (header[i].equals(column)) {
                    return i;
                }
            }
            return -1;
        }
    }
}
