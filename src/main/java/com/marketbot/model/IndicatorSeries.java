package com.marketbot.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-oriented table keyed by bar timestamp. Missing cells are {@code NaN}.
 * Indicator artifacts and crossinfo artifacts both use this shape.
 */
public final class IndicatorSeries {
    private final List<LocalDateTime> timestamps;
    private final Map<String, double[]> columns;

    public IndicatorSeries(List<LocalDateTime> timestamps, Map<String, double[]> columns) {
        List<LocalDateTime> ts = timestamps == null ? List.of() : new ArrayList<>(timestamps);
        Map<String, double[]> cols = new LinkedHashMap<>();
        if (columns != null) {
            for (Map.Entry<String, double[]> entry : columns.entrySet()) {
                double[] values = entry.getValue() == null ? new double[0] : entry.getValue();
                if (values.length != ts.size()) {
                    throw new IllegalArgumentException("column " + entry.getKey() + " has " + values.length
                            + " rows, expected " + ts.size());
                }
                cols.put(entry.getKey(), values.clone());
            }
        }
        this.timestamps = Collections.unmodifiableList(ts);
        this.columns = Collections.unmodifiableMap(cols);
    }

    public static IndicatorSeries empty() {
        return new IndicatorSeries(List.of(), Map.of());
    }

    public List<LocalDateTime> timestamps() {
        return timestamps;
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public double[] column(String name) {
        double[] values = columns.get(name);
        return values == null ? null : values.clone();
    }

    public double value(String name, int row) {
        double[] values = columns.get(name);
        if (values == null || row < 0 || row >= values.length) {
            return Double.NaN;
        }
        return values[row];
    }

    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public LocalDateTime latestTimestamp() {
        LocalDateTime latest = null;
        for (LocalDateTime ts : timestamps) {
            if (ts != null && (latest == null || ts.isAfter(latest))) {
                latest = ts;
            }
        }
        return latest;
    }
}
