package com.marketbot.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable sequence of bars for one ticker, market and timeframe.
 */
public final class BarSeries {
    private static final BarSeries EMPTY = new BarSeries(List.of());

    private final List<Bar> bars;

    private BarSeries(List<Bar> bars) {
        this.bars = bars;
    }

    public static BarSeries of(List<Bar> bars) {
        if (bars == null || bars.isEmpty()) {
            return EMPTY;
        }
        List<Bar> copy = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            if (bar != null) {
                copy.add(bar);
            }
        }
        return new BarSeries(Collections.unmodifiableList(copy));
    }

    public static BarSeries empty() {
        return EMPTY;
    }

    public List<Bar> bars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public Bar get(int index) {
        return bars.get(index);
    }

    public Bar first() {
        return bars.isEmpty() ? null : bars.get(0);
    }

    public Bar last() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    public LocalDateTime latestTimestamp() {
        LocalDateTime latest = null;
        for (Bar bar : bars) {
            if (bar.timestamp != null && (latest == null || bar.timestamp.isAfter(latest))) {
                latest = bar.timestamp;
            }
        }
        return latest;
    }
}
