package com.marketbot.transform;

import com.marketbot.model.Bar;
import com.marketbot.model.BarSeries;
import com.marketbot.model.Timeframe;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates daily bars into weekly (Sunday-ending) or monthly bars.
 * Each output bar is labelled with its period's last calendar day.
 */
public final class TimeframeDeriver {
    public static final int MIN_DAILY_ROWS_WEEKLY = 7;
    public static final int MIN_DAILY_ROWS_MONTHLY = 30;

    public BarSeries resample(BarSeries daily, Timeframe target) {
        if (target == null || target == Timeframe.DAILY) {
            throw new IllegalArgumentException("resample target must be weekly or monthly, got " + target);
        }
        if (daily == null || daily.size() < minimumRows(target)) {
            return BarSeries.empty();
        }

        Map<LocalDate, List<Bar>> buckets = new TreeMap<>();
        for (Bar bar : daily.bars()) {
            if (!bar.isComplete()) {
                continue;
            }
            buckets.computeIfAbsent(periodEnd(bar.timestamp.toLocalDate(), target), k -> new ArrayList<>()).add(bar);
        }

        List<Bar> out = new ArrayList<>(buckets.size());
        for (Map.Entry<LocalDate, List<Bar>> entry : buckets.entrySet()) {
            List<Bar> group = entry.getValue();
            group.sort((a, b) -> a.timestamp.compareTo(b.timestamp));
            double high = Double.NEGATIVE_INFINITY;
            double low = Double.POSITIVE_INFINITY;
            double volume = 0.0;
            for (Bar bar : group) {
                high = Math.max(high, bar.high);
                low = Math.min(low, bar.low);
                volume += bar.volume;
            }
            LocalDateTime label = entry.getKey().atStartOfDay();
            out.add(new Bar(label, group.get(0).open, high, low, group.get(group.size() - 1).close, volume));
        }
        return BarSeries.of(out);
    }

    public static int minimumRows(Timeframe target) {
        return target == Timeframe.MONTHLY ? MIN_DAILY_ROWS_MONTHLY : MIN_DAILY_ROWS_WEEKLY;
    }

    static LocalDate periodEnd(LocalDate date, Timeframe target) {
        if (target == Timeframe.MONTHLY) {
            return date.with(TemporalAdjusters.lastDayOfMonth());
        }
        return date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
    }
}
