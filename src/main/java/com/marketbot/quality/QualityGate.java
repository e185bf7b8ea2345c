package com.marketbot.quality;

import com.marketbot.core.ValidationException;
import com.marketbot.model.Bar;
import com.marketbot.model.BarSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 模块说明：QualityGate（class）。
 * 主要职责：校验、清洗 K 线序列；所有方法都返回新序列，不修改入参。
 */
public final class QualityGate {
    private static final Logger LOG = LogManager.getLogger(QualityGate.class);

    public Optional<QualityIssue> inspect(BarSeries series, int minRows) {
        if (series == null || series.isEmpty()) {
            return Optional.of(QualityIssue.EMPTY);
        }
        if (series.size() < minRows) {
            return Optional.of(QualityIssue.TOO_FEW_ROWS);
        }
        Set<LocalDateTime> seen = new HashSet<>();
        QualityIssue found = null;
        for (Bar bar : series.bars()) {
            QualityIssue issue = inspectBar(bar);
            if (issue == null && !seen.add(bar.timestamp)) {
                issue = QualityIssue.DUPLICATE_TIMESTAMP;
            }
            if (issue != null && (found == null || issue.ordinal() < found.ordinal())) {
                found = issue;
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Never throws; a failing series is logged with the first issue found.
     */
    public boolean validate(BarSeries series, String ticker, int minRows) {
        Optional<QualityIssue> issue = inspect(series, minRows);
        if (issue.isPresent()) {
            LOG.warn("validation failed ticker={} rows={} min_rows={} issue={}",
                    ticker, series == null ? 0 : series.size(), minRows, issue.get().description);
            return false;
        }
        return true;
    }

    public void requireValid(BarSeries series, String ticker, int minRows) throws ValidationException {
        Optional<QualityIssue> issue = inspect(series, minRows);
        if (issue.isPresent()) {
            validate(series, ticker, minRows);
            throw new ValidationException("data validation failed: " + issue.get().description
                    + " (rows=" + (series == null ? 0 : series.size()) + ")");
        }
    }

    /**
     * Drops incomplete rows, sorts, keeps the first bar per timestamp,
     * takes absolute values of negative prices and volume, and swaps inverted high/low.
     */
    public BarSeries clean(BarSeries series, String ticker) {
        if (series == null || series.isEmpty()) {
            return BarSeries.empty();
        }
        List<Bar> sorted = new ArrayList<>(series.bars());
        sorted.sort(Comparator.comparing(b -> b.timestamp, Comparator.nullsLast(Comparator.naturalOrder())));

        Set<LocalDateTime> seen = new HashSet<>();
        List<Bar> out = new ArrayList<>(sorted.size());
        int dropped = 0;
        int fixed = 0;
        for (Bar bar : sorted) {
            if (!bar.isComplete()) {
                dropped++;
                continue;
            }
            if (!seen.add(bar.timestamp)) {
                dropped++;
                continue;
            }
            double open = Math.abs(bar.open);
            double high = Math.abs(bar.high);
            double low = Math.abs(bar.low);
            double close = Math.abs(bar.close);
            double volume = Math.abs(bar.volume);
            if (high < low) {
                double swap = high;
                high = low;
                low = swap;
            }
            if (open != bar.open || high != bar.high || low != bar.low || close != bar.close || volume != bar.volume) {
                fixed++;
            }
            out.add(bar.withPrices(open, high, low, close, volume));
        }
        if (dropped > 0 || fixed > 0) {
            LOG.info("cleaned ticker={} rows_in={} rows_out={} dropped={} fixed={}",
                    ticker, series.size(), out.size(), dropped, fixed);
        }
        return BarSeries.of(out);
    }

    /**
     * Widens high up to close and low down to close where close falls outside the bar's range.
     */
    public BarSeries repairCloseRange(BarSeries series, String ticker) {
        if (series == null || series.isEmpty()) {
            return BarSeries.empty();
        }
        List<Bar> out = new ArrayList<>(series.size());
        int repaired = 0;
        for (Bar bar : series.bars()) {
            double high = bar.high;
            double low = bar.low;
            if (bar.close > high) {
                high = bar.close;
            }
            if (bar.close < low) {
                low = bar.close;
            }
            if (high != bar.high || low != bar.low) {
                repaired++;
                out.add(bar.withPrices(bar.open, high, low, bar.close, bar.volume));
            } else {
                out.add(bar);
            }
        }
        if (repaired > 0) {
            LOG.info("close-range repair ticker={} rows={}", ticker, repaired);
        }
        return BarSeries.of(out);
    }

    private static QualityIssue inspectBar(Bar bar) {
        if (!bar.isComplete()) {
            return QualityIssue.NON_NUMERIC;
        }
        if (bar.open < 0 || bar.high < 0 || bar.low < 0 || bar.close < 0) {
            return QualityIssue.NEGATIVE_PRICE;
        }
        if (bar.high < bar.low) {
            return QualityIssue.HIGH_BELOW_LOW;
        }
        if (bar.volume < 0) {
            return QualityIssue.NEGATIVE_VOLUME;
        }
        return null;
    }
}
