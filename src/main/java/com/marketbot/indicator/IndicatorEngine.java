package com.marketbot.indicator;

import com.marketbot.model.Bar;
import com.marketbot.model.BarSeries;
import com.marketbot.model.IndicatorSeries;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：IndicatorEngine（class）。
 * 主要职责：对任意周期的 K 线序列计算固定一组技术指标（EMA、MACD、RSI、随机指标、布林带、一目均衡表、量比）。
 * 使用建议：窗口未填满的早期行输出 NaN，不得补 0；本类为纯计算，不读写文件。
 */
public final class IndicatorEngine {
    public static final String CLOSE = "Close";
    public static final String CHANGE_PERCENT = "Change_Percent";
    public static final String EMA5 = "EMA5";
    public static final String EMA20 = "EMA20";
    public static final String EMA40 = "EMA40";
    public static final String MACD = "MACD";
    public static final String MACD_SIGNAL = "MACD_Signal";
    public static final String MACD_HISTOGRAM = "MACD_Histogram";
    public static final String RSI = "RSI";
    public static final String STOCH_K = "Stoch_K";
    public static final String STOCH_D = "Stoch_D";
    public static final String BB_UPPER = "BB_Upper";
    public static final String BB_LOWER = "BB_Lower";
    public static final String BB_MIDDLE = "BB_Middle";
    public static final String ICHIMOKU_TENKAN = "Ichimoku_Tenkan";
    public static final String ICHIMOKU_KIJUN = "Ichimoku_Kijun";
    public static final String ICHIMOKU_SENKOU_A = "Ichimoku_Senkou_A";
    public static final String ICHIMOKU_SENKOU_B = "Ichimoku_Senkou_B";
    public static final String VOLUME_MA5 = "Volume_MA5";
    public static final String VOLUME_MA20 = "Volume_MA20";
    public static final String VOLUME_MA40 = "Volume_MA40";
    public static final String VOLUME_RATIO_5D = "Volume_Ratio_5d";
    public static final String VOLUME_RATIO_20D = "Volume_Ratio_20d";
    public static final String VOLUME_RATIO_40D = "Volume_Ratio_40d";

    public static final List<String> COLUMNS = List.of(
            CLOSE, CHANGE_PERCENT,
            EMA5, EMA20, EMA40,
            MACD, MACD_SIGNAL, MACD_HISTOGRAM,
            RSI,
            STOCH_K, STOCH_D,
            BB_UPPER, BB_LOWER, BB_MIDDLE,
            ICHIMOKU_TENKAN, ICHIMOKU_KIJUN, ICHIMOKU_SENKOU_A, ICHIMOKU_SENKOU_B,
            VOLUME_MA5, VOLUME_MA20, VOLUME_MA40,
            VOLUME_RATIO_5D, VOLUME_RATIO_20D, VOLUME_RATIO_40D
    );

    private static final int MACD_FAST = 12;
    private static final int MACD_SLOW = 26;
    private static final int MACD_SIGNAL_SPAN = 9;
    private static final int RSI_WINDOW = 14;
    private static final int STOCH_WINDOW = 14;
    private static final int STOCH_SMOOTH = 3;
    private static final int BB_WINDOW = 20;
    private static final double BB_DEVIATIONS = 2.0;
    private static final int TENKAN_WINDOW = 9;
    private static final int KIJUN_WINDOW = 26;
    private static final int SENKOU_B_WINDOW = 52;

    public IndicatorSeries compute(BarSeries series) {
        if (series == null || series.isEmpty()) {
            return IndicatorSeries.empty();
        }

        int size = series.size();
        List<LocalDateTime> timestamps = new ArrayList<>(size);
        double[] closes = new double[size];
        double[] highs = new double[size];
        double[] lows = new double[size];
        double[] volumes = new double[size];
        for (int i = 0; i < size; i++) {
            Bar bar = series.get(i);
            timestamps.add(bar.timestamp);
            closes[i] = bar.close;
            highs[i] = bar.high;
            lows[i] = bar.low;
            volumes[i] = bar.volume;
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(CLOSE, closes.clone());
        columns.put(CHANGE_PERCENT, changePercent(closes));

        columns.put(EMA5, ema(closes, 5));
        columns.put(EMA20, ema(closes, 20));
        columns.put(EMA40, ema(closes, 40));

        double[] macd = subtract(ema(closes, MACD_FAST), ema(closes, MACD_SLOW));
        double[] signal = ema(macd, MACD_SIGNAL_SPAN);
        columns.put(MACD, macd);
        columns.put(MACD_SIGNAL, signal);
        columns.put(MACD_HISTOGRAM, subtract(macd, signal));

        columns.put(RSI, rsi(closes, RSI_WINDOW));

        double[] stochK = stochasticK(highs, lows, closes, STOCH_WINDOW);
        columns.put(STOCH_K, stochK);
        columns.put(STOCH_D, rollingMean(stochK, STOCH_SMOOTH));

        double[] bbMiddle = rollingMean(closes, BB_WINDOW);
        double[] bbStd = rollingStd(closes, BB_WINDOW);
        double[] bbUpper = new double[size];
        double[] bbLower = new double[size];
        for (int i = 0; i < size; i++) {
            bbUpper[i] = bbMiddle[i] + BB_DEVIATIONS * bbStd[i];
            bbLower[i] = bbMiddle[i] - BB_DEVIATIONS * bbStd[i];
        }
        columns.put(BB_UPPER, bbUpper);
        columns.put(BB_LOWER, bbLower);
        columns.put(BB_MIDDLE, bbMiddle);

        double[] tenkan = midpoint(highs, lows, TENKAN_WINDOW);
        double[] kijun = midpoint(highs, lows, KIJUN_WINDOW);
        double[] senkouA = new double[size];
        for (int i = 0; i < size; i++) {
            senkouA[i] = (tenkan[i] + kijun[i]) / 2.0;
        }
        columns.put(ICHIMOKU_TENKAN, tenkan);
        columns.put(ICHIMOKU_KIJUN, kijun);
        columns.put(ICHIMOKU_SENKOU_A, senkouA);
        columns.put(ICHIMOKU_SENKOU_B, midpoint(highs, lows, SENKOU_B_WINDOW));

        double[] volMa5 = rollingMean(volumes, 5);
        double[] volMa20 = rollingMean(volumes, 20);
        double[] volMa40 = rollingMean(volumes, 40);
        columns.put(VOLUME_MA5, volMa5);
        columns.put(VOLUME_MA20, volMa20);
        columns.put(VOLUME_MA40, volMa40);
        columns.put(VOLUME_RATIO_5D, ratioPercent(volumes, volMa5));
        columns.put(VOLUME_RATIO_20D, ratioPercent(volumes, volMa20));
        columns.put(VOLUME_RATIO_40D, ratioPercent(volumes, volMa40));

        return new IndicatorSeries(timestamps, columns);
    }

    private static double[] changePercent(double[] closes) {
        double[] out = new double[closes.length];
        if (closes.length == 0) {
            return out;
        }
        out[0] = 0.0;
        for (int i = 1; i < closes.length; i++) {
            double prev = closes[i - 1];
            out[i] = prev == 0.0 || !Double.isFinite(prev) ? Double.NaN : round2((closes[i] - prev) / prev * 100.0);
        }
        return out;
    }

    /**
     * Recursive EMA with alpha = 2 / (span + 1), seeded with the first observation.
     */
    static double[] ema(double[] values, int span) {
        return ewm(values, 2.0 / (span + 1.0), span);
    }

    /**
     * Exponential smoothing without bias adjustment. Leading NaNs are skipped and
     * output stays NaN until {@code minPeriods} observations have been seen.
     */
    static double[] ewm(double[] values, double alpha, int minPeriods) {
        double[] out = nanArray(values.length);
        double prev = Double.NaN;
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (!Double.isFinite(v)) {
                if (count >= minPeriods) {
                    out[i] = prev;
                }
                continue;
            }
            prev = Double.isNaN(prev) ? v : alpha * v + (1.0 - alpha) * prev;
            count++;
            if (count >= minPeriods) {
                out[i] = prev;
            }
        }
        return out;
    }

    /**
     * Wilder RSI. The first row counts as no movement. Undefined while there has been no movement
     * at all, 100 when there were gains and no losses.
     */
    static double[] rsi(double[] closes, int window) {
        int n = closes.length;
        double[] gains = new double[n];
        double[] losses = new double[n];
        for (int i = 1; i < n; i++) {
            double diff = closes[i] - closes[i - 1];
            gains[i] = diff > 0 ? diff : 0.0;
            losses[i] = diff < 0 ? -diff : 0.0;
        }
        double alpha = 1.0 / window;
        double[] avgGain = ewm(gains, alpha, window);
        double[] avgLoss = ewm(losses, alpha, window);
        double[] out = nanArray(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(avgGain[i]) || Double.isNaN(avgLoss[i])) {
                continue;
            }
            if (avgLoss[i] == 0.0) {
                out[i] = avgGain[i] == 0.0 ? Double.NaN : 100.0;
            } else {
                out[i] = 100.0 - 100.0 / (1.0 + avgGain[i] / avgLoss[i]);
            }
        }
        return out;
    }

    private static double[] stochasticK(double[] highs, double[] lows, double[] closes, int window) {
        double[] highest = rollingMax(highs, window);
        double[] lowest = rollingMin(lows, window);
        double[] out = nanArray(closes.length);
        for (int i = 0; i < closes.length; i++) {
            double range = highest[i] - lowest[i];
            if (Double.isFinite(range) && range > 0.0) {
                out[i] = 100.0 * (closes[i] - lowest[i]) / range;
            }
        }
        return out;
    }

    private static double[] midpoint(double[] highs, double[] lows, int window) {
        double[] highest = rollingMax(highs, window);
        double[] lowest = rollingMin(lows, window);
        double[] out = new double[highs.length];
        for (int i = 0; i < highs.length; i++) {
            out[i] = (highest[i] + lowest[i]) / 2.0;
        }
        return out;
    }

    private static double[] ratioPercent(double[] volumes, double[] averages) {
        double[] out = nanArray(volumes.length);
        for (int i = 0; i < volumes.length; i++) {
            if (Double.isFinite(averages[i]) && averages[i] > 0.0) {
                out[i] = round2(volumes[i] / averages[i] * 100.0);
            }
        }
        return out;
    }

    static double[] rollingMean(double[] values, int window) {
        double[] out = nanArray(values.length);
        for (int i = window - 1; i < values.length; i++) {
            double sum = 0.0;
            boolean complete = true;
            for (int j = i - window + 1; j <= i; j++) {
                if (!Double.isFinite(values[j])) {
                    complete = false;
                    break;
                }
                sum += values[j];
            }
            if (complete) {
                out[i] = sum / window;
            }
        }
        return out;
    }

    /**
     * Population standard deviation over the window.
     */
    private static double[] rollingStd(double[] values, int window) {
        double[] mean = rollingMean(values, window);
        double[] out = nanArray(values.length);
        for (int i = window - 1; i < values.length; i++) {
            if (Double.isNaN(mean[i])) {
                continue;
            }
            double acc = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                double d = values[j] - mean[i];
                acc += d * d;
            }
            out[i] = Math.sqrt(acc / window);
        }
        return out;
    }

    private static double[] rollingMax(double[] values, int window) {
        double[] out = nanArray(values.length);
        for (int i = window - 1; i < values.length; i++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int j = i - window + 1; j <= i; j++) {
                if (!Double.isFinite(values[j])) {
                    max = Double.NaN;
                    break;
                }
                max = Math.max(max, values[j]);
            }
            out[i] = max;
        }
        return out;
    }

    private static double[] rollingMin(double[] values, int window) {
        double[] out = nanArray(values.length);
        for (int i = window - 1; i < values.length; i++) {
            double min = Double.POSITIVE_INFINITY;
            for (int j = i - window + 1; j <= i; j++) {
                if (!Double.isFinite(values[j])) {
                    min = Double.NaN;
                    break;
                }
                min = Math.min(min, values[j]);
            }
            out[i] = min;
        }
        return out;
    }

    private static double[] subtract(double[] a, double[] b) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] - b[i];
        }
        return out;
    }

    private static double[] nanArray(int size) {
        double[] out = new double[size];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    private static double round2(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return Math.rint(value * 100.0) / 100.0;
    }
}
