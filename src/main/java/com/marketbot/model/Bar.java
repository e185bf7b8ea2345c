package com.marketbot.model;

import java.time.LocalDateTime;

/**
 * 模块说明：Bar（class）。
 * 主要职责：单根 K 线（开高低收量），时间戳为市场本地的无时区时间，缺失值用 NaN 表示。
 */
public final class Bar {
    public final LocalDateTime timestamp;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public Bar(LocalDateTime timestamp, double open, double high, double low, double close, double volume) {
        this.timestamp = timestamp;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public boolean isComplete() {
        return timestamp != null
                && Double.isFinite(open)
                && Double.isFinite(high)
                && Double.isFinite(low)
                && Double.isFinite(close)
                && Double.isFinite(volume);
    }

    public Bar withPrices(double open, double high, double low, double close, double volume) {
        return new Bar(timestamp, open, high, low, close, volume);
    }

    @Override
    public String toString() {
        return "Bar{" + timestamp + " o=" + open + " h=" + high + " l=" + low + " c=" + close + " v=" + volume + "}";
    }
}
