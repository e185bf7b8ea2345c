package com.marketbot.model;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Locale;

/**
 * 模块说明：Market（enum）。
 * 主要职责：描述支持的三个市场及其时区、交易时段与存储目录。
 */
public enum Market {
    US("US", ZoneId.of("America/New_York"), "EST", LocalTime.of(9, 30), LocalTime.of(16, 0)),
    KOSPI("KOSPI", ZoneId.of("Asia/Seoul"), "KST", LocalTime.of(9, 0), LocalTime.of(15, 30)),
    KOSDAQ("KOSDAQ", ZoneId.of("Asia/Seoul"), "KST", LocalTime.of(9, 0), LocalTime.of(15, 30));

    public final String folder;
    public final ZoneId zone;
    public final String timezoneLabel;
    public final LocalTime open;
    public final LocalTime close;

    Market(String folder, ZoneId zone, String timezoneLabel, LocalTime open, LocalTime close) {
        this.folder = folder;
        this.zone = zone;
        this.timezoneLabel = timezoneLabel;
        this.open = open;
        this.close = close;
    }

    public boolean isKorean() {
        return this == KOSPI || this == KOSDAQ;
    }

    public static Market fromText(String raw) {
        String token = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        switch (token) {
            case "US":
            case "U.S.":
            case "USA":
                return US;
            case "KOSPI":
                return KOSPI;
            case "KOSDAQ":
                return KOSDAQ;
            default:
                throw new IllegalArgumentException("unsupported market: " + raw);
        }
    }
}
