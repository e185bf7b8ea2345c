package com.marketbot.model;

import java.util.Locale;

public enum ArtifactKind {
    OHLCV("ohlcv", "OHLCV"),
    INDICATORS("indicators", "Indicators"),
    CROSSINFO("crossinfo", "CrossInfo");

    public final String token;
    public final String title;

    ArtifactKind(String token, String title) {
        this.token = token;
        this.title = title;
    }

    public static ArtifactKind fromToken(String raw) {
        String token = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (ArtifactKind kind : values()) {
            if (kind.token.equals(token)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown artifact kind: " + raw);
    }
}
