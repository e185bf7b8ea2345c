package com.marketbot.model;

import java.util.Locale;

public enum Timeframe {
    DAILY("d", "daily"),
    WEEKLY("w", "weekly"),
    MONTHLY("m", "monthly");

    public final String code;
    public final String label;

    Timeframe(String code, String label) {
        this.code = code;
        this.label = label;
    }

    /**
     * Unknown codes map to {@link #DAILY}, matching how artifact names are written.
     */
    public static Timeframe fromCode(String raw) {
        String token = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Timeframe tf : values()) {
            if (tf.code.equals(token) || tf.label.equals(token)) {
                return tf;
            }
        }
        return DAILY;
    }
}
