package com.marketbot.storage;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Cell formatting shared by the artifact writer and reader.
 */
final class CsvFormat {
    static final String METADATA_END = "# End Metadata";

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);
    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT);
    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT);

    private CsvFormat() {
    }

    /**
     * Empty for NaN, integral values without a fraction, shortest round-trip text otherwise.
     */
    static String number(double value) {
        if (!Double.isFinite(value)) {
            return "";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static double parseNumber(String raw) {
        String v = raw == null ? "" : raw.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("nan") || v.equalsIgnoreCase("null")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static String dateCell(LocalDateTime ts) {
        if (ts.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            return DATE.format(ts);
        }
        return TIMESTAMP.format(ts);
    }

    static Optional<LocalDateTime> parseTimestamp(String raw) {
        String v = raw == null ? "" : raw.trim();
        if (v.isEmpty()) {
            return Optional.empty();
        }
        try {
            if (v.length() == 10) {
                return Optional.of(LocalDate.parse(v, DATE).atStartOfDay());
            }
            if (v.length() >= 19 && v.charAt(10) == 'T') {
                return Optional.of(LocalDateTime.parse(v.substring(0, 19)));
            }
            return Optional.of(LocalDateTime.parse(v.substring(0, Math.min(19, v.length())), TIMESTAMP));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
