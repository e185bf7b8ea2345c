package com.marketbot.storage;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code # key: value} block written ahead of an artifact's CSV body.
 */
public final class ArtifactMetadata {
    public static final String TICKER = "ticker";
    public static final String MARKET_TYPE = "market_type";
    public static final String TIMEFRAME = "timeframe";
    public static final String DATA_START_DATE = "data_start_date";
    public static final String DATA_END_DATE = "data_end_date";
    public static final String LATEST_DATA_DATETIME = "latest_data_datetime";
    public static final String TOTAL_ROWS = "total_rows";
    public static final String CREATED_AT = "created_at";
    public static final String TIMEZONE = "timezone";

    private final Map<String, String> values;

    public ArtifactMetadata(Map<String, String> values) {
        this.values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ArtifactMetadata empty() {
        return new ArtifactMetadata(Map.of());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public String get(String key) {
        return values.getOrDefault(key, "");
    }

    public Optional<LocalDateTime> createdAt() {
        return CsvFormat.parseTimestamp(get(CREATED_AT));
    }

    public int totalRows() {
        try {
            return Integer.parseInt(get(TOTAL_ROWS).trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
