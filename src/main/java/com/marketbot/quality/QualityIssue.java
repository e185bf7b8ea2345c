package com.marketbot.quality;

public enum QualityIssue {
    EMPTY("series is empty"),
    TOO_FEW_ROWS("fewer rows than required"),
    NON_NUMERIC("missing or non-numeric value in a required column"),
    NEGATIVE_PRICE("negative price"),
    HIGH_BELOW_LOW("high below low"),
    NEGATIVE_VOLUME("negative volume"),
    DUPLICATE_TIMESTAMP("duplicate timestamp");

    public final String description;

    QualityIssue(String description) {
        this.description = description;
    }
}
