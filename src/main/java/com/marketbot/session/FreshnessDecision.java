package com.marketbot.session;

import java.nio.file.Path;
import java.time.Duration;

public final class FreshnessDecision {
    public enum Strategy {
        USE_EXISTING,
        DOWNLOAD_FRESH
    }

    public final Strategy strategy;
    public final String reason;
    public final Path artifact;
    public final Duration age;

    FreshnessDecision(Strategy strategy, String reason, Path artifact, Duration age) {
        this.strategy = strategy;
        this.reason = reason == null ? "" : reason;
        this.artifact = artifact;
        this.age = age;
    }

    public static FreshnessDecision downloadFresh(String reason) {
        return new FreshnessDecision(Strategy.DOWNLOAD_FRESH, reason, null, null);
    }

    public boolean useExisting() {
        return strategy == Strategy.USE_EXISTING;
    }

    @Override
    public String toString() {
        return strategy + " (" + reason + (age == null ? "" : ", age_min=" + age.toMinutes()) + ")";
    }
}
