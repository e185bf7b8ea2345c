package com.marketbot.session;

import com.marketbot.model.Bar;
import com.marketbot.model.BarSeries;
import com.marketbot.model.Market;
import com.marketbot.model.Timeframe;
import com.marketbot.storage.ArtifactReader;
import com.marketbot.storage.ArtifactStore;
import com.marketbot.storage.FileArtifactLocator;
import com.marketbot.transform.TimeframeDeriver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FreshnessPolicyTest {

    @TempDir
    Path dataRoot;

    @Test
    void decide_shouldDownloadWhenNothingStored() {
        FreshnessDecision decision = policyAt("2024-03-04T15:00:00Z").decide("AAPL", Market.US);

        assertEquals(FreshnessDecision.Strategy.DOWNLOAD_FRESH, decision.strategy);
        assertEquals("no_artifact", decision.reason);
    }

    @Test
    void decide_shouldDownloadWhenStaleDuringSession() throws Exception {
        saveAt("2024-03-04T13:00:00Z");

        FreshnessDecision decision = policyAt("2024-03-04T15:00:00Z").decide("AAPL", Market.US);

        assertEquals(FreshnessDecision.Strategy.DOWNLOAD_FRESH, decision.strategy);
        assertEquals("stale_during_session", decision.reason);
        assertEquals(120, decision.age.toMinutes());
    }

    @Test
    void decide_shouldReuseRecentArtifactDuringSession() throws Exception {
        saveAt("2024-03-04T14:30:00Z");

        FreshnessDecision decision = policyAt("2024-03-04T15:00:00Z").decide("AAPL", Market.US);

        assertTrue(decision.useExisting());
        assertEquals("fresh_during_session", decision.reason);
    }

    @Test
    void decide_shouldReuseArtifactExactlyAtThreshold() throws Exception {
        saveAt("2024-03-04T14:00:00Z");

        assertTrue(policyAt("2024-03-04T15:00:00Z").decide("AAPL", Market.US).useExisting());
    }

    @Test
    void decide_shouldReuseAnythingWhileMarketClosed() throws Exception {
        saveAt("2024-02-20T15:00:00Z");

        FreshnessPolicy policy = policyAt("2024-03-04T22:00:00Z");
        FreshnessDecision first = policy.decide("AAPL", Market.US);
        FreshnessDecision second = policy.decide("AAPL", Market.US);

        assertTrue(first.useExisting());
        assertEquals("market_closed", first.reason);
        assertEquals(first.strategy, second.strategy);
        assertEquals(first.artifact, second.artifact);
    }

    @Test
    void decide_shouldFallBackToFileTimeWithoutCreatedAt() throws Exception {
        Path dir = Files.createDirectories(dataRoot.resolve("US"));
        Path file = dir.resolve("AAPL_ohlcv_d_20240301_000000_EST.csv");
        Files.writeString(file, "# OHLCV Data Metadata\n# End Metadata\n\nDate,Open,High,Low,Close,Volume\n");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-03-04T12:00:00Z")));

        FreshnessPolicy policy = policyAt("2024-03-04T15:00:00Z");

        assertEquals(Instant.parse("2024-03-04T12:00:00Z"), policy.creationInstant(file, Market.US).orElseThrow());
        assertFalse(policy.decide("AAPL", Market.US).useExisting());
    }

    @Test
    void isStaleForPage_shouldUseTodaysCloseAfterSession() {
        FreshnessPolicy policy = policyAt("2024-03-04T22:00:00Z");

        assertTrue(policy.isStaleForPage(Instant.parse("2024-03-04T20:00:00Z"), Market.US));
        assertFalse(policy.isStaleForPage(Instant.parse("2024-03-04T21:30:00Z"), Market.US));
        assertFalse(policy.isStaleForPage(Instant.parse("2024-03-04T21:00:00Z"), Market.US));
    }

    @Test
    void isStaleForPage_shouldUsePreviousCloseDuringSession() {
        FreshnessPolicy policy = policyAt("2024-03-04T15:00:00Z");

        assertFalse(policy.isStaleForPage(Instant.parse("2024-03-01T22:00:00Z"), Market.US));
        assertTrue(policy.isStaleForPage(Instant.parse("2024-03-01T20:00:00Z"), Market.US));
        assertTrue(policy.isStaleForPage("AAPL", Market.US));
    }

    private FreshnessPolicy policyAt(String instant) {
        FileArtifactLocator locator = new FileArtifactLocator(dataRoot);
        SessionClock clock = new SessionClock(Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
        return new FreshnessPolicy(locator, new ArtifactReader(locator), clock, Duration.ofMinutes(60));
    }

    private void saveAt(String instant) throws Exception {
        ArtifactStore store = new ArtifactStore(dataRoot, new TimeframeDeriver(),
                Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
        List<Bar> bars = new ArrayList<>();
        LocalDate day = LocalDate.of(2024, 2, 1);
        for (int i = 0; i < 25; i++) {
            bars.add(new Bar(day.plusDays(i).atStartOfDay(), 10, 11, 9, 10.5, 1000));
        }
        store.saveBars("AAPL", Market.US, Timeframe.DAILY, BarSeries.of(bars));
    }
}
