package com.marketbot.session;

import com.marketbot.model.ArtifactKind;
import com.marketbot.model.Market;
import com.marketbot.model.Timeframe;
import com.marketbot.storage.ArtifactLocator;
import com.marketbot.storage.ArtifactReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 模块说明：FreshnessPolicy（class）。
 * 主要职责：根据现有日线产物的生成时间与市场开收盘状态，决定复用已有数据还是重新下载。
 * 规则：无产物 → 下载；开盘中且产物超过阈值（默认 60 分钟）→ 下载；休市 → 复用。
 */
public class FreshnessPolicy {
    private static final Logger LOG = LogManager.getLogger(FreshnessPolicy.class);

    public static final Duration DEFAULT_OPEN_MAX_AGE = Duration.ofMinutes(60);

    private final ArtifactLocator locator;
    private final ArtifactReader reader;
    private final SessionClock clock;
    private final Duration openMaxAge;

    public FreshnessPolicy(ArtifactLocator locator, ArtifactReader reader, SessionClock clock, Duration openMaxAge) {
        this.locator = locator;
        this.reader = reader;
        this.clock = clock;
        this.openMaxAge = openMaxAge == null || openMaxAge.isNegative() ? DEFAULT_OPEN_MAX_AGE : openMaxAge;
    }

    public FreshnessDecision decide(String ticker, Market market) {
        Optional<Path> daily = locator.locate(ticker, ArtifactKind.OHLCV, market, Timeframe.DAILY);
        if (daily.isEmpty()) {
            return new FreshnessDecision(FreshnessDecision.Strategy.DOWNLOAD_FRESH, "no_artifact", null, null);
        }
        Path path = daily.get();
        Optional<Instant> created = creationInstant(path, market);
        if (created.isEmpty()) {
            return new FreshnessDecision(FreshnessDecision.Strategy.USE_EXISTING, "creation_time_unknown", path, null);
        }
        Duration age = Duration.between(created.get(), clock.now());
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        MarketSession session = clock.snapshot(market);
        if (!session.isOpen()) {
            return new FreshnessDecision(FreshnessDecision.Strategy.USE_EXISTING, "market_closed", path, age);
        }
        if (age.compareTo(openMaxAge) > 0) {
            return new FreshnessDecision(FreshnessDecision.Strategy.DOWNLOAD_FRESH, "stale_during_session", path, age);
        }
        return new FreshnessDecision(FreshnessDecision.Strategy.USE_EXISTING, "fresh_during_session", path, age);
    }

    /**
     * Page-level check: before or during a session the boundary is the previous business day's close,
     * after the close it is today's close. Created strictly before the boundary means stale.
     */
    public boolean isStaleForPage(Instant createdAt, Market market) {
        if (createdAt == null) {
            return true;
        }
        MarketSession session = clock.snapshot(market);
        Instant boundary = session.phase == SessionPhase.POST
                ? clock.currentSessionClose(market)
                : clock.previousBusinessDayClose(market);
        return createdAt.isBefore(boundary);
    }

    public boolean isStaleForPage(String ticker, Market market) {
        Optional<Path> daily = locator.locate(ticker, ArtifactKind.OHLCV, market, Timeframe.DAILY);
        if (daily.isEmpty()) {
            return true;
        }
        return isStaleForPage(creationInstant(daily.get(), market).orElse(null), market);
    }

    /**
     * Embedded {@code created_at} (market-local wall clock), falling back to the file's last-modified time.
     */
    public Optional<Instant> creationInstant(Path artifact, Market market) {
        Optional<LocalDateTime> embedded = reader.readMetadata(artifact).createdAt();
        if (embedded.isPresent()) {
            return Optional.of(embedded.get().atZone(market.zone).toInstant());
        }
        try {
            return Optional.of(Files.getLastModifiedTime(artifact).toInstant());
        } catch (IOException e) {
            LOG.warn("cannot read modification time of {}: {}", artifact, e.getMessage());
            return Optional.empty();
        }
    }
}
