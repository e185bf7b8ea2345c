package com.marketbot.storage;

import com.marketbot.model.Market;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes artifacts (and abandoned temp files) whose last-modified time is older than a cut-off.
 */
public final class RetentionSweeper {
    private static final Logger LOG = LogManager.getLogger(RetentionSweeper.class);

    private final Path dataRoot;
    private final Clock clock;

    public RetentionSweeper(Path dataRoot, Clock clock) {
        this.dataRoot = dataRoot;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public int sweepAll(Duration maxAge) {
        int deleted = 0;
        for (Market market : Market.values()) {
            deleted += sweep(market, maxAge);
        }
        return deleted;
    }

    public int sweep(Market market, Duration maxAge) {
        Path dir = dataRoot.resolve(market.folder);
        if (maxAge == null || maxAge.isNegative() || !Files.isDirectory(dir)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(maxAge);
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path file : stream) {
                if (!Files.isRegularFile(file) || !isSweepable(file.getFileName().toString())) {
                    continue;
                }
                try {
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        Files.delete(file);
                        deleted++;
                    }
                } catch (IOException e) {
                    LOG.warn("retention: cannot delete {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            LOG.warn("retention: cannot list {}: {}", dir, e.getMessage());
        }
        if (deleted > 0) {
            LOG.info("retention: deleted {} files older than {} days in {}", deleted, maxAge.toDays(), dir);
        }
        return deleted;
    }

    static boolean isSweepable(String fileName) {
        if (fileName.startsWith(".") && fileName.endsWith(".tmp")) {
            return true;
        }
        return ArtifactName.parse(fileName).isPresent();
    }
}
