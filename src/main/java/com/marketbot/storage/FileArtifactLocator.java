package com.marketbot.storage;

import com.marketbot.model.ArtifactKind;
import com.marketbot.model.Market;
import com.marketbot.model.TickerIdentity;
import com.marketbot.model.Timeframe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 模块说明：FileArtifactLocator（class）。
 * 主要职责：在 {dataRoot}/{market} 目录下按候选代码写法查找产物文件，按文件名内嵌时间戳（缺失时用创建时间）取最新。
 * 维护提示：目录不存在或没有匹配文件时返回空，不抛异常；其他组件不应自行遍历目录。
 */
public final class FileArtifactLocator implements ArtifactLocator {
    private static final Logger LOG = LogManager.getLogger(FileArtifactLocator.class);

    private final Path dataRoot;

    public FileArtifactLocator(Path dataRoot) {
        this.dataRoot = dataRoot;
    }

    public Path dataRoot() {
        return dataRoot;
    }

    @Override
    public Optional<Path> locate(String ticker, ArtifactKind kind, Market market, Timeframe timeframe) {
        List<Path> all = findAll(ticker, kind, market, timeframe);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    @Override
    public List<Path> findAll(String ticker, ArtifactKind kind, Market market, Timeframe timeframe) {
        Path dir = dataRoot.resolve(market.folder);
        if (ticker == null || ticker.isBlank() || !Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> candidates = TickerIdentity.parse(ticker).storageCandidates(market);
        List<Candidate> found = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.csv")) {
            for (Path file : stream) {
                String fileName = file.getFileName().toString();
                for (int priority = 0; priority < candidates.size(); priority++) {
                    if (ArtifactName.matchesPrefix(fileName, candidates.get(priority), kind, timeframe)) {
                        found.add(new Candidate(file, sortKey(file, market), priority));
                        break;
                    }
                }
            }
        } catch (IOException e) {
            LOG.warn("artifact lookup failed dir={} ticker={} kind={} tf={}: {}",
                    dir, ticker, kind.token, timeframe.code, e.getMessage());
            return List.of();
        }
        found.sort(Comparator.comparing((Candidate c) -> c.sortKey).reversed()
                .thenComparingInt(c -> c.priority)
                .thenComparing(c -> c.path.getFileName().toString(), Comparator.reverseOrder()));
        List<Path> out = new ArrayList<>(found.size());
        for (Candidate c : found) {
            out.add(c.path);
        }
        return out;
    }

    /**
     * Embedded filename timestamp in the market zone, falling back to the file's creation time.
     */
    private Instant sortKey(Path file, Market market) {
        Optional<ArtifactName> parsed = ArtifactName.parse(file.getFileName().toString());
        if (parsed.isPresent()) {
            return parsed.get().timestamp.atZone(market.zone).toInstant();
        }
        try {
            return Files.readAttributes(file, BasicFileAttributes.class).creationTime().toInstant();
        } catch (IOException e) {
            LOG.warn("cannot read file time of {}: {}", file, e.getMessage());
            return Instant.EPOCH;
        }
    }

    private static final class Candidate {
        private final Path path;
        private final Instant sortKey;
        private final int priority;

        private Candidate(Path path, Instant sortKey, int priority) {
            this.path = path;
            this.sortKey = sortKey;
            this.priority = priority;
        }
    }
}
