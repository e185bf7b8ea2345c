package com.marketbot.storage;

import com.marketbot.model.ArtifactKind;
import com.marketbot.model.Market;
import com.marketbot.model.Timeframe;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Single entry point for "which file is the current artifact".
 */
public interface ArtifactLocator {

    /**
     * The artifact with the greatest embedded timestamp, or empty when none exists.
     */
    Optional<Path> locate(String ticker, ArtifactKind kind, Market market, Timeframe timeframe);

    /**
     * Every matching artifact, newest first.
     */
    List<Path> findAll(String ticker, ArtifactKind kind, Market market, Timeframe timeframe);
}
