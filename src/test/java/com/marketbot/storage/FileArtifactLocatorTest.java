package com.marketbot.storage;

import com.marketbot.model.ArtifactKind;
import com.marketbot.model.Market;
import com.marketbot.model.Timeframe;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileArtifactLocatorTest {

    @TempDir
    Path dataRoot;

    @Test
    void locate_shouldPickNewestEmbeddedTimestamp() throws Exception {
        touch("US", "AAPL_ohlcv_d_20240229_000000_EST.csv");
        touch("US", "AAPL_ohlcv_d_20240301_000000_EST.csv");
        touch("US", "AAPL_ohlcv_d_20240228_000000_EST.csv");
        touch("US", "AAPL_indicators_d_20240305_000000_EST.csv");

        FileArtifactLocator locator = new FileArtifactLocator(dataRoot);
        Optional<Path> found = locator.locate("AAPL", ArtifactKind.OHLCV, Market.US, Timeframe.DAILY);

        assertEquals("AAPL_ohlcv_d_20240301_000000_EST.csv", found.orElseThrow().getFileName().toString());
        List<Path> all = locator.findAll("AAPL", ArtifactKind.OHLCV, Market.US, Timeframe.DAILY);
        assertEquals(3, all.size());
        assertEquals("AAPL_ohlcv_d_20240228_000000_EST.csv", all.get(2).getFileName().toString());
    }

    @Test
    void locate_shouldBeDeterministicAcrossCalls() throws Exception {
        touch("US", "AAPL_ohlcv_w_20240301_000000_EST.csv");
        touch("US", "AAPL_ohlcv_w_20240222_000000_EST.csv");
        FileArtifactLocator locator = new FileArtifactLocator(dataRoot);

        Path first = locator.locate("AAPL", ArtifactKind.OHLCV, Market.US, Timeframe.WEEKLY).orElseThrow();
        Path second = locator.locate("AAPL", ArtifactKind.OHLCV, Market.US, Timeframe.WEEKLY).orElseThrow();

        assertEquals(first, second);
    }

    @Test
    void locate_shouldFindKoreanArtifactsUnderAnySpelling() throws Exception {
        touch("KOSPI", "005930.KS_ohlcv_d_20240301_000000_KST.csv");
        touch("KOSPI", "005930_ohlcv_d_20240229_000000_KST.csv");
        FileArtifactLocator locator = new FileArtifactLocator(dataRoot);

        Path bare = locator.locate("005930", ArtifactKind.OHLCV, Market.KOSPI, Timeframe.DAILY).orElseThrow();
        Path suffixed = locator.locate("005930.KS", ArtifactKind.OHLCV, Market.KOSPI, Timeframe.DAILY).orElseThrow();

        assertEquals("005930.KS_ohlcv_d_20240301_000000_KST.csv", bare.getFileName().toString());
        assertEquals(bare, suffixed);
    }

    @Test
    void locate_shouldPreferRequestedSpellingOnTimestampTie() throws Exception {
        touch("KOSDAQ", "000660.KQ_ohlcv_d_20240301_000000_KST.csv");
        touch("KOSDAQ", "000660_ohlcv_d_20240301_000000_KST.csv");
        FileArtifactLocator locator = new FileArtifactLocator(dataRoot);

        assertEquals("000660_ohlcv_d_20240301_000000_KST.csv", locator
                .locate("000660", ArtifactKind.OHLCV, Market.KOSDAQ, Timeframe.DAILY)
                .orElseThrow().getFileName().toString());
        assertEquals("000660.KQ_ohlcv_d_20240301_000000_KST.csv", locator
                .locate("000660.KQ", ArtifactKind.OHLCV, Market.KOSDAQ, Timeframe.DAILY)
                .orElseThrow().getFileName().toString());
    }

    @Test
    void locate_shouldReturnEmptyForOtherMarketOrMissingDirectory() throws Exception {
        touch("KOSPI", "005930_ohlcv_d_20240301_000000_KST.csv");
        FileArtifactLocator locator = new FileArtifactLocator(dataRoot);

        assertFalse(locator.locate("005930", ArtifactKind.OHLCV, Market.KOSDAQ, Timeframe.DAILY).isPresent());
        assertFalse(locator.locate("AAPL", ArtifactKind.OHLCV, Market.US, Timeframe.DAILY).isPresent());
        assertTrue(locator.findAll(" ", ArtifactKind.OHLCV, Market.KOSPI, Timeframe.DAILY).isEmpty());
    }

    private void touch(String folder, String fileName) throws IOException {
        Path dir = Files.createDirectories(dataRoot.resolve(folder));
        Files.writeString(dir.resolve(fileName), "# End Metadata\n\nDate,Close\n");
    }
}
