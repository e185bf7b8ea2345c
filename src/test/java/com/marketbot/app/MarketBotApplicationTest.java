package com.marketbot.app;

import com.marketbot.config.Config;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketBotApplicationTest {

    @TempDir
    Path workDir;

    @Test
    void run_shouldPrintHelpAndExitCleanly() {
        assertEquals(MarketBotApplication.EXIT_OK, new MarketBotApplication().run(new String[]{"--help"}));
    }

    @Test
    void run_shouldRejectUnknownMarket() {
        assertEquals(MarketBotApplication.EXIT_USAGE,
                new MarketBotApplication().run(new String[]{"--tickers", "AAPL", "--market", "NYSE"}));
    }

    @Test
    void run_shouldRejectNonPositiveThreads() {
        assertEquals(MarketBotApplication.EXIT_USAGE,
                new MarketBotApplication().run(new String[]{"--tickers", "AAPL", "--threads", "0"}));
    }

    @Test
    void run_shouldRejectUnknownOption() {
        assertEquals(MarketBotApplication.EXIT_USAGE, new MarketBotApplication().run(new String[]{"--verbose"}));
    }

    @Test
    void cliOverrides_shouldMapDataDirAndThreads() throws Exception {
        CommandLine cmd = parse("--data-dir", " /srv/data ", "--threads", "4");

        Map<String, Object> overrides = MarketBotApplication.cliOverrides(cmd);

        assertEquals("/srv/data", overrides.get("pipeline.data-dir"));
        assertEquals(4, overrides.get("pipeline.threads"));
        assertTrue(MarketBotApplication.cliOverrides(parse()).isEmpty());
        assertThrows(NumberFormatException.class, () -> MarketBotApplication.cliOverrides(parse("--threads", "two")));
    }

    @Test
    void readTickers_shouldMergeListAndFileWithoutDuplicates() throws Exception {
        Files.writeString(workDir.resolve("tickers.txt"),
                "# watchlist\nMSFT\n\n005930, 000660\nAAPL\n", StandardCharsets.UTF_8);
        Config config = Config.load(workDir);

        List<String> tickers = MarketBotApplication.readTickers(
                parse("--tickers", "AAPL,TSLA", "--tickers-file", "tickers.txt"), config);

        assertEquals(List.of("AAPL", "TSLA", "MSFT", "005930", "000660"), tickers);
    }

    @Test
    void readTickers_shouldFallBackToConfiguredDefaults() throws Exception {
        Files.writeString(workDir.resolve("config.properties"), "tickers.default=NVDA;AMD\n", StandardCharsets.UTF_8);

        List<String> tickers = MarketBotApplication.readTickers(parse(), Config.load(workDir));

        assertEquals(List.of("NVDA", "AMD"), tickers);
    }

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(MarketBotApplication.buildOptions(), args);
    }
}
