package com.marketbot.app;

import com.marketbot.config.Config;
import com.marketbot.core.RunTelemetry;
import com.marketbot.model.Market;
import com.marketbot.model.ProcessingResult;
import com.marketbot.pipeline.BatchRunner;
import com.marketbot.storage.RetentionSweeper;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.io.IoBuilder;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class MarketBotApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_PARTIAL = 3;

    private static final DateTimeFormatter RUN_ID_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new MarketBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("marketbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("marketbot", options);
            return EXIT_OK;
        }

        Market market;
        try {
            market = Market.fromText(cmd.getOptionValue("market", "US"));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        Map<String, Object> overrides;
        try {
            overrides = cliOverrides(cmd);
        } catch (NumberFormatException e) {
            System.err.println("ERROR: --threads must be a positive integer: " + e.getMessage());
            return EXIT_USAGE;
        }

        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("cli", overrides));
            context.register(PipelineBootstrapConfig.class);
            context.refresh();

            Config config = context.getBean(Config.class);
            installLogRoutingIfNeeded(config);

            List<String> tickers = readTickers(cmd, config);
            if (tickers.isEmpty()) {
                System.err.println("ERROR: no tickers given (use --tickers, --tickers-file or config tickers.default).");
                return EXIT_USAGE;
            }

            Instant startedAt = Instant.now();
            RunTelemetry telemetry = new RunTelemetry(
                    market.name().toLowerCase(Locale.ROOT) + "-" + RUN_ID_FMT.format(startedAt),
                    cmd.hasOption("tickers-file") ? "file" : "cli",
                    startedAt
            );

            if (cmd.hasOption("sweep-days")) {
                int days = parsePositive(cmd.getOptionValue("sweep-days"), config.getInt("retention.max_age_days", 90));
                long sweepStarted = System.nanoTime();
                int deleted = context.getBean(RetentionSweeper.class).sweep(market, Duration.ofDays(days));
                telemetry.recordStep(RunTelemetry.STEP_SWEEP, (System.nanoTime() - sweepStarted) / 1_000_000L,
                        0, deleted, 0, "max_age_days=" + days);
            }

            List<ProcessingResult> results = context.getBean(BatchRunner.class).runAll(tickers, market, telemetry);
            telemetry.finish();
            for (ProcessingResult result : results) {
                System.out.println(result);
            }
            System.out.println(telemetry.getSummary());
            return telemetry.tickersFailed() > 0 ? EXIT_PARTIAL : EXIT_OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("FATAL: interrupted");
            return EXIT_FATAL;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return EXIT_FATAL;
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("tickers").hasArg().argName("list")
                .desc("Comma separated tickers, e.g. AAPL,MSFT or 005930,000660").build());
        options.addOption(Option.builder().longOpt("tickers-file").hasArg().argName("path")
                .desc("File with one ticker per line (# comments allowed)").build());
        options.addOption(Option.builder().longOpt("market").hasArg().argName("US|KOSPI|KOSDAQ")
                .desc("Market of the tickers (default US)").build());
        options.addOption(Option.builder().longOpt("data-dir").hasArg().argName("dir")
                .desc("Artifact root directory (default static/data)").build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("n")
                .desc("Worker threads for the batch").build());
        options.addOption(Option.builder().longOpt("sweep-days").hasArg().argName("days")
                .desc("Delete artifacts of the market older than this many days before running").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }

    static Map<String, Object> cliOverrides(CommandLine cmd) {
        Map<String, Object> overrides = new HashMap<>();
        if (cmd.hasOption("data-dir")) {
            overrides.put("pipeline.data-dir", cmd.getOptionValue("data-dir").trim());
        }
        if (cmd.hasOption("threads")) {
            int threads = Integer.parseInt(cmd.getOptionValue("threads").trim());
            if (threads <= 0) {
                throw new NumberFormatException(String.valueOf(threads));
            }
            overrides.put("pipeline.threads", threads);
        }
        return overrides;
    }

    static List<String> readTickers(CommandLine cmd, Config config) throws IOException {
        Set<String> tickers = new LinkedHashSet<>();
        if (cmd.hasOption("tickers")) {
            addTokens(tickers, cmd.getOptionValue("tickers"));
        }
        if (cmd.hasOption("tickers-file")) {
            Path file = config.workingDir().resolve(cmd.getOptionValue("tickers-file").trim()).normalize();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    addTokens(tickers, trimmed);
                }
            }
        }
        if (tickers.isEmpty()) {
            tickers.addAll(config.getList("tickers.default"));
        }
        return new ArrayList<>(tickers);
    }

    private static void addTokens(Set<String> out, String raw) {
        if (raw == null) {
            return;
        }
        for (String token : raw.split("[,;\\s]+")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
    }

    private static int parsePositive(String raw, int fallback) {
        try {
            int value = Integer.parseInt(raw == null ? "" : raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (MarketBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("marketbot.log.dir", logDir.toAbsolutePath().toString());

                // Reconfigure so the file appender picks up the directory; console keeps the original streams.
                ((LoggerContext) LogManager.getContext(false)).reconfigure();
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException | RuntimeException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }
}
