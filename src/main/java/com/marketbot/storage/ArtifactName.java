package com.marketbot.storage;

import com.marketbot.model.ArtifactKind;
import com.marketbot.model.Market;
import com.marketbot.model.Timeframe;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File name codec: {@code {ticker}_{kind}_{tf}_{yyyyMMdd}_{HHmmss}_{KST|EST}.csv}.
 * The embedded timestamp is the latest bar timestamp and orders artifacts.
 */
public final class ArtifactName {
    private static final Pattern NAME = Pattern.compile(
            "^(.+?)_(ohlcv|indicators|crossinfo)_([dwm])_(\\d{8}_\\d{6})_(KST|EST)\\.csv$",
            Pattern.CASE_INSENSITIVE
    );
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT);

    public final String ticker;
    public final ArtifactKind kind;
    public final Timeframe timeframe;
    public final LocalDateTime timestamp;
    public final String timezoneLabel;

    private ArtifactName(String ticker, ArtifactKind kind, Timeframe timeframe, LocalDateTime timestamp, String timezoneLabel) {
        this.ticker = ticker;
        this.kind = kind;
        this.timeframe = timeframe;
        this.timestamp = timestamp;
        this.timezoneLabel = timezoneLabel;
    }

    public static String format(String ticker, ArtifactKind kind, Timeframe timeframe, LocalDateTime timestamp, Market market) {
        return ticker + "_" + kind.token + "_" + timeframe.code + "_" + STAMP.format(timestamp)
                + "_" + market.timezoneLabel + ".csv";
    }

    public static Optional<ArtifactName> parse(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher m = NAME.matcher(fileName);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            LocalDateTime ts = LocalDateTime.parse(m.group(4), STAMP);
            return Optional.of(new ArtifactName(
                    m.group(1),
                    ArtifactKind.fromToken(m.group(2)),
                    Timeframe.fromCode(m.group(3)),
                    ts,
                    m.group(5).toUpperCase(Locale.ROOT)
            ));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * True when the name starts with {@code {ticker}_{kind}_{tf}_} and ends in {@code .csv};
     * the kind is compared case-insensitively.
     */
    public static boolean matchesPrefix(String fileName, String ticker, ArtifactKind kind, Timeframe timeframe) {
        if (fileName == null || !fileName.endsWith(".csv") || !fileName.startsWith(ticker + "_")) {
            return false;
        }
        String rest = fileName.substring(ticker.length() + 1).toLowerCase(Locale.ROOT);
        return rest.startsWith(kind.token + "_" + timeframe.code + "_");
    }
}
