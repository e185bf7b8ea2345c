package com.marketbot.data;

import com.marketbot.config.Config;
import com.marketbot.data.http.HttpClientEx;
import com.marketbot.model.Bar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Korean secondary provider. Takes the bare 6-digit code and answers with
 * {@code <item data="yyyyMMdd|open|high|low|close|volume"/>} rows.
 */
public class NaverChartClient extends RetryingProvider {
    public static final String NAME = "naver";
    private static final Logger LOG = LogManager.getLogger(NaverChartClient.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;

    public NaverChartClient(Config config, HttpClientEx http) {
        this(config, http, Sleeper.SYSTEM);
    }

    public NaverChartClient(Config config, HttpClientEx http, Sleeper sleeper) {
        super(
                NAME,
                config.getInt("naver.max_attempts", 3),
                Math.max(0L, config.getLong("naver.retry_sleep_ms", 2000L)),
                sleeper
        );
        this.http = http;
        this.baseUrl = config.getString("naver.base_url");
        this.timeoutSec = Math.max(3, config.getInt("naver.request_timeout_sec", 20));
    }

    @Override
    protected List<Bar> fetchOnce(String symbol, LocalDate start, LocalDate end) throws IOException, InterruptedException {
        // calendar days always cover the trading days in range
        long count = Math.max(1L, ChronoUnit.DAYS.between(start, end) + 1L);
        String url = String.format(Locale.ROOT, baseUrl, symbol, count);
        return parseChart(http.getBytes(url, timeoutSec), start, end);
    }

    List<Bar> parseChart(byte[] body, LocalDate start, LocalDate end) throws IOException {
        if (body == null || body.length == 0) {
            return List.of();
        }
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            doc = factory.newDocumentBuilder().parse(new ByteArrayInputStream(body));
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("naver payload is not valid xml: " + e.getMessage(), e);
        }
        NodeList items = doc.getElementsByTagName("item");
        List<Bar> out = new ArrayList<>(items.getLength());
        int malformed = 0;
        for (int i = 0; i < items.getLength(); i++) {
            Element item = (Element) items.item(i);
            String[] cols = item.getAttribute("data").split("\\|");
            if (cols.length < 6) {
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(cols[0].trim(), DAY);
                if (date.isBefore(start) || date.isAfter(end)) {
                    continue;
                }
                double close = parseDouble(cols[4]);
                if (!Double.isFinite(close) || close <= 0.0) {
                    continue;
                }
                out.add(new Bar(
                        date.atStartOfDay(),
                        parseDouble(cols[1]),
                        parseDouble(cols[2]),
                        parseDouble(cols[3]),
                        close,
                        parseDouble(cols[5])
                ));
            } catch (DateTimeParseException | NumberFormatException e) {
                malformed++;
            }
        }
        if (malformed > 0) {
            LOG.debug("naver skipped {} malformed rows", malformed);
        }
        out.sort(Comparator.comparing(b -> b.timestamp));
        return out;
    }

    private double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return Double.NaN;
        }
        return Double.parseDouble(v);
    }
}
