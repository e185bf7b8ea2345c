package com.marketbot.data;

import java.time.LocalDate;

/**
 * One remote source of daily bars.
 */
public interface MarketDataProvider {
    String name();

    /**
     * Never throws for transport or payload problems; those come back as a tagged result.
     */
    FetchResult fetch(String symbol, LocalDate start, LocalDate end);
}
