package com.marketbot.pipeline;

import com.marketbot.model.Market;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a ticker is still worth processing (e.g. not delisted).
 */
@FunctionalInterface
public interface TickerAllowList {
    TickerAllowList ALLOW_ALL = (ticker, market) -> true;

    boolean isActive(String ticker, Market market);

    /**
     * Everything is active except the listed tickers (case-insensitive, any market).
     */
    static TickerAllowList excluding(Collection<String> inactiveTickers) {
        if (inactiveTickers == null || inactiveTickers.isEmpty()) {
            return ALLOW_ALL;
        }
        Set<String> inactive = new HashSet<>();
        for (String ticker : inactiveTickers) {
            if (ticker != null && !ticker.isBlank()) {
                inactive.add(ticker.trim().toUpperCase(Locale.ROOT));
            }
        }
        return (ticker, market) -> ticker == null || !inactive.contains(ticker.trim().toUpperCase(Locale.ROOT));
    }
}
