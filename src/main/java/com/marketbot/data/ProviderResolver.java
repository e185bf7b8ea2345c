package com.marketbot.data;

import com.marketbot.core.DownloadException;
import com.marketbot.core.EventLog;
import com.marketbot.model.BarSeries;
import com.marketbot.model.Market;
import com.marketbot.model.TickerIdentity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：ProviderResolver（class）。
 * 主要职责：按市场生成有序的“数据源 + 代码写法”尝试计划，依次调用直到拿到非空数据；全部失败时抛出 DownloadException。
 * 使用建议：本类不做任何持久化，也不做数据清洗。
 */
public class ProviderResolver {
    private static final Logger LOG = LogManager.getLogger(ProviderResolver.class);

    public record ProviderAttempt(MarketDataProvider provider, String symbol) {
        @Override
        public String toString() {
            return provider.name() + ":" + symbol;
        }
    }

    private final MarketDataProvider primary;
    private final MarketDataProvider koreanSecondary;
    private final MarketDataProvider usSecondary;

    public ProviderResolver(MarketDataProvider primary, MarketDataProvider koreanSecondary, MarketDataProvider usSecondary) {
        this.primary = primary;
        this.koreanSecondary = koreanSecondary;
        this.usSecondary = usSecondary;
    }

    /**
     * Korean tickers go to the Korean secondary with the bare code first, then the primary with
     * each exchange suffix. US tickers go to the primary first, then the US secondary.
     */
    public List<ProviderAttempt> plan(String ticker, Market market) {
        TickerIdentity identity = TickerIdentity.parse(ticker);
        List<ProviderAttempt> out = new ArrayList<>();
        if (identity.isKorean(market)) {
            Market krMarket = effectiveKoreanMarket(identity, market);
            if (koreanSecondary != null) {
                out.add(new ProviderAttempt(koreanSecondary, identity.providerCode()));
            }
            for (String symbol : identity.exchangeCandidates(krMarket)) {
                out.add(new ProviderAttempt(primary, symbol));
            }
            return out;
        }
        out.add(new ProviderAttempt(primary, identity.raw));
        if (usSecondary != null) {
            out.add(new ProviderAttempt(usSecondary, identity.raw));
        }
        return out;
    }

    public BarSeries download(String ticker, Market market, LocalDate start, LocalDate end) throws DownloadException {
        List<ProviderAttempt> attempts = plan(ticker, market);
        EventLog.info(LOG, "download.fallback.begin", "ticker", ticker, "market", market,
                "plan", attempts.toString());
        List<String> errors = new ArrayList<>();
        for (ProviderAttempt attempt : attempts) {
            FetchResult result = attempt.provider().fetch(attempt.symbol(), start, end);
            if (result.isSuccess()) {
                EventLog.info(LOG, "download.fallback.route", "ticker", ticker, "provider", result.provider,
                        "symbol", result.symbol, "rows", result.bars.size());
                return BarSeries.of(result.bars);
            }
            errors.add(result.describe());
            EventLog.warn(LOG, "download.fallback.miss", "ticker", ticker, "provider", result.provider,
                    "symbol", result.symbol, "status", result.status.name(), "error", result.error);
        }
        throw new DownloadException("all providers failed for " + ticker + " [" + market + "]: "
                + String.join("; ", errors), errors);
    }

    private Market effectiveKoreanMarket(TickerIdentity identity, Market market) {
        if (market != null && market.isKorean()) {
            return market;
        }
        return TickerIdentity.SUFFIX_KOSDAQ.equals(identity.suffix) ? Market.KOSDAQ : Market.KOSPI;
    }
}
