package com.marketbot.session;

import com.marketbot.model.Market;

import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Point-in-time view of one market's trading session.
 */
public final class MarketSession {
    public final Market market;
    public final ZonedDateTime localNow;
    public final LocalTime open;
    public final LocalTime close;
    public final SessionPhase phase;
    public final boolean tradingDay;

    MarketSession(Market market, ZonedDateTime localNow, SessionPhase phase, boolean tradingDay) {
        this.market = market;
        this.localNow = localNow;
        this.open = market.open;
        this.close = market.close;
        this.phase = phase;
        this.tradingDay = tradingDay;
    }

    public boolean isOpen() {
        return phase == SessionPhase.OPEN;
    }

    public String status() {
        return isOpen() ? "open" : "closed";
    }

    @Override
    public String toString() {
        return market + " " + localNow.toLocalDate() + " " + localNow.toLocalTime().withNano(0)
                + " " + market.timezoneLabel + " weekday=" + localNow.getDayOfWeek()
                + " phase=" + phase + " status=" + status();
    }
}
