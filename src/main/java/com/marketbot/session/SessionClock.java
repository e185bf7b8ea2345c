package com.marketbot.session;

import com.marketbot.model.Market;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * 模块说明：SessionClock（class）。
 * 主要职责：以注入的 Clock 计算各市场本地时间、交易时段与阶段（PRE/OPEN/POST）。
 * 维护提示：仅识别周末休市，不含节假日日历；节假日会被视为普通交易日。
 */
public final class SessionClock {
    private final Clock clock;

    public SessionClock(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static SessionClock system() {
        return new SessionClock(Clock.systemUTC());
    }

    public Instant now() {
        return clock.instant();
    }

    public ZonedDateTime nowIn(Market market) {
        return ZonedDateTime.ofInstant(clock.instant(), market.zone);
    }

    public LocalDate today(Market market) {
        return nowIn(market).toLocalDate();
    }

    /**
     * Open bounds are inclusive. Weekends report {@link SessionPhase#PRE} since the next session has not started.
     */
    public MarketSession snapshot(Market market) {
        ZonedDateTime local = nowIn(market);
        boolean tradingDay = isBusinessDay(local.toLocalDate());
        SessionPhase phase;
        if (!tradingDay) {
            phase = SessionPhase.PRE;
        } else {
            LocalTime time = local.toLocalTime();
            if (time.isBefore(market.open)) {
                phase = SessionPhase.PRE;
            } else if (time.isAfter(market.close)) {
                phase = SessionPhase.POST;
            } else {
                phase = SessionPhase.OPEN;
            }
        }
        return new MarketSession(market, local, phase, tradingDay);
    }

    public boolean isOpen(Market market) {
        return snapshot(market).isOpen();
    }

    public Instant currentSessionClose(Market market) {
        return today(market).atTime(market.close).atZone(market.zone).toInstant();
    }

    public Instant previousBusinessDayClose(Market market) {
        LocalDate day = today(market).minusDays(1);
        while (!isBusinessDay(day)) {
            day = day.minusDays(1);
        }
        return day.atTime(market.close).atZone(market.zone).toInstant();
    }

    public String timezoneLabel(Market market) {
        return market.timezoneLabel;
    }

    static boolean isBusinessDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }
}
