package com.marketbot.transform;

import com.marketbot.model.Bar;
import com.marketbot.model.BarSeries;
import com.marketbot.model.Timeframe;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeframeDeriverTest {

    private final TimeframeDeriver deriver = new TimeframeDeriver();

    @Test
    void resample_shouldCollapseOneWeekIntoOneBar() {
        BarSeries week = bars(LocalDate.of(2024, 3, 4), 7);

        BarSeries weekly = deriver.resample(week, Timeframe.WEEKLY);

        assertEquals(1, weekly.size());
        Bar bar = weekly.first();
        assertEquals(LocalDateTime.of(2024, 3, 10, 0, 0), bar.timestamp);
        assertEquals(100.0, bar.open, 1e-9);
        assertEquals(108.0, bar.high, 1e-9);
        assertEquals(99.0, bar.low, 1e-9);
        assertEquals(106.5, bar.close, 1e-9);
        assertEquals(7 * 1000.0 + 21.0, bar.volume, 1e-9);
    }

    @Test
    void resample_shouldReturnEmptyBelowMinimumRows() {
        assertTrue(deriver.resample(bars(LocalDate.of(2024, 3, 4), 6), Timeframe.WEEKLY).isEmpty());
        assertTrue(deriver.resample(bars(LocalDate.of(2024, 2, 1), 29), Timeframe.MONTHLY).isEmpty());
    }

    @Test
    void resample_shouldLabelMonthsWithLastCalendarDay() {
        BarSeries monthly = deriver.resample(bars(LocalDate.of(2024, 2, 1), 30), Timeframe.MONTHLY);

        assertEquals(2, monthly.size());
        assertEquals(LocalDateTime.of(2024, 2, 29, 0, 0), monthly.get(0).timestamp);
        assertEquals(LocalDateTime.of(2024, 3, 31, 0, 0), monthly.get(1).timestamp);
        assertEquals(129.0 + 0.5, monthly.get(1).close, 1e-9);
        assertEquals(129.0, monthly.get(1).open, 1e-9);
    }

    @Test
    void resample_shouldSkipIncompleteBars() {
        List<Bar> list = new ArrayList<>(bars(LocalDate.of(2024, 3, 4), 7).bars());
        list.add(new Bar(LocalDateTime.of(2024, 3, 11, 0, 0), 1.0, Double.NaN, 1.0, 1.0, 1.0));

        BarSeries weekly = deriver.resample(BarSeries.of(list), Timeframe.WEEKLY);

        assertEquals(1, weekly.size());
    }

    @Test
    void resample_shouldRejectDailyTarget() {
        assertThrows(IllegalArgumentException.class,
                () -> deriver.resample(bars(LocalDate.of(2024, 3, 4), 10), Timeframe.DAILY));
    }

    @Test
    void periodEnd_shouldKeepSundayInItsOwnWeek() {
        assertEquals(LocalDate.of(2024, 3, 10), TimeframeDeriver.periodEnd(LocalDate.of(2024, 3, 10), Timeframe.WEEKLY));
        assertEquals(LocalDate.of(2024, 3, 17), TimeframeDeriver.periodEnd(LocalDate.of(2024, 3, 11), Timeframe.WEEKLY));
    }

    private static BarSeries bars(LocalDate first, int count) {
        List<Bar> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double open = 100.0 + i;
            out.add(new Bar(first.plusDays(i).atStartOfDay(), open, open + 2.0, open - 1.0, open + 0.5, 1000.0 + i));
        }
        return BarSeries.of(out);
    }
}
