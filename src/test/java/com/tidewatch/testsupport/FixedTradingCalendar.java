package com.tidewatch.testsupport;

import com.tidewatch.calendar.TradingCalendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Weekends closed, plus whatever holidays a test registers. Covers every year.
 */
public final class FixedTradingCalendar implements TradingCalendar {
    private final Map<LocalDate, String> holidays = new HashMap<>();
    private int lookups;

    public FixedTradingCalendar holiday(LocalDate date, String name) {
        holidays.put(date, name);
        return this;
    }

    public FixedTradingCalendar closedRange(LocalDate from, LocalDate to, String name) {
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            holidays.put(d, name);
        }
        return this;
    }

    public int lookups() {
        return lookups;
    }

    @Override
    public boolean isTradingDay(LocalDate date) {
        lookups++;
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY && !holidays.containsKey(date);
    }

    @Override
    public Optional<String> holidayName(LocalDate date) {
        return Optional.ofNullable(holidays.get(date));
    }

    @Override
    public LocalDate nextTradingDayAfter(LocalDate date) {
        LocalDate cur = date.plusDays(1);
        while (!isTradingDay(cur)) {
            cur = cur.plusDays(1);
        }
        return cur;
    }
}
