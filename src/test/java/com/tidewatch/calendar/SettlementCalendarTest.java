package com.tidewatch.calendar;

import com.tidewatch.core.error.CalendarDataGapException;
import com.tidewatch.testsupport.FixedTradingCalendar;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettlementCalendarTest {

    @Test
    void nominalCyclesOfJanuary2026() {
        SettlementCalendar calendar = new SettlementCalendar(new FixedTradingCalendar());

        assertEquals(LocalDate.of(2026, 1, 16), calendar.futuresSettlement(2026, 1));
        assertEquals(LocalDate.of(2026, 1, 28), calendar.optionsSettlement(2026, 1));
    }

    @Test
    void holidayOnSettlementDayRollsBackToPreviousTradingDay() {
        FixedTradingCalendar trading = new FixedTradingCalendar().holiday(LocalDate.of(2026, 1, 16), "synthetic");
        SettlementCalendar calendar = new SettlementCalendar(trading);

        SettlementCycle cycle = calendar.settlement(CycleType.FUTURES, YearMonth.of(2026, 1));

        assertEquals(LocalDate.of(2026, 1, 16), cycle.nominalDate);
        assertEquals(LocalDate.of(2026, 1, 15), cycle.occurrenceDate);
        assertTrue(cycle.rolledBack());
    }

    @Test
    void springFestivalPushesFebruaryFuturesIntoThePreviousWeek() {
        SettlementCalendar calendar = new SettlementCalendar(HolidayTableCalendar.fromClasspath("calendar/cn_holidays.properties"));

        SettlementCycle cycle = calendar.settlement(CycleType.FUTURES, YearMonth.of(2026, 2));

        assertEquals(LocalDate.of(2026, 2, 20), cycle.nominalDate);
        assertEquals(LocalDate.of(2026, 2, 13), cycle.occurrenceDate);
        assertEquals(LocalDate.of(2026, 2, 9), cycle.weekStart());
    }

    @Test
    void rollbackBeyondLookbackIsACalendarGap() {
        FixedTradingCalendar trading = new FixedTradingCalendar()
                .closedRange(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31), "closed");
        SettlementCalendar calendar = new SettlementCalendar(trading, 3);

        CalendarDataGapException e = assertThrows(CalendarDataGapException.class,
                () -> calendar.rollbackToTradingDay(LocalDate.of(2026, 1, 16)));
        assertEquals(LocalDate.of(2026, 1, 16), e.start());
        assertEquals(3, e.lookbackDays());
    }

    @Test
    void nthWeekdayRejectsMissingOccurrence() {
        assertEquals(LocalDate.of(2026, 4, 29), SettlementCalendar.nthWeekday(2026, 4, DayOfWeek.WEDNESDAY, 5));
        assertThrows(IllegalArgumentException.class,
                () -> SettlementCalendar.nthWeekday(2026, 2, DayOfWeek.WEDNESDAY, 5));
        assertThrows(IllegalArgumentException.class,
                () -> SettlementCalendar.nthWeekday(2026, 1, DayOfWeek.FRIDAY, 0));
    }

    @Test
    void preRetreatAndProbeDaysSurroundTheSettlementWeek() {
        SettlementCalendar calendar = new SettlementCalendar(new FixedTradingCalendar());
        SettlementCycle futures = calendar.settlement(CycleType.FUTURES, YearMonth.of(2026, 1));

        assertEquals(LocalDate.of(2026, 1, 9), calendar.preRetreatDay(futures));
        assertEquals(LocalDate.of(2026, 1, 13), calendar.probeDay(futures));
        assertTrue(futures.inSettlementWeek(LocalDate.of(2026, 1, 12)));
        assertFalse(futures.inSettlementWeek(LocalDate.of(2026, 1, 19)));
    }

    @Test
    void preRetreatFridayOnAHolidayRollsBack() {
        FixedTradingCalendar trading = new FixedTradingCalendar().holiday(LocalDate.of(2026, 1, 9), "synthetic");
        SettlementCalendar calendar = new SettlementCalendar(trading);

        SettlementCycle futures = calendar.settlement(CycleType.FUTURES, YearMonth.of(2026, 1));

        assertEquals(LocalDate.of(2026, 1, 8), calendar.preRetreatDay(futures));
    }

    @Test
    void cyclesAreComputedOncePerMonth() {
        FixedTradingCalendar trading = new FixedTradingCalendar();
        SettlementCalendar calendar = new SettlementCalendar(trading);

        SettlementCycle first = calendar.settlement(CycleType.OPTIONS, YearMonth.of(2026, 1));
        int lookups = trading.lookups();
        SettlementCycle second = calendar.settlement(CycleType.OPTIONS, YearMonth.of(2026, 1));

        assertSame(first, second);
        assertEquals(lookups, trading.lookups());
    }

    @Test
    void calendarTodayCountsCalendarDaysToTheNextOccurrence() {
        SettlementCalendar calendar = new SettlementCalendar(new FixedTradingCalendar());

        CalendarToday today = calendar.calendarToday(LocalDate.of(2026, 1, 13));

        assertEquals(LocalDate.of(2026, 1, 16), today.futuresDay);
        assertEquals(LocalDate.of(2026, 1, 28), today.optionsDay);
        assertEquals(3, today.daysToFutures);
        assertEquals(15, today.daysToOptions);
        assertTrue(today.futuresWeek);
        assertFalse(today.optionsWeek);

        JSONObject json = today.toJson();
        assertEquals("2026-01-16", json.getString("next_futures_day"));
        assertTrue(json.getBoolean("is_futures_week"));
    }

    @Test
    void calendarTodayAfterSettlementLooksAtNextMonth() {
        SettlementCalendar calendar = new SettlementCalendar(new FixedTradingCalendar());

        CalendarToday today = calendar.calendarToday(LocalDate.of(2026, 1, 29));

        assertEquals(LocalDate.of(2026, 1, 16), today.futuresDay);
        assertEquals(LocalDate.of(2026, 2, 20), today.nextFuturesDay);
        assertEquals(LocalDate.of(2026, 2, 25), today.nextOptionsDay);
        assertEquals(22, today.daysToFutures);
        assertEquals(27, today.daysToOptions);
        assertFalse(today.futuresWeek);
        assertFalse(today.optionsWeek);
    }

    @Test
    void settlementDayItselfCountsAsZeroDaysAway() {
        SettlementCalendar calendar = new SettlementCalendar(new FixedTradingCalendar());

        CalendarToday today = calendar.calendarToday(LocalDate.of(2026, 1, 28));

        assertEquals(0, today.daysToOptions);
        assertTrue(today.optionsWeek);
    }

    @Test
    void nextOccurrenceNeverMovesBackwardAcrossThreeYears(@TempDir Path dir) throws Exception {
        Path supplement = dir.resolve("cn_holidays.properties");
        Files.writeString(supplement, "coverage.last_year=2027\n2027-01-01=元旦\n", StandardCharsets.UTF_8);
        HolidayTableCalendar trading = HolidayTableCalendar.load("calendar/cn_holidays.properties", supplement);
        SettlementCalendar calendar = new SettlementCalendar(trading);

        for (CycleType type : CycleType.values()) {
            LocalDate previous = null;
            int days = 0;
            for (LocalDate d = LocalDate.of(2024, 1, 1); d.getYear() <= 2026; d = d.plusDays(1)) {
                if (!trading.isTradingDay(d)) {
                    continue;
                }
                LocalDate occurrence = calendar.nextOccurrence(type, d).occurrenceDate;
                assertFalse(occurrence.isBefore(d), type + " on " + d + " -> " + occurrence);
                assertTrue(trading.isTradingDay(occurrence), type + " occurrence " + occurrence);
                if (previous != null) {
                    assertFalse(occurrence.isBefore(previous),
                            type + " on " + d + " -> " + occurrence + " after " + previous);
                }
                previous = occurrence;
                days++;
            }
            assertTrue(days > 700, type + " walked " + days + " trading days");
        }
    }
}
