package com.tidewatch.calendar;

import com.tidewatch.core.error.DataUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HolidayTableCalendarTest {
    private final HolidayTableCalendar calendar = HolidayTableCalendar.fromClasspath("calendar/cn_holidays.properties");

    @Test
    void bundledTableCoversThreeYears() {
        assertEquals(2024, calendar.firstYear());
        assertEquals(2026, calendar.lastYear());
    }

    @Test
    void weekdaysOpenWeekendsAndHolidaysClosed() {
        assertTrue(calendar.isTradingDay(LocalDate.of(2026, 1, 13)));
        assertFalse(calendar.isTradingDay(LocalDate.of(2026, 1, 10)));
        assertFalse(calendar.isTradingDay(LocalDate.of(2026, 10, 1)));
        assertEquals(Optional.of("国庆节"), calendar.holidayName(LocalDate.of(2026, 10, 1)));
        assertEquals(Optional.empty(), calendar.holidayName(LocalDate.of(2026, 1, 10)));
    }

    @Test
    void lookupCarriesHolidayName() {
        TradingDay day = calendar.lookup(LocalDate.of(2025, 1, 29));

        assertFalse(day.tradingDay);
        assertTrue(day.isHoliday());
        assertEquals("春节", day.holidayName);
    }

    @Test
    void springFestivalEveOf2024IsClosed() {
        assertFalse(calendar.isTradingDay(LocalDate.of(2024, 2, 9)));
        assertEquals(LocalDate.of(2024, 2, 19), calendar.nextTradingDayAfter(LocalDate.of(2024, 2, 8)));
    }

    @Test
    void supplementFileExtendsCoverage(@TempDir Path dir) throws Exception {
        Path supplement = dir.resolve("cn_holidays.properties");
        Files.writeString(supplement, "coverage.last_year=2027\n2027-01-01=元旦\n", StandardCharsets.UTF_8);

        HolidayTableCalendar extended = HolidayTableCalendar.load("calendar/cn_holidays.properties", supplement);

        assertEquals(2027, extended.lastYear());
        assertFalse(extended.isTradingDay(LocalDate.of(2027, 1, 1)));
        assertTrue(extended.isTradingDay(LocalDate.of(2027, 1, 15)));
        assertFalse(extended.isTradingDay(LocalDate.of(2026, 10, 1)));
    }

    @Test
    void missingSupplementFallsBackToTheBundledTable(@TempDir Path dir) {
        HolidayTableCalendar bundled = HolidayTableCalendar.load("calendar/cn_holidays.properties",
                dir.resolve("absent.properties"));

        assertEquals(2026, bundled.lastYear());
    }

    @Test
    void nextTradingDaySkipsTheGoldenWeek() {
        assertEquals(LocalDate.of(2026, 10, 8), calendar.nextTradingDayAfter(LocalDate.of(2026, 9, 30)));
        assertEquals(LocalDate.of(2026, 1, 12), calendar.nextTradingDayAfter(LocalDate.of(2026, 1, 9)));
    }

    @Test
    void datesOutsideCoverageAreUnavailable() {
        assertThrows(DataUnavailableException.class, () -> calendar.isTradingDay(LocalDate.of(2027, 3, 1)));
        assertThrows(DataUnavailableException.class, () -> calendar.isTradingDay(LocalDate.of(2023, 12, 29)));
    }

    @Test
    void missingResourceIsUnavailable() {
        assertThrows(DataUnavailableException.class, () -> HolidayTableCalendar.fromClasspath("calendar/missing.properties"));
    }

    @Test
    void malformedEntryIsRejected() {
        Properties props = new Properties();
        props.setProperty("coverage.first_year", "2026");
        props.setProperty("coverage.last_year", "2026");
        props.setProperty("2026-13-01", "bogus");

        assertThrows(DataUnavailableException.class, () -> HolidayTableCalendar.fromProperties(props, "test"));
    }

    @Test
    void missingCoverageIsRejected() {
        Properties props = new Properties();
        props.setProperty("2026-01-01", "元旦");

        assertThrows(DataUnavailableException.class, () -> HolidayTableCalendar.fromProperties(props, "test"));
    }
}
