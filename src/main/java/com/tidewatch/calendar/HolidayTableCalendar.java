package com.tidewatch.calendar;

import com.tidewatch.core.error.DataUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;

/**
 * A-share trading calendar backed by a published holiday table.
 * <p>
 * Weekends are always closed. Weekdays are open unless listed as a holiday. Dates outside the table's
 * coverage years are reported as {@link DataUnavailableException}.
 * <p>
 * The bundled table can be extended without a rebuild: a file in the same format, read on top of it,
 * adds holidays and may widen {@code coverage.first_year}/{@code coverage.last_year} once the
 * exchanges publish the next year's closures.
 */
public final class HolidayTableCalendar implements TradingCalendar {
    private static final Logger LOG = LogManager.getLogger(HolidayTableCalendar.class);
    private static final String KEY_FIRST_YEAR = "coverage.first_year";
    private static final String KEY_LAST_YEAR = "coverage.last_year";
    private static final int MAX_FORWARD_SCAN_DAYS = 30;

    private final int firstYear;
    private final int lastYear;
    private final Map<LocalDate, String> holidays;

    public HolidayTableCalendar(int firstYear, int lastYear, Map<LocalDate, String> holidays) {
        if (lastYear < firstYear) {
            throw new IllegalArgumentException("coverage range is empty: " + firstYear + ".." + lastYear);
        }
        this.firstYear = firstYear;
        this.lastYear = lastYear;
        this.holidays = Collections.unmodifiableMap(new TreeMap<>(holidays == null ? Map.of() : holidays));
    }

    public static HolidayTableCalendar fromClasspath(String resource) {
        Properties props = new Properties();
        readClasspath(props, resource);
        return fromProperties(props, resource);
    }

    /**
     * Bundled table plus {@code supplement} when that file exists. Supplement entries win on conflict.
     */
    public static HolidayTableCalendar load(String resource, Path supplement) {
        Properties props = new Properties();
        readClasspath(props, resource);
        if (supplement == null || !Files.isRegularFile(supplement)) {
            return fromProperties(props, resource);
        }
        try (Reader reader = Files.newBufferedReader(supplement, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new DataUnavailableException("failed to read holiday supplement " + supplement, e);
        }
        LOG.info("Holiday supplement applied: {}", supplement.toAbsolutePath());
        return fromProperties(props, resource + " + " + supplement);
    }

    private static void readClasspath(Properties props, String resource) {
        try (InputStream in = HolidayTableCalendar.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new DataUnavailableException("holiday table not found on classpath: " + resource);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        } catch (IOException e) {
            throw new DataUnavailableException("failed to read holiday table " + resource, e);
        }
    }

    static HolidayTableCalendar fromProperties(Properties props, String source) {
        int first = parseYear(props.getProperty(KEY_FIRST_YEAR), KEY_FIRST_YEAR, source);
        int last = parseYear(props.getProperty(KEY_LAST_YEAR), KEY_LAST_YEAR, source);
        Map<LocalDate, String> holidays = new TreeMap<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith("coverage.")) {
                continue;
            }
            try {
                holidays.put(LocalDate.parse(key.trim()), props.getProperty(key).trim());
            } catch (DateTimeParseException e) {
                throw new DataUnavailableException("malformed holiday entry '" + key + "' in " + source, e);
            }
        }
        LOG.info("Holiday table loaded. source={}, years={}..{}, entries={}", source, first, last, holidays.size());
        return new HolidayTableCalendar(first, last, holidays);
    }

    @Override
    public boolean isTradingDay(LocalDate date) {
        requireCovered(date);
        if (isWeekend(date)) {
            return false;
        }
        return !holidays.containsKey(date);
    }

    @Override
    public Optional<String> holidayName(LocalDate date) {
        requireCovered(date);
        return Optional.ofNullable(holidays.get(date));
    }

    @Override
    public LocalDate nextTradingDayAfter(LocalDate date) {
        LocalDate cur = date.plusDays(1);
        for (int i = 0; i < MAX_FORWARD_SCAN_DAYS; i++) {
            if (isTradingDay(cur)) {
                return cur;
            }
            cur = cur.plusDays(1);
        }
        throw new DataUnavailableException("no trading day within " + MAX_FORWARD_SCAN_DAYS + " days after " + date);
    }

    public int firstYear() {
        return firstYear;
    }

    public int lastYear() {
        return lastYear;
    }

    private void requireCovered(LocalDate date) {
        if (date == null) {
            throw new DataUnavailableException("date is required");
        }
        int year = date.getYear();
        if (year < firstYear || year > lastYear) {
            throw new DataUnavailableException("holiday table does not cover " + date
                    + " (covered years " + firstYear + ".." + lastYear + ")");
        }
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    private static int parseYear(String raw, String key, String source) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new DataUnavailableException("missing " + key + " in " + source);
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new DataUnavailableException("invalid " + key + "=" + raw + " in " + source, e);
        }
    }
}
