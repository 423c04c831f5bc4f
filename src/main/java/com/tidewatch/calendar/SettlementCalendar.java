package com.tidewatch.calendar;

import com.tidewatch.config.Config;
import com.tidewatch.core.error.CalendarDataGapException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives monthly futures and options settlement days from the trading-day oracle.
 */
public final class SettlementCalendar {
    private static final Logger LOG = LogManager.getLogger(SettlementCalendar.class);
    public static final int DEFAULT_LOOKBACK_DAYS = 10;

    private final TradingCalendar tradingCalendar;
    private final int lookbackDays;
    private final Map<String, SettlementCycle> cycles = new ConcurrentHashMap<>();

    public SettlementCalendar(TradingCalendar tradingCalendar) {
        this(tradingCalendar, DEFAULT_LOOKBACK_DAYS);
    }

    public SettlementCalendar(TradingCalendar tradingCalendar, Config config) {
        this(tradingCalendar, config.getInt("calendar.rollback_lookback_days", DEFAULT_LOOKBACK_DAYS));
    }

    public SettlementCalendar(TradingCalendar tradingCalendar, int lookbackDays) {
        this.tradingCalendar = Objects.requireNonNull(tradingCalendar, "tradingCalendar");
        if (lookbackDays < 0) {
            throw new IllegalArgumentException("lookbackDays must be >= 0: " + lookbackDays);
        }
        this.lookbackDays = lookbackDays;
    }

    /**
     * The {@code ordinal}-th occurrence of {@code weekday} in the given month.
     *
     * @throws IllegalArgumentException when the month has no such occurrence
     */
    public static LocalDate nthWeekday(int year, int month, DayOfWeek weekday, int ordinal) {
        if (ordinal < 1 || ordinal > 5) {
            throw new IllegalArgumentException("ordinal must be within 1..5: " + ordinal);
        }
        Objects.requireNonNull(weekday, "weekday");
        LocalDate first = LocalDate.of(year, month, 1).with(TemporalAdjusters.firstInMonth(weekday));
        LocalDate target = first.plusWeeks(ordinal - 1L);
        if (target.getMonthValue() != month) {
            throw new IllegalArgumentException(
                    String.format("%d-%02d has no occurrence #%d of %s", year, month, ordinal, weekday));
        }
        return target;
    }

    /**
     * Steps backward from {@code date} (inclusive) to the closest trading day.
     *
     * @throws CalendarDataGapException when no trading day lies within the lookback window
     */
    public LocalDate rollbackToTradingDay(LocalDate date) {
        LocalDate cur = date;
        for (int i = 0; i <= lookbackDays; i++) {
            if (tradingCalendar.isTradingDay(cur)) {
                return cur;
            }
            cur = cur.minusDays(1);
        }
        throw new CalendarDataGapException(date, lookbackDays);
    }

    public SettlementCycle settlement(CycleType type, YearMonth month) {
        String key = type.code() + ":" + month;
        SettlementCycle cached = cycles.get(key);
        if (cached != null) {
            return cached;
        }
        LocalDate nominal = nthWeekday(month.getYear(), month.getMonthValue(), type.weekday(), type.occurrence());
        LocalDate actual = rollbackToTradingDay(nominal);
        SettlementCycle cycle = new SettlementCycle(type, month, nominal, actual);
        if (cycle.rolledBack()) {
            LOG.info("Settlement rolled back. cycle={}, nominal={}, actual={}", type.code(), nominal, actual);
        }
        cycles.putIfAbsent(key, cycle);
        return cycle;
    }

    public LocalDate futuresSettlement(int year, int month) {
        return settlement(CycleType.FUTURES, YearMonth.of(year, month)).occurrenceDate;
    }

    public LocalDate optionsSettlement(int year, int month) {
        return settlement(CycleType.OPTIONS, YearMonth.of(year, month)).occurrenceDate;
    }

    /**
     * Last trading day on or before the Friday that precedes the settlement week.
     */
    public LocalDate preRetreatDay(SettlementCycle cycle) {
        LocalDate friday = cycle.weekStart().minusDays(3);
        return rollbackToTradingDay(friday);
    }

    /**
     * Tuesday of the settlement week. May be a non-trading day, in which case no probe fires.
     */
    public LocalDate probeDay(SettlementCycle cycle) {
        return cycle.weekStart().with(DayOfWeek.TUESDAY);
    }

    /**
     * This month's cycle when it falls on or after {@code date}, otherwise next month's.
     */
    public SettlementCycle nextOccurrence(CycleType type, LocalDate date) {
        SettlementCycle current = settlement(type, YearMonth.from(date));
        if (!current.occurrenceDate.isBefore(date)) {
            return current;
        }
        return settlement(type, YearMonth.from(date).plusMonths(1));
    }

    public CalendarToday calendarToday(LocalDate today) {
        SettlementCycle futures = settlement(CycleType.FUTURES, YearMonth.from(today));
        SettlementCycle options = settlement(CycleType.OPTIONS, YearMonth.from(today));
        SettlementCycle nextFutures = nextOccurrence(CycleType.FUTURES, today);
        SettlementCycle nextOptions = nextOccurrence(CycleType.OPTIONS, today);
        return new CalendarToday(
                today,
                futures.occurrenceDate,
                options.occurrenceDate,
                nextFutures.occurrenceDate,
                nextOptions.occurrenceDate,
                ChronoUnit.DAYS.between(today, nextFutures.occurrenceDate),
                ChronoUnit.DAYS.between(today, nextOptions.occurrenceDate),
                nextFutures.inSettlementWeek(today),
                nextOptions.inSettlementWeek(today)
        );
    }

    public TradingCalendar tradingCalendar() {
        return tradingCalendar;
    }

    public int lookbackDays() {
        return lookbackDays;
    }
}
