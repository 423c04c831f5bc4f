package com.tidewatch.calendar;

import com.tidewatch.core.error.DataUnavailableException;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Trading-day oracle.
 * <p>
 * Implementations throw {@link DataUnavailableException} when they cannot answer for a date; they must
 * never guess "open" or "closed".
 */
public interface TradingCalendar {

    boolean isTradingDay(LocalDate date);

    Optional<String> holidayName(LocalDate date);

    /**
     * Earliest trading day strictly after {@code date}.
     */
    LocalDate nextTradingDayAfter(LocalDate date);

    default TradingDay lookup(LocalDate date) {
        boolean open = isTradingDay(date);
        return new TradingDay(date, open, open ? null : holidayName(date).orElse(null));
    }
}
