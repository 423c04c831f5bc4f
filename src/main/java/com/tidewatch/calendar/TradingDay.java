package com.tidewatch.calendar;

import java.time.LocalDate;
import java.util.Objects;

public final class TradingDay {
    public final LocalDate date;
    public final boolean tradingDay;
    public final String holidayName;

    public TradingDay(LocalDate date, boolean tradingDay, String holidayName) {
        this.date = Objects.requireNonNull(date, "date");
        this.tradingDay = tradingDay;
        this.holidayName = holidayName;
    }

    public boolean isHoliday() {
        return holidayName != null;
    }
}
