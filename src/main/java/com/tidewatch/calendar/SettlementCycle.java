package com.tidewatch.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;

/**
 * One monthly settlement occurrence. {@code occurrenceDate} is always a trading day.
 */
public final class SettlementCycle {
    public final CycleType type;
    public final YearMonth month;
    public final LocalDate nominalDate;
    public final LocalDate occurrenceDate;

    public SettlementCycle(CycleType type, YearMonth month, LocalDate nominalDate, LocalDate occurrenceDate) {
        this.type = Objects.requireNonNull(type, "type");
        this.month = Objects.requireNonNull(month, "month");
        this.nominalDate = Objects.requireNonNull(nominalDate, "nominalDate");
        this.occurrenceDate = Objects.requireNonNull(occurrenceDate, "occurrenceDate");
    }

    public boolean rolledBack() {
        return !nominalDate.equals(occurrenceDate);
    }

    /**
     * Monday of the ISO week that contains the occurrence.
     */
    public LocalDate weekStart() {
        return occurrenceDate.with(DayOfWeek.MONDAY);
    }

    public boolean inSettlementWeek(LocalDate date) {
        return date != null && date.with(DayOfWeek.MONDAY).equals(weekStart());
    }

    @Override
    public String toString() {
        return type.code() + "@" + occurrenceDate + (rolledBack() ? " (rolled back from " + nominalDate + ")" : "");
    }
}
