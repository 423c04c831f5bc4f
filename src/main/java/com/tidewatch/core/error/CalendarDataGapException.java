package com.tidewatch.core.error;

import com.tidewatch.core.diagnostics.CauseCode;

import java.time.LocalDate;

/**
 * No trading day was found within the rollback lookback window.
 */
public class CalendarDataGapException extends TideWatchException {
    private final LocalDate start;
    private final int lookbackDays;

    public CalendarDataGapException(LocalDate start, int lookbackDays) {
        super(CauseCode.CALENDAR_DATA_GAP,
                "no trading day within " + lookbackDays + " days on or before " + start);
        this.start = start;
        this.lookbackDays = lookbackDays;
    }

    public LocalDate start() {
        return start;
    }

    public int lookbackDays() {
        return lookbackDays;
    }
}
