package com.tidewatch.calendar;

import org.json.JSONObject;

import java.time.LocalDate;

/**
 * Settlement overview for one day. Field names of {@link #toJson()} are a stable contract.
 */
public final class CalendarToday {
    public final LocalDate today;
    public final LocalDate futuresDay;
    public final LocalDate optionsDay;
    public final LocalDate nextFuturesDay;
    public final LocalDate nextOptionsDay;
    public final long daysToFutures;
    public final long daysToOptions;
    public final boolean futuresWeek;
    public final boolean optionsWeek;

    public CalendarToday(
            LocalDate today,
            LocalDate futuresDay,
            LocalDate optionsDay,
            LocalDate nextFuturesDay,
            LocalDate nextOptionsDay,
            long daysToFutures,
            long daysToOptions,
            boolean futuresWeek,
            boolean optionsWeek
    ) {
        this.today = today;
        this.futuresDay = futuresDay;
        this.optionsDay = optionsDay;
        this.nextFuturesDay = nextFuturesDay;
        this.nextOptionsDay = nextOptionsDay;
        this.daysToFutures = daysToFutures;
        this.daysToOptions = daysToOptions;
        this.futuresWeek = futuresWeek;
        this.optionsWeek = optionsWeek;
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("today", today.toString());
        out.put("futures_day", futuresDay.toString());
        out.put("options_day", optionsDay.toString());
        out.put("next_futures_day", nextFuturesDay.toString());
        out.put("next_options_day", nextOptionsDay.toString());
        out.put("days_to_futures", daysToFutures);
        out.put("days_to_options", daysToOptions);
        out.put("is_futures_week", futuresWeek);
        out.put("is_options_week", optionsWeek);
        return out;
    }
}
