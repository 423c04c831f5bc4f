package com.tidewatch.timing;

import com.tidewatch.guard.GuardVerdict;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Classification of one date (and time of day) by the timing funnel.
 */
public final class TimingSignal {
    public final LocalDate date;
    public final Level level;
    public final Light light;
    public final Action action;
    public final String reason;
    public final List<String> details;
    public final boolean tradingDay;
    public final String holidayName;
    public final LocalDate nextOpenDate;
    public final GuardVerdict guard;

    public TimingSignal(
            LocalDate date,
            Level level,
            Light light,
            Action action,
            String reason,
            List<String> details,
            boolean tradingDay,
            String holidayName,
            LocalDate nextOpenDate,
            GuardVerdict guard
    ) {
        this.date = Objects.requireNonNull(date, "date");
        this.level = Objects.requireNonNull(level, "level");
        this.light = Objects.requireNonNull(light, "light");
        this.action = Objects.requireNonNull(action, "action");
        this.reason = reason == null ? "" : reason;
        this.details = details == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(details));
        this.tradingDay = tradingDay;
        this.holidayName = holidayName;
        this.nextOpenDate = nextOpenDate;
        this.guard = guard;
    }

    public boolean isHoliday() {
        return holidayName != null;
    }

    public boolean isProvisionalEntry() {
        return action == Action.PROBE_ENTRY;
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("date", date.toString());
        out.put("level", level.code());
        out.put("light", light.code());
        out.put("action", action.code());
        out.put("reason", reason);
        out.put("details", new JSONArray(details));
        out.put("is_trading_day", tradingDay);
        out.put("is_holiday", isHoliday());
        out.put("holiday_name", holidayName == null ? JSONObject.NULL : holidayName);
        out.put("next_open_date", nextOpenDate == null ? JSONObject.NULL : nextOpenDate.toString());
        if (guard != null) {
            out.put("guard", guard.toJson());
        }
        return out;
    }

    @Override
    public String toString() {
        return "[" + date + "] " + level.code() + " " + light.code() + " | " + action.code() + " - " + reason;
    }
}
