package com.tidewatch.status;

import com.tidewatch.calendar.CalendarToday;
import com.tidewatch.risk.RiskSummary;
import com.tidewatch.timing.TimingSignal;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Objects;

/**
 * One-shot dashboard snapshot: timing, settlement calendar and risk flags for a date.
 */
public final class GlobalStatus {
    public final TimingSignal timing;
    public final CalendarToday calendar;
    public final RiskSummary risk;

    public GlobalStatus(TimingSignal timing, CalendarToday calendar, RiskSummary risk) {
        this.timing = Objects.requireNonNull(timing, "timing");
        this.calendar = Objects.requireNonNull(calendar, "calendar");
        this.risk = Objects.requireNonNull(risk, "risk");
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("timing", timing.toJson());
        out.put("calendar", calendar.toJson());
        out.put("risk_stock_total", risk.total);
        out.put("risk_stock_extreme", risk.extremeCount);
        out.put("risk_codes", new JSONArray(risk.codes));
        return out;
    }
}
