package com.tidewatch.calendar;

import java.time.DayOfWeek;
import java.util.Locale;

/**
 * Monthly derivative settlement cycles tracked by the engine.
 */
public enum CycleType {
    /** Stock index futures: third Friday. */
    FUTURES("futures", DayOfWeek.FRIDAY, 3),
    /** ETF options: fourth Wednesday. */
    OPTIONS("options", DayOfWeek.WEDNESDAY, 4);

    private final String code;
    private final DayOfWeek weekday;
    private final int ordinal;

    CycleType(String code, DayOfWeek weekday, int ordinal) {
        this.code = code;
        this.weekday = weekday;
        this.ordinal = ordinal;
    }

    public String code() {
        return code;
    }

    public DayOfWeek weekday() {
        return weekday;
    }

    public int occurrence() {
        return ordinal;
    }

    public static CycleType fromCode(String raw) {
        String target = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (CycleType type : values()) {
            if (type.code.equals(target)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown settlement cycle: " + raw);
    }
}
