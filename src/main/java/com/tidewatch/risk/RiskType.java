package com.tidewatch.risk;

import java.util.Locale;

public enum RiskType {
    LOW_REVENUE("low_revenue"),
    CONSECUTIVE_LOSS("consecutive_loss"),
    BOTH("both");

    private final String code;

    RiskType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static RiskType fromCode(String raw) {
        String target = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (RiskType type : values()) {
            if (type.code.equals(target)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown risk type: " + raw);
    }
}
