package com.tidewatch.risk;

import java.util.Locale;

public enum RiskLevel {
    HIGH("high"),
    EXTREME("extreme");

    private final String code;

    RiskLevel(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static RiskLevel fromCode(String raw) {
        String target = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.code.equals(target)) {
                return level;
            }
        }
        throw new IllegalArgumentException("unknown risk level: " + raw);
    }
}
