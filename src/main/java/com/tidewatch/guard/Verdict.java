package com.tidewatch.guard;

import java.util.Locale;

public enum Verdict {
    PASS("pass"),
    DOWNGRADE("downgrade"),
    BLOCK("block");

    private final String code;

    Verdict(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Verdict fromCode(String raw) {
        String target = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Verdict verdict : values()) {
            if (verdict.code.equals(target)) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("unknown guard verdict: " + raw);
    }
}
