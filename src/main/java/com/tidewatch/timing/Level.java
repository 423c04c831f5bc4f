package com.tidewatch.timing;

/**
 * Funnel tier. Declaration order is priority order: a higher tier always masks the lower ones.
 */
public enum Level {
    L1("L1"),
    L2("L2"),
    L3("L3"),
    NONE("NONE");

    private final String code;

    Level(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean outranks(Level other) {
        return ordinal() < other.ordinal();
    }

    public static Level fromCode(String raw) {
        String target = raw == null ? "" : raw.trim();
        for (Level level : values()) {
            if (level.code.equalsIgnoreCase(target)) {
                return level;
            }
        }
        throw new IllegalArgumentException("unknown timing level: " + raw);
    }
}
