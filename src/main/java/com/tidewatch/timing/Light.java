package com.tidewatch.timing;

import java.util.Locale;

public enum Light {
    RED("red"),
    YELLOW("yellow"),
    GREEN("green"),
    GREY("grey");

    private final String code;

    Light(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Light fromCode(String raw) {
        String target = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Light light : values()) {
            if (light.code.equals(target)) {
                return light;
            }
        }
        throw new IllegalArgumentException("unknown light: " + raw);
    }
}
