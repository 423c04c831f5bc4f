package com.tidewatch.risk;

import java.util.Objects;

/**
 * One listed security in the scan universe.
 */
public final class Listing {
    public final String code;
    public final String name;

    public Listing(String code, String name) {
        this.code = Objects.requireNonNull(code, "code");
        this.name = name == null ? "" : name;
    }

    @Override
    public String toString() {
        return code + (name.isEmpty() ? "" : "(" + name + ")");
    }
}
