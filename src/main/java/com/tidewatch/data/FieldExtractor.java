package com.tidewatch.data;

import org.json.JSONObject;

/**
 * Tolerant field access over ZhituAPI rows, which name the same figure differently across endpoints and
 * report missing data as {@code "--"}.
 */
public final class FieldExtractor {
    public static final String NO_DATA = "--";

    private FieldExtractor() {
    }

    /**
     * First parseable number among {@code keys}; {@code null} when none is present.
     */
    public static Double number(JSONObject row, String... keys) {
        if (row == null) {
            return null;
        }
        for (String key : keys) {
            if (!row.has(key) || row.isNull(key)) {
                continue;
            }
            Object raw = row.get(key);
            if (raw instanceof Number) {
                double value = ((Number) raw).doubleValue();
                if (Double.isFinite(value)) {
                    return value;
                }
                continue;
            }
            String text = String.valueOf(raw).trim().replace(",", "");
            if (text.isEmpty() || NO_DATA.equals(text)) {
                continue;
            }
            try {
                double value = Double.parseDouble(text);
                if (Double.isFinite(value)) {
                    return value;
                }
            } catch (NumberFormatException e) {
                continue;
            }
        }
        return null;
    }

    public static double numberOr(JSONObject row, double fallback, String... keys) {
        Double value = number(row, keys);
        return value == null ? fallback : value;
    }

    public static String text(JSONObject row, String... keys) {
        if (row == null) {
            return "";
        }
        for (String key : keys) {
            if (!row.has(key) || row.isNull(key)) {
                continue;
            }
            String text = String.valueOf(row.get(key)).trim();
            if (!text.isEmpty() && !NO_DATA.equals(text)) {
                return text;
            }
        }
        return "";
    }
}
