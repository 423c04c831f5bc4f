package com.tidewatch.data;

import java.util.Locale;

/**
 * Daily stock pools published by ZhituAPI.
 */
public enum PoolType {
    LIMIT_UP("ztgc", "涨停股池"),
    LIMIT_DOWN("dtgc", "跌停股池"),
    STRONG("qsgc", "强势股池"),
    SUB_NEW("cxgc", "次新股池"),
    BROKEN_BOARD("zbgc", "炸板股池");

    private final String slug;
    private final String displayName;

    PoolType(String slug, String displayName) {
        this.slug = slug;
        this.displayName = displayName;
    }

    public String slug() {
        return slug;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Accepts the API slug or the Chinese pool name.
     */
    public static PoolType fromCode(String raw) {
        String target = raw == null ? "" : raw.trim();
        for (PoolType type : values()) {
            if (type.slug.equals(target.toLowerCase(Locale.ROOT)) || type.displayName.equals(target)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown pool type: " + raw);
    }
}
