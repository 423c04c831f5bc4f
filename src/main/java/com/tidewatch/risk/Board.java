package com.tidewatch.risk;

import java.util.Locale;

/**
 * Listing board, derived from the numeric code prefix.
 */
public enum Board {
    MAIN("main"),
    CHINEXT("chinext"),
    STAR("star"),
    BSE("bse");

    private final String code;

    Board(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isMain() {
        return this == MAIN;
    }

    /**
     * 300/301 ChiNext, 688/689 STAR, 4/8/92 Beijing, everything else main board.
     */
    public static Board detect(String symbol) {
        String pure = pureCode(symbol);
        if (pure.startsWith("300") || pure.startsWith("301")) {
            return CHINEXT;
        }
        if (pure.startsWith("688") || pure.startsWith("689")) {
            return STAR;
        }
        if (pure.startsWith("4") || pure.startsWith("8") || pure.startsWith("92")) {
            return BSE;
        }
        return MAIN;
    }

    public static Board fromCode(String raw) {
        String target = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Board board : values()) {
            if (board.code.equals(target)) {
                return board;
            }
        }
        throw new IllegalArgumentException("unknown board: " + raw);
    }

    static String pureCode(String symbol) {
        if (symbol == null) {
            return "";
        }
        String s = symbol.trim().toUpperCase(Locale.ROOT);
        if (s.startsWith("SH") || s.startsWith("SZ") || s.startsWith("BJ")) {
            s = s.substring(2);
        }
        int dot = s.indexOf('.');
        return dot >= 0 ? s.substring(0, dot) : s;
    }
}
