package com.tidewatch.timing;

import java.util.Locale;

/**
 * Operator action attached to a timing signal.
 */
public enum Action {
    FORCE_EMPTY("force_empty"),
    EXIT_ALL("exit_all"),
    INACTIVE("inactive"),
    PRE_RETREAT("pre_retreat"),
    /** Provisional; replaced by one of the guard-adjusted actions once the guard has been consulted. */
    PROBE_ENTRY("probe_entry"),
    PROBE_PERMITTED("probe_permitted"),
    /** Entry allowed with at most 10% of a normal position. */
    PROBE_LIGHT("probe_light"),
    OBSERVE_ONLY("observe_only"),
    OBSERVE("observe"),
    NORMAL_TRADING("normal_trading");

    private final String code;

    Action(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Action fromCode(String raw) {
        String target = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Action action : values()) {
            if (action.code.equals(target)) {
                return action;
            }
        }
        throw new IllegalArgumentException("unknown action: " + raw);
    }
}
