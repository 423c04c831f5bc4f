package com.tidewatch.core.diagnostics;

/**
 * Machine-readable failure causes shared by the engine's exceptions and JSON error payloads.
 */
public enum CauseCode {
    DATA_UNAVAILABLE("data_unavailable"),
    FETCH_FAILED("fetch_failed"),
    FETCH_TIMEOUT("fetch_timeout"),
    CALENDAR_DATA_GAP("calendar_data_gap"),
    SCAN_IN_PROGRESS("scan_in_progress"),
    STORE_FAILED("store_failed");

    private final String label;

    CauseCode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
