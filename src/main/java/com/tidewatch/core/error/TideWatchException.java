package com.tidewatch.core.error;

import com.tidewatch.core.diagnostics.CauseCode;

/**
 * Base type for engine failures that must surface to the caller instead of degrading to a permissive state.
 */
public abstract class TideWatchException extends RuntimeException {
    private final CauseCode causeCode;

    protected TideWatchException(CauseCode causeCode, String message) {
        super(message);
        this.causeCode = causeCode;
    }

    protected TideWatchException(CauseCode causeCode, String message, Throwable cause) {
        super(message, cause);
        this.causeCode = causeCode;
    }

    public CauseCode causeCode() {
        return causeCode;
    }
}
