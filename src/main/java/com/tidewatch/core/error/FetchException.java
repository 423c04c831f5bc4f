package com.tidewatch.core.error;

import com.tidewatch.core.diagnostics.CauseCode;

/**
 * A remote fetch failed or timed out. Callers recover locally with their most conservative outcome.
 */
public class FetchException extends Exception {
    private final CauseCode causeCode;

    public FetchException(String message) {
        this(CauseCode.FETCH_FAILED, message, null);
    }

    public FetchException(String message, Throwable cause) {
        this(CauseCode.FETCH_FAILED, message, cause);
    }

    public FetchException(CauseCode causeCode, String message, Throwable cause) {
        super(message, cause);
        this.causeCode = causeCode == null ? CauseCode.FETCH_FAILED : causeCode;
    }

    public static FetchException timeout(String message, Throwable cause) {
        return new FetchException(CauseCode.FETCH_TIMEOUT, message, cause);
    }

    public CauseCode causeCode() {
        return causeCode;
    }
}
