package com.tidewatch.core.error;

import com.tidewatch.core.diagnostics.CauseCode;

/**
 * Reading or writing persisted engine state failed.
 */
public class StoreException extends TideWatchException {

    public StoreException(String message, Throwable cause) {
        super(CauseCode.STORE_FAILED, message, cause);
    }
}
