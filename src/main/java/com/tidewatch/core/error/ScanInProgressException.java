package com.tidewatch.core.error;

import com.tidewatch.core.diagnostics.CauseCode;

/**
 * A risk scan was triggered while another one is still running.
 */
public class ScanInProgressException extends TideWatchException {

    public ScanInProgressException(String message) {
        super(CauseCode.SCAN_IN_PROGRESS, message);
    }
}
