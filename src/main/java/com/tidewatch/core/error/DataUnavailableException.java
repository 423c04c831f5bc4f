package com.tidewatch.core.error;

import com.tidewatch.core.diagnostics.CauseCode;

/**
 * Required data could not be obtained: the trading-day oracle or holiday lookup could not answer, or a
 * risk scan could not screen enough of the universe. Fatal for the request.
 */
public class DataUnavailableException extends TideWatchException {

    public DataUnavailableException(String message) {
        super(CauseCode.DATA_UNAVAILABLE, message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(CauseCode.DATA_UNAVAILABLE, message, cause);
    }
}
