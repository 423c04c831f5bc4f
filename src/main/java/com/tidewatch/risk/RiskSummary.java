package com.tidewatch.risk;

import java.util.Collections;
import java.util.List;

/**
 * Current flag set reduced to counts and codes.
 */
public final class RiskSummary {
    public final int total;
    public final int extremeCount;
    public final List<String> codes;

    public RiskSummary(int total, int extremeCount, List<String> codes) {
        this.total = total;
        this.extremeCount = extremeCount;
        this.codes = codes == null ? List.of() : Collections.unmodifiableList(codes);
    }
}
