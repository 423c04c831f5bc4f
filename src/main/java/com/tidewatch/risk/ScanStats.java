package com.tidewatch.risk;

import org.json.JSONObject;

import java.time.LocalDate;

public final class ScanStats {
    public final LocalDate scanDate;
    public final String scanCycle;
    public final int total;
    public final int scanned;
    public final int flagged;
    public final int extreme;
    public final int errors;
    public final int skippedNoData;
    public final long elapsedMs;

    public ScanStats(
            LocalDate scanDate,
            String scanCycle,
            int total,
            int scanned,
            int flagged,
            int extreme,
            int errors,
            int skippedNoData,
            long elapsedMs
    ) {
        this.scanDate = scanDate;
        this.scanCycle = scanCycle;
        this.total = total;
        this.scanned = scanned;
        this.flagged = flagged;
        this.extreme = extreme;
        this.errors = errors;
        this.skippedNoData = skippedNoData;
        this.elapsedMs = elapsedMs;
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("scan_date", scanDate.toString());
        out.put("scan_cycle", scanCycle);
        out.put("total", total);
        out.put("scanned", scanned);
        out.put("flagged", flagged);
        out.put("extreme", extreme);
        out.put("errors", errors);
        out.put("skipped_no_data", skippedNoData);
        out.put("elapsed_ms", elapsedMs);
        return out;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
