package com.tidewatch.risk;

import org.json.JSONObject;

/**
 * Answer to a single-code risk lookup.
 */
public final class RiskCheckResult {
    public final String code;
    public final RiskRecord record;

    private RiskCheckResult(String code, RiskRecord record) {
        this.code = code;
        this.record = record;
    }

    public static RiskCheckResult clean(String code) {
        return new RiskCheckResult(code, null);
    }

    public static RiskCheckResult flagged(String code, RiskRecord record) {
        return new RiskCheckResult(code, record);
    }

    public boolean hasRisk() {
        return record != null;
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("code", code);
        out.put("has_risk", hasRisk());
        if (record != null) {
            out.put("risk_type", record.riskType.code());
            out.put("risk_level", record.riskLevel.code());
            out.put("reason", record.reason);
            out.put("loss_years", record.consecutiveLossYears);
            out.put("cumulative_loss", record.cumulativeLoss);
            out.put("latest_revenue", record.revenue == null ? JSONObject.NULL : record.revenue);
            out.put("scan_date", record.scanDate.toString());
        }
        return out;
    }
}
