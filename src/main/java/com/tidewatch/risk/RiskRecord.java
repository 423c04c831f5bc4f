package com.tidewatch.risk;

import org.json.JSONObject;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A listing flagged by the financial risk scan.
 * <p>
 * {@code extreme} is only ever set together with a low-revenue flag and at least three consecutive loss
 * years.
 */
public final class RiskRecord {
    public final String code;
    public final String name;
    public final Board board;
    public final RiskType riskType;
    public final RiskLevel riskLevel;
    public final String reason;
    public final Double revenue;
    public final Double latestNetProfit;
    public final int consecutiveLossYears;
    public final double cumulativeLoss;
    public final boolean extreme;
    public final LocalDate scanDate;
    public final String scanCycle;

    public RiskRecord(
            String code,
            String name,
            Board board,
            RiskType riskType,
            RiskLevel riskLevel,
            String reason,
            Double revenue,
            Double latestNetProfit,
            int consecutiveLossYears,
            double cumulativeLoss,
            boolean extreme,
            LocalDate scanDate,
            String scanCycle
    ) {
        this.code = Objects.requireNonNull(code, "code");
        this.name = name == null ? "" : name;
        this.board = Objects.requireNonNull(board, "board");
        this.riskType = Objects.requireNonNull(riskType, "riskType");
        this.riskLevel = Objects.requireNonNull(riskLevel, "riskLevel");
        this.reason = reason == null ? "" : reason;
        this.revenue = revenue;
        this.latestNetProfit = latestNetProfit;
        this.consecutiveLossYears = consecutiveLossYears;
        this.cumulativeLoss = cumulativeLoss;
        this.extreme = extreme;
        this.scanDate = Objects.requireNonNull(scanDate, "scanDate");
        this.scanCycle = scanCycle == null ? "" : scanCycle;
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("code", code);
        out.put("name", name);
        out.put("board", board.code());
        out.put("risk_type", riskType.code());
        out.put("risk_level", riskLevel.code());
        out.put("reason", reason);
        out.put("latest_revenue", revenue == null ? JSONObject.NULL : revenue);
        out.put("latest_net_profit", latestNetProfit == null ? JSONObject.NULL : latestNetProfit);
        out.put("loss_years", consecutiveLossYears);
        out.put("cumulative_loss", cumulativeLoss);
        out.put("is_extreme", extreme);
        out.put("scan_date", scanDate.toString());
        return out;
    }
}
