package com.tidewatch.guard;

import org.json.JSONObject;

/**
 * Real-time market breadth figures. Any field may be {@code null} when the source could not provide it.
 */
public final class MarketSnapshot {
    public final Double indexDrawdownPct;
    public final Integer limitDownCount;
    public final Integer upCount;
    public final Integer downCount;
    public final Double brokenBoardRate;

    public MarketSnapshot(
            Double indexDrawdownPct,
            Integer limitDownCount,
            Integer upCount,
            Integer downCount,
            Double brokenBoardRate
    ) {
        this.indexDrawdownPct = indexDrawdownPct;
        this.limitDownCount = limitDownCount;
        this.upCount = upCount;
        this.downCount = downCount;
        this.brokenBoardRate = brokenBoardRate;
    }

    public static MarketSnapshot empty() {
        return new MarketSnapshot(null, null, null, null, null);
    }

    public boolean complete() {
        return indexDrawdownPct != null
                && limitDownCount != null
                && upCount != null
                && downCount != null
                && brokenBoardRate != null;
    }

    public MarketSnapshot withIndexDrawdownPct(Double value) {
        return new MarketSnapshot(value, limitDownCount, upCount, downCount, brokenBoardRate);
    }

    public MarketSnapshot withLimitDownCount(Integer value) {
        return new MarketSnapshot(indexDrawdownPct, value, upCount, downCount, brokenBoardRate);
    }

    public MarketSnapshot withBreadth(Integer up, Integer down) {
        return new MarketSnapshot(indexDrawdownPct, limitDownCount, up, down, brokenBoardRate);
    }

    public MarketSnapshot withBrokenBoardRate(Double value) {
        return new MarketSnapshot(indexDrawdownPct, limitDownCount, upCount, downCount, value);
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("index_drawdown_pct", indexDrawdownPct == null ? JSONObject.NULL : indexDrawdownPct);
        out.put("limit_down_count", limitDownCount == null ? JSONObject.NULL : limitDownCount);
        out.put("up_count", upCount == null ? JSONObject.NULL : upCount);
        out.put("down_count", downCount == null ? JSONObject.NULL : downCount);
        out.put("broken_board_rate", brokenBoardRate == null ? JSONObject.NULL : brokenBoardRate);
        return out;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
