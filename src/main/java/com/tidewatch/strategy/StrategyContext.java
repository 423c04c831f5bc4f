package com.tidewatch.strategy;

import com.tidewatch.core.error.FetchException;
import com.tidewatch.data.PoolType;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Data access handed to a running strategy.
 */
public final class StrategyContext {
    private final PoolSource pools;
    private final LocalDate runDate;
    private final String strategyName;

    public StrategyContext(PoolSource pools, LocalDate runDate, String strategyName) {
        this.pools = Objects.requireNonNull(pools, "pools");
        this.runDate = Objects.requireNonNull(runDate, "runDate");
        this.strategyName = Objects.requireNonNull(strategyName, "strategyName");
    }

    public LocalDate runDate() {
        return runDate;
    }

    public List<JSONObject> pool(PoolType type) throws FetchException {
        JSONArray rows = pools.pool(type, runDate);
        List<JSONObject> out = new ArrayList<>(rows.length());
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.optJSONObject(i);
            if (row != null) {
                out.add(row);
            }
        }
        return out;
    }

    public StrategySignal signal(String code, String name, double score, String reason, Map<String, Object> extra) {
        return new StrategySignal(strategyName, code, name, runDate, score, reason, extra);
    }
}
