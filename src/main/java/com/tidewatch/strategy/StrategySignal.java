package com.tidewatch.strategy;

import org.json.JSONObject;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class StrategySignal {
    public final String strategyName;
    public final String code;
    public final String name;
    public final LocalDate signalDate;
    public final double score;
    public final String reason;
    public final Map<String, Object> extra;

    public StrategySignal(
            String strategyName,
            String code,
            String name,
            LocalDate signalDate,
            double score,
            String reason,
            Map<String, Object> extra
    ) {
        this.strategyName = Objects.requireNonNull(strategyName, "strategyName");
        this.code = Objects.requireNonNull(code, "code");
        this.name = name == null ? "" : name;
        this.signalDate = Objects.requireNonNull(signalDate, "signalDate");
        this.score = score;
        this.reason = reason == null ? "" : reason;
        this.extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public JSONObject extraJson() {
        return new JSONObject(extra);
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("strategy_name", strategyName);
        out.put("stock_code", code);
        out.put("stock_name", name);
        out.put("signal_date", signalDate.toString());
        out.put("score", score);
        out.put("reason", reason);
        out.put("extra", extraJson());
        return out;
    }
}
