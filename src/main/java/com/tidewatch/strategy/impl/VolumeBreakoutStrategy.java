package com.tidewatch.strategy.impl;

import com.tidewatch.core.error.FetchException;
import com.tidewatch.data.FieldExtractor;
import com.tidewatch.data.PoolType;
import com.tidewatch.strategy.Strategy;
import com.tidewatch.strategy.StrategyContext;
import com.tidewatch.strategy.StrategySignal;
import org.json.JSONObject;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Strong-pool stocks trading on heavy volume (ratio >= 2) and up 5% to 9.5%, i.e. strong but not sealed.
 */
public final class VolumeBreakoutStrategy implements Strategy {
    public static final String NAME = "volume_breakout";
    static final double MIN_VOLUME_RATIO = 2.0;
    static final double MIN_CHANGE_PCT = 5.0;
    static final double MAX_CHANGE_PCT = 9.5;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<LocalTime> schedule() {
        return Optional.of(LocalTime.of(14, 30));
    }

    @Override
    public String description() {
        return "strong pool stocks with volume ratio >= 2 and change between 5% and 9.5%";
    }

    @Override
    public List<StrategySignal> run(StrategyContext context) throws FetchException {
        List<StrategySignal> out = new ArrayList<>();
        for (JSONObject stock : context.pool(PoolType.STRONG)) {
            String code = FieldExtractor.text(stock, "dm");
            double volumeRatio = FieldExtractor.numberOr(stock, 0, "lb");
            double changePct = FieldExtractor.numberOr(stock, 0, "zf");
            boolean newHigh = FieldExtractor.numberOr(stock, 0, "nh") == 1.0;
            double speed = FieldExtractor.numberOr(stock, 0, "zs");
            if (code.isEmpty() || volumeRatio < MIN_VOLUME_RATIO) {
                continue;
            }
            if (changePct < MIN_CHANGE_PCT || changePct > MAX_CHANGE_PCT) {
                continue;
            }
            double score = Math.min(volumeRatio * 8.0, 40.0)
                    + Math.min((changePct - MIN_CHANGE_PCT) / 4.5 * 30.0, 30.0)
                    + (newHigh ? 20.0 : 0.0)
                    + Math.min(speed * 2.0, 10.0);
            score = Math.round(Math.max(0.0, Math.min(100.0, score)) * 10.0) / 10.0;

            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("price", FieldExtractor.numberOr(stock, 0, "p"));
            extra.put("limit_price", FieldExtractor.numberOr(stock, 0, "ztp"));
            extra.put("volume_ratio", volumeRatio);
            String reason = String.format(Locale.ROOT, "volume_ratio=%.1f change=%.1f%%%s speed=%.1f%%",
                    volumeRatio, changePct, newHigh ? " new_high" : "", speed);
            out.add(context.signal(code, FieldExtractor.text(stock, "mc"), score, reason, extra));
        }
        out.sort(Comparator.comparingDouble((StrategySignal s) -> s.score).reversed());
        return out;
    }
}
