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
 * Limit-up chains: at least two consecutive boards with more than 50 million in seal funds.
 * <p>
 * Score: consecutive boards (up to 60) plus seal funds (up to 30) minus a broken-board penalty (up to 10).
 */
public final class LimitUpBoardStrategy implements Strategy {
    public static final String NAME = "limit_up_board";
    static final int MIN_BOARDS = 2;
    static final double MIN_SEAL_FUNDS = 5e7;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<LocalTime> schedule() {
        return Optional.of(LocalTime.of(14, 50));
    }

    @Override
    public String description() {
        return "limit-up pool stocks with >= 2 consecutive boards and seal funds > 50M";
    }

    @Override
    public List<StrategySignal> run(StrategyContext context) throws FetchException {
        List<StrategySignal> out = new ArrayList<>();
        for (JSONObject stock : context.pool(PoolType.LIMIT_UP)) {
            String code = FieldExtractor.text(stock, "dm");
            int boards = (int) FieldExtractor.numberOr(stock, 0, "lbc");
            double sealFunds = FieldExtractor.numberOr(stock, 0, "zj");
            int brokenTimes = (int) FieldExtractor.numberOr(stock, 0, "zbc");
            if (code.isEmpty() || boards < MIN_BOARDS || sealFunds <= MIN_SEAL_FUNDS) {
                continue;
            }
            double score = Math.min(boards * 20.0, 60.0)
                    + Math.min(sealFunds / 1e8 * 30.0, 30.0)
                    - Math.min(brokenTimes * 5.0, 10.0);
            score = Math.round(Math.max(0.0, Math.min(100.0, score)) * 10.0) / 10.0;

            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("price", FieldExtractor.numberOr(stock, 0, "p"));
            extra.put("turnover", FieldExtractor.numberOr(stock, 0, "hs"));
            extra.put("first_limit_time", FieldExtractor.text(stock, "fbt"));
            extra.put("last_limit_time", FieldExtractor.text(stock, "lbt"));
            String reason = String.format(Locale.ROOT, "%s boards=%d seal_funds=%.1fx1e8 broken=%d",
                    FieldExtractor.text(stock, "tj"), boards, sealFunds / 1e8, brokenTimes).trim();
            out.add(context.signal(code, FieldExtractor.text(stock, "mc"), score, reason, extra));
        }
        out.sort(Comparator.comparingDouble((StrategySignal s) -> s.score).reversed());
        return out;
    }
}
