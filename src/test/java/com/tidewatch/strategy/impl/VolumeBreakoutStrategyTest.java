package com.tidewatch.strategy.impl;

import com.tidewatch.strategy.StrategyContext;
import com.tidewatch.strategy.StrategySignal;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VolumeBreakoutStrategyTest {
    private final VolumeBreakoutStrategy strategy = new VolumeBreakoutStrategy();

    @Test
    void keepsHeavyVolumeMovesBelowTheLimit() throws Exception {
        JSONArray pool = new JSONArray()
                .put(row("000001", 6.0, 5.0, 0, 0.0))
                .put(row("000002", 3.0, 7.25, 1, 2.0))
                .put(row("000003", 1.5, 7.0, 1, 1.0))
                .put(row("000004", 4.0, 9.8, 0, 1.0))
                .put(row("000005", 4.0, 4.9, 0, 1.0));
        StrategyContext context = new StrategyContext((type, date) -> pool, LocalDate.of(2026, 1, 13), strategy.name());

        List<StrategySignal> signals = strategy.run(context);

        assertEquals(2, signals.size());
        assertEquals("000002", signals.get(0).code);
        assertEquals(63.0, signals.get(0).score, 1e-9);
        assertTrue(signals.get(0).reason.contains("new_high"), signals.get(0).reason);
        assertEquals("000001", signals.get(1).code);
        assertEquals(40.0, signals.get(1).score, 1e-9);
    }

    private static JSONObject row(String code, double volumeRatio, double changePct, int newHigh, double speed) {
        return new JSONObject()
                .put("dm", code)
                .put("mc", "name-" + code)
                .put("lb", volumeRatio)
                .put("zf", changePct)
                .put("nh", newHigh)
                .put("zs", speed);
    }
}
