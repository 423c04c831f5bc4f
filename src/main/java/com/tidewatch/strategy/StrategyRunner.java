package com.tidewatch.strategy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs registered strategies and persists their signals. A failing strategy yields no signals and never
 * stops the others.
 */
public final class StrategyRunner {
    private static final Logger LOG = LogManager.getLogger(StrategyRunner.class);

    private final StrategyRegistry registry;
    private final PoolSource pools;
    private final SignalStore store;

    public StrategyRunner(StrategyRegistry registry, PoolSource pools, SignalStore store) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.pools = Objects.requireNonNull(pools, "pools");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @throws IllegalArgumentException when no strategy has that name
     */
    public List<StrategySignal> run(String name, LocalDate runDate) {
        Strategy strategy = registry.get(name).orElseThrow(() -> new IllegalArgumentException(
                "strategy '" + name + "' not found, registered: " + registry.names()));
        return run(strategy, runDate);
    }

    public Map<String, List<StrategySignal>> runAll(LocalDate runDate) {
        Map<String, List<StrategySignal>> out = new LinkedHashMap<>();
        for (Strategy strategy : registry.enabled()) {
            out.put(strategy.name(), run(strategy, runDate));
        }
        return out;
    }

    private List<StrategySignal> run(Strategy strategy, LocalDate runDate) {
        LOG.info("Strategy started: {} date={}", strategy.name(), runDate);
        List<StrategySignal> signals;
        try {
            signals = strategy.run(new StrategyContext(pools, runDate, strategy.name()));
        } catch (Exception e) {
            LOG.error("Strategy '{}' failed", strategy.name(), e);
            return List.of();
        }
        if (signals == null || signals.isEmpty()) {
            LOG.info("Strategy '{}' finished with no signals", strategy.name());
            return List.of();
        }
        try {
            store.saveSignals(signals);
        } catch (SQLException e) {
            LOG.error("Failed to persist {} signal(s) of strategy '{}'", signals.size(), strategy.name(), e);
        }
        LOG.info("Strategy '{}' finished with {} signal(s)", strategy.name(), signals.size());
        return signals;
    }
}
