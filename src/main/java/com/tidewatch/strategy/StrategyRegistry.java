package com.tidewatch.strategy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of strategies, assembled explicitly at startup.
 */
public final class StrategyRegistry {
    private static final Logger LOG = LogManager.getLogger(StrategyRegistry.class);

    private final Map<String, Strategy> strategies;

    private StrategyRegistry(Map<String, Strategy> strategies) {
        this.strategies = Collections.unmodifiableMap(strategies);
    }

    public static StrategyRegistry of(Strategy... strategies) {
        Builder builder = builder();
        for (Strategy strategy : strategies) {
            builder.register(strategy);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Strategy> get(String name) {
        return Optional.ofNullable(strategies.get(name));
    }

    public List<Strategy> all() {
        return new ArrayList<>(strategies.values());
    }

    public List<Strategy> enabled() {
        List<Strategy> out = new ArrayList<>();
        for (Strategy strategy : strategies.values()) {
            if (strategy.enabled()) {
                out.add(strategy);
            }
        }
        return out;
    }

    public List<Strategy> scheduled() {
        List<Strategy> out = new ArrayList<>();
        for (Strategy strategy : enabled()) {
            if (strategy.schedule().isPresent()) {
                out.add(strategy);
            }
        }
        return out;
    }

    public List<String> names() {
        return new ArrayList<>(strategies.keySet());
    }

    public static final class Builder {
        private final Map<String, Strategy> strategies = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException when the name is blank or already registered
         */
        public Builder register(Strategy strategy) {
            String name = strategy.name() == null ? "" : strategy.name().trim();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("strategy name must not be blank: " + strategy.getClass().getName());
            }
            if (strategies.containsKey(name)) {
                throw new IllegalArgumentException("duplicate strategy name: " + name);
            }
            strategies.put(name, strategy);
            LOG.info("Strategy registered: {} (schedule: {})", name,
                    strategy.schedule().map(Object::toString).orElse("manual"));
            return this;
        }

        public StrategyRegistry build() {
            return new StrategyRegistry(new LinkedHashMap<>(strategies));
        }
    }
}
