package com.tidewatch.strategy;

import com.tidewatch.core.error.FetchException;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * A stock-picking rule run over one trading day's data.
 */
public interface Strategy {

    /**
     * Unique registry key.
     */
    String name();

    /**
     * Daily run time, or empty for manual-only strategies.
     */
    Optional<LocalTime> schedule();

    String description();

    default boolean enabled() {
        return true;
    }

    /**
     * Signals ordered best first.
     */
    List<StrategySignal> run(StrategyContext context) throws FetchException;
}
