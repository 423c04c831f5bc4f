package com.tidewatch.guard;

import com.tidewatch.core.error.FetchException;

/**
 * Supplies the real-time market breadth snapshot consumed by {@link MarketGuard}.
 */
@FunctionalInterface
public interface AggregateStatsSource {

    MarketSnapshot fetchAggregateStats() throws FetchException;
}
