package com.tidewatch.guard;

import com.tidewatch.config.Config;
import com.tidewatch.core.error.FetchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Second-stage gate for provisional entries.
 * <p>
 * Rules are checked in order and the first match wins. Each rule needs its own snapshot fields; when a
 * rule is reached and one of them is missing the verdict is {@code block(data_unavailable)}. Failing to
 * fetch the snapshot at all, or fetching it too slowly, also blocks.
 */
public final class MarketGuard implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(MarketGuard.class);

    private final AggregateStatsSource source;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Clock clock;
    private final long timeoutMs;
    private final double indexDrawdownBlockPct;
    private final int limitDownBlock;
    private final double downUpRatioBlock;
    private final double brokenRateDowngradePct;
    private final int limitDownDowngrade;

    public MarketGuard(AggregateStatsSource source, Config config, Clock clock) {
        this(source, config, clock, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "market-guard");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public MarketGuard(AggregateStatsSource source, Config config, Clock clock, ExecutorService executor) {
        this(source, config, clock, executor, false);
    }

    private MarketGuard(
            AggregateStatsSource source,
            Config config,
            Clock clock,
            ExecutorService executor,
            boolean ownsExecutor
    ) {
        this.source = Objects.requireNonNull(source, "source");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
        this.timeoutMs = Math.max(1L, config.getLong("guard.timeout_ms", 5000L));
        this.indexDrawdownBlockPct = config.getDouble("guard.index_drawdown_block_pct", 3.0);
        this.limitDownBlock = config.getInt("guard.limit_down_block", 200);
        this.downUpRatioBlock = config.getDouble("guard.down_up_ratio_block", 3.0);
        this.brokenRateDowngradePct = config.getDouble("guard.broken_rate_downgrade_pct", 50.0);
        this.limitDownDowngrade = config.getInt("guard.limit_down_downgrade", 50);
    }

    /**
     * Fetches a fresh snapshot within the configured timeout and evaluates it.
     */
    public GuardVerdict confirm() {
        Future<MarketSnapshot> future = executor.submit(source::fetchAggregateStats);
        MarketSnapshot snapshot;
        try {
            snapshot = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Market snapshot fetch timed out after {} ms", timeoutMs);
            return GuardVerdict.block(GuardVerdict.REASON_DATA_UNAVAILABLE, now());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Market snapshot fetch interrupted");
            return GuardVerdict.block(GuardVerdict.REASON_DATA_UNAVAILABLE, now());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof FetchException) {
                FetchException fe = (FetchException) cause;
                LOG.warn("Market snapshot fetch failed. cause={}, message={}", fe.causeCode().label(), fe.getMessage());
            } else {
                LOG.error("Market snapshot fetch crashed", cause);
            }
            return GuardVerdict.block(GuardVerdict.REASON_DATA_UNAVAILABLE, now());
        }
        GuardVerdict verdict = checkGuard(snapshot);
        LOG.info("Guard verdict. verdict={}, snapshot={}", verdict, snapshot);
        return verdict;
    }

    public GuardVerdict checkGuard(MarketSnapshot snapshot) {
        Instant at = now();
        if (snapshot == null) {
            return GuardVerdict.block(GuardVerdict.REASON_DATA_UNAVAILABLE, at);
        }

        if (snapshot.indexDrawdownPct == null) {
            return GuardVerdict.block(GuardVerdict.REASON_DATA_UNAVAILABLE, at);
        }
        if (snapshot.indexDrawdownPct > indexDrawdownBlockPct) {
            return GuardVerdict.block("index_drawdown", at);
        }

        if (snapshot.limitDownCount == null) {
            return GuardVerdict.block(GuardVerdict.REASON_DATA_UNAVAILABLE, at);
        }
        if (snapshot.limitDownCount > limitDownBlock) {
            return GuardVerdict.block("mass_limit_down", at);
        }

        if (snapshot.upCount == null || snapshot.downCount == null) {
            return GuardVerdict.block(GuardVerdict.REASON_DATA_UNAVAILABLE, at);
        }
        if (snapshot.downCount > downUpRatioBlock * snapshot.upCount) {
            return GuardVerdict.block("breadth_skew", at);
        }

        if (snapshot.brokenBoardRate == null) {
            return GuardVerdict.block(GuardVerdict.REASON_DATA_UNAVAILABLE, at);
        }
        if (snapshot.brokenBoardRate > brokenRateDowngradePct) {
            return GuardVerdict.downgrade("high_broken_rate", at);
        }

        if (snapshot.limitDownCount > limitDownDowngrade) {
            return GuardVerdict.downgrade("elevated_limit_down", at);
        }
        return GuardVerdict.pass(at);
    }

    private Instant now() {
        return clock.instant();
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }
}
