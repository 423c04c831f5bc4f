package com.tidewatch.risk;

import com.tidewatch.config.Config;
import com.tidewatch.core.error.DataUnavailableException;
import com.tidewatch.core.error.FetchException;
import com.tidewatch.core.error.ScanInProgressException;
import com.tidewatch.core.error.StoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Two-pass financial risk scan over the listed universe.
 * <p>
 * Pass 1 screens every listing on its latest revenue and net profit with a board-dependent revenue
 * threshold. Pass 2 pulls the profit history of every low-revenue or loss-making listing and measures
 * the trailing loss run. The finished cycle replaces the previous one in the {@link RiskRecordStore},
 * unless too many pass-1 fetches failed, in which case the previous cycle stays current.
 */
public final class FinancialRiskScanner {
    private static final Logger LOG = LogManager.getLogger(FinancialRiskScanner.class);
    private static final Pattern CODE_PATTERN = Pattern.compile("[0-9A-Z.]{1,16}");
    private static final DateTimeFormatter CYCLE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final int MAX_ERROR_LOGS = 10;

    private final FinancialMetricsSource source;
    private final RiskRecordStore store;
    private final Clock clock;
    private final ZoneId zone;
    private final ReentrantLock scanLock = new ReentrantLock();

    private final double revenueThresholdMain;
    private final double revenueThresholdSmall;
    private final double cumulativeLossThreshold;
    private final int historyYears;
    private final int extremeLossYears;
    private final int maxConcurrent;
    private final int batchSize;
    private final long batchDelayMs;
    private final int progressLogEvery;
    private final double maxErrorRatio;

    public FinancialRiskScanner(FinancialMetricsSource source, RiskRecordStore store, Config config, Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = config.getZone("app.zone");
        this.revenueThresholdMain = config.getDouble("risk.revenue_threshold_main", 3e8);
        this.revenueThresholdSmall = config.getDouble("risk.revenue_threshold_small", 1e8);
        this.cumulativeLossThreshold = config.getDouble("risk.cumulative_loss_threshold", 3e8);
        this.historyYears = Math.max(1, config.getInt("risk.history_years", 3));
        this.extremeLossYears = Math.max(1, config.getInt("risk.extreme_loss_years", 3));
        this.maxConcurrent = Math.max(1, Math.min(10, config.getInt("risk.scan.max_concurrent", 10)));
        this.batchSize = Math.max(1, config.getInt("risk.scan.batch_size", 30));
        this.batchDelayMs = Math.max(0L, config.getLong("risk.scan.batch_delay_ms", 500L));
        this.progressLogEvery = Math.max(0, config.getInt("risk.scan.progress_log_every", 500));
        this.maxErrorRatio = Math.max(0.0, Math.min(1.0, config.getDouble("risk.scan.max_error_ratio", 0.5)));
    }

    /**
     * Runs a full scan cycle.
     *
     * @throws ScanInProgressException when another scan is still running
     * @throws DataUnavailableException when the universe is empty or pass 1 failed for too many listings;
     *                                  the previous cycle is left untouched
     */
    public ScanStats scan(List<Listing> universe) throws InterruptedException {
        if (!scanLock.tryLock()) {
            throw new ScanInProgressException("financial risk scan already running");
        }
        try {
            return runScan(universe == null ? List.of() : universe);
        } finally {
            scanLock.unlock();
        }
    }

    public boolean isScanning() {
        return scanLock.isLocked();
    }

    private ScanStats runScan(List<Listing> universe) throws InterruptedException {
        long started = System.nanoTime();
        LocalDateTime now = LocalDateTime.now(clock.withZone(zone));
        LocalDate scanDate = now.toLocalDate();
        String scanCycle = now.format(CYCLE_FORMAT) + "-" + UUID.randomUUID().toString().substring(0, 8);
        int total = universe.size();
        if (total == 0) {
            throw new DataUnavailableException("listing universe is empty, keeping previous risk cycle");
        }
        LOG.info("Financial risk scan started. cycle={}, listings={}", scanCycle, total);

        Counters counters = new Counters();
        List<Screened> flagged = new ArrayList<>();
        List<RiskRecord> records = new ArrayList<>();

        ExecutorService pool = Executors.newFixedThreadPool(maxConcurrent);
        try {
            List<List<Listing>> batches = partition(universe, batchSize);
            for (int b = 0; b < batches.size(); b++) {
                List<Listing> batch = batches.get(b);
                int before = counters.scanned;
                List<Callable<Screened>> tasks = new ArrayList<>(batch.size());
                for (Listing listing : batch) {
                    tasks.add(() -> screen(listing));
                }
                for (Screened result : runBatch(pool, tasks, counters, "screen")) {
                    counters.scanned++;
                    if (result.noData) {
                        counters.skippedNoData++;
                    } else if (result.needsHistory()) {
                        flagged.add(result);
                    }
                }
                if (progressLogEvery > 0 && counters.scanned / progressLogEvery > before / progressLogEvery) {
                    LOG.info("Scan progress: {}/{} (flagged: {}, errors: {})",
                            counters.scanned, total, flagged.size(), counters.errors());
                }
                pauseBetweenBatches(b, batches.size());
            }
            LOG.info("Pass 1 complete. scanned={}, candidates={}, errors={}", counters.scanned, flagged.size(), counters.errors());
            refuseIfDegraded(scanCycle, counters);

            List<List<Screened>> deepBatches = partition(flagged, batchSize);
            for (int b = 0; b < deepBatches.size(); b++) {
                List<Callable<RiskRecord>> tasks = new ArrayList<>();
                for (Screened screened : deepBatches.get(b)) {
                    tasks.add(() -> deepScan(screened, scanDate, scanCycle, counters));
                }
                records.addAll(runBatch(pool, tasks, counters, "deep"));
                pauseBetweenBatches(b, deepBatches.size());
            }
        } finally {
            pool.shutdown();
        }

        int extreme = 0;
        for (RiskRecord record : records) {
            if (record.extreme) {
                extreme++;
            }
        }
        try {
            store.replaceCycle(scanCycle, records);
        } catch (SQLException e) {
            throw new StoreException("failed to persist risk cycle " + scanCycle, e);
        }

        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        ScanStats stats = new ScanStats(scanDate, scanCycle, total, counters.scanned, records.size(), extreme,
                counters.errors(), counters.skippedNoData, elapsedMs);
        LOG.info("Financial risk scan finished: {}", stats);
        return stats;
    }

    private <T> List<T> runBatch(ExecutorService pool, List<Callable<T>> tasks, Counters counters, String stage)
            throws InterruptedException {
        CompletionService<T> completion = new ExecutorCompletionService<>(pool);
        for (Callable<T> task : tasks) {
            completion.submit(task);
        }
        List<T> out = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            Future<T> future = completion.take();
            try {
                T value = future.get();
                if (value != null) {
                    out.add(value);
                }
            } catch (ExecutionException e) {
                int errors = counters.recordError();
                if (errors <= MAX_ERROR_LOGS) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("Stage[{}] failed: {}", stage, cause.getMessage());
                }
                if (stage.equals("screen")) {
                    counters.scanned++;
                    counters.screenErrors++;
                }
            }
        }
        return out;
    }

    /**
     * Pass 1 failures count against the ratio; pass 2 failures only lose loss-run detail.
     */
    private void refuseIfDegraded(String scanCycle, Counters counters) {
        int failed = counters.screenErrors;
        if (failed == 0) {
            return;
        }
        double ratio = (double) failed / counters.scanned;
        if (failed == counters.scanned || ratio > maxErrorRatio) {
            LOG.error("Financial risk scan aborted. cycle={}, failed={}/{}, max_error_ratio={}",
                    scanCycle, failed, counters.scanned, maxErrorRatio);
            throw new DataUnavailableException(String.format(Locale.ROOT,
                    "financial data fetch failed for %d of %d listings, keeping previous risk cycle",
                    failed, counters.scanned));
        }
    }

    private Screened screen(Listing listing) throws FetchException {
        Optional<LatestMetrics> fetched;
        try {
            fetched = source.fetchLatestMetrics(listing.code);
        } catch (FetchException e) {
            throw new FetchException(e.causeCode(), listing + ": " + e.getMessage(), e);
        }
        Board board = Board.detect(listing.code);
        if (fetched.isEmpty()) {
            return Screened.noData(listing, board);
        }
        LatestMetrics metrics = fetched.get();
        return new Screened(listing, board, metrics, false, isLowRevenue(board, metrics));
    }

    /**
     * Zero revenue flags on any board. Otherwise, main board: positive revenue below the main threshold
     * and a net loss; other boards: positive revenue below the small threshold. Negative or unknown
     * revenue never flags.
     */
    boolean isLowRevenue(Board board, LatestMetrics metrics) {
        if (metrics == null || metrics.revenue == null || metrics.revenue < 0) {
            return false;
        }
        double revenue = metrics.revenue;
        if (revenue == 0) {
            return true;
        }
        if (board.isMain()) {
            return revenue < revenueThresholdMain && metrics.netProfit != null && metrics.netProfit < 0;
        }
        return revenue < revenueThresholdSmall;
    }

    private RiskRecord deepScan(Screened screened, LocalDate scanDate, String scanCycle, Counters counters) {
        LossRun run = LossRun.NONE;
        try {
            run = trailingLossRun(source.fetchProfitHistory(screened.listing.code, historyYears), historyYears);
        } catch (FetchException e) {
            int errors = counters.recordError();
            if (errors <= MAX_ERROR_LOGS) {
                LOG.warn("Profit history unavailable for {}, keeping pass-1 result: {}", screened.listing, e.getMessage());
            }
        }
        return toRecord(screened, run, scanDate, scanCycle);
    }

    /**
     * Combines the pass-1 revenue flag with the loss rule (two or more trailing loss years and a
     * cumulative loss above the threshold). Returns {@code null} when neither applies.
     */
    RiskRecord toRecord(Screened screened, LossRun run, LocalDate scanDate, String scanCycle) {
        boolean lossRule = run.years >= 2 && run.cumulativeLoss > cumulativeLossThreshold;
        if (!screened.lowRevenue && !lossRule) {
            return null;
        }
        boolean extreme = screened.lowRevenue && run.years >= extremeLossYears;
        RiskType type;
        if (screened.lowRevenue) {
            type = lossRule ? RiskType.BOTH : RiskType.LOW_REVENUE;
        } else {
            type = RiskType.CONSECUTIVE_LOSS;
        }

        List<String> reasons = new ArrayList<>();
        if (screened.lowRevenue) {
            reasons.add(revenueReason(screened.board, screened.metrics));
        }
        if (run.years > 0) {
            reasons.add(String.format(Locale.ROOT, "net loss for %d consecutive year(s), cumulative %.2f x1e8",
                    run.years, run.cumulativeLoss / 1e8));
        }
        return new RiskRecord(
                screened.listing.code,
                screened.listing.name,
                screened.board,
                type,
                extreme ? RiskLevel.EXTREME : RiskLevel.HIGH,
                String.join("; ", reasons),
                screened.metrics.revenue,
                screened.metrics.netProfit,
                run.years,
                run.cumulativeLoss,
                extreme,
                scanDate,
                scanCycle
        );
    }

    private String revenueReason(Board board, LatestMetrics metrics) {
        if (metrics.revenue == 0) {
            return board.code() + " board latest annual revenue is 0";
        }
        if (board.isMain()) {
            return String.format(Locale.ROOT, "%s board revenue %.2f x1e8 below %.0f x1e8 with net loss",
                    board.code(), metrics.revenue / 1e8, revenueThresholdMain / 1e8);
        }
        return String.format(Locale.ROOT, "%s board revenue %.4f x1e8 below %.0f x1e8",
                board.code(), metrics.revenue / 1e8, revenueThresholdSmall / 1e8);
    }

    /**
     * Trailing run of negative annual profits ending at the latest period. A missing value ends the run.
     */
    static LossRun trailingLossRun(List<ProfitPoint> history, int maxYears) {
        if (history == null || history.isEmpty()) {
            return LossRun.NONE;
        }
        List<ProfitPoint> sorted = new ArrayList<>(history);
        sorted.sort(Comparator.comparing(p -> p.period));
        int from = Math.max(0, sorted.size() - maxYears);
        List<ProfitPoint> window = sorted.subList(from, sorted.size());

        int years = 0;
        double cumulative = 0.0;
        for (int i = window.size() - 1; i >= 0; i--) {
            Double profit = window.get(i).netProfit;
            if (profit == null || profit >= 0) {
                break;
            }
            years++;
            cumulative += -profit;
        }
        return years == 0 ? LossRun.NONE : new LossRun(years, cumulative);
    }

    public RiskCheckResult riskCheck(String code) {
        String normalized = sanitizeCode(code);
        try {
            return store.findByCodePrefix(normalized)
                    .map(record -> RiskCheckResult.flagged(normalized, record))
                    .orElseGet(() -> RiskCheckResult.clean(normalized));
        } catch (SQLException e) {
            throw new StoreException("risk lookup failed for " + normalized, e);
        }
    }

    /**
     * Only codes that carry a risk are present in the result, keyed by the normalized input code.
     */
    public Map<String, RiskRecord> riskCheckBatch(Collection<String> codes) {
        Map<String, RiskRecord> out = new LinkedHashMap<>();
        if (codes == null) {
            return out;
        }
        for (String code : codes) {
            RiskCheckResult result = riskCheck(code);
            if (result.hasRisk()) {
                out.put(result.code, result.record);
            }
        }
        return out;
    }

    public List<RiskRecord> riskList() {
        try {
            return store.listCurrent();
        } catch (SQLException e) {
            throw new StoreException("failed to list risk records", e);
        }
    }

    public RiskSummary riskSummary() {
        List<RiskRecord> current = riskList();
        List<String> codes = new ArrayList<>(current.size());
        int extreme = 0;
        for (RiskRecord record : current) {
            codes.add(record.code);
            if (record.extreme) {
                extreme++;
            }
        }
        return new RiskSummary(current.size(), extreme, codes);
    }

    /**
     * Upper-cases the code and rewrites {@code SZ000001} into {@code 000001.SZ}.
     *
     * @throws IllegalArgumentException for anything but digits, letters and dots
     */
    static String sanitizeCode(String raw) {
        String s = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        if (!CODE_PATTERN.matcher(s).matches()) {
            throw new IllegalArgumentException("invalid security code: " + raw);
        }
        if (s.length() > 2 && (s.startsWith("SH") || s.startsWith("SZ") || s.startsWith("BJ"))
                && Character.isDigit(s.charAt(2))) {
            s = s.substring(2) + "." + s.substring(0, 2);
        }
        return s;
    }

    private void pauseBetweenBatches(int index, int count) throws InterruptedException {
        if (batchDelayMs > 0 && index < count - 1) {
            Thread.sleep(batchDelayMs);
        }
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            out.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return out;
    }

    static final class Screened {
        final Listing listing;
        final Board board;
        final LatestMetrics metrics;
        final boolean noData;
        final boolean lowRevenue;

        Screened(Listing listing, Board board, LatestMetrics metrics, boolean noData, boolean lowRevenue) {
            this.listing = listing;
            this.board = board;
            this.metrics = metrics;
            this.noData = noData;
            this.lowRevenue = lowRevenue;
        }

        static Screened noData(Listing listing, Board board) {
            return new Screened(listing, board, null, true, false);
        }

        boolean needsHistory() {
            return lowRevenue || (metrics != null && metrics.netProfit != null && metrics.netProfit < 0);
        }
    }

    static final class LossRun {
        static final LossRun NONE = new LossRun(0, 0.0);

        final int years;
        final double cumulativeLoss;

        LossRun(int years, double cumulativeLoss) {
            this.years = years;
            this.cumulativeLoss = cumulativeLoss;
        }
    }

    private static final class Counters {
        int scanned;
        int skippedNoData;
        int screenErrors;
        int errors;

        synchronized int recordError() {
            return ++errors;
        }

        synchronized int errors() {
            return errors;
        }
    }
}
