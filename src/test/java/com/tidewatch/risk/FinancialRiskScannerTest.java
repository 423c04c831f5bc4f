package com.tidewatch.risk;

import com.tidewatch.config.Config;
import com.tidewatch.core.error.DataUnavailableException;
import com.tidewatch.core.error.ScanInProgressException;
import com.tidewatch.core.error.StoreException;
import com.tidewatch.testsupport.FakeFinancialSource;
import com.tidewatch.testsupport.InMemoryRiskRecordStore;
import com.tidewatch.testsupport.MutableClock;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FinancialRiskScannerTest {
    private final MutableClock clock = MutableClock.at(LocalDateTime.of(2026, 1, 5, 16, 0));
    private final Config config = Config.of(Map.of("risk.scan.batch_delay_ms", "0", "risk.scan.batch_size", "3"));
    private final FakeFinancialSource source = new FakeFinancialSource();
    private final InMemoryRiskRecordStore store = new InMemoryRiskRecordStore();
    private final FinancialRiskScanner scanner = new FinancialRiskScanner(source, store, config, clock);

    @Test
    void fullScanFlagsLowRevenueAndMeasuresLossRuns() throws Exception {
        source.latest("600001.SH", 2.5e8, -1e6).profits("600001.SH", -1e8, -2e8, -3e8)
                .latest("600002.SH", 2.5e8, 1e6)
                .latest("300001.SZ", 5e7, 5e6).profits("300001.SZ", -1e6, 2e6, -3e6)
                .latest("688001.SH", 2e8, -9e7)
                .latest("830001.BJ", null, -1e6)
                .failLatest("600004.SH");
        List<Listing> universe = List.of(
                new Listing("600001.SH", "Alpha"),
                new Listing("600002.SH", "Beta"),
                new Listing("300001.SZ", "Gamma"),
                new Listing("688001.SH", "Delta"),
                new Listing("600003.SH", "NoData"),
                new Listing("600004.SH", "Broken"),
                new Listing("830001.BJ", "Unknown"));

        ScanStats stats = scanner.scan(universe);

        assertEquals(7, stats.total);
        assertEquals(7, stats.scanned);
        assertEquals(2, stats.flagged);
        assertEquals(1, stats.extreme);
        assertEquals(1, stats.errors);
        assertEquals(1, stats.skippedNoData);
        assertEquals(LocalDate.of(2026, 1, 5), stats.scanDate);
        assertTrue(stats.scanCycle.matches("20260105T160000-[0-9a-f]{8}"), stats.scanCycle);
        assertEquals(stats.scanCycle, store.currentCycle());

        RiskRecord alpha = store.findByCodePrefix("600001").orElseThrow();
        assertEquals(RiskType.BOTH, alpha.riskType);
        assertEquals(RiskLevel.EXTREME, alpha.riskLevel);
        assertTrue(alpha.extreme);
        assertEquals(3, alpha.consecutiveLossYears);
        assertEquals(6e8, alpha.cumulativeLoss, 1e-3);
        assertEquals(Board.MAIN, alpha.board);

        RiskRecord gamma = store.findByCodePrefix("300001").orElseThrow();
        assertEquals(RiskType.LOW_REVENUE, gamma.riskType);
        assertEquals(RiskLevel.HIGH, gamma.riskLevel);
        assertFalse(gamma.extreme);
        assertEquals(1, gamma.consecutiveLossYears);
        assertEquals(Board.CHINEXT, gamma.board);

        JSONObject json = stats.toJson();
        assertEquals(1, json.getInt("skipped_no_data"));
        assertEquals("2026-01-05", json.getString("scan_date"));
    }

    @Test
    void profitHistoryFailureKeepsThePassOneFlag() throws Exception {
        source.latest("600005.SH", 1e8, -5e7).failHistory("600005.SH");

        ScanStats stats = scanner.scan(List.of(new Listing("600005.SH", "Epsilon")));

        assertEquals(1, stats.flagged);
        assertEquals(1, stats.errors);
        RiskRecord record = store.findByCodePrefix("600005").orElseThrow();
        assertEquals(0, record.consecutiveLossYears);
        assertEquals(RiskType.LOW_REVENUE, record.riskType);
        assertEquals(RiskLevel.HIGH, record.riskLevel);
    }

    @Test
    void newCycleReplacesThePreviousOne() throws Exception {
        source.latest("600001.SH", 2.5e8, -1e6);
        scanner.scan(List.of(new Listing("600001.SH", "Alpha")));
        assertTrue(scanner.riskCheck("600001").hasRisk());

        source.latest("600001.SH", 9e8, 1e7).latest("600006.SH", 1e8, -1e7);
        scanner.scan(List.of(new Listing("600001.SH", "Alpha"), new Listing("600006.SH", "Zeta")));

        assertFalse(scanner.riskCheck("600001").hasRisk());
        assertTrue(scanner.riskCheck("600006").hasRisk());
        assertEquals(1, scanner.riskList().size());
    }

    @Test
    void lowRevenueRuleDependsOnBoard() {
        assertTrue(scanner.isLowRevenue(Board.MAIN, new LatestMetrics("2025-12-31", 2.5e8, -1e6)));
        assertFalse(scanner.isLowRevenue(Board.MAIN, new LatestMetrics("2025-12-31", 2.5e8, 1e6)));
        assertFalse(scanner.isLowRevenue(Board.MAIN, new LatestMetrics("2025-12-31", 2.5e8, null)));
        assertFalse(scanner.isLowRevenue(Board.MAIN, new LatestMetrics("2025-12-31", 3e8, -1e6)));
        assertTrue(scanner.isLowRevenue(Board.CHINEXT, new LatestMetrics("2025-12-31", 9.9e7, 1e7)));
        assertFalse(scanner.isLowRevenue(Board.STAR, new LatestMetrics("2025-12-31", 1e8, -1e7)));
        assertFalse(scanner.isLowRevenue(Board.BSE, new LatestMetrics("2025-12-31", null, -1e7)));
    }

    @Test
    void zeroRevenueFlagsEverywhereAndNegativeRevenueNever() {
        assertTrue(scanner.isLowRevenue(Board.MAIN, new LatestMetrics("2025-12-31", 0.0, 1e6)));
        assertTrue(scanner.isLowRevenue(Board.STAR, new LatestMetrics("2025-12-31", 0.0, null)));
        assertFalse(scanner.isLowRevenue(Board.MAIN, new LatestMetrics("2025-12-31", -1e6, -1e6)));
        assertFalse(scanner.isLowRevenue(Board.CHINEXT, new LatestMetrics("2025-12-31", -5e6, 1e6)));
    }

    @Test
    void lossRunAloneIsAConsecutiveLossRisk() throws Exception {
        source.latest("600010.SH", 9e8, -2e8).profits("600010.SH", -1e8, -1.5e8, -2e8)
                .latest("600011.SH", 9e8, -1e7).profits("600011.SH", -1e7, -1e7)
                .latest("600012.SH", 9e8, 5e7).profits("600012.SH", -3e8, -3e8, 5e7);

        ScanStats stats = scanner.scan(List.of(
                new Listing("600010.SH", "Iota"),
                new Listing("600011.SH", "Kappa"),
                new Listing("600012.SH", "Lambda")));

        assertEquals(1, stats.flagged);
        assertEquals(0, stats.extreme);
        RiskRecord iota = store.findByCodePrefix("600010").orElseThrow();
        assertEquals(RiskType.CONSECUTIVE_LOSS, iota.riskType);
        assertEquals(RiskLevel.HIGH, iota.riskLevel);
        assertFalse(iota.extreme);
        assertEquals(3, iota.consecutiveLossYears);
        assertEquals(4.5e8, iota.cumulativeLoss, 1e-3);
        assertFalse(iota.reason.contains("revenue"), iota.reason);
        assertFalse(scanner.riskCheck("600011").hasRisk());
        assertFalse(scanner.riskCheck("600012").hasRisk());
    }

    @Test
    void failedScanKeepsThePreviousCycle() throws Exception {
        store.replaceCycle("c0", List.of(record("600001.SH", true)));
        source.failLatest("600001.SH").failLatest("600002.SH");

        assertThrows(DataUnavailableException.class, () -> scanner.scan(List.of(
                new Listing("600001.SH", "Alpha"), new Listing("600002.SH", "Beta"))));

        assertEquals("c0", store.currentCycle());
        assertEquals(1, store.replaceCalls());
        assertTrue(scanner.riskCheck("600001").hasRisk());
        assertFalse(scanner.isScanning());
    }

    @Test
    void scanIsRefusedAboveTheErrorRatio() throws Exception {
        store.replaceCycle("c0", List.of(record("000004.SZ", false)));
        source.latest("600001.SH", 2.5e8, -1e6).failLatest("600002.SH").failLatest("600003.SH");

        assertThrows(DataUnavailableException.class, () -> scanner.scan(List.of(
                new Listing("600001.SH", "Alpha"), new Listing("600002.SH", "Beta"), new Listing("600003.SH", "Gamma"))));
        assertEquals("c0", store.currentCycle());

        FinancialRiskScanner tolerant = new FinancialRiskScanner(source, store, Config.of(Map.of(
                "risk.scan.batch_delay_ms", "0", "risk.scan.max_error_ratio", "0.7")), clock);
        ScanStats stats = tolerant.scan(List.of(
                new Listing("600001.SH", "Alpha"), new Listing("600002.SH", "Beta"), new Listing("600003.SH", "Gamma")));
        assertEquals(2, stats.errors);
        assertEquals(stats.scanCycle, store.currentCycle());
    }

    @Test
    void emptyUniverseIsRefused() throws Exception {
        store.replaceCycle("c0", List.of(record("000004.SZ", false)));

        assertThrows(DataUnavailableException.class, () -> scanner.scan(List.of()));
        assertEquals("c0", store.currentCycle());
    }

    @Test
    void trailingLossRunStopsAtFirstProfitOrGap() {
        FinancialRiskScanner.LossRun threeLosses = FinancialRiskScanner.trailingLossRun(
                points(-1.0, -2.0, -3.0), 3);
        assertEquals(3, threeLosses.years);
        assertEquals(6.0, threeLosses.cumulativeLoss, 1e-9);

        assertEquals(1, FinancialRiskScanner.trailingLossRun(points(-1.0, 2.0, -3.0), 3).years);
        assertEquals(0, FinancialRiskScanner.trailingLossRun(points(-1.0, -2.0, null), 3).years);
        assertEquals(1, FinancialRiskScanner.trailingLossRun(points(-1.0, null, -3.0), 3).years);
        assertEquals(3, FinancialRiskScanner.trailingLossRun(points(-1.0, -1.0, -1.0, -1.0, -1.0), 3).years);
        assertEquals(0, FinancialRiskScanner.trailingLossRun(List.of(), 3).years);
    }

    @Test
    void trailingLossRunSortsByPeriod() {
        List<ProfitPoint> shuffled = new ArrayList<>(points(5.0, -2.0, -3.0));
        Collections.reverse(shuffled);

        assertEquals(2, FinancialRiskScanner.trailingLossRun(shuffled, 3).years);
    }

    @Test
    void bothRequiresTwoLossYearsAndCumulativeLossAboveThreshold() {
        FinancialRiskScanner.Screened screened = new FinancialRiskScanner.Screened(
                new Listing("600007.SH", "Eta"), Board.MAIN, new LatestMetrics("2025-12-31", 1e8, -1e8), false, true);
        LocalDate date = LocalDate.of(2026, 1, 5);

        RiskRecord small = scanner.toRecord(screened, new FinancialRiskScanner.LossRun(2, 2e8), date, "c1");
        assertEquals(RiskType.LOW_REVENUE, small.riskType);
        assertEquals(RiskLevel.HIGH, small.riskLevel);

        RiskRecord large = scanner.toRecord(screened, new FinancialRiskScanner.LossRun(2, 3.5e8), date, "c1");
        assertEquals(RiskType.BOTH, large.riskType);
        assertFalse(large.extreme);

        RiskRecord exact = scanner.toRecord(screened, new FinancialRiskScanner.LossRun(2, 3e8), date, "c1");
        assertEquals(RiskType.LOW_REVENUE, exact.riskType);

        FinancialRiskScanner.Screened healthyRevenue = new FinancialRiskScanner.Screened(
                new Listing("600008.SH", "Theta"), Board.MAIN, new LatestMetrics("2025-12-31", 9e8, -2e8), false, false);
        RiskRecord lossOnly = scanner.toRecord(healthyRevenue, new FinancialRiskScanner.LossRun(3, 6e8), date, "c1");
        assertEquals(RiskType.CONSECUTIVE_LOSS, lossOnly.riskType);
        assertEquals(RiskLevel.HIGH, lossOnly.riskLevel);
        assertFalse(lossOnly.extreme);
        assertNull(scanner.toRecord(healthyRevenue, new FinancialRiskScanner.LossRun(2, 3e8), date, "c1"));
    }

    @Test
    void riskCheckNormalizesAndMatchesByPrefix() throws Exception {
        store.replaceCycle("c1", List.of(record("000004.SZ", true)));

        RiskCheckResult byPure = scanner.riskCheck("000004");
        assertTrue(byPure.hasRisk());
        assertEquals("000004.SZ", byPure.record.code);

        RiskCheckResult byPrefixed = scanner.riskCheck("sz000004");
        assertEquals("000004.SZ", byPrefixed.code);
        assertTrue(byPrefixed.hasRisk());

        JSONObject json = byPure.toJson();
        assertTrue(json.getBoolean("has_risk"));
        assertEquals("extreme", json.getString("risk_level"));
    }

    @Test
    void cleanCodeReportsNoRisk() {
        RiskCheckResult result = scanner.riskCheck("600519");

        assertFalse(result.hasRisk());
        assertNull(result.record);
        assertFalse(result.toJson().has("risk_type"));
    }

    @Test
    void invalidCodeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> scanner.riskCheck("000004'; drop table x"));
        assertThrows(IllegalArgumentException.class, () -> scanner.riskCheck(""));
        assertThrows(IllegalArgumentException.class, () -> scanner.riskCheck("0000000000000000000"));
    }

    @Test
    void sanitizeCodeRewritesExchangePrefix() {
        assertEquals("000001.SZ", FinancialRiskScanner.sanitizeCode(" sz000001 "));
        assertEquals("600519.SH", FinancialRiskScanner.sanitizeCode("SH600519"));
        assertEquals("600519", FinancialRiskScanner.sanitizeCode("600519"));
        assertEquals("000001.SZ", FinancialRiskScanner.sanitizeCode("000001.sz"));
    }

    @Test
    void batchAndSummaryOnlyCountFlaggedCodes() throws Exception {
        store.replaceCycle("c1", List.of(record("000004.SZ", true), record("300100.SZ", false)));

        Map<String, RiskRecord> batch = scanner.riskCheckBatch(Arrays.asList("000004", "600519", "300100"));
        assertEquals(List.of("000004", "300100"), new ArrayList<>(batch.keySet()));

        RiskSummary summary = scanner.riskSummary();
        assertEquals(2, summary.total);
        assertEquals(1, summary.extremeCount);
        assertTrue(summary.codes.contains("300100.SZ"));
    }

    @Test
    void concurrentScanIsRejected() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        source.latest("600001.SH", 2.5e8, -1e6).blockOn(gate);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread first = new Thread(() -> {
            try {
                scanner.scan(List.of(new Listing("600001.SH", "Alpha")));
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        first.start();
        try {
            assertTrue(source.awaitEntered(5_000));
            assertTrue(scanner.isScanning());
            assertThrows(ScanInProgressException.class, () -> scanner.scan(List.of()));
        } finally {
            gate.countDown();
            first.join(10_000);
        }

        assertNull(failure.get());
        assertFalse(scanner.isScanning());
        assertEquals(1, store.replaceCalls());
    }

    @Test
    void storeFailureSurfacesAsStoreException() {
        InMemoryRiskRecordStore failing = new InMemoryRiskRecordStore().failWrites();
        FinancialRiskScanner broken = new FinancialRiskScanner(source, failing, config, clock);

        assertThrows(StoreException.class, () -> broken.scan(List.of(new Listing("600002.SH", "Beta"))));
        assertFalse(broken.isScanning());
    }

    private static List<ProfitPoint> points(Double... profits) {
        List<ProfitPoint> out = new ArrayList<>();
        int year = 2025 - profits.length + 1;
        for (Double profit : profits) {
            out.add(new ProfitPoint(year + "-12-31", profit));
            year++;
        }
        return out;
    }

    private static RiskRecord record(String code, boolean extreme) {
        return new RiskRecord(code, "name", Board.detect(code), extreme ? RiskType.BOTH : RiskType.LOW_REVENUE,
                extreme ? RiskLevel.EXTREME : RiskLevel.HIGH, "test", 1e8, -1e8, extreme ? 3 : 0,
                extreme ? 5e8 : 0.0, extreme, LocalDate.of(2026, 1, 5), "c1");
    }
}
