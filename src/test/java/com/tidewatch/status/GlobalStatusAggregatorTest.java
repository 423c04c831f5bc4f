package com.tidewatch.status;

import com.tidewatch.calendar.HolidayTableCalendar;
import com.tidewatch.calendar.SettlementCalendar;
import com.tidewatch.config.Config;
import com.tidewatch.data.MemoryCache;
import com.tidewatch.guard.MarketGuard;
import com.tidewatch.risk.Board;
import com.tidewatch.risk.FinancialRiskScanner;
import com.tidewatch.risk.RiskLevel;
import com.tidewatch.risk.RiskRecord;
import com.tidewatch.risk.RiskType;
import com.tidewatch.testsupport.FakeFinancialSource;
import com.tidewatch.testsupport.FakeStatsSource;
import com.tidewatch.testsupport.InMemoryRiskRecordStore;
import com.tidewatch.testsupport.MutableClock;
import com.tidewatch.timing.TimingFunnel;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlobalStatusAggregatorTest {
    private final MutableClock clock = MutableClock.at(LocalDateTime.of(2026, 1, 5, 10, 0));
    private final Config config = Config.of(Map.of());
    private final MarketGuard guard = new MarketGuard(new FakeStatsSource(FakeStatsSource.healthy()), config, clock);
    private final SettlementCalendar settlement =
            new SettlementCalendar(HolidayTableCalendar.fromClasspath("calendar/cn_holidays.properties"));
    private final InMemoryRiskRecordStore store = new InMemoryRiskRecordStore();
    private final GlobalStatusAggregator aggregator = new GlobalStatusAggregator(
            new TimingFunnel(settlement, guard, new MemoryCache(clock), config, clock),
            settlement,
            new FinancialRiskScanner(new FakeFinancialSource(), store, config, clock));

    @AfterEach
    void tearDown() {
        guard.close();
    }

    @Test
    void combinesTimingCalendarAndRiskSummary() throws Exception {
        store.replaceCycle("c1", List.of(
                record("000004.SZ", true),
                record("300100.SZ", false)));

        JSONObject json = aggregator.aggregate(LocalDate.of(2026, 1, 13)).toJson();

        assertEquals("probe_permitted", json.getJSONObject("timing").getString("action"));
        assertEquals("2026-01-16", json.getJSONObject("calendar").getString("futures_day"));
        assertTrue(json.getJSONObject("calendar").getBoolean("is_futures_week"));
        assertEquals(2, json.getInt("risk_stock_total"));
        assertEquals(1, json.getInt("risk_stock_extreme"));
        assertEquals("000004.SZ", json.getJSONArray("risk_codes").getString(0));
    }

    @Test
    void emptyRiskStoreReportsZero() {
        GlobalStatus status = aggregator.aggregate(LocalDate.of(2026, 1, 21));

        assertEquals(0, status.risk.total);
        assertTrue(status.risk.codes.isEmpty());
        assertFalse(status.calendar.futuresWeek);
        assertEquals("normal_trading", status.timing.action.code());
    }

    private static RiskRecord record(String code, boolean extreme) {
        return new RiskRecord(code, "name", Board.detect(code), extreme ? RiskType.BOTH : RiskType.LOW_REVENUE,
                extreme ? RiskLevel.EXTREME : RiskLevel.HIGH, "test", 5e7, -2e8, extreme ? 3 : 1,
                extreme ? 6e8 : 2e8, extreme, LocalDate.of(2026, 1, 5), "c1");
    }
}
