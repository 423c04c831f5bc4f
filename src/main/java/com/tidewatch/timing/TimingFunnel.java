package com.tidewatch.timing;

import com.tidewatch.calendar.CycleType;
import com.tidewatch.calendar.SettlementCalendar;
import com.tidewatch.calendar.SettlementCycle;
import com.tidewatch.calendar.TradingCalendar;
import com.tidewatch.calendar.TradingDay;
import com.tidewatch.config.Config;
import com.tidewatch.data.MemoryCache;
import com.tidewatch.guard.GuardVerdict;
import com.tidewatch.guard.MarketGuard;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Three-tier priority funnel.
 * <p>
 * L1 (earnings blow-up season) and L2 (pre-lockout retreat, year-end drain) are calendar windows and
 * apply to every date inside them. Outside those windows a non-trading day is INACTIVE. Trading days are
 * then checked against the futures and options settlement cycles (L3). A settlement-week Tuesday yields a
 * provisional entry that is reconfirmed by the {@link MarketGuard}.
 */
public final class TimingFunnel {
    private static final Logger LOG = LogManager.getLogger(TimingFunnel.class);
    private static final CycleType[] CYCLE_ORDER = {CycleType.FUTURES, CycleType.OPTIONS};

    private static final MonthDay L1_START = MonthDay.of(3, 15);
    private static final MonthDay L1_END = MonthDay.of(4, 30);
    private static final MonthDay L2_RETREAT_START = MonthDay.of(3, 5);
    private static final MonthDay L2_RETREAT_END = MonthDay.of(3, 14);

    private final SettlementCalendar settlementCalendar;
    private final TradingCalendar tradingCalendar;
    private final MarketGuard guard;
    private final MemoryCache cache;
    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime windowOpen;
    private final LocalTime settlementClose;
    private final Duration cacheTtl;

    public TimingFunnel(
            SettlementCalendar settlementCalendar,
            MarketGuard guard,
            MemoryCache cache,
            Config config,
            Clock clock
    ) {
        this.settlementCalendar = Objects.requireNonNull(settlementCalendar, "settlementCalendar");
        this.tradingCalendar = settlementCalendar.tradingCalendar();
        this.guard = Objects.requireNonNull(guard, "guard");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = config.getZone("app.zone");
        this.windowOpen = config.getTime("timing.window_open");
        this.settlementClose = config.getTime("timing.settlement_close");
        this.cacheTtl = Duration.ofSeconds(Math.max(0L, config.getLong("timing.cache_ttl_sec", 3600L)));
    }

    /**
     * Signal for {@code date}. Today is evaluated at the current wall-clock time; any other date at the
     * settlement close.
     */
    public TimingSignal timingFor(LocalDate date) {
        LocalDateTime now = LocalDateTime.now(clock.withZone(zone));
        if (date.equals(now.toLocalDate())) {
            return evaluate(date, now.toLocalTime().truncatedTo(ChronoUnit.MINUTES));
        }
        String key = "timing:" + date;
        TimingSignal cached = cache.get(key, TimingSignal.class).orElse(null);
        if (cached != null) {
            return cached;
        }
        TimingSignal signal = evaluate(date, settlementClose);
        if (signal.guard == null) {
            cache.put(key, signal, cacheTtl);
        }
        return signal;
    }

    public TimingSignal timingFor(LocalDateTime instant) {
        return evaluate(instant.toLocalDate(), instant.toLocalTime());
    }

    public TimingSignal today() {
        return timingFor(LocalDate.now(clock.withZone(zone)));
    }

    public TimingSignal evaluate(LocalDate date, LocalTime time) {
        TimingSignal signal = evaluate(date, time, true);
        LOG.debug("Timing evaluated: {}", signal);
        return signal;
    }

    /**
     * Signals for every trading day in {@code [start, end]}, evaluated at the close. The guard is not
     * consulted, so settlement-week Tuesdays stay provisional.
     */
    public List<TimingSignal> evaluateRange(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("range end " + end + " is before start " + start);
        }
        List<TimingSignal> out = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            if (tradingDay(d).tradingDay) {
                out.add(evaluate(d, settlementClose, false));
            }
        }
        return out;
    }

    private TimingSignal evaluate(LocalDate date, LocalTime time, boolean consultGuard) {
        TradingDay day = tradingDay(date);
        LocalDate nextOpen = day.tradingDay ? null : tradingCalendar.nextTradingDayAfter(date);
        MonthDay md = MonthDay.from(date);

        if (!md.isBefore(L1_START) && !md.isAfter(L1_END)) {
            return new TimingSignal(date, Level.L1, Light.RED, Action.FORCE_EMPTY,
                    "earnings blow-up season (03-15..04-30), stay fully in cash",
                    List.of("annual and Q1 reports are being published", "no new positions of any kind"),
                    day.tradingDay, day.holidayName, nextOpen, null);
        }

        if (!md.isBefore(L2_RETREAT_START) && !md.isAfter(L2_RETREAT_END)) {
            long daysToLockout = ChronoUnit.DAYS.between(date, L1_START.atYear(date.getYear()));
            return new TimingSignal(date, Level.L2, Light.YELLOW, Action.EXIT_ALL,
                    "pre-lockout retreat, " + daysToLockout + " day(s) until earnings season",
                    List.of("earnings season starts 03-15", "exits only, no new positions"),
                    day.tradingDay, day.holidayName, nextOpen, null);
        }
        if (date.getMonthValue() == 12) {
            return new TimingSignal(date, Level.L2, Light.RED, Action.EXIT_ALL,
                    "year-end liquidity drain",
                    List.of("year-end funding pressure and institutional rebalancing", "exits only, no new positions"),
                    day.tradingDay, day.holidayName, nextOpen, null);
        }

        if (!day.tradingDay) {
            String reason = day.holidayName == null
                    ? "market closed (weekend)"
                    : "market closed (" + day.holidayName + ")";
            return new TimingSignal(date, Level.NONE, Light.GREY, Action.INACTIVE, reason,
                    List.of("next open: " + nextOpen),
                    false, day.holidayName, nextOpen, null);
        }

        return evaluateSettlementWeek(date, time, consultGuard);
    }

    private TimingSignal evaluateSettlementWeek(LocalDate date, LocalTime time, boolean consultGuard) {
        List<String> pending = new ArrayList<>();
        boolean windowOpened = !time.isBefore(windowOpen);

        for (CycleType type : CYCLE_ORDER) {
            for (SettlementCycle cycle : candidateCycles(type, date)) {
                if (!settlementCalendar.preRetreatDay(cycle).equals(date)) {
                    continue;
                }
                if (windowOpened) {
                    return new TimingSignal(date, Level.L3, Light.YELLOW, Action.PRE_RETREAT,
                            "pre-retreat before " + describe(cycle),
                            List.of("next week is a " + type.code() + " settlement week",
                                    "reduce or exit positions before the close"),
                            true, null, null, null);
                }
                pending.add("pre-retreat window before " + describe(cycle) + " opens at " + windowOpen);
            }
        }

        List<SettlementCycle> probeTargets = new ArrayList<>();
        for (CycleType type : CYCLE_ORDER) {
            for (SettlementCycle cycle : candidateCycles(type, date)) {
                if (date.getDayOfWeek() == DayOfWeek.TUESDAY && cycle.inSettlementWeek(date)) {
                    probeTargets.add(cycle);
                }
            }
        }
        if (!probeTargets.isEmpty()) {
            if (windowOpened) {
                return probeEntry(date, probeTargets, consultGuard);
            }
            pending.add("probe window for " + join(probeTargets) + " opens at " + windowOpen);
        }

        for (CycleType type : CYCLE_ORDER) {
            SettlementCycle cycle = settlementCalendar.settlement(type, YearMonth.from(date));
            if (!cycle.occurrenceDate.equals(date)) {
                continue;
            }
            if (!time.isBefore(settlementClose)) {
                return new TimingSignal(date, Level.L3, Light.YELLOW, Action.OBSERVE,
                        "post-settlement sentiment watch (" + describe(cycle) + ")",
                        List.of(type.code() + " contracts for this month have settled",
                                "watch after-hours flows and sentiment shift"),
                        true, null, null, null);
            }
            pending.add("post-settlement watch for " + describe(cycle) + " opens at " + settlementClose);
        }

        return new TimingSignal(date, Level.NONE, Light.GREEN, Action.NORMAL_TRADING,
                "normal trading session", pending, true, null, null, null);
    }

    private TimingSignal probeEntry(LocalDate date, List<SettlementCycle> targets, boolean consultGuard) {
        String base = "settlement-week probe (" + join(targets) + ")";
        List<String> details = new ArrayList<>();
        details.add("watch for a settlement-driven dip into the close");
        if (!consultGuard) {
            details.add("provisional: needs real-time market guard confirmation");
            return new TimingSignal(date, Level.L3, Light.GREEN, Action.PROBE_ENTRY, base, details,
                    true, null, null, null);
        }

        GuardVerdict verdict = guard.confirm();
        details.add("market guard: " + verdict);
        switch (verdict.verdict) {
            case PASS:
                return new TimingSignal(date, Level.L3, Light.GREEN, Action.PROBE_PERMITTED,
                        base + " confirmed by market guard", details, true, null, null, verdict);
            case DOWNGRADE:
                details.add("position limited to 10%");
                return new TimingSignal(date, Level.L3, Light.YELLOW, Action.PROBE_LIGHT,
                        base + " downgraded by market guard: " + verdict.reason, details,
                        true, null, null, verdict);
            case BLOCK:
                details.add("stay on the sidelines until the market stabilises");
                return new TimingSignal(date, Level.L3, Light.YELLOW, Action.OBSERVE_ONLY,
                        "probe blocked by market guard: " + verdict.reason, details,
                        true, null, null, verdict);
        }
        throw new IllegalStateException("unhandled guard verdict: " + verdict.verdict);
    }

    private List<SettlementCycle> candidateCycles(CycleType type, LocalDate date) {
        YearMonth month = YearMonth.from(date);
        return List.of(settlementCalendar.settlement(type, month), settlementCalendar.settlement(type, month.plusMonths(1)));
    }

    private TradingDay tradingDay(LocalDate date) {
        String key = "trading_day:" + date;
        TradingDay cached = cache.get(key, TradingDay.class).orElse(null);
        if (cached != null) {
            return cached;
        }
        TradingDay day = tradingCalendar.lookup(date);
        cache.put(key, day, cacheTtl);
        return day;
    }

    private static String describe(SettlementCycle cycle) {
        return cycle.type.code() + " settlement " + cycle.occurrenceDate;
    }

    private static String join(List<SettlementCycle> cycles) {
        List<String> parts = new ArrayList<>();
        for (SettlementCycle cycle : cycles) {
            parts.add(describe(cycle));
        }
        return String.join(" + ", parts);
    }
}
