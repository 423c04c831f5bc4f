package com.tidewatch.data;

import com.tidewatch.core.error.FetchException;
import com.tidewatch.guard.AggregateStatsSource;
import com.tidewatch.guard.MarketSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the guard's market snapshot from the full-market quote list and the daily pools.
 */
public final class ZhituMarketStatsSource implements AggregateStatsSource {
    private static final Logger LOG = LogManager.getLogger(ZhituMarketStatsSource.class);
    /** SSE Composite, SZSE Component and ChiNext, exchange-qualified. */
    static final Set<String> INDEX_CODES = Set.of("000001.SH", "399001.SZ", "399006.SZ");

    private final ZhituClient client;
    private final Clock clock;
    private final ZoneId zone;

    public ZhituMarketStatsSource(ZhituClient client, Clock clock, ZoneId zone) {
        this.client = Objects.requireNonNull(client, "client");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public MarketSnapshot fetchAggregateStats() throws FetchException {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        JSONArray quotes = client.realtimeAll();
        JSONArray limitUp = client.pool(PoolType.LIMIT_UP, today);
        JSONArray limitDown = client.pool(PoolType.LIMIT_DOWN, today);
        JSONArray broken = client.pool(PoolType.BROKEN_BOARD, today);

        MarketSnapshot snapshot = assemble(quotes, limitUp.length(), limitDown.length(), broken.length());
        LOG.info("Market snapshot: {}", snapshot);
        return snapshot;
    }

    /**
     * Drawdown is the worst of the three main indices, floored at zero; missing index rows leave it unknown.
     * Breadth counts only individual A-shares, so index, fund and bond rows never move it. Rows are matched
     * by exchange-qualified code: {@code 000001.SZ} is a stock, {@code 000001.SH} is the SSE Composite.
     */
    static MarketSnapshot assemble(JSONArray quotes, int limitUpCount, int limitDownCount, int brokenCount) {
        Double worstIndexPct = null;
        int up = 0;
        int down = 0;
        int priced = 0;
        for (int i = 0; i < quotes.length(); i++) {
            JSONObject q = quotes.optJSONObject(i);
            if (q == null) {
                continue;
            }
            String code = qualify(FieldExtractor.text(q, "dm", "code"));
            Double pct = FieldExtractor.number(q, "pc", "zf", "change_pct");
            if (code == null || pct == null) {
                continue;
            }
            if (INDEX_CODES.contains(code)) {
                worstIndexPct = worstIndexPct == null ? pct : Math.min(worstIndexPct, pct);
            } else if (isIndividualShare(code)) {
                priced++;
                if (pct > 0) {
                    up++;
                } else if (pct < 0) {
                    down++;
                }
            }
        }

        Double drawdown = worstIndexPct == null ? null : Math.max(0.0, -worstIndexPct);
        int boards = limitUpCount + brokenCount;
        double brokenRate = boards > 0 ? brokenCount * 100.0 / boards : 0.0;
        return new MarketSnapshot(
                drawdown,
                limitDownCount,
                priced == 0 ? null : up,
                priced == 0 ? null : down,
                brokenRate
        );
    }

    private static String qualify(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return ZhituClient.normalizeCode(raw).toUpperCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            LOG.debug("Skipping quote row with unrecognised code {}: {}", raw, e.getMessage());
            return null;
        }
    }

    /**
     * SH shares start with 6, SZ shares with 0 or 3 (399 is the index range), BJ shares with 4, 8 or 92.
     */
    static boolean isIndividualShare(String qualified) {
        if (qualified == null || qualified.length() != 9 || qualified.charAt(6) != '.') {
            return false;
        }
        String pure = qualified.substring(0, 6);
        for (int i = 0; i < pure.length(); i++) {
            if (!Character.isDigit(pure.charAt(i))) {
                return false;
            }
        }
        char first = pure.charAt(0);
        switch (qualified.substring(7)) {
            case "SH":
                return first == '6';
            case "SZ":
                return (first == '0' || first == '3') && !pure.startsWith("399");
            case "BJ":
                return first == '4' || first == '8' || pure.startsWith("92");
            default:
                return false;
        }
    }
}
