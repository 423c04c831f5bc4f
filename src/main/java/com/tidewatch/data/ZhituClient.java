package com.tidewatch.data;

import com.tidewatch.core.error.FetchException;
import com.tidewatch.data.http.HttpClientEx;
import com.tidewatch.risk.Listing;
import com.tidewatch.strategy.PoolSource;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * ZhituAPI client. Every request takes a permit from the shared {@link RateLimiter}; list-style endpoints
 * are cached in the shared {@link MemoryCache}.
 */
public class ZhituClient implements PoolSource {
    private static final Logger LOG = LogManager.getLogger(ZhituClient.class);

    private final HttpClientEx http;
    private final RateLimiter limiter;
    private final MemoryCache cache;
    private final String baseUrl;
    private final String token;

    public ZhituClient(HttpClientEx http, RateLimiter limiter, MemoryCache cache, String baseUrl, String token) {
        this.http = Objects.requireNonNull(http, "http");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.cache = Objects.requireNonNull(cache, "cache");
        String base = baseUrl == null ? "" : baseUrl.trim();
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.token = token == null ? "" : token.trim();
    }

    /**
     * ZhituAPI quota: {@code requestsPerMinute} permits per one-minute period. A caller waits at most
     * {@code maxWait} for a permit.
     */
    public static RateLimiter rateLimiter(int requestsPerMinute, Duration maxWait) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(requestsPerMinute)
                .timeoutDuration(maxWait)
                .build();
        return RateLimiter.of("zhitu", config);
    }

    public JSONArray stockList() throws FetchException {
        return cache.getOrLoad("zhitu:stock_list", JSONArray.class, MemoryCache.TTL_STOCK_LIST,
                () -> request("/hs/list/all"));
    }

    public List<Listing> listings() throws FetchException {
        JSONArray rows = stockList();
        List<Listing> out = new ArrayList<>(rows.length());
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.optJSONObject(i);
            String code = FieldExtractor.text(row, "dm", "code");
            if (!code.isEmpty()) {
                out.add(new Listing(code, FieldExtractor.text(row, "mc", "name")));
            }
        }
        return out;
    }

    public JSONArray realtimeAll() throws FetchException {
        return cache.getOrLoad("zhitu:realtime_all", JSONArray.class, MemoryCache.TTL_REALTIME,
                () -> request("/hs/public/realall"));
    }

    @Override
    public JSONArray pool(PoolType type, LocalDate date) throws FetchException {
        String key = "zhitu:pool:" + type.slug() + ":" + date;
        return cache.getOrLoad(key, JSONArray.class, MemoryCache.TTL_POOL,
                () -> request("/hs/pool/" + type.slug() + "/" + date));
    }

    /**
     * Company financial indicators, newest and oldest periods mixed.
     */
    public JSONArray financialIndicators(String code) throws FetchException {
        String pure = toPureCode(code);
        return cache.getOrLoad("zhitu:cwzb:" + pure, JSONArray.class, MemoryCache.TTL_FINANCE,
                () -> request("/hs/gs/cwzb/" + pure));
    }

    public JSONArray incomeStatements(String code) throws FetchException {
        String normalized = normalizeCode(code);
        return cache.getOrLoad("zhitu:income:" + normalized, JSONArray.class, MemoryCache.TTL_FINANCE,
                () -> request("/hs/fin/income/" + normalized));
    }

    JSONArray request(String path) throws FetchException {
        if (!limiter.acquirePermission()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new FetchException("interrupted while waiting for rate limit: " + path);
            }
            LOG.warn("Rate limit permit not granted within {} ms: {}",
                    limiter.getRateLimiterConfig().getTimeoutDuration().toMillis(), path);
            throw new FetchException("rate limit exceeded for " + path);
        }
        String url = baseUrl + path + "?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
        String body = http.getText(url);
        return unwrap(path, body);
    }

    static JSONArray unwrap(String path, String body) throws FetchException {
        Object payload;
        try {
            payload = new JSONTokener(body == null ? "" : body).nextValue();
        } catch (JSONException e) {
            throw new FetchException("invalid JSON from " + path, e);
        }
        if (payload instanceof JSONArray) {
            return (JSONArray) payload;
        }
        if (!(payload instanceof JSONObject)) {
            throw new FetchException("unexpected payload from " + path + ": " + payload);
        }
        JSONObject obj = (JSONObject) payload;
        if (obj.has("code") && !obj.isNull("code")) {
            int code = obj.optInt("code", -1);
            if (code != 0 && code != 200) {
                String msg = obj.optString("msg", "unknown error");
                LOG.error("ZhituAPI business error: {} -> {}", path, msg);
                throw new FetchException("ZhituAPI error on " + path + ": " + msg);
            }
        }
        if (!obj.has("data")) {
            return new JSONArray().put(obj);
        }
        Object data = obj.get("data");
        if (data instanceof JSONArray) {
            return (JSONArray) data;
        }
        if (data instanceof JSONObject) {
            return new JSONArray().put(data);
        }
        return new JSONArray();
    }

    /**
     * {@code 000001}, {@code sz000001} and {@code 000001.sz} all become {@code 000001.SZ}.
     */
    public static String normalizeCode(String raw) {
        String s = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("security code is required");
        }
        int dot = s.indexOf('.');
        if (dot >= 0) {
            String[] parts = s.split("\\.");
            return parts.length >= 2 ? parts[0] + "." + parts[1] : parts[0] + "." + exchangeOf(parts[0]);
        }
        if (s.startsWith("SH") || s.startsWith("SZ") || s.startsWith("BJ")) {
            return s.substring(2) + "." + s.substring(0, 2);
        }
        return s + "." + exchangeOf(s);
    }

    public static String toPureCode(String raw) {
        String s = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        int dot = s.indexOf('.');
        if (dot >= 0) {
            return s.substring(0, dot);
        }
        if (s.startsWith("SH") || s.startsWith("SZ") || s.startsWith("BJ")) {
            return s.substring(2);
        }
        return s;
    }

    static String exchangeOf(String pure) {
        if (pure.isEmpty()) {
            throw new IllegalArgumentException("security code is required");
        }
        if (pure.startsWith("92")) {
            return "BJ";
        }
        switch (pure.charAt(0)) {
            case '5':
            case '6':
            case '9':
                return "SH";
            case '0':
            case '1':
            case '2':
            case '3':
                return "SZ";
            case '4':
            case '8':
                return "BJ";
            default:
                throw new IllegalArgumentException("cannot infer exchange for code " + pure);
        }
    }
}
