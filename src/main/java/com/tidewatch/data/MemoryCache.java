package com.tidewatch.data;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide key/value cache with a TTL per entry, backed by Caffeine. Expired entries are dropped
 * during Caffeine's maintenance on reads and writes; the entry count is capped at {@code maxEntries}.
 */
public final class MemoryCache {
    private static final Logger LOG = LogManager.getLogger(MemoryCache.class);

    public static final Duration TTL_REALTIME = Duration.ofSeconds(60);
    public static final Duration TTL_POOL = Duration.ofMinutes(5);
    public static final Duration TTL_STOCK_LIST = Duration.ofHours(1);
    public static final Duration TTL_FINANCE = Duration.ofHours(1);
    public static final Duration TTL_COMPANY = Duration.ofHours(24);

    public static final long DEFAULT_MAX_ENTRIES = 50_000L;

    private final Cache<String, Entry> store;

    public MemoryCache(Clock clock) {
        this(clock, DEFAULT_MAX_ENTRIES);
    }

    public MemoryCache(Clock clock, long maxEntries) {
        Objects.requireNonNull(clock, "clock");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0: " + maxEntries);
        }
        this.store = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new PerEntryTtl())
                .ticker(() -> toNanos(clock.instant()))
                .executor(Runnable::run)
                .build();
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = store.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!type.isInstance(entry.value)) {
            LOG.warn("Cache type mismatch. key={}, expected={}, actual={}",
                    key, type.getSimpleName(), entry.value.getClass().getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.value));
    }

    public void put(String key, Object value, Duration ttl) {
        if (key == null || value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        store.put(key, new Entry(value, ttl.toNanos()));
    }

    /**
     * Returns the cached value or loads, stores and returns a fresh one. Loader failures are not cached.
     */
    public <T, E extends Exception> T getOrLoad(String key, Class<T> type, Duration ttl, Loader<T, E> loader) throws E {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            LOG.debug("Cache hit: {}", key);
            return cached.get();
        }
        LOG.debug("Cache miss: {}", key);
        T value = loader.load();
        put(key, value, ttl);
        return value;
    }

    public void invalidate(String key) {
        store.invalidate(key);
    }

    public void clear() {
        store.invalidateAll();
        LOG.info("Cache cleared");
    }

    /**
     * Live entries after pending expiry and size eviction have run.
     */
    public long size() {
        store.cleanUp();
        return store.estimatedSize();
    }

    private static long toNanos(Instant instant) {
        return TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
    }

    @FunctionalInterface
    public interface Loader<T, E extends Exception> {
        T load() throws E;
    }

    private static final class Entry {
        final Object value;
        final long ttlNanos;

        Entry(Object value, long ttlNanos) {
            this.value = value;
            this.ttlNanos = ttlNanos;
        }
    }

    private static final class PerEntryTtl implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
