package com.tidewatch.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Properties;

/**
 * Flat {@code key=value} settings for the funnel, guard, scanner and ZhituAPI client.
 * <p>
 * Three layers, last one wins: built-in defaults, the bundled {@code config.properties},
 * then {@code config.properties} in the working directory. Numeric getters take the
 * caller's fallback when a value is missing or unparsable.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final String FILE_NAME = "config.properties";
    private static final Properties DEFAULTS = defaults();

    private final Properties values;

    private Config(Properties values) {
        this.values = values;
    }

    public static Config load(Path workingDir) {
        Properties bundled = new Properties(DEFAULTS);
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                bundled.load(in);
            }
        } catch (IOException e) {
            LOG.warn("Bundled {} unreadable, using built-in defaults: {}", FILE_NAME, e.getMessage());
        }

        Properties local = new Properties(bundled);
        Path file = workingDir.resolve(FILE_NAME);
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                local.load(in);
                LOG.info("Loaded local overrides from {}", file);
            } catch (IOException e) {
                LOG.warn("Local {} unreadable, ignoring it: {}", file, e.getMessage());
            }
        }
        return new Config(local);
    }

    /**
     * Defaults plus the given entries; nothing is read from disk.
     */
    public static Config of(Map<String, String> entries) {
        Properties props = new Properties(DEFAULTS);
        props.putAll(entries);
        return new Config(props);
    }

    /** Trimmed value, or an empty string when the key is unset or blank in every layer. */
    public String getString(String key) {
        String raw = values.getProperty(key);
        if (raw != null && !raw.isBlank()) {
            return raw.trim();
        }
        String fallback = DEFAULTS.getProperty(key);
        return fallback == null ? "" : fallback;
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        return value.isEmpty() ? fallback : value;
    }

    public int getInt(String key, int fallback) {
        try {
            return Integer.parseInt(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public long getLong(String key, long fallback) {
        try {
            return Long.parseLong(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        try {
            return Double.parseDouble(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public ZoneId getZone(String key) {
        return ZoneId.of(getString(key, "Asia/Shanghai"));
    }

    /**
     * Reads an {@code H:mm} or {@code HH:mm} time. A malformed value is an error, not a fallback.
     */
    public LocalTime getTime(String key) {
        String value = getString(key);
        try {
            return LocalTime.parse(value.length() == 4 ? "0" + value : value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid time for config key " + key + ": " + value, e);
        }
    }

    private static Properties defaults() {
        Properties d = new Properties();

        d.setProperty("app.zone", "Asia/Shanghai");
        d.setProperty("db.url", "jdbc:postgresql://localhost:5432/tidewatch");
        d.setProperty("db.user", "tidewatch");
        d.setProperty("db.pass", "tidewatch");
        d.setProperty("db.schema", "tidewatch");
        d.setProperty("cache.max_entries", "50000");

        d.setProperty("calendar.holiday_resource", "calendar/cn_holidays.properties");
        d.setProperty("calendar.holiday_file", "cn_holidays.properties");
        d.setProperty("calendar.rollback_lookback_days", "10");

        d.setProperty("timing.window_open", "14:30");
        d.setProperty("timing.settlement_close", "15:00");
        d.setProperty("timing.cache_ttl_sec", "3600");

        d.setProperty("guard.timeout_ms", "5000");
        d.setProperty("guard.index_drawdown_block_pct", "3.0");
        d.setProperty("guard.limit_down_block", "200");
        d.setProperty("guard.down_up_ratio_block", "3.0");
        d.setProperty("guard.broken_rate_downgrade_pct", "50.0");
        d.setProperty("guard.limit_down_downgrade", "50");

        d.setProperty("risk.revenue_threshold_main", "300000000");
        d.setProperty("risk.revenue_threshold_small", "100000000");
        d.setProperty("risk.cumulative_loss_threshold", "300000000");
        d.setProperty("risk.history_years", "3");
        d.setProperty("risk.extreme_loss_years", "3");
        d.setProperty("risk.scan.max_concurrent", "10");
        d.setProperty("risk.scan.batch_size", "30");
        d.setProperty("risk.scan.batch_delay_ms", "500");
        d.setProperty("risk.scan.progress_log_every", "500");
        d.setProperty("risk.scan.max_error_ratio", "0.5");

        d.setProperty("zhitu.base_url", "https://api.zhituapi.com");
        d.setProperty("zhitu.rate_limit_per_min", "3000");
        d.setProperty("zhitu.rate_limit_timeout_ms", "65000");
        d.setProperty("zhitu.timeout_sec", "10");
        d.setProperty("zhitu.max_retries", "3");
        return d;
    }
}
