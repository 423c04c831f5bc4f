package com.tidewatch.app;

import com.tidewatch.app.properties.DbProperties;
import com.tidewatch.app.properties.ZhituProperties;
import com.tidewatch.calendar.HolidayTableCalendar;
import com.tidewatch.calendar.SettlementCalendar;
import com.tidewatch.calendar.TradingCalendar;
import com.tidewatch.config.Config;
import com.tidewatch.data.MemoryCache;
import com.tidewatch.data.ZhituClient;
import com.tidewatch.data.ZhituFinancialSource;
import com.tidewatch.data.ZhituMarketStatsSource;
import com.tidewatch.data.http.HttpClientEx;
import com.tidewatch.db.Database;
import com.tidewatch.db.FinancialRiskDao;
import com.tidewatch.db.MigrationRunner;
import com.tidewatch.db.StrategySignalDao;
import com.tidewatch.guard.MarketGuard;
import com.tidewatch.risk.FinancialRiskScanner;
import com.tidewatch.status.GlobalStatusAggregator;
import com.tidewatch.strategy.StrategyRegistry;
import com.tidewatch.strategy.StrategyRunner;
import com.tidewatch.strategy.impl.LimitUpBoardStrategy;
import com.tidewatch.strategy.impl.VolumeBreakoutStrategy;
import com.tidewatch.timing.TimingFunnel;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.annotation.PropertySource;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;

/**
 * Application wiring. Everything that touches PostgreSQL is lazy so read-only commands such as
 * {@code --timing} and {@code --calendar} run without a database.
 */
@Configuration
@PropertySource(value = "classpath:config.properties", encoding = "UTF-8")
@EnableConfigurationProperties({DbProperties.class, ZhituProperties.class})
public class TideWatchBootstrapConfig {
    @Bean
    public Config tideWatchConfig() {
        return Config.load(Path.of(".").toAbsolutePath().normalize());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public MemoryCache memoryCache(Clock clock, Config config) {
        return new MemoryCache(clock, config.getLong("cache.max_entries", MemoryCache.DEFAULT_MAX_ENTRIES));
    }

    @Bean
    public RateLimiter zhituRateLimiter(Config config) {
        return ZhituClient.rateLimiter(
                config.getInt("zhitu.rate_limit_per_min", 3000),
                Duration.ofMillis(config.getLong("zhitu.rate_limit_timeout_ms", 65_000L))
        );
    }

    @Bean
    public ZhituClient zhituClient(
            Config config,
            ZhituProperties zhituProperties,
            RateLimiter zhituRateLimiter,
            MemoryCache cache
    ) {
        HttpClientEx http = new HttpClientEx(
                config.getInt("zhitu.timeout_sec", 10),
                config.getInt("zhitu.max_retries", 3)
        );
        return new ZhituClient(http, zhituRateLimiter, cache, config.getString("zhitu.base_url"),
                readZhituToken(zhituProperties));
    }

    @Bean
    public TradingCalendar tradingCalendar(Config config) {
        return HolidayTableCalendar.load(config.getString("calendar.holiday_resource"),
                Path.of(config.getString("calendar.holiday_file")));
    }

    @Bean
    public SettlementCalendar settlementCalendar(TradingCalendar tradingCalendar, Config config) {
        return new SettlementCalendar(tradingCalendar, config);
    }

    @Bean
    public MarketGuard marketGuard(ZhituClient zhituClient, Config config, Clock clock) {
        ZhituMarketStatsSource source = new ZhituMarketStatsSource(zhituClient, clock, config.getZone("app.zone"));
        return new MarketGuard(source, config, clock);
    }

    @Bean
    public TimingFunnel timingFunnel(
            SettlementCalendar settlementCalendar,
            MarketGuard marketGuard,
            MemoryCache cache,
            Config config,
            Clock clock
    ) {
        return new TimingFunnel(settlementCalendar, marketGuard, cache, config, clock);
    }

    @Bean
    public StrategyRegistry strategyRegistry() {
        return StrategyRegistry.of(new LimitUpBoardStrategy(), new VolumeBreakoutStrategy());
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                readDbUrl(dbProperties),
                readDbUser(dbProperties),
                readDbPass(dbProperties),
                firstNonBlank(dbProperties == null ? null : dbProperties.getSchema(), "tidewatch")
        );
        try {
            new MigrationRunner().run(database);
        } catch (SQLException e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public FinancialRiskScanner financialRiskScanner(ZhituClient zhituClient, Database database, Config config, Clock clock) {
        return new FinancialRiskScanner(new ZhituFinancialSource(zhituClient), new FinancialRiskDao(database), config, clock);
    }

    @Bean
    @Lazy
    public GlobalStatusAggregator globalStatusAggregator(
            TimingFunnel timingFunnel,
            SettlementCalendar settlementCalendar,
            FinancialRiskScanner financialRiskScanner
    ) {
        return new GlobalStatusAggregator(timingFunnel, settlementCalendar, financialRiskScanner);
    }

    @Bean
    @Lazy
    public StrategyRunner strategyRunner(StrategyRegistry registry, ZhituClient zhituClient, Database database) {
        return new StrategyRunner(registry, zhituClient, new StrategySignalDao(database));
    }

    private String readDbUrl(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("TIDEWATCH_DB_URL"),
                dbProperties == null ? null : dbProperties.getUrl(),
                "jdbc:postgresql://localhost:5432/tidewatch"
        );
    }

    private String readDbUser(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("TIDEWATCH_DB_USER"),
                dbProperties == null ? null : dbProperties.getUser(),
                "tidewatch"
        );
    }

    private String readDbPass(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("TIDEWATCH_DB_PASS"),
                dbProperties == null ? null : dbProperties.getPass(),
                "tidewatch"
        );
    }

    private String readZhituToken(ZhituProperties zhituProperties) {
        return firstNonBlank(
                System.getenv("ZHITU_TOKEN"),
                zhituProperties == null ? null : zhituProperties.getToken()
        );
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
