package com.tidewatch.app;

import com.tidewatch.app.properties.DbProperties;
import com.tidewatch.config.Config;
import com.tidewatch.strategy.StrategyRegistry;
import com.tidewatch.timing.TimingFunnel;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class TideWatchBootstrapConfigTest {

    @Test
    void contextStartsWithoutDatabase() {
        try (AnnotationConfigApplicationContext context =
                     new AnnotationConfigApplicationContext(TideWatchBootstrapConfig.class)) {
            assertNotNull(context.getBean(TimingFunnel.class));
            assertEquals(List.of("limit_up_board", "volume_breakout"), context.getBean(StrategyRegistry.class).names());
            assertEquals("tidewatch", context.getBean(DbProperties.class).getSchema());
            assertEquals("Asia/Shanghai", context.getBean(Config.class).getString("app.zone"));
        }
    }

    @Test
    void firstNonBlankSkipsEmptyValues() {
        assertEquals("b", TideWatchBootstrapConfig.firstNonBlank(null, "  ", " b ", "c"));
        assertEquals("", TideWatchBootstrapConfig.firstNonBlank(null, ""));
    }
}
