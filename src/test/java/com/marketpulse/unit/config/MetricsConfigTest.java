package com.marketpulse.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.marketpulse.config.MetricsConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class MetricsConfigTest {

    @Test
    void tagsEveryMeterWithTheApplicationName() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        new MetricsConfig().commonTags("market-pulse").customize(registry);
        Counter cycles = registry.counter("market.cycles");

        assertThat(cycles.getId().getTag("application")).isEqualTo("market-pulse");
    }
}
