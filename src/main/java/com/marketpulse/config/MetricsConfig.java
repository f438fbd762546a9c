package com.marketpulse.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags for every meter, custom ({@code market.*} from
 * {@link com.marketpulse.observability.PipelineMetricsService}) and auto-configured alike.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags(
            @Value("${spring.application.name:market-pulse}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
