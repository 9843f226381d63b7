package com.storycast.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides an in-memory meter registry when metrics.enabled=true and no other registry is configured.
 * A host that ships its own registry (StatsD, Prometheus, ...) replaces it.
 */
@Configuration
@ConditionalOnProperty(name = "metrics.enabled", havingValue = "true", matchIfMissing = false)
public class MetricsConfig {

    private static final Logger logger = LoggerFactory.getLogger(MetricsConfig.class);

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        logger.info("No meter registry configured, using SimpleMeterRegistry");
        return new SimpleMeterRegistry();
    }
}
