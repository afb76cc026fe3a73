package com.levertrader.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer registry setup for the engine.
 *
 * <p>Without an exporter on the classpath no registry is auto-configured, so an in-memory
 * {@link SimpleMeterRegistry} tagged with the application name is supplied. The meter
 * definitions live in {@link com.levertrader.observability.TradingMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        meterRegistry.config().commonTags("application", "lever-trader-engine");
        return meterRegistry;
    }
}
