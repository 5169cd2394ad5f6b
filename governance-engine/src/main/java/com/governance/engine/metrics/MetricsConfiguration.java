package com.governance.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring. Without an actuator registry the metrics go to an in-process simple registry.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "governance-control-plane");
    }

    @Bean
    public GovernanceMetrics governanceMetrics(ObjectProvider<MeterRegistry> registry) {
        return new GovernanceMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }
}
