package com.brandcheck.config;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.statsd.StatsdConfig;
import io.micrometer.statsd.StatsdMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Ships engine metrics to Datadog over DogStatsD when datadog.enabled=true.
 * The StatsD registry joins the default one, so meters stay visible on the actuator endpoint.
 */
@Configuration
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class DatadogMetricsConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatadogMetricsConfig.class);

    @Value("${DD_AGENT_HOST:localhost}")
    private String agentHost;

    @Value("${DD_DOGSTATSD_PORT:8125}")
    private int statsdPort;

    @Bean
    public StatsdConfig statsdConfig() {
        return new StatsdConfig() {
            @Override
            public String get(String key) {
                return null;
            }

            @Override
            public String host() {
                return agentHost;
            }

            @Override
            public int port() {
                return statsdPort;
            }

            @Override
            public String prefix() {
                return "brandcheck";
            }
        };
    }

    @Bean
    public StatsdMeterRegistry statsdMeterRegistry(StatsdConfig statsdConfig) {
        StatsdMeterRegistry registry = new StatsdMeterRegistry(statsdConfig, Clock.SYSTEM);
        logger.info("DogStatsD registry configured: host={}, port={}", agentHost, statsdPort);
        return registry;
    }

    @Bean
    @Primary
    public CompositeMeterRegistry compositeMeterRegistry(MeterRegistry defaultRegistry, StatsdMeterRegistry statsdRegistry) {
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        composite.add(defaultRegistry);
        composite.add(statsdRegistry);
        return composite;
    }
}
