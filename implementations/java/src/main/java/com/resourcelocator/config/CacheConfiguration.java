package com.resourcelocator.config;

import com.resourcelocator.infrastructure.cache.ResourceDefinitionCache;
import com.resourcelocator.infrastructure.token.ReplayLedger;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine caches owned by the locator.
 *
 * <p>Two caches with different jobs:
 * - resource definitions: read-through with a fixed TTL, evicted on registration
 * - redeemed nonces: retained for the longest token lifetime
 *
 * <p>Caches hold encrypted credential references only, never decrypted material.
 */
@Configuration
@Slf4j
public class CacheConfiguration {

    static final String DEFINITION_CACHE_NAME = "resourceDefinitions";

    @Bean
    public ResourceDefinitionCache resourceDefinitionCache(ResourceLocatorProperties properties,
                                                           MeterRegistry meterRegistry) {
        ResourceLocatorProperties.Cache settings = properties.getCache();
        ResourceDefinitionCache cache = new ResourceDefinitionCache(settings.getTtl(), settings.getMaximumSize());

        // Hit/miss/eviction gauges for the actuator
        CaffeineCacheMetrics.monitor(meterRegistry, cache.nativeCache(), DEFINITION_CACHE_NAME);
        return cache;
    }

    @Bean
    public ReplayLedger replayLedger(ResourceLocatorProperties properties) {
        log.info("Configuring redeemed-token ledger, retention={}", properties.getToken().getMaxLifetime());
        return new ReplayLedger(properties.getToken().getMaxLifetime());
    }
}
