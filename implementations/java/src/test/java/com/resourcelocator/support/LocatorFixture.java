package com.resourcelocator.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resourcelocator.application.ResolverMetrics;
import com.resourcelocator.application.SecureResourceLocator;
import com.resourcelocator.config.ResourceLocatorProperties;
import com.resourcelocator.infrastructure.audit.DefaultAuditService;
import com.resourcelocator.infrastructure.cache.ResourceDefinitionCache;
import com.resourcelocator.infrastructure.crypto.HmacCryptoService;
import com.resourcelocator.infrastructure.persistence.DeadlineBoundStorage;
import com.resourcelocator.infrastructure.persistence.PolicyCodec;
import com.resourcelocator.infrastructure.security.BooleanPolicyEvaluator;
import com.resourcelocator.infrastructure.security.VectorPolicyEvaluator;
import com.resourcelocator.infrastructure.security.VectorValueMaps;
import com.resourcelocator.infrastructure.token.ReplayLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Locator wired by hand around a {@link FailingStorageAdapter}, a {@link MutableClock}
 * and a {@link ManualTicker}.
 */
public class LocatorFixture implements AutoCloseable {

    public static final Instant START = Instant.parse("2024-03-13T10:00:00Z"); // a Wednesday

    public final FailingStorageAdapter storage = new FailingStorageAdapter();
    public final MutableClock clock = new MutableClock(START);
    public final ManualTicker ticker = new ManualTicker();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final ResourceLocatorProperties properties = new ResourceLocatorProperties();
    public final PolicyCodec codec = new PolicyCodec(new ObjectMapper());
    public final ResourceDefinitionCache cache;
    public final SecureResourceLocator locator;

    private final ExecutorService executor = Executors.newCachedThreadPool();

    public LocatorFixture() {
        properties.getStorage().setTimeout(Duration.ofMillis(500));
        cache = new ResourceDefinitionCache(properties.getCache().getTtl(), 1_000, ticker, Runnable::run);

        DeadlineBoundStorage bounded =
            new DeadlineBoundStorage(storage, executor, properties.getStorage().getTimeout(), clock);
        VectorValueMaps maps = new VectorValueMaps(Map.of(
            "clearance", Map.of("public", 1.0, "internal", 2.0, "secret", 3.0)));

        locator = new SecureResourceLocator(
            bounded,
            cache,
            new BooleanPolicyEvaluator(),
            new VectorPolicyEvaluator(maps),
            new DefaultAuditService(bounded, clock),
            HmacCryptoService.fromSecret(null, new SecureRandom()),
            new ReplayLedger(properties.getToken().getMaxLifetime(), ticker),
            new ResolverMetrics(meterRegistry),
            properties,
            clock);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
