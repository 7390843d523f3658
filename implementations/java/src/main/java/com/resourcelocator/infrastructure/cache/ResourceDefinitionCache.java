package com.resourcelocator.infrastructure.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.resourcelocator.domain.model.ResourceDefinition;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Read-through, TTL-bounded cache of resource definitions keyed by logical name.
 *
 * <p>Backed by Caffeine:
 * <ul>
 *   <li>entries are replaced atomically, so a reader never sees an old definition with a new expiry</li>
 *   <li>concurrent misses on the same cold key trigger one load; other keys are not blocked</li>
 *   <li>the map only holds a pending future while a load runs; the load itself runs on the
 *       calling thread, outside any map lock</li>
 *   <li>an invalidation racing an in-flight load drops the pending future, so its result is never installed</li>
 *   <li>an absent definition is not cached, so a later registration is visible immediately</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
public class ResourceDefinitionCache {

    private final AsyncCache<String, ResourceDefinition> cache;

    public ResourceDefinitionCache(Duration ttl, long maximumSize) {
        this(ttl, maximumSize, Ticker.systemTicker(), null);
    }

    /**
     * @param ticker Time source for expiry (tests pass a manual ticker)
     * @param maintenanceExecutor Executor for Caffeine housekeeping, {@code null} for the default
     */
    public ResourceDefinitionCache(Duration ttl, long maximumSize, Ticker ticker, Executor maintenanceExecutor) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }

        Caffeine<Object, Object> builder = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maximumSize)
            .ticker(ticker)
            .recordStats();
        if (maintenanceExecutor != null) {
            builder.executor(maintenanceExecutor);
        }
        this.cache = builder.buildAsync();

        log.info("Resource definition cache configured: ttl={}, maximumSize={}", ttl, maximumSize);
    }

    /**
     * Return the cached definition or load it, counting a hit or a miss.
     *
     * <p>Exceptions thrown by the loader propagate unchanged and nothing is cached.
     *
     * @param logicalName Cache key
     * @param loader Storage lookup, returning {@code null} when the name is unknown
     * @return Definition, empty when the loader found none
     */
    public Optional<ResourceDefinition> get(String logicalName, Function<String, ResourceDefinition> loader) {
        CompletableFuture<ResourceDefinition> pending = new CompletableFuture<>();
        CompletableFuture<ResourceDefinition> entry = cache.get(logicalName, (key, executor) -> pending);

        if (entry == pending) {
            ResourceDefinition loaded;
            try {
                loaded = loader.apply(logicalName);
            } catch (RuntimeException | Error e) {
                pending.completeExceptionally(e);
                throw e;
            }
            pending.complete(loaded);
            return Optional.ofNullable(loaded);
        }
        return Optional.ofNullable(await(entry));
    }

    /**
     * Evict one entry, including a load still in flight.
     */
    public void invalidate(String logicalName) {
        cache.synchronous().invalidate(logicalName);
        log.debug("Evicted cached definition for {}", logicalName);
    }

    public void invalidateAll() {
        cache.synchronous().invalidateAll();
    }

    public CacheStatistics statistics() {
        Cache<String, ResourceDefinition> view = cache.synchronous();
        CacheStats stats = view.stats();
        return new CacheStatistics(stats.hitCount(), stats.missCount(), view.estimatedSize());
    }

    /**
     * Underlying Caffeine cache, for metrics binding.
     */
    public Cache<String, ResourceDefinition> nativeCache() {
        return cache.synchronous();
    }

    private static ResourceDefinition await(CompletableFuture<ResourceDefinition> entry) {
        try {
            return entry.join();
        } catch (CompletionException e) {
            // Waiters see the loading thread's failure unchanged
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
