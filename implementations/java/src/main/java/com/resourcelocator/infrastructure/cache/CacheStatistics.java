package com.resourcelocator.infrastructure.cache;

import lombok.Value;

/**
 * Point-in-time hit/miss counters of the resource definition cache.
 */
@Value
public class CacheStatistics {
    long hits;
    long misses;
    long size;

    public long getRequests() {
        return hits + misses;
    }
}
