/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.cache;

/**
 * Point-in-time statistics for one cache namespace.
 *
 * @param namespace
 *            cache namespace
 * @param hitCount
 *            lookups served from the cache
 * @param missCount
 *            lookups that found nothing or an expired entry
 * @param hitRate
 *            hits / (hits + misses), 1.0 when no lookups have happened
 * @param size
 *            approximate number of live entries
 * @param maxSize
 *            configured entry bound
 * @param evictionCount
 *            entries removed for size or expiry
 */
public record CacheStatistics(String namespace, long hitCount, long missCount, double hitRate, long size, long maxSize,
        long evictionCount) {
}
