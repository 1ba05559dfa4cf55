/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.weather.cache.CacheStatistics;

/**
 * Health check response.
 *
 * @param status
 *            "UP" when the upstream provider answers, "DEGRADED" otherwise
 * @param provider
 *            configured provider name
 * @param providerHealthy
 *            false if the last provider call failed
 * @param caches
 *            per-namespace cache statistics
 */
public record HealthType(String status, String provider, @JsonProperty("provider_healthy") boolean providerHealthy,
        List<CacheStatusType> caches) {

    public record CacheStatusType(String namespace, long size, @JsonProperty("max_size") long maxSize,
            @JsonProperty("hit_count") long hitCount, @JsonProperty("miss_count") long missCount,
            @JsonProperty("hit_rate") double hitRate, @JsonProperty("eviction_count") long evictionCount) {

        public static CacheStatusType from(CacheStatistics stats) {
            return new CacheStatusType(stats.namespace(), stats.size(), stats.maxSize(), stats.hitCount(),
                    stats.missCount(), stats.hitRate(), stats.evictionCount());
        }
    }
}
