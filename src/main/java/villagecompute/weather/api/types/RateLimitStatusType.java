/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.weather.services.TokenBucket.RateLimitStats;

/**
 * Global upstream budget status.
 */
public record RateLimitStatusType(@JsonProperty("max_requests") int maxRequests,
        @JsonProperty("remaining_requests") int remainingRequests,
        @JsonProperty("consumed_requests") long consumedRequests,
        @JsonProperty("rejected_requests") long rejectedRequests, @JsonProperty("reset_time") String resetTime,
        String algorithm, ResponseMetadataType metadata) {

    public static RateLimitStatusType from(RateLimitStats stats, ResponseMetadataType metadata) {
        return new RateLimitStatusType(stats.maxRequests(), stats.remainingRequests(), stats.consumedRequests(),
                stats.rejectedRequests(), stats.resetTime().toString(), stats.algorithm(), metadata);
    }
}
