/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.integration.weather;

/**
 * Published quota of an upstream provider.
 *
 * @param maxRequestsPerDay
 *            daily call allowance
 * @param requestsPerMinute
 *            per-minute call allowance
 */
public record RateLimitInfo(int maxRequestsPerDay, int requestsPerMinute) {
}
