/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

import villagecompute.weather.services.RateLimitService.Layer;

/**
 * Exception thrown when a rate limit bucket has no tokens left.
 *
 * <p>
 * Unlike per-location data failures, this aborts the whole request. The rejecting {@link Layer} lets callers tell a
 * quota exhaustion apart from burst protection.
 */
public class RateLimitExceededException extends RuntimeException {

    private final Layer layer;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message) {
        this(message, Layer.GLOBAL, 0);
    }

    public RateLimitExceededException(String message, Layer layer, long retryAfterSeconds) {
        super(message);
        this.layer = layer;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RateLimitExceededException(String message, Throwable cause) {
        super(message, cause);
        this.layer = Layer.GLOBAL;
        this.retryAfterSeconds = 0;
    }

    public Layer getLayer() {
        return layer;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
