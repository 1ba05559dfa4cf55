/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

/**
 * Token bucket rate limiter.
 *
 * <p>
 * The bucket starts full with {@code capacity} tokens and refills continuously at {@code capacity / window} tokens per
 * millisecond, never exceeding capacity. Each admitted request takes one token.
 *
 * <p>
 * <b>Thread Safety:</b> every operation refills and then acts while holding a single lock, so concurrent callers can
 * never be admitted past the available tokens. No I/O happens under the lock.
 *
 * <p>
 * State lives only in memory; a restart yields a full bucket.
 */
public class TokenBucket {

    private static final Logger LOG = Logger.getLogger(TokenBucket.class);

    public static final String ALGORITHM = "TOKEN_BUCKET";

    private final String name;
    private final int capacity;
    private final Duration window;
    private final double refillRatePerMs;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillMillis;
    private long consumedRequests;
    private long rejectedRequests;

    public TokenBucket(String name, int capacity, Duration window) {
        this(name, capacity, window, Clock.systemUTC());
    }

    public TokenBucket(String name, int capacity, Duration window, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.name = Objects.requireNonNull(name, "name is required");
        this.capacity = capacity;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.refillRatePerMs = (double) capacity / window.toMillis();
        this.tokens = capacity;
        this.lastRefillMillis = clock.millis();
    }

    /**
     * Takes one token if available.
     *
     * @return true if the request is admitted, false if the bucket is empty (state is only refilled in that case)
     */
    public boolean tryConsume() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                consumedRequests++;
                LOG.debugf("Token consumed from bucket %s, remaining=%d", name, (long) Math.floor(tokens));
                return true;
            }
            rejectedRequests++;
            LOG.warnf("Token bucket %s empty, request rejected", name);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports whether a token is available without taking it.
     */
    public boolean canConsume() {
        lock.lock();
        try {
            refill();
            return tokens >= 1.0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return whole tokens currently available
     */
    public int remaining() {
        lock.lock();
        try {
            refill();
            return (int) Math.floor(tokens);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time until the bucket is full again at the current refill rate. Zero when already full; a full window when empty.
     */
    public Duration timeUntilReset() {
        lock.lock();
        try {
            refill();
            return durationUntilFull();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time until at least one token is available. Zero when a request would be admitted now.
     */
    public Duration timeUntilAvailable() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1.0) {
                return Duration.ZERO;
            }
            return Duration.ofMillis((long) Math.ceil((1.0 - tokens) / refillRatePerMs));
        } finally {
            lock.unlock();
        }
    }

    public RateLimitStats stats() {
        lock.lock();
        try {
            refill();
            Instant resetTime = Instant.ofEpochMilli(lastRefillMillis).plus(durationUntilFull());
            return new RateLimitStats(name, capacity, (int) Math.floor(tokens), consumedRequests, rejectedRequests,
                    resetTime, ALGORITHM);
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Adds tokens for the time elapsed since the last refill. Caller must hold the lock.
     */
    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefillMillis;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsed * refillRatePerMs);
        lastRefillMillis = now;
    }

    private Duration durationUntilFull() {
        double missing = capacity - tokens;
        if (missing <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) Math.ceil(missing / refillRatePerMs));
    }

    /**
     * Point-in-time view of a bucket.
     *
     * @param name
     *            bucket name
     * @param maxRequests
     *            bucket capacity
     * @param remainingRequests
     *            whole tokens available
     * @param consumedRequests
     *            admitted requests since startup
     * @param rejectedRequests
     *            rejected requests since startup
     * @param resetTime
     *            instant at which the bucket will be full again
     * @param algorithm
     *            algorithm identifier
     */
    public record RateLimitStats(String name, int maxRequests, int remainingRequests, long consumedRequests,
            long rejectedRequests, Instant resetTime, String algorithm) {
    }
}
