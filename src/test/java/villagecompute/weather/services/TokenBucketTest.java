/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.weather.services.TokenBucket.RateLimitStats;
import villagecompute.weather.testing.MutableClock;

/**
 * Unit tests for {@link TokenBucket}.
 */
class TokenBucketTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-15T12:00:00Z");
    }

    @Test
    void testTryConsume_capacityThenRejected() {
        TokenBucket bucket = new TokenBucket("test", 5, Duration.ofMinutes(1), clock);

        for (int i = 0; i < 5; i++) {
            assertTrue(bucket.tryConsume(), "request " + i + " should be allowed");
        }
        assertFalse(bucket.tryConsume());
        assertEquals(0, bucket.remaining());
    }

    @Test
    void testRefill_afterWindowRestoresCapacity() {
        TokenBucket bucket = new TokenBucket("test", 10, Duration.ofMinutes(10), clock);
        for (int i = 0; i < 10; i++) {
            bucket.tryConsume();
        }
        assertFalse(bucket.canConsume());

        clock.advance(Duration.ofMinutes(11));

        assertEquals(10, bucket.remaining());
    }

    @Test
    void testRefill_neverExceedsCapacity() {
        TokenBucket bucket = new TokenBucket("test", 3, Duration.ofSeconds(3), clock);

        clock.advance(Duration.ofHours(5));

        assertEquals(3, bucket.remaining());
    }

    @Test
    void testRefill_proportionalToElapsedTime() {
        // one token per second
        TokenBucket bucket = new TokenBucket("test", 60, Duration.ofMinutes(1), clock);
        for (int i = 0; i < 60; i++) {
            bucket.tryConsume();
        }

        clock.advance(Duration.ofMillis(2500));

        assertEquals(2, bucket.remaining());
    }

    @Test
    void testCanConsume_doesNotTakeToken() {
        TokenBucket bucket = new TokenBucket("test", 1, Duration.ofMinutes(1), clock);

        assertTrue(bucket.canConsume());
        assertTrue(bucket.canConsume());
        assertEquals(1, bucket.remaining());
    }

    @Test
    void testTimeUntilAvailable() {
        TokenBucket bucket = new TokenBucket("test", 60, Duration.ofMinutes(1), clock);
        assertEquals(Duration.ZERO, bucket.timeUntilAvailable());
        for (int i = 0; i < 60; i++) {
            bucket.tryConsume();
        }

        assertEquals(1, bucket.timeUntilAvailable().toSeconds());
    }

    @Test
    void testTimeUntilReset_fullWhenUnused() {
        TokenBucket bucket = new TokenBucket("test", 60, Duration.ofMinutes(1), clock);
        assertEquals(Duration.ZERO, bucket.timeUntilReset());

        bucket.tryConsume();
        bucket.tryConsume();

        assertEquals(2, bucket.timeUntilReset().toSeconds());
    }

    @Test
    void testStats_countsConsumedAndRejected() {
        TokenBucket bucket = new TokenBucket("global", 2, Duration.ofDays(1), clock);
        bucket.tryConsume();
        bucket.tryConsume();
        bucket.tryConsume();

        RateLimitStats stats = bucket.stats();

        assertEquals("global", stats.name());
        assertEquals(2, stats.maxRequests());
        assertEquals(0, stats.remainingRequests());
        assertEquals(2, stats.consumedRequests());
        assertEquals(1, stats.rejectedRequests());
        assertEquals(TokenBucket.ALGORITHM, stats.algorithm());
        Instant fullAgain = Instant.parse("2025-01-16T12:00:00Z");
        assertFalse(stats.resetTime().isBefore(fullAgain));
        assertTrue(stats.resetTime().isBefore(fullAgain.plusSeconds(1)));
    }

    @Test
    void testConstructor_rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket("x", 0, Duration.ofMinutes(1), clock));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket("x", 1, Duration.ZERO, clock));
    }

    @Test
    void testTryConsume_concurrentCallersNeverExceedCapacity() throws Exception {
        int capacity = 100;
        TokenBucket bucket = new TokenBucket("concurrent", capacity, Duration.ofDays(1), clock);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < 500; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    if (bucket.tryConsume()) {
                        granted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(capacity, granted.get());
        assertEquals(0, bucket.remaining());
    }
}
