/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.jboss.logging.Logger;
import villagecompute.weather.observability.LoggingConfig;
import villagecompute.weather.observability.ObservabilityMetrics;
import villagecompute.weather.services.TokenBucket.RateLimitStats;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Layered token-bucket rate limiting for upstream weather calls.
 *
 * <p>
 * Three independent layers protect the upstream quota:
 * <ul>
 * <li><b>global:</b> one daily bucket shared by every caller; one token per upstream-bound location</li>
 * <li><b>per_client:</b> hourly bucket per client key (IP address)</li>
 * <li><b>burst:</b> short-window bucket per client key</li>
 * </ul>
 *
 * <p>
 * A client request is admitted only if both client layers admit it. The first layer to reject determines the reason,
 * so callers can tell a plain rate limit from burst protection.
 *
 * <p>
 * <b>Thread Safety:</b> buckets serialize their own state; the two client buckets are checked and consumed together
 * under the client's monitor so a rejection by one layer never spends a token from the other.
 *
 * <p>
 * State is in-memory only and resets to full buckets on restart.
 */
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    private static final Duration CLIENT_WINDOW = Duration.ofHours(1);
    private static final Duration GLOBAL_WINDOW = Duration.ofDays(1);

    public static final long DEFAULT_MAX_TRACKED_CLIENTS = 100_000;

    private final TokenBucket globalBucket;
    private final int perClientHourlyLimit;
    private final int burstLimit;
    private final Duration burstWindow;
    private final Clock clock;
    private final ObservabilityMetrics metrics;

    /**
     * Client buckets (client key -> buckets), expired after an hour idle and bounded by {@code maxTrackedClients}.
     *
     * <p>
     * When more distinct clients are active than the bound allows, Caffeine evicts some of them and an evicted client
     * comes back with full buckets. A caller that fetched a pair just before it expired may also finish on the old
     * pair while a concurrent caller already uses a fresh one. Both only ever admit more, never less, and the global
     * bucket still caps upstream volume.
     */
    private final Cache<String, ClientBuckets> clientBuckets;

    /**
     * Rate limit layers.
     */
    public enum Layer {
        GLOBAL("global"), PER_CLIENT("per_client"), BURST("burst");

        private final String value;

        Layer(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    /**
     * Rate limit check result.
     *
     * @param allowed
     *            true if the request is admitted
     * @param layer
     *            layer that decided; for admitted client checks the per-client layer
     * @param limit
     *            capacity of the deciding layer
     * @param remaining
     *            tokens left in the deciding layer
     * @param retryAfterSeconds
     *            seconds until the deciding layer admits again; zero when allowed
     */
    public record RateLimitResult(boolean allowed, Layer layer, int limit, int remaining, long retryAfterSeconds) {

        public static RateLimitResult allowed(Layer layer, int limit, int remaining) {
            return new RateLimitResult(true, layer, limit, remaining, 0);
        }

        public static RateLimitResult denied(Layer layer, int limit, long retryAfterSeconds) {
            return new RateLimitResult(false, layer, limit, 0, retryAfterSeconds);
        }
    }

    private record ClientBuckets(TokenBucket hourly, TokenBucket burst) {
    }

    public RateLimitService(int globalDailyLimit, int perClientHourlyLimit, int burstLimit, Duration burstWindow,
            Clock clock, ObservabilityMetrics metrics) {
        this(globalDailyLimit, perClientHourlyLimit, burstLimit, burstWindow, DEFAULT_MAX_TRACKED_CLIENTS, clock,
                metrics);
    }

    public RateLimitService(int globalDailyLimit, int perClientHourlyLimit, int burstLimit, Duration burstWindow,
            long maxTrackedClients, Clock clock, ObservabilityMetrics metrics) {
        if (maxTrackedClients <= 0) {
            throw new IllegalArgumentException("maxTrackedClients must be positive");
        }
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.perClientHourlyLimit = perClientHourlyLimit;
        this.burstLimit = burstLimit;
        this.burstWindow = Objects.requireNonNull(burstWindow, "burstWindow is required");
        this.globalBucket = new TokenBucket("global", globalDailyLimit, GLOBAL_WINDOW, clock);
        this.clientBuckets = Caffeine.newBuilder().expireAfterAccess(CLIENT_WINDOW).maximumSize(maxTrackedClients)
                .ticker(clockTicker(clock)).build();

        metrics.registerGlobalRemainingGauge(globalBucket::remaining);
        LOG.infof("Rate limits configured: global=%d/day perClient=%d/hour burst=%d/%s trackedClients<=%d",
                globalDailyLimit, perClientHourlyLimit, burstLimit, burstWindow, maxTrackedClients);
    }

    /**
     * Takes one token from the global daily bucket.
     *
     * @return the decision; a denial carries the seconds until the next token
     */
    public RateLimitResult checkGlobal() {
        if (globalBucket.tryConsume()) {
            metrics.incrementRateLimitCheck(Layer.GLOBAL.getValue(), true);
            return RateLimitResult.allowed(Layer.GLOBAL, globalBucket.getCapacity(), globalBucket.remaining());
        }

        long retryAfter = toRetrySeconds(globalBucket.timeUntilAvailable());
        metrics.incrementRateLimitCheck(Layer.GLOBAL.getValue(), false);
        LoggingConfig.setRateLimitBucket(Layer.GLOBAL.getValue());
        LOG.warnf("Global rate limit exhausted: limit=%d retryAfter=%ds", globalBucket.getCapacity(), retryAfter);
        return RateLimitResult.denied(Layer.GLOBAL, globalBucket.getCapacity(), retryAfter);
    }

    /**
     * Applies the per-client hourly and burst layers for one request.
     *
     * @param clientKey
     *            client identifier, normally the caller's IP address
     * @return the decision from the first rejecting layer, or an allowed result describing the hourly layer
     */
    public RateLimitResult checkClient(String clientKey) {
        Objects.requireNonNull(clientKey, "clientKey is required");
        ClientBuckets buckets = clientBuckets.get(clientKey, this::newClientBuckets);

        synchronized (buckets) {
            if (!buckets.hourly().canConsume()) {
                return deny(Layer.PER_CLIENT, buckets.hourly(), clientKey);
            }
            if (!buckets.burst().canConsume()) {
                return deny(Layer.BURST, buckets.burst(), clientKey);
            }
            buckets.hourly().tryConsume();
            buckets.burst().tryConsume();
        }

        LoggingConfig.setRateLimitBucket(Layer.PER_CLIENT.getValue() + ":" + clientKey);
        metrics.incrementRateLimitCheck(Layer.PER_CLIENT.getValue(), true);
        metrics.incrementRateLimitCheck(Layer.BURST.getValue(), true);
        return RateLimitResult.allowed(Layer.PER_CLIENT, perClientHourlyLimit, buckets.hourly().remaining());
    }

    public int getGlobalRemaining() {
        return globalBucket.remaining();
    }

    long trackedClients() {
        clientBuckets.cleanUp();
        return clientBuckets.estimatedSize();
    }

    public RateLimitStats getGlobalStats() {
        return globalBucket.stats();
    }

    private RateLimitResult deny(Layer layer, TokenBucket bucket, String clientKey) {
        long retryAfter = toRetrySeconds(bucket.timeUntilAvailable());
        String bucketKey = layer.getValue() + ":" + clientKey;
        LoggingConfig.setRateLimitBucket(bucketKey);
        metrics.incrementRateLimitCheck(layer.getValue(), false);
        LOG.warnf("Rate limit exceeded: layer=%s client=%s limit=%d retryAfter=%ds", layer.getValue(), clientKey,
                bucket.getCapacity(), retryAfter);
        return RateLimitResult.denied(layer, bucket.getCapacity(), retryAfter);
    }

    private ClientBuckets newClientBuckets(String clientKey) {
        return new ClientBuckets(
                new TokenBucket(Layer.PER_CLIENT.getValue() + ":" + clientKey, perClientHourlyLimit, CLIENT_WINDOW,
                        clock),
                new TokenBucket(Layer.BURST.getValue() + ":" + clientKey, burstLimit, burstWindow, clock));
    }

    private static long toRetrySeconds(Duration wait) {
        long millis = wait.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    /**
     * Drives Caffeine expiry from the same clock as the buckets.
     */
    private static Ticker clockTicker(Clock clock) {
        return () -> clock.millis() * 1_000_000L;
    }
}
