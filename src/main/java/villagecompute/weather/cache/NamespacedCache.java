/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import villagecompute.weather.observability.ObservabilityMetrics;

/**
 * In-memory TTL cache for one kind of data.
 *
 * <p>
 * Every instance owns a namespace which prefixes its keys ({@code namespace + "_" + key}), so the weather, forecast
 * and location caches never collide even when callers use the same coordinate string as key.
 *
 * <h2>Contract</h2>
 * <ul>
 * <li>TTL is fixed per instance and measured from the last write. An entry is gone once its age reaches the TTL
 * ({@code age >= ttl}, Caffeine's rule), one ticker nanosecond before a strict {@code age > ttl} reading would drop
 * it</li>
 * <li>Expired entries are never returned, even before Caffeine sweeps them</li>
 * <li>The entry count is bounded by {@code maxSize}; eviction order is Caffeine's (W-TinyLFU)</li>
 * <li>{@link #getOrLoad} never stores a null result or a result whose loader threw</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> backed by a Caffeine cache; safe for concurrent readers and writers.
 *
 * @param <V>
 *            cached value type
 */
public class NamespacedCache<V> {

    private static final Logger LOG = Logger.getLogger(NamespacedCache.class);

    private final String namespace;
    private final Duration ttl;
    private final long maxSize;
    private final ObservabilityMetrics metrics;
    private final Cache<String, V> cache;

    public NamespacedCache(String namespace, Duration ttl, long maxSize, ObservabilityMetrics metrics) {
        this(namespace, ttl, maxSize, metrics, Ticker.systemTicker());
    }

    public NamespacedCache(String namespace, Duration ttl, long maxSize, ObservabilityMetrics metrics, Ticker ticker) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.namespace = namespace;
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.cache = Caffeine.newBuilder().expireAfterWrite(ttl).maximumSize(maxSize)
                .ticker(Objects.requireNonNull(ticker, "ticker is required")).recordStats().build();
    }

    /**
     * @return the cached value, or empty if absent or expired
     */
    public Optional<V> get(String key) {
        V value = cache.getIfPresent(namespacedKey(key));
        boolean hit = value != null;
        metrics.incrementCacheRequest(namespace, hit);
        LOG.debugf("Cache %s for %s_%s", hit ? "hit" : "miss", namespace, key);
        return Optional.ofNullable(value);
    }

    /**
     * Stores a value with a fresh TTL, replacing any existing entry.
     */
    public void put(String key, V value) {
        Objects.requireNonNull(value, "value is required");
        cache.put(namespacedKey(key), value);
    }

    /**
     * Returns the cached value or loads, stores and returns it.
     *
     * <p>
     * The loader runs outside Caffeine's compute lock because it performs network I/O. Concurrent misses for the same
     * key may therefore each call the loader; the last write wins. A null result is returned as empty and not cached;
     * an exception from the loader propagates and nothing is cached.
     */
    public Optional<V> getOrLoad(String key, Supplier<V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached;
        }

        V loaded = loader.get();
        if (loaded == null) {
            LOG.debugf("Loader returned nothing for %s_%s, not caching", namespace, key);
            return Optional.empty();
        }
        put(key, loaded);
        return Optional.of(loaded);
    }

    /**
     * Like {@link #getOrLoad(String, Supplier)} for loaders that report absence with {@link Optional}.
     */
    public Optional<V> getOrLoadOptional(String key, Supplier<Optional<V>> loader) {
        return getOrLoad(key, () -> loader.get().orElse(null));
    }

    public void invalidate(String key) {
        cache.invalidate(namespacedKey(key));
    }

    public void invalidateAll() {
        cache.invalidateAll();
        LOG.infof("Invalidated all entries in cache namespace %s", namespace);
    }

    /**
     * @return approximate live entry count after pending expirations are applied
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStatistics stats() {
        CacheStats stats = cache.stats();
        return new CacheStatistics(namespace, stats.hitCount(), stats.missCount(), stats.hitRate(), size(), maxSize,
                stats.evictionCount());
    }

    public String getNamespace() {
        return namespace;
    }

    public Duration getTtl() {
        return ttl;
    }

    private String namespacedKey(String key) {
        Objects.requireNonNull(key, "key is required");
        return namespace + "_" + key;
    }
}
