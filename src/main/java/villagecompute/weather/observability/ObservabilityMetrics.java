/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registers and updates the service's custom Micrometer metrics.
 *
 * <p>
 * All metrics follow the naming convention {@code weather_<category>_<metric>}:
 * <ul>
 * <li><b>Counters:</b> {@code weather_cache_requests_total{namespace,result}} - cache hits and misses</li>
 * <li><b>Counters:</b> {@code weather_provider_calls_total{operation,status}} - upstream provider outcomes</li>
 * <li><b>Counters:</b> {@code weather_rate_limit_checks_total{layer,result}} - rate limit decisions</li>
 * <li><b>Counters:</b> {@code weather_summary_locations_total{outcome}} - per-location summary outcomes</li>
 * <li><b>Gauges:</b> {@code weather_rate_limit_global_remaining} - tokens left in the global daily bucket</li>
 * </ul>
 *
 * <p>
 * HTTP server metrics are exposed by Quarkus under {@code http_server_*}. Everything is scraped at {@code /q/metrics}.
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    private final MeterRegistry registry;

    /**
     * Counters indexed by metric name plus tag values, created lazily on first use.
     */
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    @Inject
    public ObservabilityMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
    }

    /**
     * Registers the global remaining-tokens gauge. The supplier is sampled on every scrape.
     */
    public void registerGlobalRemainingGauge(Supplier<Number> remaining) {
        Gauge.builder("weather_rate_limit_global_remaining", remaining)
                .description("Requests left in the global daily upstream budget").register(registry);
        LOG.debug("Registered gauge: weather_rate_limit_global_remaining");
    }

    /**
     * @param namespace
     *            cache namespace ("weather", "forecast", "location")
     * @param hit
     *            true on a cache hit
     */
    public void incrementCacheRequest(String namespace, boolean hit) {
        increment("weather_cache_requests_total", "Cache lookups by namespace and result",
                List.of(Tag.of("namespace", namespace), Tag.of("result", hit ? "hit" : "miss")));
    }

    /**
     * @param operation
     *            provider operation ("current", "forecast", "location", "search")
     * @param status
     *            "success" or a provider error type in lower case
     */
    public void incrementProviderCall(String operation, String status) {
        increment("weather_provider_calls_total", "Upstream weather provider calls by operation and outcome",
                List.of(Tag.of("operation", operation), Tag.of("status", status)));
    }

    /**
     * @param layer
     *            rate limit layer ("global", "per_client", "burst")
     * @param allowed
     *            true if the request was admitted
     */
    public void incrementRateLimitCheck(String layer, boolean allowed) {
        increment("weather_rate_limit_checks_total", "Rate limit checks by layer and result",
                List.of(Tag.of("layer", layer), Tag.of("result", allowed ? "allowed" : "denied")));
    }

    /**
     * @param outcome
     *            "included", "excluded" or "failed"
     */
    public void incrementSummaryLocation(String outcome) {
        increment("weather_summary_locations_total", "Locations processed by summary requests",
                List.of(Tag.of("outcome", outcome)));
    }

    private void increment(String name, String description, List<Tag> tags) {
        StringBuilder key = new StringBuilder(name);
        for (Tag tag : tags) {
            key.append(':').append(tag.getValue());
        }
        Counter counter = counters.computeIfAbsent(key.toString(),
                k -> Counter.builder(name).description(description).tags(tags).register(registry));
        counter.increment();
    }
}
