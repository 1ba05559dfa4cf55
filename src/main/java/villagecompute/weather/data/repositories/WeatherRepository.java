/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.repositories;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import villagecompute.weather.cache.CacheStatistics;
import villagecompute.weather.cache.NamespacedCache;
import villagecompute.weather.data.models.Coordinates;
import villagecompute.weather.data.models.Location;
import villagecompute.weather.data.models.ValidationResult;
import villagecompute.weather.data.models.WeatherData;
import villagecompute.weather.data.models.WeatherForecast;
import villagecompute.weather.exceptions.ServiceUnavailableException;
import villagecompute.weather.exceptions.ValidationException;
import villagecompute.weather.integration.weather.WeatherProvider;
import villagecompute.weather.integration.weather.WeatherProviderError;
import villagecompute.weather.integration.weather.WeatherProviderError.ErrorType;
import villagecompute.weather.integration.weather.WeatherResult;
import villagecompute.weather.observability.ObservabilityMetrics;

/**
 * Cache-aside access to weather, forecast and location data.
 *
 * <h2>Lookup Flow</h2>
 * <ol>
 * <li>Look up the namespaced cache ({@code weather_}, {@code forecast_}, {@code location_} + location id)</li>
 * <li>On a hit, return without touching the provider</li>
 * <li>On a miss, call the provider once and cache a non-empty success</li>
 * </ol>
 *
 * <h2>Failure Handling</h2>
 * <ul>
 * <li>{@code LOCATION_NOT_FOUND}: empty result, nothing cached</li>
 * <li>Any other provider failure, or an exception from the provider: {@link ServiceUnavailableException}, nothing
 * cached</li>
 * </ul>
 *
 * <p>
 * This class owns its cache handles and the provider handle. It performs no rate limiting; callers spend their budget
 * before asking.
 */
public class WeatherRepository {

    private static final Logger LOG = Logger.getLogger(WeatherRepository.class);

    private final WeatherProvider provider;
    private final NamespacedCache<WeatherData> weatherCache;
    private final NamespacedCache<WeatherForecast> forecastCache;
    private final NamespacedCache<Location> locationCache;
    private final ObservabilityMetrics metrics;
    private final Tracer tracer;

    /** Outcome of the most recent provider call; no call yet counts as healthy. */
    private volatile boolean providerHealthy = true;

    public WeatherRepository(WeatherProvider provider, NamespacedCache<WeatherData> weatherCache,
            NamespacedCache<WeatherForecast> forecastCache, NamespacedCache<Location> locationCache,
            ObservabilityMetrics metrics, Tracer tracer) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.weatherCache = Objects.requireNonNull(weatherCache, "weatherCache is required");
        this.forecastCache = Objects.requireNonNull(forecastCache, "forecastCache is required");
        this.locationCache = Objects.requireNonNull(locationCache, "locationCache is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    /**
     * @return current conditions, or empty if the provider does not know the location
     * @throws ServiceUnavailableException
     *             if the provider fails
     */
    public Optional<WeatherData> getCurrentWeather(Location location) {
        Objects.requireNonNull(location, "location is required");
        return traced("weather.repository.current", location.id(), weatherCache, location.id(),
                () -> load("current", location.id(),
                        () -> provider.getCurrentWeather(location.latitude(), location.longitude())));
    }

    /**
     * @param days
     *            number of daily entries; part of the cache key
     * @return forecast ascending by date, or empty if the location is unknown or the provider returned no entries
     * @throws ServiceUnavailableException
     *             if the provider fails
     */
    public Optional<WeatherForecast> getForecast(Location location, int days) {
        Objects.requireNonNull(location, "location is required");
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        String key = location.id() + "_" + days;
        return traced("weather.repository.forecast", location.id(), forecastCache, key, () -> {
            WeatherForecast forecast = load("forecast", location.id(),
                    () -> provider.getForecast(location.latitude(), location.longitude(), days));
            if (forecast == null || forecast.isEmpty()) {
                LOG.warnf("Provider returned no forecast entries for %s", location.id());
                return null;
            }
            // provider may echo its own grid point; keep the caller's identity
            return new WeatherForecast(location, forecast.forecasts());
        });
    }

    /**
     * Resolves a location from its coordinate-string id.
     *
     * @param id
     *            "lat,lon"
     * @return the location, or empty if the provider cannot resolve it
     * @throws ValidationException
     *             if the id is not a valid coordinate string
     * @throws ServiceUnavailableException
     *             if the provider fails
     */
    public Optional<Location> getLocationById(String id) {
        ValidationResult<Coordinates> parsed = Coordinates.parse(id);
        if (parsed.isFailure()) {
            throw ValidationException.from(parsed.failure().orElseThrow());
        }
        Coordinates coordinates = parsed.value();
        String key = coordinates.toCoordinateString();

        return traced("weather.repository.location", key, locationCache, key, () -> load("location", key,
                () -> provider.getLocationDetails(coordinates.latitude(), coordinates.longitude())));
    }

    /**
     * Resolves each id independently. Ids that are invalid, unknown or fail upstream are logged and skipped.
     *
     * @return resolved locations in input order
     */
    public List<Location> getLocationsByIds(List<String> ids) {
        List<Location> locations = new ArrayList<>();
        for (String id : ids) {
            try {
                getLocationById(id).ifPresentOrElse(locations::add,
                        () -> LOG.warnf("Location %s not found, skipping", id));
            } catch (ValidationException | ServiceUnavailableException e) {
                LOG.warnf(e, "Failed to resolve location %s, skipping", id);
            }
        }
        return locations;
    }

    /**
     * @return statistics for the weather, forecast and location caches
     */
    public List<CacheStatistics> cacheStatistics() {
        return List.of(weatherCache.stats(), forecastCache.stats(), locationCache.stats());
    }

    /**
     * Drops every cached entry in all three namespaces.
     */
    public void invalidateAll() {
        weatherCache.invalidateAll();
        forecastCache.invalidateAll();
        locationCache.invalidateAll();
    }

    public String providerName() {
        return provider.providerName();
    }

    /**
     * Reports provider health from the outcome of the last lookup that reached the provider. Never calls upstream, so
     * health checks do not spend the upstream quota.
     *
     * @return false if the last provider call failed with anything other than "location not found"
     */
    public boolean isProviderHealthy() {
        return providerHealthy;
    }

    /**
     * Calls the provider and classifies the outcome.
     *
     * @return the payload, or null when the provider reports the location as not found
     */
    private <T> T load(String operation, String locationId, Supplier<WeatherResult<T>> call) {
        WeatherResult<T> result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            providerHealthy = false;
            metrics.incrementProviderCall(operation, "exception");
            throw new ServiceUnavailableException(
                    "Weather provider failed unexpectedly for " + operation + " at " + locationId, e);
        }

        if (result instanceof WeatherResult.Success<T> success) {
            providerHealthy = true;
            metrics.incrementProviderCall(operation, "success");
            return success.value();
        }

        WeatherProviderError error = result.error().orElseThrow();
        metrics.incrementProviderCall(operation, error.type().name().toLowerCase(Locale.ROOT));
        if (error.type() == ErrorType.LOCATION_NOT_FOUND) {
            providerHealthy = true;
            LOG.debugf("Provider %s reports %s not found for %s", provider.providerName(), locationId, operation);
            return null;
        }

        providerHealthy = false;
        LOG.warnf("Provider %s %s failed for %s: %s %s", provider.providerName(), operation, locationId, error.type(),
                error.message());
        throw new ServiceUnavailableException(
                "Weather provider unavailable (" + error.type() + ") for " + operation + " at " + locationId);
    }

    private <T> Optional<T> traced(String spanName, String locationId, NamespacedCache<T> cache, String key,
            Supplier<T> loader) {
        Span span = tracer.spanBuilder(spanName).setAttribute("location_id", locationId)
                .setAttribute("cache_namespace", cache.getNamespace()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            AtomicBoolean loaded = new AtomicBoolean(false);
            Optional<T> value = cache.getOrLoad(key, () -> {
                loaded.set(true);
                LOG.debugf("Cache miss for %s_%s, calling provider %s", cache.getNamespace(), key,
                        provider.providerName());
                return loader.get();
            });
            span.setAttribute("cache_hit", !loaded.get());
            return value;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }
}
