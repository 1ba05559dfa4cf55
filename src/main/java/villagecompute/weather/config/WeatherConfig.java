/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.config;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalDouble;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import villagecompute.weather.cache.NamespacedCache;
import villagecompute.weather.data.repositories.WeatherRepository;
import villagecompute.weather.integration.weather.FailoverWeatherProvider;
import villagecompute.weather.integration.weather.OpenMeteoClient;
import villagecompute.weather.integration.weather.OpenWeatherMapClient;
import villagecompute.weather.integration.weather.WeatherProvider;
import villagecompute.weather.observability.ObservabilityMetrics;
import villagecompute.weather.services.RateLimitService;
import villagecompute.weather.services.TimezoneApproximator;
import villagecompute.weather.services.WeatherRequestValidator;
import villagecompute.weather.services.WeatherSummaryService;

/**
 * Composition root: builds the provider, caches, rate limiter and services from configuration.
 *
 * <p>
 * Core classes take their settings through constructors and know nothing about CDI; this class is the only place
 * they are wired together. All produced beans are singletons, so the caches and rate limit buckets are shared by
 * every request.
 *
 * <p>
 * <b>Configuration (application.yaml):</b>
 * <ul>
 * <li>{@code weather.provider.*} - provider selection and fallback</li>
 * <li>{@code weather.openweathermap.*}, {@code weather.open-meteo.*} - upstream endpoints and timeouts</li>
 * <li>{@code weather.cache.*} - TTL per namespace and entry bound</li>
 * <li>{@code weather.rate-limit.*} - global, per-client and burst budgets</li>
 * <li>{@code weather.api.*} - request limits and forecast length</li>
 * </ul>
 */
@ApplicationScoped
public class WeatherConfig {

    private static final Logger LOG = Logger.getLogger(WeatherConfig.class);

    public static final String PROVIDER_OPENWEATHERMAP = "openweathermap";
    public static final String PROVIDER_OPEN_METEO = "open-meteo";

    @ConfigProperty(
            name = "weather.provider.type",
            defaultValue = PROVIDER_OPENWEATHERMAP)
    String providerType;

    @ConfigProperty(
            name = "weather.provider.fallback-enabled",
            defaultValue = "true")
    boolean fallbackEnabled;

    @ConfigProperty(
            name = "weather.openweathermap.api-key")
    Optional<String> openWeatherMapApiKey;

    @ConfigProperty(
            name = "weather.openweathermap.base-url",
            defaultValue = "https://api.openweathermap.org")
    String openWeatherMapBaseUrl;

    @ConfigProperty(
            name = "weather.openweathermap.timeout",
            defaultValue = "PT10S")
    Duration openWeatherMapTimeout;

    @ConfigProperty(
            name = "weather.open-meteo.base-url",
            defaultValue = "https://api.open-meteo.com")
    String openMeteoBaseUrl;

    @ConfigProperty(
            name = "weather.open-meteo.geocoding-url",
            defaultValue = "https://geocoding-api.open-meteo.com")
    String openMeteoGeocodingUrl;

    @ConfigProperty(
            name = "weather.open-meteo.timeout",
            defaultValue = "PT10S")
    Duration openMeteoTimeout;

    @ConfigProperty(
            name = "weather.cache.weather-ttl",
            defaultValue = "PT15M")
    Duration weatherTtl;

    @ConfigProperty(
            name = "weather.cache.forecast-ttl",
            defaultValue = "PT60M")
    Duration forecastTtl;

    @ConfigProperty(
            name = "weather.cache.location-ttl",
            defaultValue = "PT24H")
    Duration locationTtl;

    @ConfigProperty(
            name = "weather.cache.max-size",
            defaultValue = "1000")
    long cacheMaxSize;

    @ConfigProperty(
            name = "weather.rate-limit.global-daily-limit",
            defaultValue = "1000")
    int globalDailyLimit;

    @ConfigProperty(
            name = "weather.rate-limit.per-client-hourly-limit",
            defaultValue = "100")
    int perClientHourlyLimit;

    @ConfigProperty(
            name = "weather.rate-limit.burst-limit",
            defaultValue = "20")
    int burstLimit;

    @ConfigProperty(
            name = "weather.rate-limit.burst-window",
            defaultValue = "PT5M")
    Duration burstWindow;

    @ConfigProperty(
            name = "weather.rate-limit.max-tracked-clients",
            defaultValue = "100000")
    long maxTrackedClients;

    @ConfigProperty(
            name = "weather.api.default-forecast-days",
            defaultValue = "5")
    int forecastDays;

    @ConfigProperty(
            name = "weather.api.max-locations",
            defaultValue = "50")
    int maxLocations;

    @ConfigProperty(
            name = "weather.api.max-temperature-celsius")
    OptionalDouble maxTemperatureCelsius;

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    WeatherProvider weatherProvider(ObjectMapper objectMapper) {
        OpenMeteoClient openMeteo = new OpenMeteoClient(objectMapper, openMeteoBaseUrl, openMeteoGeocodingUrl,
                openMeteoTimeout);

        if (PROVIDER_OPEN_METEO.equalsIgnoreCase(providerType)) {
            LOG.info("Using Open-Meteo weather provider");
            return openMeteo;
        }
        if (!PROVIDER_OPENWEATHERMAP.equalsIgnoreCase(providerType)) {
            throw new IllegalStateException("Unsupported weather.provider.type: " + providerType);
        }
        // an empty env expansion arrives as Optional.empty()
        String apiKey = openWeatherMapApiKey.filter(key -> !key.isBlank()).orElse(null);
        if (apiKey == null) {
            LOG.warn("weather.openweathermap.api-key is not set, using Open-Meteo weather provider");
            return openMeteo;
        }

        OpenWeatherMapClient openWeatherMap = new OpenWeatherMapClient(objectMapper, openWeatherMapBaseUrl, apiKey,
                openWeatherMapTimeout);
        if (fallbackEnabled) {
            LOG.info("Using OpenWeatherMap weather provider with Open-Meteo fallback");
            return new FailoverWeatherProvider(openWeatherMap, openMeteo);
        }
        LOG.info("Using OpenWeatherMap weather provider");
        return openWeatherMap;
    }

    @Produces
    @Singleton
    WeatherRepository weatherRepository(WeatherProvider provider, ObservabilityMetrics metrics, Tracer tracer) {
        LOG.infof("Cache TTLs: weather=%s forecast=%s location=%s maxSize=%d", weatherTtl, forecastTtl, locationTtl,
                cacheMaxSize);
        return new WeatherRepository(provider, new NamespacedCache<>("weather", weatherTtl, cacheMaxSize, metrics),
                new NamespacedCache<>("forecast", forecastTtl, cacheMaxSize, metrics),
                new NamespacedCache<>("location", locationTtl, cacheMaxSize, metrics), metrics, tracer);
    }

    @Produces
    @Singleton
    RateLimitService rateLimitService(Clock clock, ObservabilityMetrics metrics) {
        return new RateLimitService(globalDailyLimit, perClientHourlyLimit, burstLimit, burstWindow, maxTrackedClients,
                clock, metrics);
    }

    @Produces
    @Singleton
    WeatherSummaryService weatherSummaryService(WeatherRepository repository, RateLimitService rateLimitService,
            Clock clock, ObservabilityMetrics metrics, Tracer tracer) {
        return new WeatherSummaryService(repository, rateLimitService, new TimezoneApproximator(clock),
                new WeatherRequestValidator(maxLocations, maxTemperatureCelsius), metrics, tracer, clock,
                forecastDays);
    }
}
