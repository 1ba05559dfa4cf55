/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.integration.weather;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.jboss.logging.Logger;

import villagecompute.weather.data.models.Location;
import villagecompute.weather.data.models.WeatherData;
import villagecompute.weather.data.models.WeatherForecast;

/**
 * Routes calls to a primary provider and sends the same call once to a fallback provider when the primary fails for
 * a provider-specific reason (outage, quota, key, network). Not-found and invalid-request failures are returned as-is
 * because the fallback would answer the same.
 *
 * <p>
 * The fallback is a different upstream, not a retry of the primary; each call reaches each provider at most once.
 */
public class FailoverWeatherProvider implements WeatherProvider {

    private static final Logger LOG = Logger.getLogger(FailoverWeatherProvider.class);

    private final WeatherProvider primary;
    private final WeatherProvider fallback;

    public FailoverWeatherProvider(WeatherProvider primary, WeatherProvider fallback) {
        this.primary = Objects.requireNonNull(primary, "primary is required");
        this.fallback = Objects.requireNonNull(fallback, "fallback is required");
    }

    @Override
    public WeatherResult<WeatherData> getCurrentWeather(double latitude, double longitude) {
        return call("current weather", p -> p.getCurrentWeather(latitude, longitude));
    }

    @Override
    public WeatherResult<WeatherForecast> getForecast(double latitude, double longitude, int days) {
        return call("forecast", p -> p.getForecast(latitude, longitude, days));
    }

    @Override
    public WeatherResult<Location> getLocationDetails(double latitude, double longitude) {
        return call("location details", p -> p.getLocationDetails(latitude, longitude));
    }

    @Override
    public WeatherResult<List<Location>> searchLocations(String query) {
        return call("location search", p -> p.searchLocations(query));
    }

    /**
     * Healthy while either provider can serve.
     */
    @Override
    public boolean isHealthy() {
        return primary.isHealthy() || fallback.isHealthy();
    }

    @Override
    public Optional<RateLimitInfo> rateLimitInfo() {
        return primary.rateLimitInfo();
    }

    @Override
    public String providerName() {
        return primary.providerName() + "+" + fallback.providerName();
    }

    private <T> WeatherResult<T> call(String operation, Function<WeatherProvider, WeatherResult<T>> request) {
        WeatherResult<T> result = request.apply(primary);
        if (!(result instanceof WeatherResult.Failure<T> failure) || !failure.reason().type().isProviderSpecific()) {
            return result;
        }

        LOG.warnf("%s %s failed (%s: %s), falling back to %s", primary.providerName(), operation,
                failure.reason().type(), failure.reason().message(), fallback.providerName());
        WeatherResult<T> fallbackResult = request.apply(fallback);
        if (fallbackResult.isFailure()) {
            LOG.warnf("Fallback %s %s also failed: %s", fallback.providerName(), operation,
                    fallbackResult.error().map(WeatherProviderError::message).orElse("unknown"));
        }
        return fallbackResult;
    }
}
