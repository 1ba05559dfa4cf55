/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.integration.weather;

import java.util.List;
import java.util.Optional;

import villagecompute.weather.data.models.Location;
import villagecompute.weather.data.models.WeatherData;
import villagecompute.weather.data.models.WeatherForecast;

/**
 * Upstream weather data source.
 *
 * <p>
 * Expected failure modes (network trouble, upstream quota, bad key, unknown location) are reported as a
 * {@link WeatherResult.Failure}; implementations do not throw for them. Every network call is bounded by the client's
 * configured timeout, and a timeout is reported as {@link WeatherProviderError.ErrorType#NETWORK_ERROR}.
 */
public interface WeatherProvider {

    WeatherResult<WeatherData> getCurrentWeather(double latitude, double longitude);

    /**
     * @param days
     *            number of daily entries wanted
     * @return daily forecasts ascending by date
     */
    WeatherResult<WeatherForecast> getForecast(double latitude, double longitude, int days);

    /**
     * Resolves display metadata (name, country) for a coordinate pair.
     */
    WeatherResult<Location> getLocationDetails(double latitude, double longitude);

    /**
     * Finds locations by free-text name.
     */
    WeatherResult<List<Location>> searchLocations(String query);

    /**
     * @return true if the upstream answered a trivial request successfully
     */
    boolean isHealthy();

    /**
     * @return upstream quota information, if the provider publishes one
     */
    Optional<RateLimitInfo> rateLimitInfo();

    String providerName();
}
