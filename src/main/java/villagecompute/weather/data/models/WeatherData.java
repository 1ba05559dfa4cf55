/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import java.time.Instant;
import java.util.Objects;

/**
 * Current conditions at a location.
 *
 * @param location
 *            where the observation applies
 * @param timestamp
 *            observation time reported by the provider
 * @param temperature
 *            current temperature
 * @param description
 *            human-readable conditions
 * @param humidity
 *            relative humidity percentage (0-100)
 * @param windSpeed
 *            wind speed in m/s
 * @param pressure
 *            atmospheric pressure in hPa
 */
public record WeatherData(Location location, Instant timestamp, Temperature temperature, String description,
        int humidity, double windSpeed, int pressure) {

    public WeatherData {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(temperature, "temperature is required");
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Weather description cannot be blank");
        }
        if (humidity < 0 || humidity > 100) {
            throw new IllegalArgumentException("Humidity must be between 0 and 100 percent");
        }
        if (windSpeed < 0) {
            throw new IllegalArgumentException("Wind speed cannot be negative");
        }
        if (pressure <= 0) {
            throw new IllegalArgumentException("Pressure must be positive");
        }
    }
}
