/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

/**
 * A resolved location together with its multi-day forecast.
 */
public record LocationWeatherDetails(Location location, WeatherForecast forecast) {
}
