/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of a forecast.
 */
public record DailyForecast(LocalDate date, Temperature temperatureMin, Temperature temperatureMax, String description,
        int humidity, double windSpeed, int pressure) {

    public DailyForecast {
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(temperatureMin, "temperatureMin is required");
        Objects.requireNonNull(temperatureMax, "temperatureMax is required");
        Objects.requireNonNull(description, "description is required");
    }
}
