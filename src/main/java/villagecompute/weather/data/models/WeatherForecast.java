/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Multi-day forecast for a location, ordered ascending by date.
 */
public record WeatherForecast(Location location, List<DailyForecast> forecasts) {

    public WeatherForecast {
        Objects.requireNonNull(location, "location is required");
        forecasts = forecasts == null ? List.of()
                : forecasts.stream().sorted(Comparator.comparing(DailyForecast::date)).toList();
    }

    public boolean isEmpty() {
        return forecasts.isEmpty();
    }

    public Optional<DailyForecast> forDate(LocalDate date) {
        return forecasts.stream().filter(f -> f.date().equals(date)).findFirst();
    }

    /**
     * Keeps at most the first {@code days} entries.
     */
    public WeatherForecast limitDays(int days) {
        if (forecasts.size() <= days) {
            return this;
        }
        return new WeatherForecast(location, forecasts.subList(0, days));
    }
}
