/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.weather.data.models.DailyForecast;

/**
 * One forecast day. Temperatures are in Celsius.
 *
 * @param date
 *            ISO 8601 date
 * @param temperatureMin
 *            daily minimum in Celsius
 * @param temperatureMax
 *            daily maximum in Celsius
 * @param description
 *            weather description
 * @param humidity
 *            mean relative humidity percentage
 * @param windSpeed
 *            wind speed in m/s
 * @param pressure
 *            pressure in hPa
 */
@Schema(
        description = "Daily forecast entry (Celsius, m/s, hPa)")
public record DailyForecastType(@Schema(
        description = "ISO 8601 date",
        example = "2025-06-02") String date,

        @Schema(
                description = "Daily minimum in Celsius",
                example = "14.2") @JsonProperty("temperature_min") double temperatureMin,

        @Schema(
                description = "Daily maximum in Celsius",
                example = "25.0") @JsonProperty("temperature_max") double temperatureMax,

        String description, int humidity, @JsonProperty("wind_speed") double windSpeed, int pressure) {

    public static DailyForecastType from(DailyForecast forecast) {
        return new DailyForecastType(forecast.date().toString(), forecast.temperatureMin().toCelsius(),
                forecast.temperatureMax().toCelsius(), forecast.description(), forecast.humidity(),
                forecast.windSpeed(), forecast.pressure());
    }
}
