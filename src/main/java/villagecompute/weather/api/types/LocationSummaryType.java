/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.weather.data.models.LocationSummary;

/**
 * A favorite location expected to be warmer than the requested threshold tomorrow.
 *
 * @param locationId
 *            coordinate string, e.g. "51.5074,-0.1278"
 * @param locationName
 *            display name of the location
 * @param country
 *            ISO country code, or "Unknown"
 * @param tomorrowMaxTemperature
 *            tomorrow's maximum temperature in {@code temperatureUnit}
 * @param temperatureUnit
 *            "celsius" or "fahrenheit"
 * @param weatherDescription
 *            tomorrow's weather description
 */
@Schema(
        description = "Location whose maximum temperature tomorrow exceeds the threshold")
public record LocationSummaryType(@Schema(
        description = "Coordinate string identifying the location",
        example = "51.5074,-0.1278",
        required = true) @JsonProperty("location_id") @NotBlank String locationId,

        @Schema(
                description = "Display name",
                example = "London") @JsonProperty("location_name") String locationName,

        @Schema(
                description = "Country code",
                example = "GB") String country,

        @Schema(
                description = "Tomorrow's maximum temperature in the requested unit",
                example = "25.0",
                required = true) @JsonProperty("tomorrow_max_temperature") double tomorrowMaxTemperature,

        @Schema(
                description = "Unit of tomorrow_max_temperature",
                example = "celsius",
                required = true) @JsonProperty("temperature_unit") @NotBlank String temperatureUnit,

        @Schema(
                description = "Tomorrow's weather description",
                example = "light rain") @JsonProperty("weather_description") String weatherDescription) {

    public static LocationSummaryType from(LocationSummary summary) {
        return new LocationSummaryType(summary.locationId(), summary.locationName(), summary.country(),
                summary.tomorrowMaxTemperature(), summary.temperatureUnit().getValue(), summary.weatherDescription());
    }
}
