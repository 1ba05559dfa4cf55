/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import java.util.Objects;

/**
 * A favorite location whose forecast maximum for tomorrow exceeds the requested threshold.
 *
 * @param locationId
 *            coordinate string identifying the location
 * @param locationName
 *            display name
 * @param country
 *            country code or {@link Location#UNKNOWN_COUNTRY}
 * @param tomorrowMaxTemperature
 *            tomorrow's maximum, expressed in {@code temperatureUnit}
 * @param temperatureUnit
 *            unit of {@code tomorrowMaxTemperature}
 * @param weatherDescription
 *            tomorrow's weather description
 */
public record LocationSummary(String locationId, String locationName, String country, double tomorrowMaxTemperature,
        TemperatureUnit temperatureUnit, String weatherDescription) {

    public LocationSummary {
        Objects.requireNonNull(locationId, "locationId is required");
        Objects.requireNonNull(temperatureUnit, "temperatureUnit is required");
    }
}
