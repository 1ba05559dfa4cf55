/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import villagecompute.weather.data.models.Location;

/**
 * Location metadata.
 *
 * @param id
 *            coordinate string
 * @param name
 *            display name
 * @param country
 *            country code, or "Unknown"
 * @param latitude
 *            latitude in degrees
 * @param longitude
 *            longitude in degrees
 */
public record LocationType(String id, String name, String country, double latitude, double longitude) {

    public static LocationType from(Location location) {
        return new LocationType(location.id(), location.name(), location.country(), location.latitude(),
                location.longitude());
    }
}
