/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

/**
 * A named place resolved from coordinates.
 *
 * <p>
 * The {@code id} is the coordinate string the location was looked up with ({@code "lat,lon"}). Locations are never
 * mutated after creation and are cached for a long time because geocoding data rarely changes.
 *
 * @param id
 *            coordinate-string identifier
 * @param name
 *            display name (e.g. "London")
 * @param country
 *            ISO country code or "Unknown"
 * @param latitude
 *            latitude in degrees
 * @param longitude
 *            longitude in degrees
 */
public record Location(String id, String name, String country, double latitude, double longitude) {

    public static final String UNKNOWN_COUNTRY = "Unknown";

    public Location {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Location ID cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Location name cannot be blank");
        }
        if (country == null || country.isBlank()) {
            throw new IllegalArgumentException("Country cannot be blank");
        }
        // Delegates the range check
        Coordinates.of(latitude, longitude);
    }

    /**
     * Builds a location straight from coordinates, used when the provider has no place data for them.
     */
    public static Location fromCoordinates(Coordinates coordinates) {
        String id = coordinates.toCoordinateString();
        return new Location(id, id, UNKNOWN_COUNTRY, coordinates.latitude(), coordinates.longitude());
    }

    public Coordinates coordinates() {
        return Coordinates.of(latitude, longitude);
    }
}
