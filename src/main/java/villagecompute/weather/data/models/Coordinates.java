/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Validated geographic coordinates.
 *
 * <p>
 * Instances are immutable and can only be obtained through {@link #of(double, double)} (throws on out-of-range input)
 * or the parsing factories, which report malformed input as a {@link ValidationResult} failure.
 *
 * <h2>String Form</h2>
 * <ul>
 * <li>Single pair: {@code "51.5074,-0.1278"}</li>
 * <li>Multiple pairs: {@code "51.5074,-0.1278,40.7128,-74.006"}</li>
 * </ul>
 */
public final class Coordinates {

    public static final double MIN_LATITUDE = -90.0;
    public static final double MAX_LATITUDE = 90.0;
    public static final double MIN_LONGITUDE = -180.0;
    public static final double MAX_LONGITUDE = 180.0;

    private final double latitude;
    private final double longitude;

    private Coordinates(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Creates coordinates from already-numeric values.
     *
     * @throws IllegalArgumentException
     *             if either value is out of range or not a finite number
     */
    public static Coordinates of(double latitude, double longitude) {
        String problem = rangeProblem(latitude, longitude);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        return new Coordinates(latitude, longitude);
    }

    /**
     * Parses a single {@code "lat,lon"} pair.
     *
     * @param coordinateString
     *            text to parse (surrounding whitespace is ignored)
     * @return parsed coordinates, or an {@code INVALID_COORDINATES} failure
     */
    public static ValidationResult<Coordinates> parse(String coordinateString) {
        if (coordinateString == null || coordinateString.isBlank()) {
            return ValidationResult.failure(ValidationFailure.INVALID_COORDINATES,
                    "Coordinate string is required. Expected format: 'lat,lon'");
        }

        String[] parts = coordinateString.trim().split(",", -1);
        if (parts.length != 2) {
            return ValidationResult.failure(ValidationFailure.INVALID_COORDINATES, "Invalid coordinate format: '"
                    + coordinateString + "'. Expected exactly 2 parts separated by comma");
        }
        return fromParts(parts[0], parts[1]);
    }

    /**
     * Parses a flat list of comma-separated numbers into coordinate pairs.
     *
     * <p>
     * Empty segments are ignored, so {@code "1,2,,3,4"} yields two pairs.
     *
     * @param coordinatesString
     *            text such as {@code "lat1,lon1,lat2,lon2"}
     * @return parsed pairs in input order, or an {@code INVALID_COORDINATES} failure if the count is odd, no pair
     *         results, or any value is malformed or out of range
     */
    public static ValidationResult<List<Coordinates>> parseMultiple(String coordinatesString) {
        if (coordinatesString == null) {
            return ValidationResult.failure(ValidationFailure.INVALID_COORDINATES,
                    "At least one coordinate pair required");
        }

        List<String> parts = Arrays.stream(coordinatesString.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .toList();

        if (parts.size() < 2) {
            return ValidationResult.failure(ValidationFailure.INVALID_COORDINATES,
                    "At least one coordinate pair required");
        }
        if (parts.size() % 2 != 0) {
            return ValidationResult.failure(ValidationFailure.INVALID_COORDINATES,
                    "Coordinates must be in pairs (lat,lon), got " + parts.size() + " values");
        }

        List<Coordinates> coordinates = new ArrayList<>(parts.size() / 2);
        for (int i = 0; i < parts.size(); i += 2) {
            ValidationResult<Coordinates> pair = fromParts(parts.get(i), parts.get(i + 1));
            if (pair.isFailure()) {
                return ValidationResult.failure(pair.failure().orElseThrow());
            }
            coordinates.add(pair.value());
        }
        return ValidationResult.success(List.copyOf(coordinates));
    }

    private static ValidationResult<Coordinates> fromParts(String latText, String lonText) {
        Double lat = parseDouble(latText);
        if (lat == null) {
            return ValidationResult.failure(ValidationFailure.INVALID_COORDINATES,
                    "Invalid latitude: '" + latText.trim() + "'");
        }
        Double lon = parseDouble(lonText);
        if (lon == null) {
            return ValidationResult.failure(ValidationFailure.INVALID_COORDINATES,
                    "Invalid longitude: '" + lonText.trim() + "'");
        }

        String problem = rangeProblem(lat, lon);
        if (problem != null) {
            return ValidationResult.failure(ValidationFailure.INVALID_COORDINATES, problem);
        }
        return ValidationResult.success(new Coordinates(lat, lon));
    }

    private static Double parseDouble(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String rangeProblem(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < MIN_LATITUDE || latitude > MAX_LATITUDE) {
            return "Latitude must be between -90 and 90 degrees, got: " + latitude;
        }
        if (Double.isNaN(longitude) || longitude < MIN_LONGITUDE || longitude > MAX_LONGITUDE) {
            return "Longitude must be between -180 and 180 degrees, got: " + longitude;
        }
        return null;
    }

    public double latitude() {
        return latitude;
    }

    public double longitude() {
        return longitude;
    }

    /**
     * Formats as {@code "lat,lon"}; the inverse of {@link #parse(String)}.
     */
    public String toCoordinateString() {
        return latitude + "," + longitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coordinates other)) {
            return false;
        }
        return Double.compare(latitude, other.latitude) == 0 && Double.compare(longitude, other.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude);
    }

    @Override
    public String toString() {
        return toCoordinateString();
    }
}
