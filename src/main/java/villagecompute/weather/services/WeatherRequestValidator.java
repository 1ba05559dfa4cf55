/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.util.List;
import java.util.OptionalDouble;

import villagecompute.weather.data.models.Coordinates;
import villagecompute.weather.data.models.Temperature;
import villagecompute.weather.data.models.TemperatureUnit;
import villagecompute.weather.data.models.ValidationResult;
import villagecompute.weather.exceptions.ValidationException;

/**
 * Turns raw request parameters into validated domain values. Runs before any upstream call or rate limit token is
 * spent.
 */
public class WeatherRequestValidator {

    public static final double MIN_THRESHOLD_CELSIUS = -100.0;
    public static final double MAX_THRESHOLD_CELSIUS = 100.0;

    private final int maxLocations;
    private final OptionalDouble ceilingCelsius;

    /**
     * @param maxLocations
     *            largest number of coordinate pairs accepted per summary request
     * @param ceilingCelsius
     *            optional plausibility ceiling applied to parsed temperatures
     */
    public WeatherRequestValidator(int maxLocations, OptionalDouble ceilingCelsius) {
        if (maxLocations <= 0) {
            throw new IllegalArgumentException("maxLocations must be positive");
        }
        this.maxLocations = maxLocations;
        this.ceilingCelsius = ceilingCelsius == null ? OptionalDouble.empty() : ceilingCelsius;
    }

    /**
     * Validated summary request.
     *
     * @param coordinates
     *            locations in request order
     * @param threshold
     *            temperature to exceed, in the requested unit
     */
    public record SummaryRequest(List<Coordinates> coordinates, Temperature threshold) {

        public TemperatureUnit unit() {
            return threshold.getUnit();
        }
    }

    /**
     * @throws ValidationException
     *             with the failing rule's reason code
     */
    public SummaryRequest validateSummaryRequest(String locations, String temperature, String unit) {
        if (locations == null || locations.isBlank()) {
            throw new ValidationException(ValidationException.LOCATIONS_REQUIRED, "Locations parameter is required");
        }
        if (temperature == null || temperature.isBlank()) {
            throw new ValidationException(ValidationException.TEMPERATURE_REQUIRED,
                    "Temperature parameter is required");
        }

        List<Coordinates> coordinates = orThrow(Coordinates.parseMultiple(locations));
        if (coordinates.size() > maxLocations) {
            throw new ValidationException(ValidationException.TOO_MANY_LOCATIONS, "Too many locations requested. "
                    + "Maximum allowed: " + maxLocations + ", got: " + coordinates.size());
        }

        TemperatureUnit temperatureUnit = orThrow(TemperatureUnit.parse(unit));
        Temperature threshold = orThrow(Temperature.parse(temperature, temperatureUnit, ceilingCelsius));

        double celsius = threshold.toCelsius();
        if (celsius < MIN_THRESHOLD_CELSIUS || celsius > MAX_THRESHOLD_CELSIUS) {
            throw new ValidationException(ValidationException.TEMPERATURE_OUT_OF_RANGE,
                    "Temperature threshold out of reasonable range (" + MIN_THRESHOLD_CELSIUS + " to "
                            + MAX_THRESHOLD_CELSIUS + "°C), got: " + threshold.format());
        }

        return new SummaryRequest(coordinates, threshold);
    }

    /**
     * @throws ValidationException
     *             if the location is missing or not a valid "lat,lon" pair
     */
    public Coordinates validateLocation(String location) {
        if (location == null || location.isBlank()) {
            throw new ValidationException(ValidationException.LOCATION_REQUIRED, "Location parameter is required");
        }
        return orThrow(Coordinates.parse(location));
    }

    private static <T> T orThrow(ValidationResult<T> result) {
        if (result.isFailure()) {
            throw ValidationException.from(result.failure().orElseThrow());
        }
        return result.value();
    }
}
