/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.OptionalDouble;

import org.junit.jupiter.api.Test;

import villagecompute.weather.data.models.Coordinates;
import villagecompute.weather.data.models.TemperatureUnit;
import villagecompute.weather.data.models.ValidationFailure;
import villagecompute.weather.exceptions.ValidationException;
import villagecompute.weather.services.WeatherRequestValidator.SummaryRequest;

/**
 * Unit tests for {@link WeatherRequestValidator}.
 */
class WeatherRequestValidatorTest {

    private final WeatherRequestValidator validator = new WeatherRequestValidator(3, OptionalDouble.empty());

    @Test
    void testValidateSummaryRequest_success() {
        SummaryRequest request = validator.validateSummaryRequest("51.5074,-0.1278,40.7128,-74.0060", "68",
                "fahrenheit");

        assertEquals(2, request.coordinates().size());
        assertEquals(TemperatureUnit.FAHRENHEIT, request.unit());
        assertEquals(68.0, request.threshold().getValue());
    }

    @Test
    void testValidateSummaryRequest_unitDefaultsToCelsius() {
        assertEquals(TemperatureUnit.CELSIUS, validator.validateSummaryRequest("1,2", "20", null).unit());
    }

    @Test
    void testValidateSummaryRequest_missingLocations() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validateSummaryRequest(" ", "20", "celsius"));

        assertEquals(ValidationException.LOCATIONS_REQUIRED, e.getReasonCode());
    }

    @Test
    void testValidateSummaryRequest_missingTemperature() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validateSummaryRequest("1,2", null, "celsius"));

        assertEquals(ValidationException.TEMPERATURE_REQUIRED, e.getReasonCode());
    }

    @Test
    void testValidateSummaryRequest_unpairedCoordinate() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validateSummaryRequest("51.5074", "20", "celsius"));

        assertEquals(ValidationFailure.INVALID_COORDINATES, e.getReasonCode());
    }

    @Test
    void testValidateSummaryRequest_tooManyLocations() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validateSummaryRequest("1,1,2,2,3,3,4,4", "20", "celsius"));

        assertEquals(ValidationException.TOO_MANY_LOCATIONS, e.getReasonCode());
    }

    @Test
    void testValidateSummaryRequest_invalidUnit() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validateSummaryRequest("1,2", "20", "kelvin"));

        assertEquals(ValidationFailure.INVALID_UNIT, e.getReasonCode());
    }

    @Test
    void testValidateSummaryRequest_thresholdOutOfRange() {
        // 250 °F is about 121 °C
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validateSummaryRequest("1,2", "250", "f"));

        assertEquals(ValidationException.TEMPERATURE_OUT_OF_RANGE, e.getReasonCode());
    }

    @Test
    void testValidateSummaryRequest_configuredCeiling() {
        WeatherRequestValidator capped = new WeatherRequestValidator(50, OptionalDouble.of(60));

        ValidationException e = assertThrows(ValidationException.class,
                () -> capped.validateSummaryRequest("1,2", "70", "celsius"));

        assertEquals(ValidationFailure.TEMPERATURE_ABOVE_CEILING, e.getReasonCode());
    }

    @Test
    void testValidateLocation() {
        assertEquals(Coordinates.of(35.6762, 139.6503), validator.validateLocation("35.6762,139.6503"));

        ValidationException blank = assertThrows(ValidationException.class, () -> validator.validateLocation(""));
        assertEquals(ValidationException.LOCATION_REQUIRED, blank.getReasonCode());
        assertThrows(ValidationException.class, () -> validator.validateLocation("abc"));
    }
}
