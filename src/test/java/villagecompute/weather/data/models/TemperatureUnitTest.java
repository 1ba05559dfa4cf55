/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link TemperatureUnit}.
 */
class TemperatureUnitTest {

    @Test
    void testParse_acceptedSpellings() {
        assertEquals(TemperatureUnit.CELSIUS, TemperatureUnit.parse("celsius").value());
        assertEquals(TemperatureUnit.CELSIUS, TemperatureUnit.parse("C").value());
        assertEquals(TemperatureUnit.FAHRENHEIT, TemperatureUnit.parse("Fahrenheit").value());
        assertEquals(TemperatureUnit.FAHRENHEIT, TemperatureUnit.parse(" f ").value());
    }

    @Test
    void testParse_missingDefaultsToCelsius() {
        assertEquals(TemperatureUnit.CELSIUS, TemperatureUnit.parse(null).value());
        assertEquals(TemperatureUnit.CELSIUS, TemperatureUnit.parse("").value());
    }

    @Test
    void testParse_unknownUnit() {
        ValidationResult<TemperatureUnit> result = TemperatureUnit.parse("kelvin");

        assertTrue(result.isFailure());
        assertEquals(ValidationFailure.INVALID_UNIT, result.failure().orElseThrow().code());
    }

    @Test
    void testGetValue_lowerCaseName() {
        assertEquals("celsius", TemperatureUnit.CELSIUS.getValue());
        assertEquals("fahrenheit", TemperatureUnit.FAHRENHEIT.getValue());
    }
}
