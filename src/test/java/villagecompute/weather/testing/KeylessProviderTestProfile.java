/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.testing;

import java.util.Map;

import io.quarkus.test.junit.QuarkusTestProfile;

/**
 * Test profile that boots with an empty OpenWeatherMap API key, the same as the shipped defaults with
 * {@code OPENWEATHERMAP_API_KEY} unset.
 *
 * <p>
 * Open-Meteo points at a closed local port so nothing leaves the machine.
 */
public class KeylessProviderTestProfile implements QuarkusTestProfile {

    @Override
    public Map<String, String> getConfigOverrides() {
        return Map.of("weather.provider.type", "openweathermap", "weather.openweathermap.api-key", "",
                "weather.open-meteo.base-url", "http://localhost:1", "weather.open-meteo.geocoding-url",
                "http://localhost:1");
    }
}
