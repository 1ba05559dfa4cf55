/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.integration.weather;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.weather.data.models.Coordinates;
import villagecompute.weather.data.models.Location;
import villagecompute.weather.integration.weather.WeatherProviderError.ErrorType;

/**
 * Unit tests for {@link FailoverWeatherProvider}.
 */
class FailoverWeatherProviderTest {

    @Mock
    WeatherProvider primary;

    @Mock
    WeatherProvider fallback;

    private FailoverWeatherProvider provider;
    private Location london;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(primary.providerName()).thenReturn("OpenWeatherMap");
        when(fallback.providerName()).thenReturn("Open-Meteo");
        provider = new FailoverWeatherProvider(primary, fallback);
        london = Location.fromCoordinates(Coordinates.of(51.5074, -0.1278));
    }

    @Test
    void testPrimarySuccess_fallbackNotCalled() {
        when(primary.getLocationDetails(51.5074, -0.1278)).thenReturn(WeatherResult.success(london));

        assertTrue(provider.getLocationDetails(51.5074, -0.1278).isSuccess());
        verify(fallback, never()).getLocationDetails(anyDouble(), anyDouble());
    }

    @Test
    void testProviderSpecificFailure_fallsBackOnce() {
        // Arrange
        when(primary.getLocationDetails(51.5074, -0.1278))
                .thenReturn(WeatherResult.failure(ErrorType.INVALID_API_KEY, "401"));
        when(fallback.getLocationDetails(51.5074, -0.1278)).thenReturn(WeatherResult.success(london));

        // Act
        WeatherResult<Location> result = provider.getLocationDetails(51.5074, -0.1278);

        // Assert
        assertEquals(Optional.of(london), result.data());
        verify(primary, times(1)).getLocationDetails(51.5074, -0.1278);
        verify(fallback, times(1)).getLocationDetails(51.5074, -0.1278);
    }

    @Test
    void testLocationNotFound_returnedAsIs() {
        when(primary.getLocationDetails(0.0, 0.0))
                .thenReturn(WeatherResult.failure(ErrorType.LOCATION_NOT_FOUND, "ocean"));

        WeatherResult<Location> result = provider.getLocationDetails(0.0, 0.0);

        assertEquals(ErrorType.LOCATION_NOT_FOUND, result.error().orElseThrow().type());
        verify(fallback, never()).getLocationDetails(anyDouble(), anyDouble());
    }

    @Test
    void testBothFail_fallbackErrorReturned() {
        when(primary.getForecast(1.0, 2.0, 5)).thenReturn(WeatherResult.failure(ErrorType.NETWORK_ERROR, "timeout"));
        when(fallback.getForecast(1.0, 2.0, 5))
                .thenReturn(WeatherResult.failure(ErrorType.PROVIDER_UNAVAILABLE, "503"));

        assertEquals(ErrorType.PROVIDER_UNAVAILABLE,
                provider.getForecast(1.0, 2.0, 5).error().orElseThrow().type());
    }

    @Test
    void testHealthAndMetadata() {
        when(primary.isHealthy()).thenReturn(false);
        when(fallback.isHealthy()).thenReturn(true);
        when(primary.rateLimitInfo()).thenReturn(Optional.of(new RateLimitInfo(1000, 60)));

        assertTrue(provider.isHealthy());
        assertEquals("OpenWeatherMap+Open-Meteo", provider.providerName());
        assertEquals(60, provider.rateLimitInfo().orElseThrow().requestsPerMinute());

        when(fallback.isHealthy()).thenReturn(false);
        assertFalse(provider.isHealthy());
    }

    @Test
    void testErrorTypeClassification() {
        assertTrue(ErrorType.NETWORK_ERROR.isProviderSpecific());
        assertTrue(ErrorType.RATE_LIMIT_EXCEEDED.isProviderSpecific());
        assertFalse(ErrorType.INVALID_REQUEST.isProviderSpecific());
        assertEquals(ErrorType.INVALID_API_KEY, WeatherProviderError.fromHttpStatus(403, "forbidden").type());
        assertEquals(ErrorType.UNKNOWN_ERROR, WeatherProviderError.fromHttpStatus(302, "moved").type());
    }
}
