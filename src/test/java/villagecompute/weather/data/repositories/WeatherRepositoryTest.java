/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.repositories;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import villagecompute.weather.cache.CacheStatistics;
import villagecompute.weather.cache.NamespacedCache;
import villagecompute.weather.data.models.DailyForecast;
import villagecompute.weather.data.models.Location;
import villagecompute.weather.data.models.Temperature;
import villagecompute.weather.data.models.WeatherData;
import villagecompute.weather.data.models.WeatherForecast;
import villagecompute.weather.exceptions.ServiceUnavailableException;
import villagecompute.weather.exceptions.ValidationException;
import villagecompute.weather.integration.weather.WeatherProvider;
import villagecompute.weather.integration.weather.WeatherProviderError.ErrorType;
import villagecompute.weather.integration.weather.WeatherResult;
import villagecompute.weather.observability.ObservabilityMetrics;
import villagecompute.weather.testing.FakeTicker;

/**
 * Unit tests for {@link WeatherRepository}.
 */
class WeatherRepositoryTest {

    private static final double LAT = 51.5074;
    private static final double LON = -0.1278;

    @Mock
    WeatherProvider provider;

    private FakeTicker ticker;
    private SimpleMeterRegistry registry;
    private WeatherRepository repository;
    private Location london;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        ticker = new FakeTicker();
        registry = new SimpleMeterRegistry();
        ObservabilityMetrics metrics = new ObservabilityMetrics(registry);
        repository = new WeatherRepository(provider,
                new NamespacedCache<>("weather", Duration.ofMinutes(15), 100, metrics, ticker),
                new NamespacedCache<>("forecast", Duration.ofMinutes(60), 100, metrics, ticker),
                new NamespacedCache<>("location", Duration.ofHours(24), 100, metrics, ticker), metrics,
                OpenTelemetry.noop().getTracer("test"));
        london = new Location("51.5074,-0.1278", "London", "GB", LAT, LON);
        when(provider.providerName()).thenReturn("mock");
    }

    private WeatherForecast forecast(Location location) {
        return new WeatherForecast(location,
                List.of(new DailyForecast(LocalDate.parse("2025-01-16"), Temperature.celsius(14),
                        Temperature.celsius(25), "clear sky", 45, 3.0, 1020)));
    }

    @Test
    void testGetLocationById_cachedAfterFirstLookup() {
        // Arrange
        when(provider.getLocationDetails(LAT, LON)).thenReturn(WeatherResult.success(london));

        // Act
        Optional<Location> first = repository.getLocationById("51.5074,-0.1278");
        Optional<Location> second = repository.getLocationById(" 51.5074, -0.1278 ");

        // Assert
        assertEquals(Optional.of(london), first);
        assertEquals(Optional.of(london), second);
        verify(provider, times(1)).getLocationDetails(LAT, LON);
    }

    @Test
    void testGetLocationById_invalidIdThrowsWithoutProviderCall() {
        assertThrows(ValidationException.class, () -> repository.getLocationById("not-a-location"));

        verify(provider, never()).getLocationDetails(anyDouble(), anyDouble());
    }

    @Test
    void testGetLocationById_notFoundIsEmptyAndNotCached() {
        // Arrange
        when(provider.getLocationDetails(LAT, LON))
                .thenReturn(WeatherResult.failure(ErrorType.LOCATION_NOT_FOUND, "nothing there"));

        // Act
        Optional<Location> first = repository.getLocationById("51.5074,-0.1278");
        repository.getLocationById("51.5074,-0.1278");

        // Assert
        assertTrue(first.isEmpty());
        verify(provider, times(2)).getLocationDetails(LAT, LON);
    }

    @Test
    void testGetForecast_providerFailureThrowsServiceUnavailable() {
        // Arrange
        when(provider.getForecast(LAT, LON, 5))
                .thenReturn(WeatherResult.failure(ErrorType.NETWORK_ERROR, "request timed out"));

        // Act / Assert
        assertThrows(ServiceUnavailableException.class, () -> repository.getForecast(london, 5));
        assertEquals(1.0, registry.get("weather_provider_calls_total")
                .tags("operation", "forecast", "status", "network_error").counter().count());
    }

    @Test
    void testGetForecast_failureNotCachedSoRetrySucceeds() {
        // Arrange
        when(provider.getForecast(LAT, LON, 5))
                .thenReturn(WeatherResult.failure(ErrorType.PROVIDER_UNAVAILABLE, "503"))
                .thenReturn(WeatherResult.success(forecast(london)));

        // Act
        assertThrows(ServiceUnavailableException.class, () -> repository.getForecast(london, 5));
        Optional<WeatherForecast> retried = repository.getForecast(london, 5);

        // Assert
        assertTrue(retried.isPresent());
    }

    @Test
    void testGetForecast_keepsCallerLocationAndCaches() {
        // Arrange
        Location gridPoint = new Location("51.5,-0.13", "London Grid", "GB", 51.5, -0.13);
        when(provider.getForecast(LAT, LON, 5)).thenReturn(WeatherResult.success(forecast(gridPoint)));

        // Act
        WeatherForecast first = repository.getForecast(london, 5).orElseThrow();
        repository.getForecast(london, 5);

        // Assert
        assertEquals(london, first.location());
        verify(provider, times(1)).getForecast(LAT, LON, 5);
    }

    @Test
    void testGetForecast_cacheKeyIncludesDays() {
        when(provider.getForecast(anyDouble(), anyDouble(), anyInt()))
                .thenReturn(WeatherResult.success(forecast(london)));

        repository.getForecast(london, 5);
        repository.getForecast(london, 3);

        verify(provider).getForecast(LAT, LON, 5);
        verify(provider).getForecast(LAT, LON, 3);
    }

    @Test
    void testGetForecast_emptyForecastTreatedAsMissing() {
        when(provider.getForecast(LAT, LON, 5)).thenReturn(WeatherResult.success(new WeatherForecast(london, null)));

        assertTrue(repository.getForecast(london, 5).isEmpty());
    }

    @Test
    void testGetForecast_expiresAfterTtl() {
        when(provider.getForecast(LAT, LON, 5)).thenReturn(WeatherResult.success(forecast(london)));

        repository.getForecast(london, 5);
        ticker.advance(Duration.ofMinutes(61));
        repository.getForecast(london, 5);

        verify(provider, times(2)).getForecast(LAT, LON, 5);
    }

    @Test
    void testGetCurrentWeather_providerExceptionWrapped() {
        when(provider.getCurrentWeather(LAT, LON)).thenThrow(new IllegalStateException("boom"));

        ServiceUnavailableException e = assertThrows(ServiceUnavailableException.class,
                () -> repository.getCurrentWeather(london));

        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    void testGetCurrentWeather_success() {
        WeatherData data = new WeatherData(london, Instant.parse("2025-01-15T12:00:00Z"), Temperature.celsius(14.2),
                "light rain", 72, 4.1, 1012);
        when(provider.getCurrentWeather(LAT, LON)).thenReturn(WeatherResult.success(data));

        assertEquals(Optional.of(data), repository.getCurrentWeather(london));
        assertEquals(Optional.of(data), repository.getCurrentWeather(london));
        verify(provider, times(1)).getCurrentWeather(LAT, LON);
    }

    @Test
    void testGetLocationsByIds_skipsInvalidAndFailing() {
        // Arrange
        Location tokyo = new Location("35.6762,139.6503", "Tokyo", "JP", 35.6762, 139.6503);
        when(provider.getLocationDetails(LAT, LON)).thenReturn(WeatherResult.success(london));
        when(provider.getLocationDetails(35.6762, 139.6503)).thenReturn(WeatherResult.success(tokyo));
        when(provider.getLocationDetails(40.7128, -74.006))
                .thenReturn(WeatherResult.failure(ErrorType.NETWORK_ERROR, "timeout"));

        // Act
        List<Location> locations = repository
                .getLocationsByIds(List.of("51.5074,-0.1278", "bogus", "40.7128,-74.006", "35.6762,139.6503"));

        // Assert
        assertEquals(List.of(london, tokyo), locations);
    }

    @Test
    void testCacheStatistics_oneEntryPerNamespace() {
        List<CacheStatistics> stats = repository.cacheStatistics();

        assertEquals(List.of("weather", "forecast", "location"), stats.stream().map(CacheStatistics::namespace).toList());
    }

    @Test
    void testIsProviderHealthy_repeatedChecksNeverReachProvider() {
        // Act
        for (int i = 0; i < 25; i++) {
            assertTrue(repository.isProviderHealthy());
        }

        // Assert
        verify(provider, never()).isHealthy();
        verify(provider, never()).getCurrentWeather(anyDouble(), anyDouble());
        verify(provider, never()).getLocationDetails(anyDouble(), anyDouble());
    }

    @Test
    void testIsProviderHealthy_followsLastProviderOutcome() {
        // Arrange
        when(provider.getLocationDetails(LAT, LON))
                .thenReturn(WeatherResult.failure(ErrorType.PROVIDER_UNAVAILABLE, "503"))
                .thenReturn(WeatherResult.success(london));

        // Act & Assert
        assertThrows(ServiceUnavailableException.class, () -> repository.getLocationById("51.5074,-0.1278"));
        assertFalse(repository.isProviderHealthy());

        repository.getLocationById("51.5074,-0.1278");
        assertTrue(repository.isProviderHealthy());
    }

    @Test
    void testIsProviderHealthy_exceptionMeansUnhealthy() {
        // Arrange
        when(provider.getCurrentWeather(LAT, LON)).thenThrow(new RuntimeException("connection reset"));

        // Act
        assertThrows(ServiceUnavailableException.class, () -> repository.getCurrentWeather(london));

        // Assert
        assertFalse(repository.isProviderHealthy());
    }

    @Test
    void testIsProviderHealthy_locationNotFoundIsHealthy() {
        when(provider.getLocationDetails(LAT, LON))
                .thenReturn(WeatherResult.failure(ErrorType.LOCATION_NOT_FOUND, "no match"));

        assertTrue(repository.getLocationById("51.5074,-0.1278").isEmpty());
        assertTrue(repository.isProviderHealthy());
    }
}
