/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.integration.weather;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.weather.data.models.Coordinates;
import villagecompute.weather.data.models.DailyForecast;
import villagecompute.weather.data.models.Location;
import villagecompute.weather.data.models.Temperature;
import villagecompute.weather.data.models.WeatherData;
import villagecompute.weather.data.models.WeatherForecast;
import villagecompute.weather.integration.weather.WeatherProviderError.ErrorType;

/**
 * HTTP client for the Open-Meteo API (keyless fallback provider).
 *
 * <p>
 * Open-Meteo needs no API key and reports conditions as WMO weather codes, translated by {@link WeatherCodeMapper}.
 * It has no reverse geocoding, so location details are built straight from the coordinates.
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Forecast: {@code /v1/forecast} on the forecast host</li>
 * <li>Search: {@code /v1/search} on the geocoding host</li>
 * <li>Rate limit: 10,000 calls/day, 600 calls/minute (free tier)</li>
 * <li>Units: Celsius, m/s, hPa; daily dates in the location's own timezone ({@code timezone=auto})</li>
 * </ul>
 *
 * @see <a href="https://open-meteo.com/en/docs">Open-Meteo API Documentation</a>
 */
public class OpenMeteoClient implements WeatherProvider {

    private static final Logger LOG = Logger.getLogger(OpenMeteoClient.class);

    public static final String PROVIDER_NAME = "Open-Meteo";

    private static final int SEARCH_LIMIT = 5;
    private static final int MAX_FORECAST_DAYS = 16;
    private static final RateLimitInfo FREE_TIER = new RateLimitInfo(10_000, 600);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String geocodingUrl;
    private final Duration timeout;

    public OpenMeteoClient(ObjectMapper objectMapper, String baseUrl, String geocodingUrl, Duration timeout) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl is required"));
        this.geocodingUrl = stripTrailingSlash(Objects.requireNonNull(geocodingUrl, "geocodingUrl is required"));
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(timeout).build();
    }

    @Override
    public WeatherResult<WeatherData> getCurrentWeather(double latitude, double longitude) {
        LOG.debugf("Fetching Open-Meteo current weather for %.4f,%.4f", latitude, longitude);
        String url = baseUrl + "/v1/forecast?latitude=" + latitude + "&longitude=" + longitude
                + "&current=temperature_2m,relative_humidity_2m,weather_code,wind_speed_10m,surface_pressure"
                + "&wind_speed_unit=ms&timezone=auto";

        return fetch(url, "current weather", root -> {
            JsonNode current = root.path("current");
            ZoneOffset offset = ZoneOffset.ofTotalSeconds(root.path("utc_offset_seconds").asInt(0));
            return new WeatherData(Location.fromCoordinates(Coordinates.of(latitude, longitude)),
                    LocalDateTime.parse(current.path("time").asText()).toInstant(offset),
                    Temperature.celsius(current.path("temperature_2m").asDouble()),
                    WeatherCodeMapper.describe(current.path("weather_code").asInt(-1)),
                    current.path("relative_humidity_2m").asInt(), current.path("wind_speed_10m").asDouble(),
                    (int) Math.round(current.path("surface_pressure").asDouble()));
        });
    }

    @Override
    public WeatherResult<WeatherForecast> getForecast(double latitude, double longitude, int days) {
        int forecastDays = Math.max(1, Math.min(MAX_FORECAST_DAYS, days));
        LOG.debugf("Fetching Open-Meteo forecast for %.4f,%.4f days=%d", latitude, longitude, forecastDays);
        String url = baseUrl + "/v1/forecast?latitude=" + latitude + "&longitude=" + longitude
                + "&daily=weather_code,temperature_2m_max,temperature_2m_min,relative_humidity_2m_mean,"
                + "wind_speed_10m_max,pressure_msl_mean&wind_speed_unit=ms&timezone=auto&forecast_days="
                + forecastDays;

        return fetch(url, "forecast", root -> parseDaily(root.path("daily"),
                Location.fromCoordinates(Coordinates.of(latitude, longitude))));
    }

    /**
     * Builds the location from the coordinates alone; no upstream call is made.
     */
    @Override
    public WeatherResult<Location> getLocationDetails(double latitude, double longitude) {
        try {
            return WeatherResult.success(Location.fromCoordinates(Coordinates.of(latitude, longitude)));
        } catch (IllegalArgumentException e) {
            return WeatherResult.failure(ErrorType.INVALID_REQUEST, e.getMessage());
        }
    }

    @Override
    public WeatherResult<List<Location>> searchLocations(String query) {
        if (query == null || query.isBlank()) {
            return WeatherResult.failure(ErrorType.INVALID_REQUEST, "Search query is required");
        }
        LOG.debugf("Searching Open-Meteo locations for '%s'", query);
        String url = geocodingUrl + "/v1/search?name=" + URLEncoder.encode(query, StandardCharsets.UTF_8) + "&count="
                + SEARCH_LIMIT + "&language=en&format=json";

        return fetch(url, "location search", root -> {
            List<Location> locations = new ArrayList<>();
            for (JsonNode place : root.path("results")) {
                double lat = place.path("latitude").asDouble();
                double lon = place.path("longitude").asDouble();
                String id = Coordinates.of(lat, lon).toCoordinateString();
                String name = place.path("name").asText(id);
                String country = place.path("country_code").asText(Location.UNKNOWN_COUNTRY);
                locations.add(new Location(id, name.isBlank() ? id : name,
                        country.isBlank() ? Location.UNKNOWN_COUNTRY : country, lat, lon));
            }
            return locations;
        });
    }

    @Override
    public boolean isHealthy() {
        return getCurrentWeather(0.0, 0.0).isSuccess();
    }

    @Override
    public Optional<RateLimitInfo> rateLimitInfo() {
        return Optional.of(FREE_TIER);
    }

    @Override
    public String providerName() {
        return PROVIDER_NAME;
    }

    @FunctionalInterface
    private interface ResponseParser<T> {
        T parse(JsonNode root) throws Exception;
    }

    private <T> WeatherResult<T> fetch(String url, String operation, ResponseParser<T> parser) {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout).GET().build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Open-Meteo %s request interrupted", operation);
            return WeatherResult.failure(ErrorType.NETWORK_ERROR, "Request interrupted");
        } catch (Exception e) {
            LOG.errorf(e, "Open-Meteo %s request failed", operation);
            return WeatherResult.failure(ErrorType.NETWORK_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (response.statusCode() != 200) {
            WeatherProviderError error = WeatherProviderError.fromHttpStatus(response.statusCode(),
                    "Open-Meteo returned HTTP " + response.statusCode() + " for " + operation);
            LOG.warnf("Open-Meteo %s failed: status=%d type=%s", operation, response.statusCode(), error.type());
            return WeatherResult.failure(error);
        }

        try {
            return WeatherResult.success(parser.parse(objectMapper.readTree(response.body())));
        } catch (Exception e) {
            LOG.errorf(e, "Failed to parse Open-Meteo %s response", operation);
            return WeatherResult.failure(ErrorType.UNKNOWN_ERROR, "Unparseable " + operation + " response");
        }
    }

    private WeatherForecast parseDaily(JsonNode daily, Location location) {
        List<DailyForecast> forecasts = new ArrayList<>();
        JsonNode dates = daily.path("time");
        JsonNode maxTemps = daily.path("temperature_2m_max");
        JsonNode minTemps = daily.path("temperature_2m_min");
        JsonNode humidity = daily.path("relative_humidity_2m_mean");
        JsonNode wind = daily.path("wind_speed_10m_max");
        JsonNode pressure = daily.path("pressure_msl_mean");
        JsonNode codes = daily.path("weather_code");

        for (int i = 0; i < dates.size(); i++) {
            forecasts.add(new DailyForecast(LocalDate.parse(dates.get(i).asText()),
                    Temperature.celsius(minTemps.path(i).asDouble()), Temperature.celsius(maxTemps.path(i).asDouble()),
                    WeatherCodeMapper.describe(codes.path(i).asInt(-1)), (int) Math.round(humidity.path(i).asDouble()),
                    wind.path(i).asDouble(), (int) Math.round(pressure.path(i).asDouble())));
        }

        return new WeatherForecast(location, forecasts);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
