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
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

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
 * HTTP client for the OpenWeatherMap API (primary provider).
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Current weather: {@code /data/2.5/weather}</li>
 * <li>Forecast: {@code /data/2.5/forecast} (3-hour steps, 8 per day, grouped here into UTC days)</li>
 * <li>Geocoding: {@code /geo/1.0/reverse} and {@code /geo/1.0/direct}</li>
 * <li>Authentication: {@code appid} query parameter</li>
 * <li>Units: metric (Celsius, m/s, hPa)</li>
 * <li>Free tier: 1,000 calls/day, 60 calls/minute</li>
 * </ul>
 *
 * <p>
 * Non-2xx responses are classified with {@link WeatherProviderError#fromHttpStatus}; I/O errors and timeouts become
 * {@code NETWORK_ERROR}.
 *
 * @see <a href="https://openweathermap.org/api">OpenWeatherMap API Documentation</a>
 */
public class OpenWeatherMapClient implements WeatherProvider {

    private static final Logger LOG = Logger.getLogger(OpenWeatherMapClient.class);

    public static final String PROVIDER_NAME = "OpenWeatherMap";

    private static final int FORECAST_STEPS_PER_DAY = 8;
    private static final int SEARCH_LIMIT = 5;
    private static final RateLimitInfo FREE_TIER = new RateLimitInfo(1000, 60);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public OpenWeatherMapClient(ObjectMapper objectMapper, String baseUrl, String apiKey, Duration timeout) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl is required"));
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(timeout).build();
    }

    @Override
    public WeatherResult<WeatherData> getCurrentWeather(double latitude, double longitude) {
        LOG.debugf("Fetching OpenWeatherMap current weather for %.4f,%.4f", latitude, longitude);
        String url = baseUrl + "/data/2.5/weather?lat=" + latitude + "&lon=" + longitude + "&units=metric&appid="
                + encode(apiKey);

        return fetch(url, "current weather", this::parseCurrentWeather);
    }

    @Override
    public WeatherResult<WeatherForecast> getForecast(double latitude, double longitude, int days) {
        LOG.debugf("Fetching OpenWeatherMap forecast for %.4f,%.4f days=%d", latitude, longitude, days);
        String url = baseUrl + "/data/2.5/forecast?lat=" + latitude + "&lon=" + longitude + "&units=metric&cnt="
                + (days * FORECAST_STEPS_PER_DAY) + "&appid=" + encode(apiKey);

        return fetch(url, "forecast", root -> parseForecast(root, days));
    }

    /**
     * Reverse-geocodes the coordinates. The returned location keeps the requested coordinates as its id so callers can
     * key caches by what they asked for.
     */
    @Override
    public WeatherResult<Location> getLocationDetails(double latitude, double longitude) {
        LOG.debugf("Fetching OpenWeatherMap location details for %.4f,%.4f", latitude, longitude);
        String url = baseUrl + "/geo/1.0/reverse?lat=" + latitude + "&lon=" + longitude + "&limit=1&appid="
                + encode(apiKey);

        WeatherResult<JsonNode> result = fetch(url, "location details", root -> root);
        if (result instanceof WeatherResult.Failure<JsonNode> failure) {
            return WeatherResult.failure(failure.reason());
        }

        JsonNode root = result.data().orElseThrow();
        if (!root.isArray() || root.isEmpty()) {
            return WeatherResult.failure(ErrorType.LOCATION_NOT_FOUND,
                    "No location found at " + latitude + "," + longitude);
        }

        Coordinates requested = Coordinates.of(latitude, longitude);
        JsonNode place = root.get(0);
        String id = requested.toCoordinateString();
        return WeatherResult.success(new Location(id, textOr(place.path("name"), id),
                textOr(place.path("country"), Location.UNKNOWN_COUNTRY), latitude, longitude));
    }

    @Override
    public WeatherResult<List<Location>> searchLocations(String query) {
        if (query == null || query.isBlank()) {
            return WeatherResult.failure(ErrorType.INVALID_REQUEST, "Search query is required");
        }
        LOG.debugf("Searching OpenWeatherMap locations for '%s'", query);
        String url = baseUrl + "/geo/1.0/direct?q=" + encode(query) + "&limit=" + SEARCH_LIMIT + "&appid="
                + encode(apiKey);

        return fetch(url, "location search", root -> {
            List<Location> locations = new ArrayList<>();
            for (JsonNode place : root) {
                locations.add(toLocation(place.path("lat").asDouble(), place.path("lon").asDouble(),
                        place.path("name"), place.path("country")));
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

    /**
     * Parser from the response body to the payload. May throw; failures are classified by {@link #fetch}.
     */
    @FunctionalInterface
    private interface ResponseParser<T> {
        T parse(JsonNode root) throws Exception;
    }

    private <T> WeatherResult<T> fetch(String url, String operation, ResponseParser<T> parser) {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout)
                    .header("Accept", "application/json").GET().build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("OpenWeatherMap %s request interrupted", operation);
            return WeatherResult.failure(ErrorType.NETWORK_ERROR, "Request interrupted");
        } catch (Exception e) {
            LOG.errorf(e, "OpenWeatherMap %s request failed", operation);
            return WeatherResult.failure(ErrorType.NETWORK_ERROR, describe(e));
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            WeatherProviderError error = WeatherProviderError.fromHttpStatus(response.statusCode(),
                    "OpenWeatherMap returned HTTP " + response.statusCode() + " for " + operation);
            LOG.warnf("OpenWeatherMap %s failed: status=%d type=%s", operation, response.statusCode(), error.type());
            return WeatherResult.failure(error);
        }

        try {
            return WeatherResult.success(parser.parse(objectMapper.readTree(response.body())));
        } catch (Exception e) {
            LOG.errorf(e, "Failed to parse OpenWeatherMap %s response", operation);
            return WeatherResult.failure(ErrorType.UNKNOWN_ERROR, "Unparseable " + operation + " response");
        }
    }

    private WeatherData parseCurrentWeather(JsonNode root) {
        JsonNode coord = root.path("coord");
        JsonNode main = root.path("main");
        Location location = toLocation(coord.path("lat").asDouble(), coord.path("lon").asDouble(), root.path("name"),
                root.path("sys").path("country"));

        return new WeatherData(location, Instant.ofEpochSecond(root.path("dt").asLong()),
                Temperature.celsius(main.path("temp").asDouble()), firstDescription(root),
                main.path("humidity").asInt(), root.path("wind").path("speed").asDouble(),
                main.path("pressure").asInt());
    }

    /**
     * Groups 3-hour items by UTC calendar day: min of minimums, max of maximums, mean humidity and wind, the most
     * frequent description (earliest wins a tie) and the day's first pressure reading.
     */
    private WeatherForecast parseForecast(JsonNode root, int days) {
        JsonNode city = root.path("city");
        JsonNode coord = city.path("coord");
        Location location = toLocation(coord.path("lat").asDouble(), coord.path("lon").asDouble(), city.path("name"),
                city.path("country"));

        Map<LocalDate, List<JsonNode>> byDay = new TreeMap<>();
        for (JsonNode item : root.path("list")) {
            LocalDate day = LocalDate.ofInstant(Instant.ofEpochSecond(item.path("dt").asLong()), ZoneOffset.UTC);
            byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(item);
        }

        List<DailyForecast> forecasts = new ArrayList<>();
        for (Map.Entry<LocalDate, List<JsonNode>> entry : byDay.entrySet()) {
            forecasts.add(aggregateDay(entry.getKey(), entry.getValue()));
        }

        return new WeatherForecast(location, forecasts).limitDays(days);
    }

    private DailyForecast aggregateDay(LocalDate date, List<JsonNode> items) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double humiditySum = 0;
        double windSum = 0;
        Map<String, Integer> descriptionCounts = new LinkedHashMap<>();

        for (JsonNode item : items) {
            JsonNode main = item.path("main");
            min = Math.min(min, main.path("temp_min").asDouble());
            max = Math.max(max, main.path("temp_max").asDouble());
            humiditySum += main.path("humidity").asInt();
            windSum += item.path("wind").path("speed").asDouble();
            descriptionCounts.merge(firstDescription(item), 1, Integer::sum);
        }

        String description = WeatherCodeMapper.UNKNOWN;
        int best = 0;
        for (Map.Entry<String, Integer> entry : descriptionCounts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                description = entry.getKey();
            }
        }

        int pressure = items.get(0).path("main").path("pressure").asInt();
        return new DailyForecast(date, Temperature.celsius(min), Temperature.celsius(max), description,
                (int) Math.round(humiditySum / items.size()), windSum / items.size(), pressure);
    }

    private static Location toLocation(double lat, double lon, JsonNode name, JsonNode country) {
        String id = Coordinates.of(lat, lon).toCoordinateString();
        return new Location(id, textOr(name, id), textOr(country, Location.UNKNOWN_COUNTRY), lat, lon);
    }

    private static String firstDescription(JsonNode node) {
        JsonNode weather = node.path("weather");
        if (weather.isArray() && !weather.isEmpty()) {
            return textOr(weather.get(0).path("description"), WeatherCodeMapper.UNKNOWN);
        }
        return WeatherCodeMapper.UNKNOWN;
    }

    private static String textOr(JsonNode node, String fallback) {
        String text = node.asText("");
        return text.isBlank() ? fallback : text;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
