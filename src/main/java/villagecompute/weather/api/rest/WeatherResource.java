/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.rest;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weather.api.filters.RateLimited;
import villagecompute.weather.api.types.DailyForecastType;
import villagecompute.weather.api.types.ErrorResponseType;
import villagecompute.weather.api.types.LocationSummaryType;
import villagecompute.weather.api.types.LocationType;
import villagecompute.weather.api.types.LocationWeatherResponseType;
import villagecompute.weather.api.types.RateLimitStatusType;
import villagecompute.weather.api.types.ResponseMetadataType;
import villagecompute.weather.api.types.WeatherSummaryResponseType;
import villagecompute.weather.data.models.LocationSummary;
import villagecompute.weather.data.models.LocationWeatherDetails;
import villagecompute.weather.exceptions.RateLimitExceededException;
import villagecompute.weather.exceptions.ResourceNotFoundException;
import villagecompute.weather.exceptions.ServiceUnavailableException;
import villagecompute.weather.exceptions.ValidationException;
import villagecompute.weather.services.RateLimitService;
import villagecompute.weather.services.RateLimitService.Layer;
import villagecompute.weather.services.WeatherSummaryService;

/**
 * REST endpoints for favorite-location weather summaries.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/v1/weather/summary} - favorites whose maximum tomorrow exceeds a threshold</li>
 * <li>{@code GET /api/v1/weather/locations/{locationId}} - location metadata and multi-day forecast</li>
 * <li>{@code GET /api/v1/weather/rate-limit} - global upstream budget</li>
 * </ul>
 *
 * <p>
 * <b>Error Mapping:</b> validation 400, unknown location 404, exhausted budget 429 (with {@code Retry-After}),
 * upstream failure 503, anything else 500. Every body carries {@link ResponseMetadataType}.
 *
 * <p>
 * <b>Response Format:</b>
 *
 * <pre>
 * {
 *   "locations": [
 *     {
 *       "location_id": "51.5074,-0.1278",
 *       "location_name": "London",
 *       "country": "GB",
 *       "tomorrow_max_temperature": 25.0,
 *       "temperature_unit": "celsius",
 *       "weather_description": "clear sky"
 *     }
 *   ],
 *   "metadata": { "timestamp": "...", "source": "weather-summary-api", "rate_limit_remaining": 998 }
 * }
 * </pre>
 */
@Path("/api/v1/weather")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Weather",
        description = "Weather summaries for favorite locations")
public class WeatherResource {

    private static final Logger LOG = Logger.getLogger(WeatherResource.class);

    @Inject
    WeatherSummaryService weatherSummaryService;

    @Inject
    RateLimitService rateLimitService;

    @Inject
    Clock clock;

    @GET
    @Path("/summary")
    @RateLimited(
            action = "weather")
    @Operation(
            summary = "Weather summary for favorite locations",
            description = "Lists the locations whose forecast maximum for tomorrow is strictly above the threshold")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Summary computed; locations that failed upstream are omitted",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = WeatherSummaryResponseType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid locations, temperature or unit",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class))),
                    @APIResponse(
                            responseCode = "429",
                            description = "Rate limit exceeded",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class)))})
    public Response getSummary(@Parameter(
            description = "Flat coordinate list: lat,lon,lat,lon",
            example = "51.5074,-0.1278,40.7128,-74.0060") @QueryParam("locations") String locations,
            @Parameter(
                    description = "Temperature threshold",
                    example = "20") @QueryParam("temperature") String temperature,
            @Parameter(
                    description = "celsius (default) or fahrenheit",
                    example = "celsius") @QueryParam("unit") String unit) {
        try {
            List<LocationSummary> summaries = weatherSummaryService.getWeatherSummaryForFavorites(locations,
                    temperature, unit);
            List<LocationSummaryType> body = summaries.stream().map(LocationSummaryType::from).toList();
            return Response.ok(new WeatherSummaryResponseType(body, metadata())).build();
        } catch (ValidationException e) {
            LOG.debugf("Invalid summary request: %s", e.getMessage());
            return validationError(e);
        } catch (RateLimitExceededException e) {
            return rateLimited(e);
        } catch (ServiceUnavailableException e) {
            LOG.errorf(e, "Weather summary unavailable");
            return serviceUnavailable();
        } catch (Exception e) {
            LOG.errorf(e, "Unexpected error computing weather summary");
            return internalError();
        }
    }

    @GET
    @Path("/locations/{locationId}")
    @RateLimited(
            action = "weather")
    @Operation(
            summary = "Location weather details",
            description = "Location metadata and multi-day forecast for a 'lat,lon' location id")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Location and forecast",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = LocationWeatherResponseType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid location id",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Location not found",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Weather provider unavailable",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class)))})
    public Response getLocationWeather(@Parameter(
            description = "Location id in 'lat,lon' form",
            example = "51.5074,-0.1278") @PathParam("locationId") String locationId) {
        try {
            LocationWeatherDetails found = weatherSummaryService.getLocationWeatherDetails(locationId)
                    .orElseThrow(() -> new ResourceNotFoundException("Location not found: " + locationId));
            List<DailyForecastType> forecast = found.forecast().forecasts().stream().map(DailyForecastType::from)
                    .toList();
            return Response
                    .ok(new LocationWeatherResponseType(LocationType.from(found.location()), forecast, metadata()))
                    .build();
        } catch (ValidationException e) {
            LOG.debugf("Invalid location request: %s", e.getMessage());
            return validationError(e);
        } catch (ResourceNotFoundException e) {
            return error(Response.Status.NOT_FOUND, "NOT_FOUND", e.getMessage(), Map.of());
        } catch (RateLimitExceededException e) {
            return rateLimited(e);
        } catch (ServiceUnavailableException e) {
            LOG.errorf(e, "Weather details unavailable for %s", locationId);
            return serviceUnavailable();
        } catch (Exception e) {
            LOG.errorf(e, "Unexpected error fetching weather details for %s", locationId);
            return internalError();
        }
    }

    @GET
    @Path("/rate-limit")
    @Operation(
            summary = "Global rate limit status",
            description = "Capacity, remaining tokens and counters of the global daily upstream budget")
    @APIResponse(
            responseCode = "200",
            description = "Current status",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = RateLimitStatusType.class)))
    public RateLimitStatusType getRateLimitStatus() {
        return RateLimitStatusType.from(rateLimitService.getGlobalStats(), metadata());
    }

    private ResponseMetadataType metadata() {
        return ResponseMetadataType.of(clock.instant().toString(), rateLimitService.getGlobalRemaining());
    }

    private Response validationError(ValidationException e) {
        return error(Response.Status.BAD_REQUEST, "VALIDATION_ERROR", e.getMessage(),
                Map.of("reason_code", e.getReasonCode()));
    }

    private Response rateLimited(RateLimitExceededException e) {
        LOG.warnf("Weather request rejected by %s rate limit", e.getLayer().getValue());
        String code = e.getLayer() == Layer.BURST ? "BURST_LIMIT_EXCEEDED" : "RATE_LIMIT_EXCEEDED";
        Response response = error(Response.Status.TOO_MANY_REQUESTS, code, e.getMessage(),
                Map.of("layer", e.getLayer().getValue(), "retry_after_seconds", e.getRetryAfterSeconds()));
        return Response.fromResponse(response).header("Retry-After", e.getRetryAfterSeconds()).build();
    }

    private Response serviceUnavailable() {
        return error(Response.Status.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE",
                "Unable to fetch weather data. Please try again later.", Map.of());
    }

    private Response internalError() {
        return error(Response.Status.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred",
                Map.of());
    }

    private Response error(Response.Status status, String code, String message, Map<String, Object> details) {
        return Response.status(status).type(MediaType.APPLICATION_JSON)
                .entity(ErrorResponseType.of(code, message, details, metadata())).build();
    }
}
