/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import villagecompute.weather.data.models.Coordinates;
import villagecompute.weather.data.models.DailyForecast;
import villagecompute.weather.data.models.Location;
import villagecompute.weather.data.models.LocationSummary;
import villagecompute.weather.data.models.LocationWeatherDetails;
import villagecompute.weather.data.models.Temperature;
import villagecompute.weather.data.models.WeatherForecast;
import villagecompute.weather.data.repositories.WeatherRepository;
import villagecompute.weather.exceptions.RateLimitExceededException;
import villagecompute.weather.exceptions.ServiceUnavailableException;
import villagecompute.weather.exceptions.ValidationException;
import villagecompute.weather.observability.LoggingConfig;
import villagecompute.weather.observability.ObservabilityMetrics;
import villagecompute.weather.services.RateLimitService.RateLimitResult;
import villagecompute.weather.services.WeatherRequestValidator.SummaryRequest;

/**
 * Answers "which of my favorite locations will be warmer than X tomorrow?".
 *
 * <h2>Per-location Flow</h2>
 * <p>
 * {@code PENDING -> LOCATION_RESOLVED -> FORECAST_RESOLVED -> INCLUDED | EXCLUDED | FAILED}
 * <ol>
 * <li>Spend one global rate limit token (exhaustion aborts the whole batch)</li>
 * <li>Resolve the location, then its forecast, through the cache-aside repository</li>
 * <li>Pick tomorrow's entry: the date matching the location's approximate local tomorrow, else the second entry, else
 * the first</li>
 * <li>Include the location when tomorrow's maximum is strictly above the threshold</li>
 * </ol>
 *
 * <p>
 * Data failures for one location are logged and leave that location out; they never fail the batch. Nothing is
 * retried.
 */
public class WeatherSummaryService {

    private static final Logger LOG = Logger.getLogger(WeatherSummaryService.class);

    /**
     * Processing state of one location within a summary request.
     */
    public enum State {
        PENDING, LOCATION_RESOLVED, FORECAST_RESOLVED, INCLUDED, EXCLUDED, FAILED
    }

    private final WeatherRepository repository;
    private final RateLimitService rateLimitService;
    private final TimezoneApproximator timezoneApproximator;
    private final WeatherRequestValidator validator;
    private final ObservabilityMetrics metrics;
    private final Tracer tracer;
    private final Clock clock;
    private final int forecastDays;

    public WeatherSummaryService(WeatherRepository repository, RateLimitService rateLimitService,
            TimezoneApproximator timezoneApproximator, WeatherRequestValidator validator, ObservabilityMetrics metrics,
            Tracer tracer, Clock clock, int forecastDays) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.rateLimitService = Objects.requireNonNull(rateLimitService, "rateLimitService is required");
        this.timezoneApproximator = Objects.requireNonNull(timezoneApproximator, "timezoneApproximator is required");
        this.validator = Objects.requireNonNull(validator, "validator is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        if (forecastDays < 2) {
            throw new IllegalArgumentException("forecastDays must cover at least today and tomorrow");
        }
        this.forecastDays = forecastDays;
    }

    /**
     * Lists the locations whose maximum temperature tomorrow is above the threshold.
     *
     * @param locations
     *            flat "lat,lon,lat,lon" list
     * @param temperature
     *            threshold value
     * @param unit
     *            "celsius" (default) or "fahrenheit"; also the unit of the reported temperatures
     * @return matching locations in request order
     * @throws ValidationException
     *             if any parameter is invalid; no upstream call is made
     * @throws RateLimitExceededException
     *             if the global budget runs out; locations already processed are discarded
     */
    public List<LocationSummary> getWeatherSummaryForFavorites(String locations, String temperature, String unit) {
        SummaryRequest request = validator.validateSummaryRequest(locations, temperature, unit);
        LOG.infof("Computing weather summary for %d locations with max > %s", request.coordinates().size(),
                request.threshold().format());

        Span span = tracer.spanBuilder("weather.summary").setAttribute("location_count", request.coordinates().size())
                .setAttribute("threshold_celsius", request.threshold().toCelsius()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            Instant now = clock.instant();
            List<LocationSummary> summaries = new ArrayList<>();

            for (Coordinates coordinates : request.coordinates()) {
                consumeGlobalToken();
                summarize(coordinates, request.threshold(), now).ifPresent(summaries::add);
            }

            span.setAttribute("included_count", summaries.size());
            LOG.infof("Weather summary complete: %d of %d locations above %s", summaries.size(),
                    request.coordinates().size(), request.threshold().format());
            return summaries;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Looks up a location and its multi-day forecast.
     *
     * @param location
     *            "lat,lon"
     * @return details, or empty if the location cannot be resolved or has no forecast
     * @throws ValidationException
     *             if the location string is invalid
     * @throws RateLimitExceededException
     *             if the global budget is exhausted
     * @throws ServiceUnavailableException
     *             if the provider fails
     */
    public Optional<LocationWeatherDetails> getLocationWeatherDetails(String location) {
        Coordinates coordinates = validator.validateLocation(location);
        consumeGlobalToken();

        String locationId = coordinates.toCoordinateString();
        LoggingConfig.setLocationId(locationId);
        try {
            Optional<Location> resolved = repository.getLocationById(locationId);
            if (resolved.isEmpty()) {
                LOG.infof("Location %s could not be resolved", locationId);
                return Optional.empty();
            }
            return repository.getForecast(resolved.get(), forecastDays)
                    .map(forecast -> new LocationWeatherDetails(resolved.get(), forecast));
        } finally {
            LoggingConfig.clearLocationId();
        }
    }

    /**
     * @return tokens left in the global daily budget
     */
    public int getRemainingRequests() {
        return rateLimitService.getGlobalRemaining();
    }

    private void consumeGlobalToken() {
        RateLimitResult result = rateLimitService.checkGlobal();
        if (!result.allowed()) {
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.", result.layer(),
                    result.retryAfterSeconds());
        }
    }

    private Optional<LocationSummary> summarize(Coordinates coordinates, Temperature threshold, Instant now) {
        String locationId = coordinates.toCoordinateString();
        LoggingConfig.setLocationId(locationId);
        State state = State.PENDING;

        try {
            Optional<Location> location = repository.getLocationById(locationId);
            if (location.isEmpty()) {
                return finish(locationId, State.FAILED, "location not found");
            }
            state = State.LOCATION_RESOLVED;

            Optional<WeatherForecast> forecast = repository.getForecast(location.get(), forecastDays);
            if (forecast.isEmpty()) {
                return finish(locationId, State.FAILED, "no forecast");
            }
            state = State.FORECAST_RESOLVED;

            Optional<DailyForecast> tomorrow = selectTomorrow(coordinates, forecast.get(), now);
            if (tomorrow.isEmpty()) {
                return finish(locationId, State.FAILED, "forecast has no entries");
            }

            Temperature max = tomorrow.get().temperatureMax();
            if (!max.isAbove(threshold)) {
                LOG.debugf("Tomorrow's max %s does not exceed %s", max.format(), threshold.format());
                return finish(locationId, State.EXCLUDED, null);
            }

            recordOutcome(locationId, State.INCLUDED, null);
            return Optional.of(new LocationSummary(locationId, location.get().name(), location.get().country(),
                    max.toUnit(threshold.getUnit()), threshold.getUnit(), tomorrow.get().description()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to summarize location %s after state %s, skipping", locationId, state);
            return finish(locationId, State.FAILED, null);
        } finally {
            LoggingConfig.clearLocationId();
        }
    }

    /**
     * Picks the entry for the location's approximate local tomorrow. Without a date match the forecast is assumed to
     * start today, so the second entry stands in for tomorrow (or the only entry, if there is just one).
     */
    Optional<DailyForecast> selectTomorrow(Coordinates coordinates, WeatherForecast forecast, Instant now) {
        LocalDate tomorrow = timezoneApproximator.tomorrow(coordinates, now);
        Optional<DailyForecast> match = forecast.forDate(tomorrow);
        if (match.isPresent()) {
            return match;
        }

        List<DailyForecast> entries = forecast.forecasts();
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        LOG.debugf("No forecast entry dated %s for %s, using positional fallback", tomorrow, coordinates);
        return Optional.of(entries.size() > 1 ? entries.get(1) : entries.get(0));
    }

    private Optional<LocationSummary> finish(String locationId, State state, String reason) {
        recordOutcome(locationId, state, reason);
        return Optional.empty();
    }

    private void recordOutcome(String locationId, State state, String reason) {
        metrics.incrementSummaryLocation(state.name().toLowerCase(Locale.ROOT));
        if (state == State.FAILED && reason != null) {
            LOG.warnf("Location %s skipped: %s", locationId, reason);
        }
    }
}
