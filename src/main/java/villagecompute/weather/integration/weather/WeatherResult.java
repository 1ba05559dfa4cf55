/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.integration.weather;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a provider call: either data or a classified error.
 *
 * @param <T>
 *            payload type
 */
public sealed interface WeatherResult<T> permits WeatherResult.Success, WeatherResult.Failure {

    static <T> WeatherResult<T> success(T data) {
        return new Success<>(data);
    }

    static <T> WeatherResult<T> failure(WeatherProviderError error) {
        return new Failure<>(error);
    }

    static <T> WeatherResult<T> failure(WeatherProviderError.ErrorType type, String message) {
        return new Failure<>(new WeatherProviderError(type, message));
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * @return the payload, or empty for a failure
     */
    default Optional<T> data() {
        if (this instanceof Success<T> success) {
            return Optional.of(success.value());
        }
        return Optional.empty();
    }

    /**
     * @return the error, or empty for a success
     */
    default Optional<WeatherProviderError> error() {
        if (this instanceof Failure<T> failure) {
            return Optional.of(failure.reason());
        }
        return Optional.empty();
    }

    record Success<T>(T value) implements WeatherResult<T> {

        public Success {
            Objects.requireNonNull(value, "value is required");
        }
    }

    record Failure<T>(WeatherProviderError reason) implements WeatherResult<T> {

        public Failure {
            Objects.requireNonNull(reason, "reason is required");
        }
    }
}
