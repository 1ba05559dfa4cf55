/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Two-variant outcome of parsing or validating user input.
 *
 * <p>
 * Either a {@link Success} holding the parsed value or a {@link Failure} holding a {@link ValidationFailure}. Expected
 * domain failures never throw; callers decide how to surface them.
 *
 * @param <T>
 *            type of the parsed value
 */
public sealed interface ValidationResult<T> permits ValidationResult.Success, ValidationResult.Failure {

    static <T> ValidationResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ValidationResult<T> failure(String code, String message) {
        return new Failure<>(ValidationFailure.of(code, message));
    }

    static <T> ValidationResult<T> failure(ValidationFailure failure) {
        return new Failure<>(failure);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the parsed value.
     *
     * @throws IllegalStateException
     *             if this result is a failure
     */
    T value();

    /**
     * Returns the failure, or empty for a success.
     */
    Optional<ValidationFailure> failure();

    /**
     * Transforms a successful value, passing failures through unchanged.
     */
    <R> ValidationResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Chains another validation step onto a successful value.
     */
    <R> ValidationResult<R> flatMap(Function<? super T, ValidationResult<R>> mapper);

    record Success<T>(T value) implements ValidationResult<T> {

        public Success {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<ValidationFailure> failure() {
            return Optional.empty();
        }

        @Override
        public <R> ValidationResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <R> ValidationResult<R> flatMap(Function<? super T, ValidationResult<R>> mapper) {
            return mapper.apply(value);
        }
    }

    record Failure<T>(ValidationFailure reason) implements ValidationResult<T> {

        public Failure {
            Objects.requireNonNull(reason, "reason is required");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("No value present: " + reason.message());
        }

        @Override
        public Optional<ValidationFailure> failure() {
            return Optional.of(reason);
        }

        @Override
        public <R> ValidationResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(reason);
        }

        @Override
        public <R> ValidationResult<R> flatMap(Function<? super T, ValidationResult<R>> mapper) {
            return new Failure<>(reason);
        }
    }
}
