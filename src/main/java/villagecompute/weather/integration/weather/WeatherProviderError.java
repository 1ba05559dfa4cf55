/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.integration.weather;

import java.util.Objects;

/**
 * Classified provider failure.
 *
 * @param type
 *            failure class
 * @param message
 *            human-readable detail for logs
 */
public record WeatherProviderError(ErrorType type, String message) {

    public enum ErrorType {
        NETWORK_ERROR, RATE_LIMIT_EXCEEDED, INVALID_API_KEY, LOCATION_NOT_FOUND, PROVIDER_UNAVAILABLE, INVALID_REQUEST,
        UNKNOWN_ERROR;

        /**
         * Whether another provider could plausibly answer the same request. Not-found and malformed requests would
         * fail the same way anywhere.
         */
        public boolean isProviderSpecific() {
            return this != LOCATION_NOT_FOUND && this != INVALID_REQUEST;
        }
    }

    public WeatherProviderError {
        Objects.requireNonNull(type, "type is required");
        message = message == null ? type.name() : message;
    }

    /**
     * Classifies an upstream HTTP status.
     */
    public static WeatherProviderError fromHttpStatus(int status, String message) {
        ErrorType type;
        if (status == 400) {
            type = ErrorType.INVALID_REQUEST;
        } else if (status == 401 || status == 403) {
            type = ErrorType.INVALID_API_KEY;
        } else if (status == 404) {
            type = ErrorType.LOCATION_NOT_FOUND;
        } else if (status == 429) {
            type = ErrorType.RATE_LIMIT_EXCEEDED;
        } else if (status >= 500) {
            type = ErrorType.PROVIDER_UNAVAILABLE;
        } else {
            type = ErrorType.UNKNOWN_ERROR;
        }
        return new WeatherProviderError(type, message);
    }
}
