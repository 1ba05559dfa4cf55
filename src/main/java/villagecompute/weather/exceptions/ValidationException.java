/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

import villagecompute.weather.data.models.ValidationFailure;

/**
 * Exception thrown when request input fails validation (malformed coordinates, unit or temperature).
 *
 * <p>
 * Carries a machine-readable {@link #getReasonCode() reason code}. Raised before any upstream call is attempted and
 * mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public static final String LOCATIONS_REQUIRED = "LOCATIONS_REQUIRED";
    public static final String LOCATION_REQUIRED = "LOCATION_REQUIRED";
    public static final String TEMPERATURE_REQUIRED = "TEMPERATURE_REQUIRED";
    public static final String TOO_MANY_LOCATIONS = "TOO_MANY_LOCATIONS";
    public static final String TEMPERATURE_OUT_OF_RANGE = "TEMPERATURE_OUT_OF_RANGE";

    private final String reasonCode;

    public ValidationException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public ValidationException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public static ValidationException from(ValidationFailure failure) {
        return new ValidationException(failure.code(), failure.message());
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
