/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import java.util.Objects;

/**
 * Machine-readable reason a value could not be parsed or validated.
 *
 * <p>
 * Value types report failures through this record instead of throwing, so they stay independent of the exception
 * hierarchy used by the service layer.
 *
 * @param code
 *            stable reason code (e.g. {@code INVALID_COORDINATES})
 * @param message
 *            human-readable explanation
 */
public record ValidationFailure(String code, String message) {

    public static final String INVALID_COORDINATES = "INVALID_COORDINATES";
    public static final String INVALID_TEMPERATURE = "INVALID_TEMPERATURE";
    public static final String TEMPERATURE_BELOW_ABSOLUTE_ZERO = "TEMPERATURE_BELOW_ABSOLUTE_ZERO";
    public static final String TEMPERATURE_ABOVE_CEILING = "TEMPERATURE_ABOVE_CEILING";
    public static final String INVALID_UNIT = "INVALID_UNIT";

    public ValidationFailure {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(message, "message is required");
    }

    public static ValidationFailure of(String code, String message) {
        return new ValidationFailure(code, message);
    }
}
