/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body for every non-2xx response.
 *
 * @param error
 *            what went wrong
 * @param metadata
 *            response metadata
 */
public record ErrorResponseType(ErrorDetailsType error, ResponseMetadataType metadata) {

    /**
     * @param code
     *            stable error code, e.g. "VALIDATION_ERROR"
     * @param message
     *            human-readable message
     * @param details
     *            extra fields such as the validation reason code; omitted when empty
     */
    public record ErrorDetailsType(String code, String message,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> details) {
    }

    public static ErrorResponseType of(String code, String message, Map<String, Object> details,
            ResponseMetadataType metadata) {
        return new ErrorResponseType(new ErrorDetailsType(code, message, details == null ? Map.of() : details),
                metadata);
    }
}
