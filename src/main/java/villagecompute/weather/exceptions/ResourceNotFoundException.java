/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

/**
 * Exception thrown when a requested location cannot be resolved.
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found in REST resources.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
