/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

/**
 * Exception thrown when the upstream weather provider cannot serve a request (network error, timeout, upstream quota or
 * unexpected fault).
 *
 * <p>
 * Retryable by the caller; nothing is cached when it is raised. Mapped to HTTP 503 Service Unavailable.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
