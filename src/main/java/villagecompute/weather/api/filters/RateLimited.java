/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.filters;

import jakarta.ws.rs.NameBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * JAX-RS name binding for per-client rate limiting.
 *
 * <p>
 * Annotated endpoints pass through {@link RateLimitFilter}, which applies the per-client hourly and burst layers keyed
 * by client IP.
 *
 * <pre>
 * &#64;GET
 * &#64;Path("/summary")
 * &#64;RateLimited(
 *         action = "weather")
 * public Response summary(...) {
 * }
 * </pre>
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RateLimited {

    /**
     * Action name used in logs and the MDC bucket key, e.g. "weather".
     */
    String action();
}
