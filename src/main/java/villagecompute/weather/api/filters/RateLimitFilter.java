/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.filters;

import io.vertx.core.http.HttpServerRequest;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import villagecompute.weather.api.types.ErrorResponseType;
import villagecompute.weather.api.types.ResponseMetadataType;
import villagecompute.weather.observability.LoggingConfig;
import villagecompute.weather.services.RateLimitService;
import villagecompute.weather.services.RateLimitService.Layer;
import villagecompute.weather.services.RateLimitService.RateLimitResult;

import java.lang.reflect.Method;
import java.time.Clock;
import java.util.Map;

/**
 * Applies the per-client rate limit layers to {@code @RateLimited} endpoints.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Enrich MDC with trace context and the request path</li>
 * <li>Resolve the client key: first X-Forwarded-For entry, else the connection's remote address</li>
 * <li>Check the per-client hourly and burst buckets</li>
 * <li>On rejection: abort with 429, a layer-specific message and {@code Retry-After}</li>
 * <li>On success: add {@code X-RateLimit-Limit} / {@code X-RateLimit-Remaining} to the response</li>
 * </ol>
 *
 * <p>
 * The global daily layer is not checked here; the summary service spends one global token per upstream-bound location.
 */
@Provider
@RateLimited(
        action = "")
@Priority(Priorities.AUTHORIZATION)
public class RateLimitFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(RateLimitFilter.class);

    static final String RATE_LIMIT_RESULT_PROPERTY = "villagecompute.weather.rateLimit.result";

    static final String UNKNOWN_CLIENT = "unknown";

    @Inject
    RateLimitService rateLimitService;

    @Inject
    Clock clock;

    @Context
    ResourceInfo resourceInfo;

    @Context
    HttpServerRequest httpRequest;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("/" + requestContext.getUriInfo().getPath());

        String action = resolveAction();
        String clientKey = extractIpAddress(requestContext);
        RateLimitResult result = rateLimitService.checkClient(clientKey);
        requestContext.setProperty(RATE_LIMIT_RESULT_PROPERTY, result);

        if (result.allowed()) {
            return;
        }

        boolean burst = result.layer() == Layer.BURST;
        String code = burst ? "BURST_LIMIT_EXCEEDED" : "RATE_LIMIT_EXCEEDED";
        String message = (burst ? "Burst protection triggered" : "Rate limit exceeded") + ". Retry after "
                + result.retryAfterSeconds() + " seconds.";

        ErrorResponseType body = ErrorResponseType.of(code, message,
                Map.of("layer", result.layer().getValue(), "retry_after_seconds", result.retryAfterSeconds()),
                ResponseMetadataType.of(clock.instant().toString(), rateLimitService.getGlobalRemaining()));

        requestContext.abortWith(Response.status(Response.Status.TOO_MANY_REQUESTS).type(MediaType.APPLICATION_JSON)
                .header("X-RateLimit-Limit", result.limit()).header("X-RateLimit-Remaining", 0)
                .header("Retry-After", result.retryAfterSeconds()).entity(body).build());
        LOG.infof("Rate limit exceeded: action=%s layer=%s client=%s limit=%d", action, result.layer().getValue(),
                clientKey, result.limit());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        try {
            Object resultObj = requestContext.getProperty(RATE_LIMIT_RESULT_PROPERTY);
            if (resultObj instanceof RateLimitResult result && result.allowed()) {
                responseContext.getHeaders().add("X-RateLimit-Limit", result.limit());
                responseContext.getHeaders().add("X-RateLimit-Remaining", Math.max(0, result.remaining()));
            }
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private String resolveAction() {
        Method method = resourceInfo == null ? null : resourceInfo.getResourceMethod();
        if (method == null) {
            return "";
        }
        RateLimited rateLimited = method.getAnnotation(RateLimited.class);
        if (rateLimited == null) {
            rateLimited = resourceInfo.getResourceClass().getAnnotation(RateLimited.class);
        }
        return rateLimited == null ? "" : rateLimited.action();
    }

    /**
     * First X-Forwarded-For entry (reverse proxy), else the remote address of the connection.
     */
    String extractIpAddress(ContainerRequestContext context) {
        String forwardedFor = context.getHeaderString("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            int commaIndex = forwardedFor.indexOf(',');
            return commaIndex > 0 ? forwardedFor.substring(0, commaIndex).trim() : forwardedFor.trim();
        }

        if (httpRequest != null && httpRequest.remoteAddress() != null) {
            return httpRequest.remoteAddress().host();
        }
        return UNKNOWN_CLIENT;
    }
}
