/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching log entries with request context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code request_origin} - HTTP request path</li>
 * <li>{@code rate_limit_bucket} - rate limit bucket key (layer + client)</li>
 * <li>{@code location_id} - coordinate string of the location being processed</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> all methods operate on {@link MDC}, which is thread-local. Request handling must call
 * {@link #clearMDC()} when done so pooled threads do not carry stale context.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    /**
     * HTTP request path, e.g. "/api/v1/weather/summary".
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    /**
     * Rate limit bucket key, e.g. "burst:203.0.113.7".
     */
    public static final String MDC_RATE_LIMIT_BUCKET = "rate_limit_bucket";

    /**
     * Coordinate string of the location currently being resolved, e.g. "51.5074,-0.1278".
     */
    public static final String MDC_LOCATION_ID = "location_id";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span into MDC. Empty strings when no span is active.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    public static void setRateLimitBucket(String rateLimitBucket) {
        if (rateLimitBucket != null) {
            MDC.put(MDC_RATE_LIMIT_BUCKET, rateLimitBucket);
        }
    }

    public static void setLocationId(String locationId) {
        if (locationId != null) {
            MDC.put(MDC_LOCATION_ID, locationId);
        }
    }

    public static void clearLocationId() {
        MDC.remove(MDC_LOCATION_ID);
    }

    /**
     * Clears all fields set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_RATE_LIMIT_BUCKET);
        MDC.remove(MDC_LOCATION_ID);
    }
}
