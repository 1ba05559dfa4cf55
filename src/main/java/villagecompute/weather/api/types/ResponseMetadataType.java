/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Metadata attached to every API response.
 *
 * @param timestamp
 *            ISO 8601 instant the response was produced
 * @param source
 *            always "weather-summary-api"
 * @param rateLimitRemaining
 *            upstream requests left in today's global budget
 */
@Schema(
        description = "Response metadata")
public record ResponseMetadataType(@Schema(
        description = "ISO 8601 instant the response was produced",
        example = "2025-06-01T12:00:00Z") String timestamp,

        @Schema(
                description = "Producing service",
                example = "weather-summary-api") String source,

        @Schema(
                description = "Upstream requests left in today's global budget",
                example = "987") @JsonProperty("rate_limit_remaining") int rateLimitRemaining) {

    public static final String SOURCE = "weather-summary-api";

    public static ResponseMetadataType of(String timestamp, int rateLimitRemaining) {
        return new ResponseMetadataType(timestamp, SOURCE, rateLimitRemaining);
    }
}
