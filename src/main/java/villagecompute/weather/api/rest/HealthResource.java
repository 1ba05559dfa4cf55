/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.weather.api.types.HealthType;
import villagecompute.weather.api.types.HealthType.CacheStatusType;
import villagecompute.weather.data.repositories.WeatherRepository;

@Path("/api/health")
@Tag(
        name = "Health",
        description = "Health check operations")
public class HealthResource {

    @Inject
    WeatherRepository weatherRepository;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Health check",
            description = "Report provider health from recent upstream calls and cache statistics")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "UP, or DEGRADED when the last provider call failed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthType.class)))})
    public HealthType health() {
        boolean providerHealthy = weatherRepository.isProviderHealthy();
        return new HealthType(providerHealthy ? "UP" : "DEGRADED", weatherRepository.providerName(), providerHealthy,
                weatherRepository.cacheStatistics().stream().map(CacheStatusType::from).toList());
    }
}
