/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Response of {@code GET /api/v1/weather/summary}.
 *
 * @param locations
 *            locations above the threshold, in request order
 * @param metadata
 *            response metadata
 */
public record WeatherSummaryResponseType(@NotNull @Valid List<LocationSummaryType> locations,
        @NotNull ResponseMetadataType metadata) {
}
