/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import java.util.List;

/**
 * Response of {@code GET /api/v1/weather/locations/{locationId}}.
 *
 * @param location
 *            resolved location
 * @param forecast
 *            daily forecast ascending by date
 * @param metadata
 *            response metadata
 */
public record LocationWeatherResponseType(LocationType location, List<DailyForecastType> forecast,
        ResponseMetadataType metadata) {
}
