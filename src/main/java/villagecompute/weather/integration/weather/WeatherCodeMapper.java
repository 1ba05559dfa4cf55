/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.integration.weather;

/**
 * Maps WMO weather codes (used by Open-Meteo) to descriptions in the lower-case wording OpenWeatherMap uses, so
 * summaries read the same whichever provider answered.
 *
 * <h2>WMO Code Ranges</h2>
 * <ul>
 * <li>0-3: Clear to overcast</li>
 * <li>45-48: Fog</li>
 * <li>51-57: Drizzle (57/56 freezing)</li>
 * <li>61-67: Rain (66/67 freezing)</li>
 * <li>71-77: Snow</li>
 * <li>80-86: Showers</li>
 * <li>95-99: Thunderstorm</li>
 * </ul>
 *
 * @see <a href="https://open-meteo.com/en/docs">Open-Meteo API Docs</a>
 */
public final class WeatherCodeMapper {

    public static final String UNKNOWN = "unknown";

    private WeatherCodeMapper() {
        // Utility class
    }

    /**
     * @param code
     *            WMO weather code (0-99)
     * @return description such as "light rain", or {@link #UNKNOWN}
     */
    public static String describe(int code) {
        return switch (code) {
            case 0 -> "clear sky";
            case 1 -> "mainly clear";
            case 2 -> "scattered clouds";
            case 3 -> "overcast clouds";
            case 45 -> "fog";
            case 48 -> "depositing rime fog";
            case 51 -> "light drizzle";
            case 53 -> "drizzle";
            case 55 -> "heavy intensity drizzle";
            case 56, 57 -> "freezing drizzle";
            case 61 -> "light rain";
            case 63 -> "moderate rain";
            case 65 -> "heavy intensity rain";
            case 66, 67 -> "freezing rain";
            case 71 -> "light snow";
            case 73 -> "snow";
            case 75 -> "heavy snow";
            case 77 -> "snow grains";
            case 80 -> "light shower rain";
            case 81 -> "shower rain";
            case 82 -> "heavy intensity shower rain";
            case 85 -> "light shower snow";
            case 86 -> "heavy shower snow";
            case 95 -> "thunderstorm";
            case 96, 99 -> "thunderstorm with hail";
            default -> UNKNOWN;
        };
    }
}
