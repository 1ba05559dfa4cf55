/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import java.util.Locale;

/**
 * Temperature units accepted by the API.
 */
public enum TemperatureUnit {
    CELSIUS("C", "Celsius"), FAHRENHEIT("F", "Fahrenheit");

    private final String symbol;
    private final String displayName;

    TemperatureUnit(String symbol, String displayName) {
        this.symbol = symbol;
        this.displayName = displayName;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Lower-case name used in API payloads ("celsius", "fahrenheit").
     */
    public String getValue() {
        return displayName.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a unit name. Blank or missing input defaults to Celsius.
     *
     * @param unitString
     *            "celsius", "c", "fahrenheit" or "f" (case-insensitive)
     * @return parsed unit, or an {@code INVALID_UNIT} failure
     */
    public static ValidationResult<TemperatureUnit> parse(String unitString) {
        if (unitString == null || unitString.isBlank()) {
            return ValidationResult.success(CELSIUS);
        }
        return switch (unitString.trim().toLowerCase(Locale.ROOT)) {
            case "celsius", "c" -> ValidationResult.success(CELSIUS);
            case "fahrenheit", "f" -> ValidationResult.success(FAHRENHEIT);
            default -> ValidationResult.failure(ValidationFailure.INVALID_UNIT,
                    "Invalid temperature unit: '" + unitString + "'. Supported: celsius, fahrenheit");
        };
    }
}
