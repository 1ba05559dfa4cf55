/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data.models;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Unit-aware temperature value.
 *
 * <p>
 * The only hard invariant is physical: the Celsius-equivalent value must not be below absolute zero. An upper ceiling
 * is a product policy and is only checked when a caller passes one to {@link #parse(String, TemperatureUnit,
 * OptionalDouble)}.
 *
 * <p>
 * Comparisons always happen in Celsius so values in different units compare correctly.
 */
public final class Temperature {

    public static final double ABSOLUTE_ZERO_CELSIUS = -273.15;

    private final double value;
    private final TemperatureUnit unit;

    private Temperature(double value, TemperatureUnit unit) {
        this.value = value;
        this.unit = unit;
    }

    /**
     * @throws IllegalArgumentException
     *             if the value is not finite or is below absolute zero
     */
    public static Temperature of(double value, TemperatureUnit unit) {
        Objects.requireNonNull(unit, "unit is required");
        ValidationResult<Temperature> result = create(value, unit, OptionalDouble.empty());
        if (result.isFailure()) {
            throw new IllegalArgumentException(result.failure().orElseThrow().message());
        }
        return result.value();
    }

    public static Temperature celsius(double value) {
        return of(value, TemperatureUnit.CELSIUS);
    }

    public static Temperature fahrenheit(double value) {
        return of(value, TemperatureUnit.FAHRENHEIT);
    }

    /**
     * Parses a numeric temperature without an upper ceiling.
     */
    public static ValidationResult<Temperature> parse(String temperatureString, TemperatureUnit unit) {
        return parse(temperatureString, unit, OptionalDouble.empty());
    }

    /**
     * Parses a numeric temperature.
     *
     * @param temperatureString
     *            text such as {@code "20"} or {@code "-3.5"}
     * @param unit
     *            unit the text is expressed in
     * @param ceilingCelsius
     *            optional inclusive upper bound in Celsius
     * @return parsed temperature or a failure with code {@code INVALID_TEMPERATURE},
     *         {@code TEMPERATURE_BELOW_ABSOLUTE_ZERO} or {@code TEMPERATURE_ABOVE_CEILING}
     */
    public static ValidationResult<Temperature> parse(String temperatureString, TemperatureUnit unit,
            OptionalDouble ceilingCelsius) {
        Objects.requireNonNull(unit, "unit is required");
        if (temperatureString == null || temperatureString.isBlank()) {
            return ValidationResult.failure(ValidationFailure.INVALID_TEMPERATURE, "Temperature value is required");
        }

        double value;
        try {
            value = Double.parseDouble(temperatureString.trim());
        } catch (NumberFormatException e) {
            return ValidationResult.failure(ValidationFailure.INVALID_TEMPERATURE,
                    "Invalid temperature value: '" + temperatureString + "'");
        }
        return create(value, unit, ceilingCelsius);
    }

    private static ValidationResult<Temperature> create(double value, TemperatureUnit unit,
            OptionalDouble ceilingCelsius) {
        if (!Double.isFinite(value)) {
            return ValidationResult.failure(ValidationFailure.INVALID_TEMPERATURE,
                    "Temperature must be a finite number, got: " + value);
        }

        Temperature temperature = new Temperature(value, unit);
        double celsius = temperature.toCelsius();
        if (celsius < ABSOLUTE_ZERO_CELSIUS) {
            return ValidationResult.failure(ValidationFailure.TEMPERATURE_BELOW_ABSOLUTE_ZERO,
                    "Temperature cannot be below absolute zero (-273.15°C), got: " + temperature.format());
        }
        if (ceilingCelsius.isPresent() && celsius > ceilingCelsius.getAsDouble()) {
            return ValidationResult.failure(ValidationFailure.TEMPERATURE_ABOVE_CEILING, "Temperature seems unreasonably high (>"
                    + ceilingCelsius.getAsDouble() + "°C), got: " + temperature.format());
        }
        return ValidationResult.success(temperature);
    }

    public double getValue() {
        return value;
    }

    public TemperatureUnit getUnit() {
        return unit;
    }

    public double toCelsius() {
        return switch (unit) {
            case CELSIUS -> value;
            case FAHRENHEIT -> (value - 32.0) * 5.0 / 9.0;
        };
    }

    public double toFahrenheit() {
        return switch (unit) {
            case CELSIUS -> value * 9.0 / 5.0 + 32.0;
            case FAHRENHEIT -> value;
        };
    }

    public double toUnit(TemperatureUnit targetUnit) {
        return switch (targetUnit) {
            case CELSIUS -> toCelsius();
            case FAHRENHEIT -> toFahrenheit();
        };
    }

    /**
     * Returns this temperature expressed in another unit.
     */
    public Temperature convertTo(TemperatureUnit targetUnit) {
        return targetUnit == unit ? this : new Temperature(toUnit(targetUnit), targetUnit);
    }

    /**
     * Strict comparison ({@code >}) in Celsius.
     */
    public boolean isAbove(Temperature threshold) {
        return toCelsius() > threshold.toCelsius();
    }

    public String format() {
        return value + "°" + unit.getSymbol();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Temperature other)) {
            return false;
        }
        return Double.compare(value, other.value) == 0 && unit == other.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        return format();
    }
}
