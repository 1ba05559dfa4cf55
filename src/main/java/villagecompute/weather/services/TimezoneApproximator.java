/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import org.jboss.logging.Logger;
import villagecompute.weather.data.models.Coordinates;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Approximates a location's local calendar date from its longitude.
 *
 * <p>
 * The offset is {@code round(longitude / 15)} hours, clamped to [-12, +14]. Real timezone boundaries follow politics
 * rather than meridians, so dates near a boundary or the date line may be off by one; no IANA lookup is performed.
 */
public class TimezoneApproximator {

    private static final Logger LOG = Logger.getLogger(TimezoneApproximator.class);

    public static final int MIN_OFFSET_HOURS = -12;
    public static final int MAX_OFFSET_HOURS = 14;

    private static final double DEGREES_PER_HOUR = 15.0;

    private final Clock clock;

    public TimezoneApproximator() {
        this(Clock.systemUTC());
    }

    public TimezoneApproximator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * @return approximate UTC offset in whole hours for the given longitude
     */
    public static int offsetHours(double longitude) {
        long rounded = Math.round(longitude / DEGREES_PER_HOUR);
        return (int) Math.max(MIN_OFFSET_HOURS, Math.min(MAX_OFFSET_HOURS, rounded));
    }

    public ZoneOffset offset(Coordinates coordinates) {
        return ZoneOffset.ofHours(offsetHours(coordinates.longitude()));
    }

    public LocalDate today(Coordinates coordinates, Instant nowUtc) {
        Objects.requireNonNull(nowUtc, "nowUtc is required");
        LocalDate date = LocalDate.ofInstant(nowUtc, offset(coordinates));
        LOG.debugf("Approximate local date for %s is %s (offset %s)", coordinates, date, offset(coordinates));
        return date;
    }

    public LocalDate today(Coordinates coordinates) {
        return today(coordinates, clock.instant());
    }

    public LocalDate tomorrow(Coordinates coordinates, Instant nowUtc) {
        return today(coordinates, nowUtc).plusDays(1);
    }

    public LocalDate tomorrow(Coordinates coordinates) {
        return tomorrow(coordinates, clock.instant());
    }

    public boolean isTomorrow(Coordinates coordinates, LocalDate date, Instant nowUtc) {
        return tomorrow(coordinates, nowUtc).equals(date);
    }

    public boolean isTomorrow(Coordinates coordinates, LocalDate date) {
        return isTomorrow(coordinates, date, clock.instant());
    }
}
