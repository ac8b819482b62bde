package com.capacityforecast.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public enum Granularity {
    DAILY(7),
    MONTHLY(12);

    private final int seasonLength;

    Granularity(int seasonLength) {
        this.seasonLength = seasonLength;
    }

    public int seasonLength() {
        return seasonLength;
    }

    public LocalDate align(LocalDate date) {
        return this == MONTHLY ? date.withDayOfMonth(1) : date;
    }

    public LocalDate plus(LocalDate period, long steps) {
        return this == MONTHLY ? period.plusMonths(steps) : period.plusDays(steps);
    }

    /** Position of a date within its season, in [0, seasonLength). */
    public int seasonalPosition(LocalDate period) {
        return this == MONTHLY ? period.getMonthValue() - 1 : period.getDayOfWeek().getValue() - 1;
    }

    /** Elapsed time between two dates measured in periods of this granularity. */
    public double periodsBetween(LocalDate from, LocalDate to) {
        long days = ChronoUnit.DAYS.between(from, to);
        return this == MONTHLY ? days / 30.436875 : days;
    }

    public boolean isFinerThan(Granularity other) {
        return this == DAILY && other == MONTHLY;
    }

    public boolean contains(LocalDate period, LocalDate date) {
        return align(date).equals(period);
    }
}
