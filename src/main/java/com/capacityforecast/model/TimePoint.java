package com.capacityforecast.model;

import java.time.LocalDate;
import java.util.Objects;

public record TimePoint(LocalDate period, double value, String category, Double iqFlag) {

    public TimePoint {
        Objects.requireNonNull(period, "period");
    }

    public static TimePoint of(LocalDate period, double value) {
        return new TimePoint(period, value, null, null);
    }

    public TimePoint withValue(double newValue) {
        return new TimePoint(period, newValue, category, iqFlag);
    }

    public TimePoint withCategory(String newCategory) {
        return new TimePoint(period, value, newCategory, iqFlag);
    }
}
