package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative adjustment applied by a {@link TransformationStage}. A null category and an
 * empty period set both mean "everything".
 */
public record Adjustment(
    AdjustmentType type,
    double amount,
    String category,
    @JsonFormat(pattern = "yyyy-MM-dd") Set<LocalDate> periods,
    int extendBy
) {

    public Adjustment {
        Objects.requireNonNull(type, "type");
        periods = periods == null ? Set.of() : Set.copyOf(periods);
    }

    public static Adjustment multiply(double factor) {
        return new Adjustment(AdjustmentType.MULTIPLY, factor, null, Set.of(), 0);
    }

    public static Adjustment multiply(double factor, String category) {
        return new Adjustment(AdjustmentType.MULTIPLY, factor, category, Set.of(), 0);
    }

    public static Adjustment add(double offset) {
        return new Adjustment(AdjustmentType.ADD, offset, null, Set.of(), 0);
    }

    public static Adjustment add(double offset, String category) {
        return new Adjustment(AdjustmentType.ADD, offset, category, Set.of(), 0);
    }

    public static Adjustment override(double value, Set<LocalDate> periods) {
        return new Adjustment(AdjustmentType.OVERRIDE, value, null, periods, 0);
    }

    public static Adjustment extend(int periods, double factor) {
        return new Adjustment(AdjustmentType.EXTEND, factor, null, Set.of(), periods);
    }

    public boolean matches(TimePoint point) {
        boolean categoryMatch = category == null || category.equals(point.category());
        boolean periodMatch = periods.isEmpty() || periods.contains(point.period());
        return categoryMatch && periodMatch;
    }
}
