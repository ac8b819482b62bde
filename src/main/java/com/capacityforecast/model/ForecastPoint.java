package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.util.Objects;

public record ForecastPoint(
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate period,
    double pointEstimate,
    double lowerBound,
    double upperBound
) {

    public ForecastPoint {
        Objects.requireNonNull(period, "period");
        if (pointEstimate < 0 || lowerBound < 0) {
            throw new IllegalArgumentException("Forecast values must be non-negative at " + period);
        }
        if (lowerBound > pointEstimate || pointEstimate > upperBound) {
            throw new IllegalArgumentException("Bounds must satisfy lower <= point <= upper at " + period);
        }
    }

    /**
     * Clips raw model output at zero and widens the interval so it always contains the estimate.
     */
    public static ForecastPoint clipped(LocalDate period, double point, double lower, double upper) {
        double p = clip(point);
        double lo = Math.min(clip(Math.min(lower, upper)), p);
        double hi = Math.max(clip(Math.max(lower, upper)), p);
        return new ForecastPoint(period, p, lo, hi);
    }

    private static double clip(double value) {
        return Double.isFinite(value) ? Math.max(0.0, value) : 0.0;
    }
}
