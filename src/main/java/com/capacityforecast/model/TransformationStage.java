package com.capacityforecast.model;

import java.util.List;
import java.util.Objects;

public record TransformationStage(StageName name, int order, List<Adjustment> adjustments, boolean periodAltering) {

    public TransformationStage {
        Objects.requireNonNull(name, "name");
        if (order < 0) {
            throw new IllegalArgumentException("Stage order must be >= 0 but was " + order);
        }
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
    }

    public static TransformationStage of(StageName name, int order, Adjustment... adjustments) {
        return new TransformationStage(name, order, List.of(adjustments), false);
    }
}
