package com.capacityforecast.config;

import com.capacityforecast.model.ErrorMetric;
import com.capacityforecast.model.ModelId;
import com.capacityforecast.model.SmoothingMethod;
import com.capacityforecast.model.StageName;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Pipeline settings and per-model hyperparameters. {@link #defaults()} is the documented
 * default literal that {@link ConfigStore#reset()} restores.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlannerSettings {

    /** Periods withheld from the end of the series to score each model. */
    @Builder.Default
    int backtestWindow = 3;

    @Builder.Default
    ErrorMetric errorMetric = ErrorMetric.MAPE;

    /** Robust z-score above which a point is treated as an anomaly. */
    @Builder.Default
    double anomalyThreshold = 3.5;

    @Builder.Default
    int smoothingWindow = 5;

    @Builder.Default
    SmoothingMethod smoothingMethod = SmoothingMethod.LINEAR_INTERPOLATION;

    /** Lower bound on dispersion, as a fraction of the median absolute level. */
    @Builder.Default
    double relativeScaleFloor = 0.05;

    /** Weight of the comparable non-holiday period when correcting a holiday anomaly. */
    @Builder.Default
    double holidayBlendWeight = 0.5;

    /** Distinct raw dates above which fine-grained uploads are bucketed to the target granularity. */
    @Builder.Default
    int aggregationThreshold = 365;

    @Builder.Default
    int minimumPeriods = 3;

    @Builder.Default
    long modelTimeoutSeconds = 60;

    @Builder.Default
    int defaultHorizon = 12;

    @Builder.Default
    List<StageName> defaultStageOrder = List.of(StageName.TRANSFORM, StageName.IA, StageName.MARKETING);

    @Builder.Default
    Map<ModelId, Map<String, Object>> hyperparameters = ModelDefaults.all();

    /** Divisor applied to baseline cells when they are written into the wide forecast table. */
    @Builder.Default
    double baselineRowDivisor = 100.0;

    public static PlannerSettings defaults() {
        return PlannerSettings.builder().build();
    }

    public Hyperparameters hyperparametersFor(ModelId modelId) {
        return new Hyperparameters(modelId, hyperparameters.get(modelId));
    }

    public int stagePosition(StageName name) {
        int index = defaultStageOrder.indexOf(name);
        return index >= 0 ? index : defaultStageOrder.size() + name.ordinal();
    }
}
