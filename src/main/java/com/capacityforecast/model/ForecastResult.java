package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResult {
    ModelId modelId;
    String category;
    @Builder.Default
    List<ForecastPoint> horizon = List.of();
    FitStatus fitStatus;
    String failureReason;
    AccuracyMetrics accuracy;
    @Builder.Default
    List<String> warnings = List.of();

    public static ForecastResult ok(ModelId modelId, String category, List<ForecastPoint> horizon, List<String> warnings) {
        return ForecastResult.builder()
            .modelId(modelId)
            .category(category)
            .horizon(List.copyOf(horizon))
            .fitStatus(FitStatus.OK)
            .warnings(List.copyOf(warnings))
            .build();
    }

    public static ForecastResult failed(ModelId modelId, String category, String reason, List<String> warnings) {
        return ForecastResult.builder()
            .modelId(modelId)
            .category(category)
            .fitStatus(FitStatus.FAILED)
            .failureReason(reason == null || reason.isBlank() ? "unknown failure" : reason)
            .warnings(List.copyOf(warnings))
            .build();
    }

    public static ForecastResult skipped(ModelId modelId, String category, String reason) {
        return ForecastResult.builder()
            .modelId(modelId)
            .category(category)
            .fitStatus(FitStatus.SKIPPED)
            .failureReason(reason)
            .build();
    }

    @JsonIgnore
    public boolean isOk() {
        return fitStatus == FitStatus.OK;
    }

    public double[] pointEstimates() {
        return horizon.stream().mapToDouble(ForecastPoint::pointEstimate).toArray();
    }

    public ForecastResult withAccuracy(AccuracyMetrics metrics, List<String> extraWarnings) {
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(extraWarnings);
        return toBuilder().accuracy(metrics).warnings(List.copyOf(merged)).build();
    }
}
