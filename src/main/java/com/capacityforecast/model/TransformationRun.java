package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Audit record of one transformation session. {@code intermediateResults.get(i)} is the output
 * of {@code stages.get(i)}; a halted run only holds the stages that completed.
 */
@Value
@Builder
public class TransformationRun {
    UUID runId;
    ForecastResult baseForecast;
    Series baseSeries;
    List<TransformationStage> stages;
    List<Series> intermediateResults;
    Series finalResult;
    Map<LocalDate, Map<String, Double>> transposedView;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;

    @JsonIgnore
    public boolean isComplete() {
        return intermediateResults.size() == stages.size();
    }

    public Optional<Series> stageOutput(StageName name) {
        for (int i = 0; i < intermediateResults.size(); i++) {
            if (stages.get(i).name() == name) {
                return Optional.of(intermediateResults.get(i));
            }
        }
        return Optional.empty();
    }
}
