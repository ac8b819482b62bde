package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Value
@Builder
@Jacksonized
public class ForecastRun {
    List<ForecastResult> results;
    List<ModelRanking> ranking;
    ErrorMetric metric;
    int backtestWindow;
    int horizon;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;

    public Optional<ForecastResult> result(ModelId modelId) {
        return results.stream().filter(r -> r.getModelId() == modelId).findFirst();
    }

    public Optional<ForecastResult> best() {
        return ranking.isEmpty() ? Optional.empty() : result(ranking.get(0).modelId());
    }

    public long okCount() {
        return results.stream().filter(ForecastResult::isOk).count();
    }
}
