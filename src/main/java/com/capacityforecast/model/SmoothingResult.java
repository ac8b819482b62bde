package com.capacityforecast.model;

import java.util.List;

public record SmoothingResult(Series smoothed, List<AnomalyRecord> anomalies) {

    public SmoothingResult {
        anomalies = List.copyOf(anomalies);
    }

    public long anomalyCount() {
        return anomalies.stream().filter(AnomalyRecord::anomaly).count();
    }
}
