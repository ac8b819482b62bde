package com.capacityforecast.dto;

import com.capacityforecast.model.AnomalyRecord;
import com.capacityforecast.store.SmoothedSeriesDocument;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PrepareSeriesResponse {
    SmoothedSeriesDocument series;
    List<AnomalyRecord> anomalies;
    long anomalyCount;
    int droppedRows;
    boolean aggregated;
}
