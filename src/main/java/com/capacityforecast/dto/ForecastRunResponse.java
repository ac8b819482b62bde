package com.capacityforecast.dto;

import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ForecastRun;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastRunResponse {
    UUID forecastRunId;
    ForecastRun run;
    /** Top-ranked result; absent when no model succeeded. */
    ForecastResult best;
}
