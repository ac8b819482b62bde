package com.capacityforecast.dto;

import com.capacityforecast.model.BaselinePivot;
import com.capacityforecast.model.CombinedForecastRow;
import com.capacityforecast.model.ForecastTable;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastTablesResponse {
    List<CombinedForecastRow> combined;
    ForecastTable wide;
    BaselinePivot baselinePivot;
}
