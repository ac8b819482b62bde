package com.capacityforecast.dto;

import com.capacityforecast.model.ModelId;
import com.capacityforecast.store.SmoothedSeriesDocument;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ForecastRunRequest {
    @NotNull(message = "series is required")
    SmoothedSeriesDocument series;

    @NotEmpty(message = "at least one model is required")
    List<ModelId> models;

    /** Falls back to the configured default horizon. */
    @Min(value = 1, message = "horizon must be >= 1")
    @Max(value = 120, message = "horizon must be <= 120")
    Integer horizon;

    /** When set, the finished run is exported as the latest forecast of this area. */
    @Pattern(regexp = "[A-Za-z0-9_-]{1,64}", message = "area must be alphanumeric")
    String area;
}
