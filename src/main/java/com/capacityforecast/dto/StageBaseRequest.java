package com.capacityforecast.dto;

import com.capacityforecast.service.SelectionPolicy;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class StageBaseRequest {
    @NotNull(message = "forecastRunId is required")
    UUID forecastRunId;

    @Builder.Default
    SelectionPolicy policy = SelectionPolicy.BEST;
}
