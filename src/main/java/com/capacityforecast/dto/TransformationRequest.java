package com.capacityforecast.dto;

import com.capacityforecast.service.SelectionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Starts a transformation session. The base forecast comes from {@code forecastRunId} when
 * given, otherwise from the staged or latest forecast of {@code area}.
 */
@Value
@Builder
@Jacksonized
public class TransformationRequest {
    UUID forecastRunId;

    @Pattern(regexp = "[A-Za-z0-9_-]{1,64}", message = "area must be alphanumeric")
    String area;

    @Builder.Default
    SelectionPolicy policy = SelectionPolicy.BEST;

    /** Category label per forecast period, keyed by ISO date. */
    @Builder.Default
    Map<LocalDate, String> categories = Map.of();

    @NotNull(message = "stages are required")
    List<@Valid StageRequest> stages;
}
