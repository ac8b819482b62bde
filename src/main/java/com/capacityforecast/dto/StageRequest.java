package com.capacityforecast.dto;

import com.capacityforecast.model.Adjustment;
import com.capacityforecast.model.StageName;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class StageRequest {
    @NotNull(message = "stage name is required")
    StageName name;

    /** Optional; the configured default stage order applies when absent. */
    @Min(value = 0, message = "order must be >= 0")
    Integer order;

    @Builder.Default
    List<Adjustment> adjustments = List.of();

    boolean periodAltering;
}
