package com.capacityforecast.dto;

import com.capacityforecast.model.Granularity;
import com.capacityforecast.model.RawRecord;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
public class PrepareSeriesRequest {
    @NotEmpty(message = "records must not be empty")
    List<RawRecord> records;

    @Builder.Default
    Granularity granularity = Granularity.MONTHLY;

    @Builder.Default
    @JsonFormat(pattern = "yyyy-MM-dd")
    List<LocalDate> holidays = List.of();
}
