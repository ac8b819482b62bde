package com.capacityforecast.store;

import com.capacityforecast.model.Granularity;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SmoothedSeriesDocument {
    @Builder.Default
    Granularity granularity = Granularity.MONTHLY;
    String category;
    @Builder.Default
    List<SmoothedSeriesRecord> records = List.of();
    @Builder.Default
    @JsonFormat(pattern = "yyyy-MM-dd")
    List<LocalDate> holidays = List.of();
}
