package com.capacityforecast.store;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One row of the smoothed-series interchange file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SmoothedSeriesRecord(
    @JsonProperty("Date") @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
    @JsonProperty("Final_Smoothed_Value") Double finalSmoothedValue,
    @JsonProperty("IQ_value") Double iqValue
) {}
