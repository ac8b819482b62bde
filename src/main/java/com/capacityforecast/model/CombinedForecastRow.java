package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

/**
 * One (model, month) cell of the long forecast table.
 */
public record CombinedForecastRow(
    String model,
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate month,
    String monthYear,
    double forecast
) {}
