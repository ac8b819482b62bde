package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

public record AnomalyRecord(
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate period,
    double rawValue,
    double smoothedValue,
    boolean anomaly,
    AnomalyMethod method
) {}
