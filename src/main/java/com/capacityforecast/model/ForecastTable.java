package com.capacityforecast.model;

import java.util.List;
import java.util.Optional;

public record ForecastTable(List<String> monthColumns, List<ForecastTableRow> rows) {

    public static final String BASELINE_ROW = "Final_smoothed_values";

    public Optional<ForecastTableRow> row(String model) {
        return rows.stream().filter(r -> r.model().equals(model)).findFirst();
    }
}
