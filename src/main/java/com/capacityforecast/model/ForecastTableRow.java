package com.capacityforecast.model;

import java.util.Map;

/**
 * A row of the wide forecast table. {@code cells} is keyed by "MMM-yy" label in calendar
 * order; {@code avg} is null when the row has no cells.
 */
public record ForecastTableRow(String model, Double avg, Map<String, Double> cells) {}
