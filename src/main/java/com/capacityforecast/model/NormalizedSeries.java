package com.capacityforecast.model;

public record NormalizedSeries(Series series, int droppedRows, boolean aggregated) {}
