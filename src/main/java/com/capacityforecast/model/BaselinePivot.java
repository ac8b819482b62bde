package com.capacityforecast.model;

import java.util.List;
import java.util.Map;

/**
 * Year by month view of the smoothed baseline. Only months that occur in the data are listed.
 */
public record BaselinePivot(List<String> months, Map<Integer, Map<String, Double>> years) {}
