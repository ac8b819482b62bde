package com.capacityforecast.model;

public enum SmoothingMethod {
    LINEAR_INTERPOLATION,
    ROLLING_MEDIAN
}
