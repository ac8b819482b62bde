package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyMethod {
    STATISTICAL("statistical"),
    HOLIDAY_ADJUSTED("holiday-adjusted");

    private final String label;

    AnomalyMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
