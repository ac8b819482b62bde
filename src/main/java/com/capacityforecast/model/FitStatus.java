package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FitStatus {
    OK,
    FAILED,
    SKIPPED;

    @JsonValue
    public String json() {
        return name().toLowerCase(Locale.ROOT);
    }
}
