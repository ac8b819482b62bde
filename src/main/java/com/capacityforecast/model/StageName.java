package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StageName {
    TRANSFORM("Transform"),
    IA("IA"),
    MARKETING("Marketing");

    public static final String BASE_COLUMN = "base";

    private final String label;

    StageName(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static StageName fromLabel(String value) {
        for (StageName name : values()) {
            if (name.label.equalsIgnoreCase(value) || name.name().equalsIgnoreCase(value)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + value);
    }
}
