package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum ModelId {
    PROPHET("prophet", "Prophet"),
    RF("rf", "Rf", "random_forest"),
    XGBOOST("xgboost", "Xgb", "xgb"),
    VAR("var", "Var"),
    SARIMAX("sarimax", "Sarimax"),
    ENSEMBLE("ensemble", "Ensemble");

    private final String key;
    private final String displayName;
    private final String[] aliases;

    ModelId(String key, String displayName, String... aliases) {
        this.key = key;
        this.displayName = displayName;
        this.aliases = aliases;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    @JsonCreator
    public static ModelId fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Model id must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ModelId id : values()) {
            if (id.key.equals(normalized) || Arrays.asList(id.aliases).contains(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown model id: " + value);
    }
}
