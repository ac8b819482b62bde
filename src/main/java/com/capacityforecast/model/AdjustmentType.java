package com.capacityforecast.model;

public enum AdjustmentType {
    MULTIPLY,
    ADD,
    OVERRIDE,
    EXTEND
}
