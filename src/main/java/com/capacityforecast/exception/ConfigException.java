package com.capacityforecast.exception;

public class ConfigException extends CapacityPlanningException {
    public ConfigException(String message) {
        super("CONFIG_ERROR", message);
    }
}
