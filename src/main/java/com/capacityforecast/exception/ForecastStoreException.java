package com.capacityforecast.exception;

public class ForecastStoreException extends CapacityPlanningException {
    public ForecastStoreException(String message, Throwable cause) {
        super("STORE_ERROR", message, cause);
    }
}
