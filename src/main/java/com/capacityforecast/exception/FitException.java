package com.capacityforecast.exception;

public class FitException extends CapacityPlanningException {
    public FitException(String message) {
        super("FIT_ERROR", message);
    }
    public FitException(String message, Throwable cause) {
        super("FIT_ERROR", message, cause);
    }
}
