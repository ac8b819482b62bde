package com.capacityforecast.exception;

import lombok.Getter;

@Getter
public abstract class CapacityPlanningException extends RuntimeException {
    private final String errorCode;
    protected CapacityPlanningException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected CapacityPlanningException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
