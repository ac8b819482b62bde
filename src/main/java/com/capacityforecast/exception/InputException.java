package com.capacityforecast.exception;

public class InputException extends CapacityPlanningException {
    public InputException(String message) {
        super("INPUT_ERROR", message);
    }

    public static InputException insufficientData(int usable, int required) {
        return new InputException(
            "Insufficient data: " + usable + " usable periods, at least " + required + " required.");
    }
}
