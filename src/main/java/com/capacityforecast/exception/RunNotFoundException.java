package com.capacityforecast.exception;

import java.util.UUID;

public class RunNotFoundException extends CapacityPlanningException {
    public RunNotFoundException(UUID runId) {
        super("RUN_NOT_FOUND", "Run with id '" + runId + "' not found.");
    }
}
