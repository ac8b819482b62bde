package com.capacityforecast.exception;

import com.capacityforecast.model.TransformationRun;
import com.capacityforecast.model.TransformationStage;
import lombok.Getter;

@Getter
public class PipelineStageException extends CapacityPlanningException {
    private final transient TransformationStage stage;
    private final transient TransformationRun partialRun;

    public PipelineStageException(TransformationStage stage, String message, TransformationRun partialRun) {
        super("PIPELINE_STAGE_ERROR",
              "Stage '" + stage.name().label() + "' (order " + stage.order() + ") failed: " + message);
        this.stage = stage;
        this.partialRun = partialRun;
    }
}
