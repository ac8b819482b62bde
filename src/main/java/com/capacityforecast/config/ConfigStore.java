package com.capacityforecast.config;

import com.capacityforecast.model.ModelId;

import java.util.List;

/**
 * Source of pipeline settings and model hyperparameters.
 */
public interface ConfigStore {

    PlannerSettings current();

    /**
     * Replaces the current settings. Invalid values are replaced by their defaults; the
     * returned list describes each replacement.
     */
    List<String> update(PlannerSettings settings);

    PlannerSettings reset();

    default Hyperparameters hyperparameters(ModelId modelId) {
        return current().hyperparametersFor(modelId);
    }
}
