package com.capacityforecast.config;

import com.capacityforecast.model.ModelId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Documented default hyperparameters for every forecast model. Keys not listed here are
 * ignored when supplied.
 */
public final class ModelDefaults {

    public static final String ENABLED = "enabled";
    public static final String INTERVAL_WIDTH = "interval_width";
    public static final String SEED = "seed";
    public static final String LAGS = "lags";
    public static final String MIN_TRAINING_ROWS = "min_training_rows";
    public static final String N_ESTIMATORS = "n_estimators";
    public static final String MAX_DEPTH = "max_depth";

    private static final Map<ModelId, Map<String, Object>> DEFAULTS = new EnumMap<>(ModelId.class);

    static {
        DEFAULTS.put(ModelId.PROPHET, ordered(
            ENABLED, true,
            "changepoints", 5,
            "seasonality_order", 3,
            "ridge_lambda", 1.0,
            INTERVAL_WIDTH, 0.8));
        DEFAULTS.put(ModelId.RF, ordered(
            ENABLED, true,
            N_ESTIMATORS, 100,
            MAX_DEPTH, 0,
            LAGS, 3,
            MIN_TRAINING_ROWS, 6,
            SEED, 42,
            INTERVAL_WIDTH, 0.8));
        DEFAULTS.put(ModelId.XGBOOST, ordered(
            ENABLED, true,
            N_ESTIMATORS, 200,
            MAX_DEPTH, 4,
            "max_nodes", 16,
            "node_size", 3,
            "learning_rate", 0.1,
            "subsample", 1.0,
            LAGS, 3,
            MIN_TRAINING_ROWS, 6,
            SEED, 42,
            INTERVAL_WIDTH, 0.8));
        DEFAULTS.put(ModelId.VAR, ordered(
            ENABLED, true,
            LAGS, 2,
            INTERVAL_WIDTH, 0.8));
        DEFAULTS.put(ModelId.SARIMAX, ordered(
            ENABLED, true,
            "p", 1,
            "d", 1,
            "seasonal_p", 1,
            "season_length", 0,
            INTERVAL_WIDTH, 0.8));
        DEFAULTS.put(ModelId.ENSEMBLE, ordered(
            ENABLED, true,
            "top_n", 3));
    }

    private ModelDefaults() {
    }

    public static Map<String, Object> of(ModelId modelId) {
        return DEFAULTS.getOrDefault(modelId, Map.of());
    }

    public static Map<ModelId, Map<String, Object>> all() {
        Map<ModelId, Map<String, Object>> copy = new EnumMap<>(ModelId.class);
        DEFAULTS.forEach((id, values) -> copy.put(id, new LinkedHashMap<>(values)));
        return copy;
    }

    private static Map<String, Object> ordered(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
