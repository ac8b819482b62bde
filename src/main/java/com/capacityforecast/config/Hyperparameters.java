package com.capacityforecast.config;

import com.capacityforecast.exception.ConfigException;
import com.capacityforecast.model.ModelId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed view over one model's hyperparameter mapping. Missing or invalid values fall back to
 * the documented default in {@link ModelDefaults}; every fallback is logged and kept in
 * {@link #warnings()} so it can travel with the forecast result.
 */
@Slf4j
public class Hyperparameters {

    private final ModelId modelId;
    private final Map<String, Object> values;
    private final Map<String, Object> defaults;
    private final List<String> warnings = new ArrayList<>();

    public Hyperparameters(ModelId modelId, Map<String, Object> values) {
        this.modelId = modelId;
        this.values = values != null ? values : Map.of();
        this.defaults = ModelDefaults.of(modelId);
        this.values.keySet().stream()
            .filter(key -> !defaults.containsKey(key))
            .sorted()
            .forEach(key -> warn("unknown hyperparameter '" + key + "' ignored"));
    }

    public static Hyperparameters defaults(ModelId modelId) {
        return new Hyperparameters(modelId, ModelDefaults.of(modelId));
    }

    public ModelId modelId() {
        return modelId;
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    public boolean getBoolean(String key) {
        Object raw = lookup(key);
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(s);
        }
        return fallback(key, raw, Boolean.class);
    }

    public int getInt(String key, int min) {
        Object raw = lookup(key);
        Double parsed = toNumber(raw);
        if (parsed != null && parsed == Math.rint(parsed) && parsed >= min && parsed <= Integer.MAX_VALUE) {
            return parsed.intValue();
        }
        return fallback(key, raw, Number.class).intValue();
    }

    public long getLong(String key) {
        Object raw = lookup(key);
        Double parsed = toNumber(raw);
        if (parsed != null && parsed == Math.rint(parsed)) {
            return parsed.longValue();
        }
        return fallback(key, raw, Number.class).longValue();
    }

    public double getDouble(String key, double min, double max) {
        Object raw = lookup(key);
        Double parsed = toNumber(raw);
        if (parsed != null && parsed >= min && parsed <= max) {
            return parsed;
        }
        return fallback(key, raw, Number.class).doubleValue();
    }

    private Object lookup(String key) {
        if (!defaults.containsKey(key)) {
            throw new ConfigException("No documented default for " + modelId.key() + "." + key);
        }
        if (!values.containsKey(key)) {
            warn("'" + key + "' missing, using default " + defaults.get(key));
            return defaults.get(key);
        }
        return values.get(key);
    }

    private <T> T fallback(String key, Object raw, Class<T> type) {
        Object def = defaults.get(key);
        if (raw != def) {
            warn("'" + key + "'=" + raw + " is invalid, using default " + def);
        }
        return type.cast(def);
    }

    private void warn(String message) {
        String full = modelId.key() + ": " + message;
        log.warn("Hyperparameter fallback | {}", full);
        warnings.add(full);
    }

    private static Double toNumber(Object raw) {
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (raw instanceof String s) {
            try {
                double d = Double.parseDouble(s.trim());
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
