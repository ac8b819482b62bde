package com.capacityforecast.config;

import com.capacityforecast.model.ModelId;
import com.capacityforecast.model.StageName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoublePredicate;

@Slf4j
@Component
public class InMemoryConfigStore implements ConfigStore {

    private final AtomicReference<PlannerSettings> settings = new AtomicReference<>(PlannerSettings.defaults());

    @Override
    public PlannerSettings current() {
        return settings.get();
    }

    @Override
    public List<String> update(PlannerSettings requested) {
        List<String> warnings = new ArrayList<>();
        PlannerSettings sanitized = sanitize(requested, warnings);
        settings.set(sanitized);
        log.info("Planner settings updated | warnings={}", warnings.size());
        return warnings;
    }

    @Override
    public PlannerSettings reset() {
        PlannerSettings defaults = PlannerSettings.defaults();
        settings.set(defaults);
        log.info("Planner settings reset to defaults");
        return defaults;
    }

    private PlannerSettings sanitize(PlannerSettings in, List<String> warnings) {
        PlannerSettings def = PlannerSettings.defaults();
        PlannerSettings.PlannerSettingsBuilder out = in.toBuilder();

        out.backtestWindow(checkInt("backtestWindow", in.getBacktestWindow(), def.getBacktestWindow(), 1, warnings));
        out.smoothingWindow(checkInt("smoothingWindow", in.getSmoothingWindow(), def.getSmoothingWindow(), 3, warnings));
        out.aggregationThreshold(checkInt("aggregationThreshold", in.getAggregationThreshold(), def.getAggregationThreshold(), 1, warnings));
        out.minimumPeriods(checkInt("minimumPeriods", in.getMinimumPeriods(), def.getMinimumPeriods(), 1, warnings));
        out.defaultHorizon(checkInt("defaultHorizon", in.getDefaultHorizon(), def.getDefaultHorizon(), 1, warnings));
        out.anomalyThreshold(checkDouble("anomalyThreshold", in.getAnomalyThreshold(), def.getAnomalyThreshold(), v -> v > 0, warnings));
        out.relativeScaleFloor(checkDouble("relativeScaleFloor", in.getRelativeScaleFloor(), def.getRelativeScaleFloor(), v -> v >= 0, warnings));
        out.holidayBlendWeight(checkDouble("holidayBlendWeight", in.getHolidayBlendWeight(), def.getHolidayBlendWeight(), v -> v >= 0 && v <= 1, warnings));
        out.baselineRowDivisor(checkDouble("baselineRowDivisor", in.getBaselineRowDivisor(), def.getBaselineRowDivisor(), v -> v > 0, warnings));

        if (in.getModelTimeoutSeconds() < 1) {
            warnings.add(fallbackMessage("modelTimeoutSeconds", in.getModelTimeoutSeconds(), def.getModelTimeoutSeconds()));
            out.modelTimeoutSeconds(def.getModelTimeoutSeconds());
        }
        if (in.getErrorMetric() == null) {
            warnings.add(fallbackMessage("errorMetric", null, def.getErrorMetric()));
            out.errorMetric(def.getErrorMetric());
        }
        if (in.getSmoothingMethod() == null) {
            warnings.add(fallbackMessage("smoothingMethod", null, def.getSmoothingMethod()));
            out.smoothingMethod(def.getSmoothingMethod());
        }
        out.defaultStageOrder(checkStageOrder(in.getDefaultStageOrder(), def.getDefaultStageOrder(), warnings));
        out.hyperparameters(mergeHyperparameters(in.getHyperparameters(), warnings));

        warnings.forEach(w -> log.warn("Config fallback | {}", w));
        return out.build();
    }

    private List<StageName> checkStageOrder(List<StageName> order, List<StageName> def, List<String> warnings) {
        if (order == null || order.isEmpty() || order.contains(null)
                || new LinkedHashSet<>(order).size() != order.size()) {
            warnings.add(fallbackMessage("defaultStageOrder", order, def));
            return def;
        }
        return List.copyOf(order);
    }

    private Map<ModelId, Map<String, Object>> mergeHyperparameters(
            Map<ModelId, Map<String, Object>> requested, List<String> warnings) {
        Map<ModelId, Map<String, Object>> merged = ModelDefaults.all();
        if (requested == null) {
            warnings.add("hyperparameters missing, using defaults");
            return merged;
        }
        requested.forEach((modelId, overrides) -> {
            if (modelId == null || overrides == null) {
                return;
            }
            Map<String, Object> target = new LinkedHashMap<>(merged.get(modelId));
            overrides.forEach((key, value) -> {
                if (target.containsKey(key)) {
                    target.put(key, value);
                } else {
                    warnings.add("hyperparameters." + modelId.key() + "." + key + " is not a known setting, ignored");
                }
            });
            merged.put(modelId, target);
        });
        return new EnumMap<>(merged);
    }

    private int checkInt(String name, int value, int def, int min, List<String> warnings) {
        if (value < min) {
            warnings.add(fallbackMessage(name, value, def));
            return def;
        }
        return value;
    }

    private double checkDouble(String name, double value, double def, DoublePredicate valid, List<String> warnings) {
        if (!Double.isFinite(value) || !valid.test(value)) {
            warnings.add(fallbackMessage(name, value, def));
            return def;
        }
        return value;
    }

    private String fallbackMessage(String name, Object value, Object def) {
        return name + "=" + value + " is invalid, using default " + def;
    }
}
