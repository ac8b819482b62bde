package com.capacityforecast.config;

import com.capacityforecast.model.ErrorMetric;
import com.capacityforecast.model.ModelId;
import com.capacityforecast.model.StageName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InMemoryConfigStoreTest {

    private InMemoryConfigStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryConfigStore();
    }

    @Test
    void startsWithDefaults() {
        assertThat(store.current()).isEqualTo(PlannerSettings.defaults());
        assertThat(store.current().getBacktestWindow()).isEqualTo(3);
        assertThat(store.current().getErrorMetric()).isEqualTo(ErrorMetric.MAPE);
    }

    @Test
    void update_keepsValidValues() {
        List<String> warnings = store.update(PlannerSettings.defaults().toBuilder()
            .backtestWindow(6)
            .errorMetric(ErrorMetric.RMSE)
            .build());

        assertThat(warnings).isEmpty();
        assertThat(store.current().getBacktestWindow()).isEqualTo(6);
        assertThat(store.current().getErrorMetric()).isEqualTo(ErrorMetric.RMSE);
    }

    @Test
    void update_replacesInvalidValuesWithDefaults() {
        List<String> warnings = store.update(PlannerSettings.defaults().toBuilder()
            .backtestWindow(0)
            .anomalyThreshold(Double.NaN)
            .holidayBlendWeight(1.5)
            .errorMetric(null)
            .defaultStageOrder(List.of(StageName.IA, StageName.IA))
            .build());

        PlannerSettings current = store.current();
        assertThat(current.getBacktestWindow()).isEqualTo(3);
        assertThat(current.getAnomalyThreshold()).isEqualTo(3.5);
        assertThat(current.getHolidayBlendWeight()).isEqualTo(0.5);
        assertThat(current.getErrorMetric()).isEqualTo(ErrorMetric.MAPE);
        assertThat(current.getDefaultStageOrder())
            .containsExactly(StageName.TRANSFORM, StageName.IA, StageName.MARKETING);
        assertThat(warnings).hasSize(5)
            .anySatisfy(w -> assertThat(w).startsWith("backtestWindow=0 is invalid"));
    }

    @Test
    void update_mergesHyperparameterOverridesOverDefaults() {
        Map<ModelId, Map<String, Object>> overrides = new EnumMap<>(ModelId.class);
        overrides.put(ModelId.RF, Map.of(ModelDefaults.N_ESTIMATORS, 25, "bogus", 1));

        List<String> warnings = store.update(PlannerSettings.defaults().toBuilder().hyperparameters(overrides).build());

        Hyperparameters rf = store.hyperparameters(ModelId.RF);
        assertThat(rf.getInt(ModelDefaults.N_ESTIMATORS, 1)).isEqualTo(25);
        assertThat(rf.getInt(ModelDefaults.LAGS, 1)).isEqualTo(3);
        assertThat(store.hyperparameters(ModelId.VAR).getInt(ModelDefaults.LAGS, 1)).isEqualTo(2);
        assertThat(warnings).containsExactly("hyperparameters.rf.bogus is not a known setting, ignored");
    }

    @Test
    void reset_restoresDocumentedDefaults() {
        store.update(PlannerSettings.defaults().toBuilder().backtestWindow(9).defaultHorizon(24).build());

        PlannerSettings reset = store.reset();

        assertThat(reset).isEqualTo(PlannerSettings.defaults());
        assertThat(store.current().getBacktestWindow()).isEqualTo(3);
        assertThat(store.current().getDefaultHorizon()).isEqualTo(12);
    }

    @Test
    void stagePosition_followsDefaultOrder() {
        PlannerSettings settings = PlannerSettings.defaults().toBuilder()
            .defaultStageOrder(List.of(StageName.MARKETING, StageName.TRANSFORM))
            .build();

        assertThat(settings.stagePosition(StageName.MARKETING)).isZero();
        assertThat(settings.stagePosition(StageName.TRANSFORM)).isEqualTo(1);
        assertThat(settings.stagePosition(StageName.IA)).isGreaterThan(1);
    }
}
