package com.capacityforecast.config;

import com.capacityforecast.exception.ConfigException;
import com.capacityforecast.model.ModelId;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class HyperparametersTest {

    @Test
    void defaults_produceNoWarnings() {
        Hyperparameters params = Hyperparameters.defaults(ModelId.RF);

        assertThat(params.getInt(ModelDefaults.N_ESTIMATORS, 1)).isEqualTo(100);
        assertThat(params.getBoolean(ModelDefaults.ENABLED)).isTrue();
        assertThat(params.warnings()).isEmpty();
    }

    @Test
    void invalidValue_fallsBackToDefaultWithWarning() {
        Hyperparameters params = new Hyperparameters(ModelId.RF, Map.of(ModelDefaults.N_ESTIMATORS, -5));

        assertThat(params.getInt(ModelDefaults.N_ESTIMATORS, 1)).isEqualTo(100);
        assertThat(params.warnings())
            .anySatisfy(w -> assertThat(w).startsWith("rf: ").contains("n_estimators").contains("-5"));
    }

    @Test
    void missingValue_usesDefaultAndRecordsIt() {
        Hyperparameters params = new Hyperparameters(ModelId.VAR, Map.of());

        assertThat(params.getInt(ModelDefaults.LAGS, 1)).isEqualTo(2);
        assertThat(params.warnings()).containsExactly("var: 'lags' missing, using default 2");
    }

    @Test
    void stringValues_areParsed() {
        Map<String, Object> values = new HashMap<>();
        values.put(ModelDefaults.ENABLED, "false");
        values.put("learning_rate", "0.25");
        Hyperparameters params = new Hyperparameters(ModelId.XGBOOST, values);

        assertThat(params.getBoolean(ModelDefaults.ENABLED)).isFalse();
        assertThat(params.getDouble("learning_rate", 1e-4, 1.0)).isEqualTo(0.25);
    }

    @Test
    void outOfRangeDouble_fallsBack() {
        Hyperparameters params = new Hyperparameters(ModelId.XGBOOST, Map.of("subsample", 3.0));

        assertThat(params.getDouble("subsample", 0.1, 1.0)).isEqualTo(1.0);
        assertThat(params.warnings()).hasSize(1);
    }

    @Test
    void unknownKey_isIgnoredWithWarning() {
        Hyperparameters params = new Hyperparameters(ModelId.VAR, Map.of(ModelDefaults.LAGS, 3, "foo", 1));

        assertThat(params.getInt(ModelDefaults.LAGS, 1)).isEqualTo(3);
        assertThat(params.warnings()).containsExactly("var: unknown hyperparameter 'foo' ignored");
    }

    @Test
    void undocumentedKeyLookup_isAConfigError() {
        Hyperparameters params = Hyperparameters.defaults(ModelId.VAR);

        assertThatThrownBy(() -> params.getInt("n_estimators", 1))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("var.n_estimators");
    }
}
