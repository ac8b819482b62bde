package com.capacityforecast.forecast;

import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.config.ModelDefaults;
import com.capacityforecast.model.Series;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Recursive multi-step forecasting over {@link LagFeatures}: each predicted step is appended
 * to the history and feeds the lags of the next one.
 */
abstract class AbstractTreeModel extends AbstractForecastModel {

    /** Trained predictor over a fixed feature layout. */
    interface Predictor {
        double predict(double[] features);
    }

    protected abstract Predictor train(LagFeatures features, LagFeatures.Matrix data, Hyperparameters params);

    @Override
    protected RawForecast fit(Series history, int horizon, Hyperparameters params) {
        int lags = params.getInt(ModelDefaults.LAGS, 1);
        int minRows = params.getInt(ModelDefaults.MIN_TRAINING_ROWS, 2);
        double z = zValue(params);
        LagFeatures features = LagFeatures.forHistory(history, lags, minRows);
        LagFeatures.Matrix data = features.trainingMatrix(history);

        checkInterrupted();
        Predictor predictor = train(features, data, params);
        checkInterrupted();

        double[] fitted = new double[data.y().length];
        for (int i = 0; i < fitted.length; i++) {
            fitted[i] = predictor.predict(data.x()[i]);
        }
        double[] values = history.values();
        double sigma = Math.max(residualStd(data.y(), fitted, 0), 0.5 * LagFeatures.naiveScale(values));

        double[] extended = Arrays.copyOf(values, values.length + horizon);
        List<LocalDate> future = history.futurePeriods(horizon);
        double[] mean = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            checkInterrupted();
            int index = values.length + h;
            double next = predictor.predict(features.row(extended, index, future.get(h)));
            extended[index] = Math.max(0.0, next);
            mean[h] = next;
        }
        return RawForecast.symmetric(mean, sigma, z, true);
    }
}
