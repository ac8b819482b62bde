package com.capacityforecast.forecast;

import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.config.ModelDefaults;
import com.capacityforecast.model.ModelId;
import com.capacityforecast.model.Series;
import com.capacityforecast.model.TimePoint;
import org.springframework.stereotype.Component;

/**
 * Vector autoregression over volume and the IQ indicator, one OLS equation per variable.
 * Falls back to a univariate AR(p) when the IQ indicator is missing anywhere or never changes.
 */
@Component
public class VarModel extends AbstractForecastModel {

    @Override
    public ModelId id() {
        return ModelId.VAR;
    }

    @Override
    protected RawForecast fit(Series history, int horizon, Hyperparameters params) {
        int p = params.getInt(ModelDefaults.LAGS, 1);
        double z = zValue(params);
        requireHistory(history, Math.max(8, 3 * p + 2));
        requireRegularSpacing(history);

        int n = history.size();
        int k = history.hasIqValues() && iqVaries(history) ? 2 : 1;
        double[][] data = new double[n][k];
        for (int t = 0; t < n; t++) {
            TimePoint point = history.get(t);
            data[t][0] = point.value();
            if (k == 2) {
                data[t][1] = point.iqFlag();
            }
        }

        int rows = n - p;
        double[][] x = new double[rows][];
        for (int t = p; t < n; t++) {
            x[t - p] = lagRow(data, t, p, k);
        }
        double[][] beta = new double[k][];
        double[] sigma = new double[k];
        for (int j = 0; j < k; j++) {
            double[] y = new double[rows];
            for (int t = p; t < n; t++) {
                y[t - p] = data[t][j];
            }
            beta[j] = LeastSquares.ols(y, x);
            double[] fitted = new double[rows];
            for (int r = 0; r < rows; r++) {
                fitted[r] = LeastSquares.predict(beta[j], x[r], true);
            }
            sigma[j] = residualStd(y, fitted, k * p + 1);
        }
        checkInterrupted();

        double[][] extended = new double[n + horizon][];
        System.arraycopy(data, 0, extended, 0, n);
        double[] mean = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            int t = n + h;
            double[] row = lagRow(extended, t, p, k);
            extended[t] = new double[k];
            for (int j = 0; j < k; j++) {
                extended[t][j] = LeastSquares.predict(beta[j], row, true);
            }
            mean[h] = extended[t][0];
        }
        return RawForecast.symmetric(mean, sigma[0], z, true);
    }

    private static boolean iqVaries(Series history) {
        double first = history.get(0).iqFlag();
        return history.getPoints().stream().anyMatch(point -> point.iqFlag() != first);
    }

    private static double[] lagRow(double[][] data, int t, int p, int k) {
        double[] row = new double[p * k];
        for (int lag = 1; lag <= p; lag++) {
            for (int j = 0; j < k; j++) {
                row[(lag - 1) * k + j] = data[t - lag][j];
            }
        }
        return row;
    }
}
