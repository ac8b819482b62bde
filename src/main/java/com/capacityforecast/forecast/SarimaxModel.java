package com.capacityforecast.forecast;

import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.model.ModelId;
import com.capacityforecast.model.Series;
import com.capacityforecast.model.TimePoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Seasonal autoregression on the differenced series with the IQ indicator as an exogenous
 * regressor. Coefficients are estimated by conditional least squares; future IQ values carry
 * the last observed value forward.
 */
@Component
public class SarimaxModel extends AbstractForecastModel {

    @Override
    public ModelId id() {
        return ModelId.SARIMAX;
    }

    @Override
    protected RawForecast fit(Series history, int horizon, Hyperparameters params) {
        int p = params.getInt("p", 0);
        int d = params.getInt("d", 0);
        int seasonalP = params.getInt("seasonal_p", 0);
        int configuredSeason = params.getInt("season_length", 0);
        int season = configuredSeason > 0 ? configuredSeason : history.getGranularity().seasonLength();
        double z = zValue(params);
        requireHistory(history, 2 * season + p + d + 1);
        requireRegularSpacing(history);

        int n = history.size();
        boolean exogenous = history.hasIqValues();
        double[] y = history.values();
        double[] iq = new double[n + horizon];
        for (int t = 0; t < n + horizon; t++) {
            TimePoint point = history.get(Math.min(t, n - 1));
            iq[t] = exogenous ? point.iqFlag() : 0.0;
        }

        List<double[]> levels = differences(y, d);
        double[] w = levels.get(d);
        double[] iqDiff = differences(iq, d).get(d);
        exogenous = exogenous && varies(iqDiff, w.length);
        int maxLag = Math.max(p, seasonalP * season);
        int rows = w.length - maxLag;

        double[][] x = new double[rows][];
        double[] target = new double[rows];
        for (int t = maxLag; t < w.length; t++) {
            x[t - maxLag] = row(w, iqDiff, t, p, seasonalP, season, exogenous);
            target[t - maxLag] = w[t];
        }
        double[] beta = LeastSquares.ols(target, x);
        double[] fitted = new double[rows];
        for (int r = 0; r < rows; r++) {
            fitted[r] = LeastSquares.predict(beta, x[r], true);
        }
        double sigma = residualStd(target, fitted, beta.length);
        checkInterrupted();

        double[] wExt = new double[w.length + horizon];
        System.arraycopy(w, 0, wExt, 0, w.length);
        for (int h = 0; h < horizon; h++) {
            int t = w.length + h;
            wExt[t] = LeastSquares.predict(beta, row(wExt, iqDiff, t, p, seasonalP, season, exogenous), true);
        }
        double[] mean = integrate(levels, wExt, w.length, horizon);
        return RawForecast.symmetric(mean, sigma, z, true);
    }

    private static double[] row(double[] w, double[] iq, int t, int p, int seasonalP, int season, boolean exogenous) {
        double[] row = new double[p + seasonalP + (exogenous ? 1 : 0)];
        int col = 0;
        for (int lag = 1; lag <= p; lag++) {
            row[col++] = w[t - lag];
        }
        for (int s = 1; s <= seasonalP; s++) {
            row[col++] = w[t - s * season];
        }
        if (exogenous) {
            row[col] = iq[t];
        }
        return row;
    }

    private static boolean varies(double[] values, int length) {
        for (int t = 1; t < length; t++) {
            if (values[t] != values[0]) {
                return true;
            }
        }
        return false;
    }

    /** {@code result.get(i)} is the series differenced {@code i} times. */
    private static List<double[]> differences(double[] series, int order) {
        List<double[]> out = new ArrayList<>(order + 1);
        out.add(series);
        double[] current = series;
        for (int i = 0; i < order; i++) {
            double[] next = new double[current.length - 1];
            for (int t = 1; t < current.length; t++) {
                next[t - 1] = current[t] - current[t - 1];
            }
            out.add(next);
            current = next;
        }
        return out;
    }

    /** Undoes the differencing for the forecast tail of {@code extended}. */
    private static double[] integrate(List<double[]> levels, double[] extended, int observed, int horizon) {
        double[] future = new double[horizon];
        System.arraycopy(extended, observed, future, 0, horizon);
        for (int level = levels.size() - 2; level >= 0; level--) {
            double[] base = levels.get(level);
            double previous = base[base.length - 1];
            for (int h = 0; h < horizon; h++) {
                previous += future[h];
                future[h] = previous;
            }
        }
        return future;
    }
}
