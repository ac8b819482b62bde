package com.capacityforecast.forecast;

import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.model.Granularity;
import com.capacityforecast.model.ModelId;
import com.capacityforecast.model.Series;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Additive trend-plus-seasonality regression in the spirit of Prophet: a piecewise-linear
 * trend with hinge changepoints and Fourier seasonal terms, fitted by ridge regression on a
 * continuous time axis so gaps and uneven spacing need no special handling.
 */
@Component
public class ProphetStyleModel extends AbstractForecastModel {

    static final int MIN_HISTORY = 3;
    private static final double CHANGEPOINT_RANGE = 0.8;
    private static final double DAYS_PER_YEAR = 365.25;

    @Override
    public ModelId id() {
        return ModelId.PROPHET;
    }

    @Override
    protected RawForecast fit(Series history, int horizon, Hyperparameters params) {
        requireHistory(history, MIN_HISTORY);
        int requestedChangepoints = params.getInt("changepoints", 0);
        int order = params.getInt("seasonality_order", 0);
        double lambda = params.getDouble("ridge_lambda", 1e-6, 1e6);
        double z = zValue(params);

        Granularity granularity = history.getGranularity();
        LocalDate origin = history.get(0).period();
        int n = history.size();
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = granularity.periodsBetween(origin, history.get(i).period());
        }
        double span = Math.max(t[n - 1], 1.0);

        int changepoints = Math.min(requestedChangepoints, Math.max(0, (n - 2) / 3));
        double[] tau = new double[changepoints];
        for (int j = 0; j < changepoints; j++) {
            int idx = (int) Math.floor((j + 1) * CHANGEPOINT_RANGE * n / (changepoints + 1));
            tau[j] = t[Math.min(idx, n - 1)] / span;
        }
        List<double[]> seasonalities = seasonalities(granularity, span, order);

        Design design = new Design(tau, seasonalities, span);
        double[][] x = new double[n][];
        for (int i = 0; i < n; i++) {
            x[i] = design.row(t[i]);
        }
        double[] y = history.values();
        double[] beta = LeastSquares.ridge(y, x, design.penalized(), lambda);
        checkInterrupted();

        double[] fitted = new double[n];
        for (int i = 0; i < n; i++) {
            fitted[i] = LeastSquares.predict(beta, x[i], false);
        }
        double sigma = residualStd(y, fitted, 2);

        double[] mean = new double[horizon];
        List<LocalDate> future = history.futurePeriods(horizon);
        for (int h = 0; h < horizon; h++) {
            double tf = granularity.periodsBetween(origin, future.get(h));
            mean[h] = LeastSquares.predict(beta, design.row(tf), false);
        }
        return RawForecast.symmetric(mean, sigma, z, false);
    }

    /** Each entry is {period length in granularity units, Fourier order}. */
    private List<double[]> seasonalities(Granularity granularity, double span, int order) {
        List<double[]> out = new ArrayList<>();
        if (order < 1) {
            return out;
        }
        int season = granularity.seasonLength();
        out.add(new double[] {season, Math.min(order, season / 2)});
        if (granularity == Granularity.DAILY && span >= DAYS_PER_YEAR) {
            out.add(new double[] {DAYS_PER_YEAR, order});
        }
        return out;
    }

    private record Design(double[] changepoints, List<double[]> seasonalities, double span) {

        double[] row(double t) {
            double s = t / span;
            List<Double> cols = new ArrayList<>();
            cols.add(1.0);
            cols.add(s);
            for (double tau : changepoints) {
                cols.add(Math.max(0.0, s - tau));
            }
            for (double[] seasonality : seasonalities) {
                double period = seasonality[0];
                for (int k = 1; k <= (int) seasonality[1]; k++) {
                    double angle = 2.0 * Math.PI * k * t / period;
                    cols.add(Math.sin(angle));
                    cols.add(Math.cos(angle));
                }
            }
            return cols.stream().mapToDouble(Double::doubleValue).toArray();
        }

        boolean[] penalized() {
            int width = row(0.0).length;
            boolean[] out = new boolean[width];
            for (int j = 2; j < width; j++) {
                out[j] = true;
            }
            return out;
        }
    }
}
