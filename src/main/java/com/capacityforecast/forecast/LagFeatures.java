package com.capacityforecast.forecast;

import com.capacityforecast.exception.FitException;
import com.capacityforecast.model.Granularity;
import com.capacityforecast.model.Series;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Supervised-learning view of a series for the tree ensembles: recent lags, an optional
 * seasonal lag, the position within the season and a linear trend index.
 */
final class LagFeatures {

    private final int lags;
    private final boolean seasonalLag;
    private final int season;
    private final Granularity granularity;

    private LagFeatures(int lags, boolean seasonalLag, int season, Granularity granularity) {
        this.lags = lags;
        this.seasonalLag = seasonalLag;
        this.season = season;
        this.granularity = granularity;
    }

    /**
     * The seasonal lag is only used when the history leaves enough rows to train on once the
     * first full season is consumed.
     */
    static LagFeatures forHistory(Series history, int lags, int minTrainingRows) {
        int n = history.size();
        if (n < lags + minTrainingRows) {
            throw new FitException("insufficient history: " + n + " periods, at least "
                + (lags + minTrainingRows) + " required");
        }
        int season = history.getGranularity().seasonLength();
        boolean seasonal = season > lags && n - season >= minTrainingRows;
        return new LagFeatures(lags, seasonal, season, history.getGranularity());
    }

    List<String> names() {
        List<String> names = new ArrayList<>();
        for (int k = 1; k <= lags; k++) {
            names.add("lag_" + k);
        }
        if (seasonalLag) {
            names.add("lag_" + season);
        }
        names.add("season_sin");
        names.add("season_cos");
        names.add("trend");
        return names;
    }

    int width() {
        return lags + (seasonalLag ? 1 : 0) + 3;
    }

    int firstTrainableIndex() {
        return seasonalLag ? season : lags;
    }

    /** Features for predicting {@code values[index]} from the values before it. */
    double[] row(double[] values, int index, LocalDate period) {
        double[] row = new double[width()];
        int col = 0;
        for (int k = 1; k <= lags; k++) {
            row[col++] = values[index - k];
        }
        if (seasonalLag) {
            row[col++] = values[index - season];
        }
        double angle = 2.0 * Math.PI * granularity.seasonalPosition(period) / season;
        row[col++] = Math.sin(angle);
        row[col++] = Math.cos(angle);
        row[col] = index;
        return row;
    }

    Matrix trainingMatrix(Series history) {
        double[] values = history.values();
        int first = firstTrainableIndex();
        int rows = values.length - first;
        double[][] x = new double[rows][];
        double[] y = new double[rows];
        for (int i = first; i < values.length; i++) {
            x[i - first] = row(values, i, history.get(i).period());
            y[i - first] = values[i];
        }
        return new Matrix(x, y);
    }

    /** Standard deviation of one-step changes, used as a floor for in-sample tree residuals. */
    static double naiveScale(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double[] diffs = new double[values.length - 1];
        double mean = 0.0;
        for (int i = 1; i < values.length; i++) {
            diffs[i - 1] = values[i] - values[i - 1];
            mean += diffs[i - 1];
        }
        mean /= diffs.length;
        double sum = 0.0;
        for (double d : diffs) {
            sum += (d - mean) * (d - mean);
        }
        return Math.sqrt(sum / Math.max(1, diffs.length - 1));
    }

    record Matrix(double[][] x, double[] y) {}
}
