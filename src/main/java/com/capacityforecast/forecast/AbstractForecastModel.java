package com.capacityforecast.forecast;

import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.config.ModelDefaults;
import com.capacityforecast.exception.FitException;
import com.capacityforecast.model.ForecastPoint;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.Series;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shared fit-and-forecast flow: validation, failure capture, zero clipping and bound ordering.
 * Subclasses only implement {@link #fit}.
 */
@Slf4j
public abstract class AbstractForecastModel implements ForecastModel {

    @Override
    public final ForecastResult fitAndForecast(Series history, int horizon, Hyperparameters params) {
        String category = history == null ? null : history.getCategory();
        if (history == null || history.isEmpty()) {
            return ForecastResult.failed(id(), category, "empty history", params.warnings());
        }
        if (horizon < 1) {
            return ForecastResult.failed(id(), category, "horizon must be >= 1 but was " + horizon, params.warnings());
        }
        long started = System.nanoTime();
        try {
            RawForecast raw = fit(history, horizon, params);
            List<LocalDate> periods = history.futurePeriods(horizon);
            List<ForecastPoint> points = new ArrayList<>(horizon);
            for (int h = 0; h < horizon; h++) {
                points.add(ForecastPoint.clipped(periods.get(h), raw.mean()[h], raw.lower()[h], raw.upper()[h]));
            }
            log.debug("Model fitted | model={} | history={} | horizon={} | tookMs={}",
                      id().key(), history.size(), horizon, (System.nanoTime() - started) / 1_000_000);
            return ForecastResult.ok(id(), category, points, params.warnings());
        } catch (FitException ex) {
            log.info("Model fit failed | model={} | reason={}", id().key(), ex.getMessage());
            return ForecastResult.failed(id(), category, ex.getMessage(), params.warnings());
        } catch (SingularMatrixException ex) {
            log.info("Model fit failed | model={} | reason=singular matrix", id().key());
            return ForecastResult.failed(id(), category, "singular matrix", params.warnings());
        } catch (MathIllegalArgumentException | MathIllegalStateException ex) {
            log.info("Model fit failed | model={} | reason={}", id().key(), ex.getMessage());
            return ForecastResult.failed(id(), category, "numerical failure: " + ex.getMessage(), params.warnings());
        } catch (RuntimeException ex) {
            log.warn("Model fit raised unexpected error | model={} | error={}", id().key(), ex.toString(), ex);
            return ForecastResult.failed(id(), category,
                ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), params.warnings());
        }
    }

    protected abstract RawForecast fit(Series history, int horizon, Hyperparameters params);

    protected static void requireHistory(Series history, int minimum) {
        if (history.size() < minimum) {
            throw new FitException("insufficient history: " + history.size() + " periods, at least " + minimum + " required");
        }
    }

    protected static void requireRegularSpacing(Series history) {
        if (!history.isRegular()) {
            throw new FitException("irregular spacing: model requires one observation per " + history.getGranularity().name().toLowerCase(Locale.ROOT));
        }
    }

    protected static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new FitException("interrupted");
        }
    }

    /** Two-sided normal quantile for the configured interval width. */
    protected static double zValue(Hyperparameters params) {
        double width = params.getDouble(ModelDefaults.INTERVAL_WIDTH, 0.5, 0.999);
        return new NormalDistribution().inverseCumulativeProbability(0.5 + width / 2.0);
    }

    protected static double residualStd(double[] actual, double[] fitted, int parameters) {
        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double r = actual[i] - fitted[i];
            sum += r * r;
        }
        int dof = Math.max(1, actual.length - parameters);
        return Math.sqrt(sum / dof);
    }
}
