package com.capacityforecast.service;

import com.capacityforecast.config.ConfigStore;
import com.capacityforecast.config.PlannerSettings;
import com.capacityforecast.model.AnomalyMethod;
import com.capacityforecast.model.AnomalyRecord;
import com.capacityforecast.model.Granularity;
import com.capacityforecast.model.Series;
import com.capacityforecast.model.SmoothingMethod;
import com.capacityforecast.model.SmoothingResult;
import com.capacityforecast.model.TimePoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Flags points whose distance from the local rolling median is extreme relative to a robust
 * dispersion estimate, and replaces them with an interpolated value. Detection is repeated on
 * the corrected series until it flags nothing, so the output is a fixed point of {@link #smooth}.
 * Replacement values are always derived from raw points that were never flagged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalySmoother {

    static final double MAD_TO_SIGMA = 1.4826;
    private static final double MIN_SCALE = 1e-9;

    private final ConfigStore configStore;

    public SmoothingResult smooth(Series series) {
        return smooth(series, Set.of(), configStore.current());
    }

    public SmoothingResult smooth(Series series, Set<LocalDate> holidays) {
        return smooth(series, holidays, configStore.current());
    }

    public SmoothingResult smooth(Series series, Set<LocalDate> holidays, PlannerSettings settings) {
        int n = series.size();
        double[] raw = series.values();
        if (n < 2) {
            return new SmoothingResult(series, records(series, raw, raw, new boolean[n], new boolean[n]));
        }

        boolean[] holidayPeriods = holidayPeriods(series, holidays == null ? Set.of() : holidays);
        double[] positions = positions(series);
        double[] current = raw.clone();
        boolean[] flaggedEver = new boolean[n];
        int passes = 0;
        while (true) {
            boolean[] flags = detect(current, settings);
            if (!any(flags)) {
                break;
            }
            passes++;
            if (!grow(flaggedEver, flags)) {
                // Every flagged point is already replaced, so widen the set with the points its
                // estimate is anchored on. The set grows on every pass, which bounds the loop by n.
                widen(flaggedEver, flags);
            }
            current = replace(series, raw, flaggedEver, holidayPeriods, positions, settings);
        }

        List<AnomalyRecord> anomalies = records(series, raw, current, flaggedEver, holidayPeriods);
        long flagged = anomalies.stream().filter(AnomalyRecord::anomaly).count();
        log.info("Series smoothed | periods={} | anomalies={} | passes={} | method={}",
                 n, flagged, passes, settings.getSmoothingMethod());
        return new SmoothingResult(series.withValues(current), anomalies);
    }

    boolean[] detect(double[] values, PlannerSettings settings) {
        int n = values.length;
        double[] rolling = rollingMedian(values, settings.getSmoothingWindow());
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = values[i] - rolling[i];
        }
        double scale = dispersion(values, residuals, settings.getRelativeScaleFloor());
        boolean[] flags = new boolean[n];
        for (int i = 0; i < n; i++) {
            flags[i] = Math.abs(residuals[i]) / scale > settings.getAnomalyThreshold();
        }
        return flags;
    }

    static double dispersion(double[] values, double[] residuals, double relativeFloor) {
        double center = median(residuals);
        double[] deviations = Arrays.stream(residuals).map(r -> Math.abs(r - center)).toArray();
        double mad = median(deviations);
        double level = median(Arrays.stream(values).map(Math::abs).toArray());
        return Math.max(Math.max(MAD_TO_SIGMA * mad, relativeFloor * level), MIN_SCALE);
    }

    static double[] rollingMedian(double[] values, int window) {
        int half = Math.max(1, window / 2);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(values.length, i + half + 1);
            out[i] = median(Arrays.copyOfRange(values, from, to));
        }
        return out;
    }

    private double[] replace(Series series, double[] raw, boolean[] flagged, boolean[] holidayPeriods,
                             double[] positions, PlannerSettings settings) {
        double[] out = raw.clone();
        for (int i = 0; i < raw.length; i++) {
            if (!flagged[i]) {
                continue;
            }
            double estimate = estimate(raw, flagged, positions, i, settings);
            if (holidayPeriods[i]) {
                estimate = blendWithComparable(raw, flagged, holidayPeriods, i,
                    series.getGranularity(), estimate, settings.getHolidayBlendWeight());
            }
            out[i] = estimate;
        }
        return out;
    }

    private static boolean grow(boolean[] flaggedEver, boolean[] flags) {
        boolean grown = false;
        for (int i = 0; i < flags.length; i++) {
            if (flags[i] && !flaggedEver[i]) {
                flaggedEver[i] = true;
                grown = true;
            }
        }
        return grown;
    }

    private static void widen(boolean[] flaggedEver, boolean[] flags) {
        for (int i = 0; i < flags.length; i++) {
            if (!flags[i]) {
                continue;
            }
            int left = nearestClean(flaggedEver, i, -1);
            int right = nearestClean(flaggedEver, i, 1);
            if (left >= 0) {
                flaggedEver[left] = true;
            }
            if (right >= 0) {
                flaggedEver[right] = true;
            }
        }
    }

    private static int nearestClean(boolean[] flagged, int i, int step) {
        int j = i + step;
        while (j >= 0 && j < flagged.length && flagged[j]) {
            j += step;
        }
        return j >= 0 && j < flagged.length ? j : -1;
    }

    private double estimate(double[] raw, boolean[] flagged, double[] positions, int i, PlannerSettings settings) {
        if (settings.getSmoothingMethod() == SmoothingMethod.ROLLING_MEDIAN) {
            return localMedian(raw, flagged, i, settings.getSmoothingWindow());
        }
        int left = nearestClean(flagged, i, -1);
        int right = nearestClean(flagged, i, 1);
        if (left < 0 || right < 0) {
            return localMedian(raw, flagged, i, settings.getSmoothingWindow());
        }
        double weight = (positions[i] - positions[left]) / (positions[right] - positions[left]);
        return raw[left] + weight * (raw[right] - raw[left]);
    }

    /** Median of the clean points around {@code i}, else of all clean points, else of everything. */
    private double localMedian(double[] raw, boolean[] flagged, int i, int window) {
        int half = Math.max(1, window / 2);
        double[] clean = clean(raw, flagged, Math.max(0, i - half), Math.min(raw.length, i + half + 1));
        if (clean.length == 0) {
            clean = clean(raw, flagged, 0, raw.length);
        }
        return clean.length == 0 ? median(raw) : median(clean);
    }

    private static double[] clean(double[] raw, boolean[] flagged, int from, int to) {
        List<Double> out = new ArrayList<>();
        for (int j = from; j < to; j++) {
            if (!flagged[j]) {
                out.add(raw[j]);
            }
        }
        return out.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private double blendWithComparable(double[] raw, boolean[] flagged, boolean[] holidayPeriods, int i,
                                       Granularity granularity, double estimate, double weight) {
        int season = granularity.seasonLength();
        for (int candidate : new int[] {i - season, i + season}) {
            if (candidate >= 0 && candidate < raw.length && !flagged[candidate] && !holidayPeriods[candidate]) {
                return (1.0 - weight) * estimate + weight * raw[candidate];
            }
        }
        return estimate;
    }

    private boolean[] holidayPeriods(Series series, Set<LocalDate> holidays) {
        boolean[] out = new boolean[series.size()];
        if (holidays.isEmpty()) {
            return out;
        }
        Granularity granularity = series.getGranularity();
        for (int i = 0; i < out.length; i++) {
            LocalDate period = series.get(i).period();
            out[i] = holidays.stream().anyMatch(h -> granularity.contains(period, h));
        }
        return out;
    }

    private double[] positions(Series series) {
        double[] out = new double[series.size()];
        boolean regular = series.isRegular();
        LocalDate origin = series.get(0).period();
        for (int i = 0; i < out.length; i++) {
            out[i] = regular ? i : series.getGranularity().periodsBetween(origin, series.get(i).period());
        }
        return out;
    }

    private List<AnomalyRecord> records(Series series, double[] raw, double[] smoothed,
                                        boolean[] flagged, boolean[] holidayPeriods) {
        List<AnomalyRecord> out = new ArrayList<>(raw.length);
        for (int i = 0; i < raw.length; i++) {
            TimePoint point = series.get(i);
            AnomalyMethod method = flagged[i] && holidayPeriods[i] ? AnomalyMethod.HOLIDAY_ADJUSTED : AnomalyMethod.STATISTICAL;
            out.add(new AnomalyRecord(point.period(), raw[i], smoothed[i], flagged[i], method));
        }
        return out;
    }

    private static boolean any(boolean[] flags) {
        for (boolean flag : flags) {
            if (flag) {
                return true;
            }
        }
        return false;
    }

    private static double median(double[] values) {
        return values.length == 0 ? 0.0 : new Median().evaluate(values);
    }
}
