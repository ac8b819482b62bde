package com.capacityforecast;

import com.capacityforecast.model.Granularity;
import com.capacityforecast.model.Series;
import com.capacityforecast.model.TimePoint;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class SeriesFixtures {

    public static final LocalDate START = LocalDate.of(2021, 1, 1);

    private SeriesFixtures() {
    }

    /** Trending monthly volume with a yearly cycle and a small deterministic wobble. */
    public static Series seasonalMonthly(int months) {
        return seasonalMonthly(months, null);
    }

    public static Series seasonalMonthly(int months, String category) {
        List<TimePoint> points = new ArrayList<>(months);
        for (int i = 0; i < months; i++) {
            double value = 500 + 4.0 * i + 60 * Math.sin(2 * Math.PI * i / 12.0) + 8 * Math.sin(1.7 * i);
            points.add(new TimePoint(START.plusMonths(i), value, category, null));
        }
        return new Series(Granularity.MONTHLY, category, points);
    }

    /** Same shape as {@link #seasonalMonthly(int)} with an IQ indicator that switches on mid-way. */
    public static Series withIq(int months) {
        List<TimePoint> points = new ArrayList<>(months);
        for (TimePoint p : seasonalMonthly(months).getPoints()) {
            double iq = points.size() >= months / 2 ? 1.0 : 0.0;
            points.add(new TimePoint(p.period(), p.value() + 40 * iq, null, iq));
        }
        return Series.of(Granularity.MONTHLY, points);
    }

    public static Series flat(int months, double value) {
        List<TimePoint> points = new ArrayList<>(months);
        for (int i = 0; i < months; i++) {
            points.add(TimePoint.of(START.plusMonths(i), value));
        }
        return Series.of(Granularity.MONTHLY, points);
    }
}
