package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable, strictly ordered sequence of {@link TimePoint}s at a single granularity.
 * Every derivation returns a new instance; the receiver is never changed.
 */
public final class Series {

    private final Granularity granularity;
    private final String category;
    private final List<TimePoint> points;

    @JsonCreator
    public Series(@JsonProperty("granularity") Granularity granularity,
                  @JsonProperty("category") String category,
                  @JsonProperty("points") List<TimePoint> points) {
        this.granularity = Objects.requireNonNull(granularity, "granularity");
        this.category = category;
        this.points = List.copyOf(points);
        for (int i = 1; i < this.points.size(); i++) {
            LocalDate prev = this.points.get(i - 1).period();
            LocalDate curr = this.points.get(i).period();
            if (!curr.isAfter(prev)) {
                throw new IllegalArgumentException(
                    "Series periods must be strictly increasing: " + prev + " then " + curr);
            }
        }
    }

    public static Series of(Granularity granularity, List<TimePoint> points) {
        return new Series(granularity, null, points);
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public String getCategory() {
        return category;
    }

    public List<TimePoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }

    public TimePoint get(int index) {
        return points.get(index);
    }

    @JsonIgnore
    public TimePoint last() {
        if (points.isEmpty()) {
            throw new IllegalStateException("Series is empty");
        }
        return points.get(points.size() - 1);
    }

    public double[] values() {
        return points.stream().mapToDouble(TimePoint::value).toArray();
    }

    public List<LocalDate> periods() {
        return points.stream().map(TimePoint::period).toList();
    }

    @JsonIgnore
    public Set<String> categories() {
        return points.stream()
            .map(TimePoint::category)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    }

    /** True when every point carries an IQ value. */
    @JsonIgnore
    public boolean hasIqValues() {
        return !points.isEmpty() && points.stream().allMatch(p -> p.iqFlag() != null);
    }

    /** True when each period is exactly one granularity step after its predecessor. */
    @JsonIgnore
    public boolean isRegular() {
        for (int i = 1; i < points.size(); i++) {
            if (!granularity.plus(points.get(i - 1).period(), 1).equals(points.get(i).period())) {
                return false;
            }
        }
        return true;
    }

    public Series withValues(double[] values) {
        if (values.length != points.size()) {
            throw new IllegalArgumentException(
                "Expected " + points.size() + " values but got " + values.length);
        }
        List<TimePoint> out = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            out.add(points.get(i).withValue(values[i]));
        }
        return new Series(granularity, category, out);
    }

    public Series withPoints(List<TimePoint> newPoints) {
        return new Series(granularity, category, newPoints);
    }

    public Series map(Function<TimePoint, TimePoint> fn) {
        return withPoints(points.stream().map(fn).toList());
    }

    public Series head(int count) {
        return withPoints(points.subList(0, Math.min(count, points.size())));
    }

    public Series tail(int count) {
        return withPoints(points.subList(Math.max(0, points.size() - count), points.size()));
    }

    public List<LocalDate> futurePeriods(int horizon) {
        LocalDate start = last().period();
        List<LocalDate> out = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            out.add(granularity.plus(start, step));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Series other)) {
            return false;
        }
        return granularity == other.granularity
            && Objects.equals(category, other.category)
            && points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(granularity, category, points);
    }

    @Override
    public String toString() {
        return "Series[" + granularity + ", category=" + category + ", size=" + points.size() + "]";
    }
}
