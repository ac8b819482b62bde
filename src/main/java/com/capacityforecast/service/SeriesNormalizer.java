package com.capacityforecast.service;

import com.capacityforecast.config.ConfigStore;
import com.capacityforecast.config.PlannerSettings;
import com.capacityforecast.exception.InputException;
import com.capacityforecast.model.Granularity;
import com.capacityforecast.model.NormalizedSeries;
import com.capacityforecast.model.RawRecord;
import com.capacityforecast.model.Series;
import com.capacityforecast.model.TimePoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class SeriesNormalizer {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("M/d/yyyy"),
        DateTimeFormatter.ofPattern("dd-MM-yyyy"));
    private static final DateTimeFormatter YEAR_MONTH = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final long MONTHLY_SPACING_DAYS = 28;

    private final ConfigStore configStore;

    public NormalizedSeries normalize(List<RawRecord> rawRecords, Granularity target) {
        return normalize(rawRecords, target, configStore.current());
    }

    public NormalizedSeries normalize(List<RawRecord> rawRecords, Granularity target, PlannerSettings settings) {
        Objects.requireNonNull(target, "target granularity");
        List<ParsedRow> rows = new ArrayList<>();
        int dropped = 0;
        for (RawRecord raw : rawRecords == null ? List.<RawRecord>of() : rawRecords) {
            ParsedRow row = parse(raw);
            if (row == null) {
                dropped++;
            } else {
                rows.add(row);
            }
        }

        Granularity nativeGranularity = inferGranularity(rows);
        long distinctDates = rows.stream().map(ParsedRow::date).distinct().count();
        boolean aggregate = nativeGranularity.isFinerThan(target) && distinctDates > settings.getAggregationThreshold();
        Granularity effective = aggregate ? target : nativeGranularity;

        List<TimePoint> points = bucket(rows, effective);
        if (points.size() < settings.getMinimumPeriods()) {
            log.warn("Normalization rejected | usable={} | dropped={} | required={}",
                     points.size(), dropped, settings.getMinimumPeriods());
            throw InputException.insufficientData(points.size(), settings.getMinimumPeriods());
        }

        List<String> categories = rows.stream().map(ParsedRow::category).filter(Objects::nonNull).distinct().toList();
        String partition = categories.size() == 1 && rows.stream().allMatch(r -> r.category() != null)
            ? categories.get(0) : null;

        log.info("Series normalized | rows={} | dropped={} | periods={} | granularity={} | aggregated={}",
                 rows.size(), dropped, points.size(), effective, aggregate);
        return new NormalizedSeries(new Series(effective, partition, points), dropped, aggregate);
    }

    private List<TimePoint> bucket(List<ParsedRow> rows, Granularity granularity) {
        Map<LocalDate, Bucket> buckets = new TreeMap<>();
        List<ParsedRow> chronological = rows.stream().sorted(Comparator.comparing(ParsedRow::date)).toList();
        for (ParsedRow row : chronological) {
            buckets.computeIfAbsent(granularity.align(row.date()), k -> new Bucket()).add(row);
        }
        List<TimePoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((period, b) -> points.add(new TimePoint(period, b.volume, b.category, b.iq())));
        return points;
    }

    private Granularity inferGranularity(List<ParsedRow> rows) {
        long[] days = rows.stream()
            .mapToLong(r -> r.date().toEpochDay())
            .distinct()
            .sorted()
            .toArray();
        if (days.length < 2) {
            return Granularity.MONTHLY;
        }
        long[] spacing = new long[days.length - 1];
        for (int i = 1; i < days.length; i++) {
            spacing[i - 1] = days[i] - days[i - 1];
        }
        Arrays.sort(spacing);
        long median = spacing[spacing.length / 2];
        return median >= MONTHLY_SPACING_DAYS ? Granularity.MONTHLY : Granularity.DAILY;
    }

    private ParsedRow parse(RawRecord raw) {
        if (raw == null) {
            return null;
        }
        LocalDate date = parseDate(raw.date());
        Double volume = parseNumber(raw.volume());
        if (date == null || volume == null) {
            return null;
        }
        String category = raw.category() == null || raw.category().isBlank() ? null : raw.category().trim();
        return new ParsedRow(date, volume, category, parseNumber(raw.iqValue()));
    }

    static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.length() > 10 && trimmed.charAt(10) == 'T') {
            trimmed = trimmed.substring(0, 10);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException ex) {
                log.trace("Date '{}' does not match {}", trimmed, format);
            }
        }
        try {
            return YearMonth.parse(trimmed, YEAR_MONTH).atDay(1);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    static Double parseNumber(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(text.trim().replace(",", ""));
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private record ParsedRow(LocalDate date, double volume, String category, Double iq) {}

    private static final class Bucket {
        private double volume;
        private String category;
        private double iqSum;
        private int iqCount;

        private void add(ParsedRow row) {
            volume += row.volume();
            if (row.category() != null) {
                category = row.category();
            }
            if (row.iq() != null) {
                iqSum += row.iq();
                iqCount++;
            }
        }

        private Double iq() {
            return iqCount == 0 ? null : iqSum / iqCount;
        }
    }
}
