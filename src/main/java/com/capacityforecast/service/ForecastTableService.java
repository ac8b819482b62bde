package com.capacityforecast.service;

import com.capacityforecast.config.ConfigStore;
import com.capacityforecast.model.BaselinePivot;
import com.capacityforecast.model.CombinedForecastRow;
import com.capacityforecast.model.ForecastPoint;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ForecastRun;
import com.capacityforecast.model.ForecastTable;
import com.capacityforecast.model.ForecastTableRow;
import com.capacityforecast.model.Series;
import com.capacityforecast.model.TimePoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Display tables for a forecast run: a long model/month table, a wide table with one row per
 * model, and the Year x Month pivot of the smoothed baseline.
 */
@Service
@RequiredArgsConstructor
public class ForecastTableService {

    private static final DateTimeFormatter MONTH_YEAR = DateTimeFormatter.ofPattern("MMM-yy", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("MMM", Locale.ENGLISH);

    private final ConfigStore configStore;

    public List<CombinedForecastRow> combined(ForecastRun run) {
        Map<String, Map<LocalDate, List<Double>>> byModel = new LinkedHashMap<>();
        for (ForecastResult result : run.getResults()) {
            if (!result.isOk()) {
                continue;
            }
            Map<LocalDate, List<Double>> months = byModel.computeIfAbsent(
                result.getModelId().displayName(), k -> new TreeMap<>());
            for (ForecastPoint point : result.getHorizon()) {
                months.computeIfAbsent(point.period().withDayOfMonth(1), k -> new ArrayList<>())
                    .add(point.pointEstimate());
            }
        }
        List<CombinedForecastRow> rows = new ArrayList<>();
        byModel.forEach((model, months) -> months.forEach((month, values) -> rows.add(
            new CombinedForecastRow(model, month, MONTH_YEAR.format(month), mean(values)))));
        return rows;
    }

    public ForecastTable wide(ForecastRun run) {
        List<CombinedForecastRow> combined = combined(run);
        TreeSet<LocalDate> months = new TreeSet<>();
        combined.forEach(r -> months.add(r.month()));
        List<String> columns = months.stream().map(MONTH_YEAR::format).toList();

        Map<String, Map<String, Double>> cells = new LinkedHashMap<>();
        combined.forEach(r -> cells.computeIfAbsent(r.model(), k -> new LinkedHashMap<>()).put(r.monthYear(), r.forecast()));
        List<ForecastTableRow> rows = new ArrayList<>();
        cells.forEach((model, values) -> rows.add(row(model, columns, values)));
        return new ForecastTable(columns, rows);
    }

    public BaselinePivot baselinePivot(Series smoothed) {
        Map<Integer, Map<Integer, List<Double>>> grouped = new TreeMap<>();
        for (TimePoint point : smoothed.getPoints()) {
            grouped.computeIfAbsent(point.period().getYear(), k -> new TreeMap<>())
                .computeIfAbsent(point.period().getMonthValue(), k -> new ArrayList<>())
                .add(point.value());
        }
        TreeSet<Integer> monthNumbers = new TreeSet<>();
        Map<Integer, Map<String, Double>> years = new LinkedHashMap<>();
        grouped.forEach((year, months) -> {
            Map<String, Double> row = new LinkedHashMap<>();
            months.forEach((month, values) -> {
                monthNumbers.add(month);
                row.put(monthName(month), mean(values));
            });
            years.put(year, row);
        });
        List<String> monthColumns = monthNumbers.stream().map(ForecastTableService::monthName).toList();
        return new BaselinePivot(monthColumns, years);
    }

    /**
     * Adds (or replaces) the baseline row. Month cells are looked up in the pivot by
     * month and year and divided by the configured divisor; unmatched months stay empty.
     */
    public ForecastTable withBaselineRow(ForecastTable wide, BaselinePivot pivot) {
        double divisor = configStore.current().getBaselineRowDivisor();
        Map<String, Double> cells = new LinkedHashMap<>();
        for (String column : wide.monthColumns()) {
            YearMonth month = YearMonth.parse(column, MONTH_YEAR);
            Map<String, Double> year = pivot.years().get(month.getYear());
            Double value = year == null ? null : year.get(monthName(month.getMonthValue()));
            if (value != null) {
                cells.put(column, value / divisor);
            }
        }
        List<ForecastTableRow> rows = new ArrayList<>(wide.rows());
        rows.removeIf(r -> r.model().equals(ForecastTable.BASELINE_ROW));
        rows.add(row(ForecastTable.BASELINE_ROW, wide.monthColumns(), cells));
        return new ForecastTable(wide.monthColumns(), rows);
    }

    private static ForecastTableRow row(String model, List<String> columns, Map<String, Double> values) {
        Map<String, Double> ordered = new LinkedHashMap<>();
        columns.stream().filter(values::containsKey).forEach(c -> ordered.put(c, values.get(c)));
        Double avg = ordered.isEmpty() ? null : mean(new ArrayList<>(ordered.values()));
        return new ForecastTableRow(model, avg, ordered);
    }

    private static String monthName(int month) {
        return MONTH.format(LocalDate.of(2000, month, 1));
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }
}
