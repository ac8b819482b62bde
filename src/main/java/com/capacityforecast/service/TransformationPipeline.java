package com.capacityforecast.service;

import com.capacityforecast.exception.InputException;
import com.capacityforecast.exception.PipelineStageException;
import com.capacityforecast.model.Adjustment;
import com.capacityforecast.model.ForecastPoint;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.Granularity;
import com.capacityforecast.model.Series;
import com.capacityforecast.model.StageName;
import com.capacityforecast.model.TimePoint;
import com.capacityforecast.model.TransformationRun;
import com.capacityforecast.model.TransformationStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Applies ordered business-rule stages to a base forecast. Every stage is a pure function from
 * one immutable {@link Series} to the next, so any run can be replayed from any stage.
 */
@Slf4j
@Service
public class TransformationPipeline {

    public TransformationRun apply(ForecastResult baseForecast, List<TransformationStage> stages) {
        return apply(baseForecast, stages, Map.of());
    }

    /**
     * @param categories category label per forecast period; periods not listed keep the
     *                   category of the base forecast
     */
    public TransformationRun apply(ForecastResult baseForecast, List<TransformationStage> stages,
                                   Map<LocalDate, String> categories) {
        Series base = toSeries(baseForecast, categories);
        return execute(UUID.randomUUID(), baseForecast, base, ordered(stages), List.of());
    }

    /**
     * Replays a run with a new stage list. Outputs of the leading stages that are unchanged
     * are reused as-is; everything from the first differing stage is recomputed.
     */
    public TransformationRun rerun(TransformationRun previous, List<TransformationStage> stages) {
        List<TransformationStage> sorted = ordered(stages);
        int reusable = 0;
        while (reusable < sorted.size()
               && reusable < previous.getIntermediateResults().size()
               && sorted.get(reusable).equals(previous.getStages().get(reusable))) {
            reusable++;
        }
        log.info("Transformation rerun | previousRun={} | reusedStages={} | recomputedStages={}",
                 previous.getRunId(), reusable, sorted.size() - reusable);
        return execute(UUID.randomUUID(), previous.getBaseForecast(), previous.getBaseSeries(), sorted,
                       previous.getIntermediateResults().subList(0, reusable));
    }

    private TransformationRun execute(UUID runId, ForecastResult baseForecast, Series base,
                                      List<TransformationStage> stages, List<Series> reused) {
        List<Series> outputs = new ArrayList<>(reused);
        Series current = outputs.isEmpty() ? base : outputs.get(outputs.size() - 1);
        for (int i = outputs.size(); i < stages.size(); i++) {
            TransformationStage stage = stages.get(i);
            try {
                current = applyStage(current, stage);
            } catch (AdjustmentRejected ex) {
                log.warn("Transformation halted | runId={} | stage={} | order={} | reason={}",
                         runId, stage.name().label(), stage.order(), ex.getMessage());
                TransformationRun partial = TransformationRun.builder()
                    .runId(runId)
                    .baseForecast(baseForecast)
                    .baseSeries(base)
                    .stages(stages)
                    .intermediateResults(List.copyOf(outputs))
                    .finalResult(current)
                    .transposedView(Map.of())
                    .createdAt(Instant.now())
                    .build();
                throw new PipelineStageException(stage, ex.getMessage(), partial);
            }
            outputs.add(current);
        }
        log.info("Transformation completed | runId={} | stages={} | periods={}", runId, stages.size(), current.size());
        return TransformationRun.builder()
            .runId(runId)
            .baseForecast(baseForecast)
            .baseSeries(base)
            .stages(stages)
            .intermediateResults(List.copyOf(outputs))
            .finalResult(current)
            .transposedView(transpose(base, stages, outputs))
            .createdAt(Instant.now())
            .build();
    }

    Series applyStage(Series input, TransformationStage stage) {
        Series current = input;
        for (Adjustment adjustment : stage.adjustments()) {
            current = applyAdjustment(current, adjustment, stage);
        }
        return current;
    }

    private Series applyAdjustment(Series input, Adjustment adjustment, TransformationStage stage) {
        if (adjustment.category() != null && !input.categories().contains(adjustment.category())) {
            throw new AdjustmentRejected("category '" + adjustment.category() + "' is not present");
        }
        Set<LocalDate> known = new HashSet<>(input.periods());
        for (LocalDate period : adjustment.periods()) {
            if (!known.contains(period)) {
                throw new AdjustmentRejected("period " + period + " is not present");
            }
        }
        double amount = adjustment.amount();
        if (!Double.isFinite(amount)) {
            throw new AdjustmentRejected(adjustment.type() + " amount must be finite");
        }
        return switch (adjustment.type()) {
            case MULTIPLY -> {
                if (amount < 0) {
                    throw new AdjustmentRejected("multiplicative factor must be >= 0 but was " + amount);
                }
                yield input.map(p -> adjustment.matches(p) ? p.withValue(p.value() * amount) : p);
            }
            case ADD -> input.map(p -> adjustment.matches(p) ? p.withValue(Math.max(0.0, p.value() + amount)) : p);
            case OVERRIDE -> {
                if (amount < 0) {
                    throw new AdjustmentRejected("override value must be >= 0 but was " + amount);
                }
                yield input.map(p -> adjustment.matches(p) ? p.withValue(amount) : p);
            }
            case EXTEND -> extend(input, adjustment, stage);
        };
    }

    private Series extend(Series input, Adjustment adjustment, TransformationStage stage) {
        if (!stage.periodAltering()) {
            throw new AdjustmentRejected("EXTEND requires a period-altering stage");
        }
        if (adjustment.extendBy() < 1 || adjustment.amount() < 0) {
            throw new AdjustmentRejected("EXTEND needs extendBy >= 1 and a factor >= 0");
        }
        if (input.isEmpty()) {
            throw new AdjustmentRejected("cannot extend an empty series");
        }
        TimePoint last = input.last();
        List<TimePoint> points = new ArrayList<>(input.getPoints());
        for (int step = 1; step <= adjustment.extendBy(); step++) {
            LocalDate period = input.getGranularity().plus(last.period(), step);
            points.add(new TimePoint(period, last.value() * adjustment.amount(), last.category(), null));
        }
        return input.withPoints(points);
    }

    private List<TransformationStage> ordered(List<TransformationStage> stages) {
        List<TransformationStage> sorted = stages.stream()
            .sorted(Comparator.comparingInt(TransformationStage::order))
            .toList();
        Set<Integer> orders = new HashSet<>();
        Set<StageName> names = EnumSet.noneOf(StageName.class);
        for (TransformationStage stage : sorted) {
            if (!orders.add(stage.order())) {
                throw new InputException("Duplicate stage order " + stage.order());
            }
            if (!names.add(stage.name())) {
                throw new InputException("Duplicate stage " + stage.name().label());
            }
        }
        return sorted;
    }

    private Map<LocalDate, Map<String, Double>> transpose(Series base, List<TransformationStage> stages,
                                                          List<Series> outputs) {
        Set<LocalDate> periods = new LinkedHashSet<>(base.periods());
        outputs.forEach(s -> periods.addAll(s.periods()));
        List<Map<LocalDate, Double>> columns = new ArrayList<>();
        columns.add(byPeriod(base));
        outputs.forEach(s -> columns.add(byPeriod(s)));

        Map<LocalDate, Map<String, Double>> view = new LinkedHashMap<>();
        periods.stream().sorted().forEach(period -> {
            Map<String, Double> row = new LinkedHashMap<>();
            putIfPresent(row, StageName.BASE_COLUMN, columns.get(0).get(period));
            for (int i = 0; i < stages.size(); i++) {
                putIfPresent(row, stages.get(i).name().label(), columns.get(i + 1).get(period));
            }
            view.put(period, row);
        });
        return view;
    }

    private static Map<LocalDate, Double> byPeriod(Series series) {
        Map<LocalDate, Double> out = new LinkedHashMap<>();
        series.getPoints().forEach(p -> out.put(p.period(), p.value()));
        return out;
    }

    private static void putIfPresent(Map<String, Double> row, String column, Double value) {
        if (value != null) {
            row.put(column, value);
        }
    }

    private Series toSeries(ForecastResult forecast, Map<LocalDate, String> categories) {
        if (forecast == null || !forecast.isOk() || forecast.getHorizon().isEmpty()) {
            throw new InputException("Base forecast must be a successful forecast with at least one period");
        }
        List<TimePoint> points = new ArrayList<>(forecast.getHorizon().size());
        for (ForecastPoint p : forecast.getHorizon()) {
            String category = categories.getOrDefault(p.period(), forecast.getCategory());
            points.add(new TimePoint(p.period(), p.pointEstimate(), category, null));
        }
        return new Series(inferGranularity(points), forecast.getCategory(), points);
    }

    private static Granularity inferGranularity(List<TimePoint> points) {
        for (int i = 0; i < points.size(); i++) {
            LocalDate period = points.get(i).period();
            if (period.getDayOfMonth() != 1) {
                return Granularity.DAILY;
            }
            if (i > 0 && !points.get(i - 1).period().plusMonths(1).equals(period)) {
                return Granularity.DAILY;
            }
        }
        return Granularity.MONTHLY;
    }

    private static final class AdjustmentRejected extends RuntimeException {
        private AdjustmentRejected(String message) {
            super(message);
        }
    }
}
