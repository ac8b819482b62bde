package com.capacityforecast.service;

import com.capacityforecast.config.ConfigStore;
import com.capacityforecast.config.PlannerSettings;
import com.capacityforecast.dto.ForecastRunRequest;
import com.capacityforecast.dto.ForecastRunResponse;
import com.capacityforecast.dto.ForecastTablesResponse;
import com.capacityforecast.dto.PrepareSeriesRequest;
import com.capacityforecast.dto.PrepareSeriesResponse;
import com.capacityforecast.dto.StageRequest;
import com.capacityforecast.dto.TransformationRequest;
import com.capacityforecast.exception.InputException;
import com.capacityforecast.exception.RunNotFoundException;
import com.capacityforecast.model.BaselinePivot;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ForecastRun;
import com.capacityforecast.model.ForecastTable;
import com.capacityforecast.model.NormalizedSeries;
import com.capacityforecast.model.Series;
import com.capacityforecast.model.SmoothingResult;
import com.capacityforecast.model.TransformationRun;
import com.capacityforecast.model.TransformationStage;
import com.capacityforecast.store.ForecastStore;
import com.capacityforecast.store.SmoothedSeriesCodec;
import com.capacityforecast.store.SmoothedSeriesDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wires the core together for the REST layer: upload to smoothed series, series to ranked
 * forecasts, forecasts to transformation runs. Forecast and transformation runs are kept in
 * memory, keyed by id, until evicted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CapacityPlanningService {

    private final SeriesNormalizer normalizer;
    private final AnomalySmoother smoother;
    private final ForecastOrchestrator orchestrator;
    private final TransformationPipeline pipeline;
    private final ForecastTableService tableService;
    private final ForecastJobService jobService;
    private final BaseForecastResolver baseForecastResolver;
    private final ForecastStore forecastStore;
    private final SmoothedSeriesCodec codec;
    private final ConfigStore configStore;

    @Value("${planner.max-retained-runs:200}")
    private int maxRetainedRuns;

    private final ConcurrentHashMap<UUID, ForecastRun> forecastRuns = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, TransformationRun> transformationRuns = new ConcurrentHashMap<>();

    public PrepareSeriesResponse prepare(PrepareSeriesRequest request) {
        PlannerSettings settings = configStore.current();
        NormalizedSeries normalized = normalizer.normalize(request.getRecords(), request.getGranularity(), settings);
        SmoothingResult smoothed = smoother.smooth(normalized.series(), new HashSet<>(request.getHolidays()), settings);
        return PrepareSeriesResponse.builder()
            .series(codec.fromSeries(smoothed.smoothed(), request.getHolidays()))
            .anomalies(smoothed.anomalies())
            .anomalyCount(smoothed.anomalyCount())
            .droppedRows(normalized.droppedRows())
            .aggregated(normalized.aggregated())
            .build();
    }

    public Mono<ForecastRunResponse> runForecast(ForecastRunRequest request, String requestId) {
        return forecastMono(request, requestId).map(this::register);
    }

    public UUID submitForecast(ForecastRunRequest request, String requestId) {
        Mono<ForecastRunResponse> work = forecastMono(request, requestId).map(this::register);
        return jobService.submit(request.getArea(), request.getModels(), requestId, work);
    }

    public ForecastRun getForecastRun(UUID forecastRunId) {
        ForecastRun run = forecastRuns.get(forecastRunId);
        if (run == null) {
            throw new RunNotFoundException(forecastRunId);
        }
        return run;
    }

    public ForecastTablesResponse tables(UUID forecastRunId, SmoothedSeriesDocument baseline) {
        ForecastRun run = getForecastRun(forecastRunId);
        ForecastTable wide = tableService.wide(run);
        BaselinePivot pivot = null;
        if (baseline != null && !baseline.getRecords().isEmpty()) {
            pivot = tableService.baselinePivot(codec.toSeries(baseline));
            wide = tableService.withBaselineRow(wide, pivot);
        }
        return ForecastTablesResponse.builder()
            .combined(tableService.combined(run))
            .wide(wide)
            .baselinePivot(pivot)
            .build();
    }

    public ForecastResult stageBase(String area, UUID forecastRunId, SelectionPolicy policy) {
        ForecastResult chosen = orchestrator.choose(getForecastRun(forecastRunId), policy);
        forecastStore.saveStaged(area, chosen);
        return chosen;
    }

    public TransformationRun transform(TransformationRequest request) {
        ForecastResult base = resolveBase(request);
        List<TransformationStage> stages = toStages(request.getStages());
        Map<LocalDate, String> categories = request.getCategories() == null ? Map.of() : request.getCategories();
        return remember(pipeline.apply(base, stages, categories));
    }

    public TransformationRun rerun(UUID runId, List<StageRequest> stages) {
        return remember(pipeline.rerun(getTransformation(runId), toStages(stages)));
    }

    public TransformationRun getTransformation(UUID runId) {
        TransformationRun run = transformationRuns.get(runId);
        if (run == null) {
            throw new RunNotFoundException(runId);
        }
        return run;
    }

    List<TransformationStage> toStages(List<StageRequest> requests) {
        PlannerSettings settings = configStore.current();
        return requests.stream()
            .map(r -> new TransformationStage(
                r.getName(),
                r.getOrder() != null ? r.getOrder() : settings.stagePosition(r.getName()),
                r.getAdjustments(),
                r.isPeriodAltering()))
            .toList();
    }

    private ForecastResult resolveBase(TransformationRequest request) {
        if (request.getForecastRunId() != null) {
            return orchestrator.choose(getForecastRun(request.getForecastRunId()), request.getPolicy());
        }
        if (request.getArea() != null) {
            return baseForecastResolver.resolve(request.getArea(), request.getPolicy());
        }
        throw new InputException("Either forecastRunId or area must be given");
    }

    private Mono<ForecastRun> forecastMono(ForecastRunRequest request, String requestId) {
        PlannerSettings settings = configStore.current();
        Series series = codec.toSeries(request.getSeries());
        int horizon = request.getHorizon() != null ? request.getHorizon() : settings.getDefaultHorizon();
        log.info("Forecast run requested | models={} | periods={} | horizon={} | requestId={}",
                 request.getModels(), series.size(), horizon, requestId);
        Mono<ForecastRun> run = orchestrator.run(series, request.getModels(), horizon, settings);
        if (request.getArea() == null) {
            return run;
        }
        return run.doOnNext(r -> forecastStore.exportRun(request.getArea(), r));
    }

    private ForecastRunResponse register(ForecastRun run) {
        UUID id = UUID.randomUUID();
        forecastRuns.put(id, run);
        evictOldest();
        return ForecastRunResponse.builder()
            .forecastRunId(id)
            .run(run)
            .best(run.best().orElse(null))
            .build();
    }

    private TransformationRun remember(TransformationRun run) {
        transformationRuns.put(run.getRunId(), run);
        if (transformationRuns.size() > maxRetainedRuns) {
            transformationRuns.entrySet().stream()
                .min(Map.Entry.comparingByValue((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt())))
                .ifPresent(e -> transformationRuns.remove(e.getKey()));
        }
        return run;
    }

    private void evictOldest() {
        if (forecastRuns.size() > maxRetainedRuns) {
            forecastRuns.entrySet().stream()
                .min(Map.Entry.comparingByValue((a, b) -> a.getGeneratedAt().compareTo(b.getGeneratedAt())))
                .ifPresent(e -> forecastRuns.remove(e.getKey()));
        }
    }
}
