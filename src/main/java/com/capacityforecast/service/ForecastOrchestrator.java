package com.capacityforecast.service;

import com.capacityforecast.config.ConfigStore;
import com.capacityforecast.config.ModelDefaults;
import com.capacityforecast.config.PlannerSettings;
import com.capacityforecast.exception.InputException;
import com.capacityforecast.forecast.ForecastModel;
import com.capacityforecast.model.AccuracyMetrics;
import com.capacityforecast.model.ErrorMetric;
import com.capacityforecast.model.ForecastPoint;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ForecastRun;
import com.capacityforecast.model.ModelId;
import com.capacityforecast.model.ModelRanking;
import com.capacityforecast.model.Series;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Fans a smoothed series out to the requested forecast models, scores each one on a held-out
 * tail and ranks the successful ones. A model's failure or slowness never affects its siblings.
 */
@Slf4j
@Service
public class ForecastOrchestrator {

    private final Map<ModelId, ForecastModel> models = new EnumMap<>(ModelId.class);
    private final Scheduler modelScheduler;
    private final ConfigStore configStore;

    public ForecastOrchestrator(List<ForecastModel> registered,
                                @Qualifier("modelScheduler") Scheduler modelScheduler,
                                ConfigStore configStore) {
        registered.forEach(model -> models.put(model.id(), model));
        this.modelScheduler = modelScheduler;
        this.configStore = configStore;
    }

    public Mono<ForecastRun> run(Series smoothed, Collection<ModelId> requested, int horizon) {
        return run(smoothed, requested, horizon, configStore.current());
    }

    public Mono<ForecastRun> run(Series smoothed, Collection<ModelId> requested, int horizon, PlannerSettings settings) {
        if (smoothed == null || smoothed.isEmpty()) {
            return Mono.error(new InputException("Cannot forecast an empty series"));
        }
        if (horizon < 1) {
            return Mono.error(new InputException("Horizon must be >= 1 but was " + horizon));
        }
        List<ModelId> ordered = new ArrayList<>(new LinkedHashSet<>(requested));
        long started = System.currentTimeMillis();
        return Flux.fromIterable(ordered)
            .flatMapSequential(id -> runOne(id, smoothed, horizon, settings))
            .collectList()
            .map(results -> assemble(results, horizon, settings))
            .doOnNext(run -> log.info("Forecast run completed | models={} | ok={} | failed={} | tookMs={}",
                                      ordered.size(), run.okCount(),
                                      run.getResults().size() - run.okCount(),
                                      System.currentTimeMillis() - started));
    }

    public ForecastRun runBlocking(Series smoothed, Collection<ModelId> requested, int horizon, PlannerSettings settings) {
        return run(smoothed, requested, horizon, settings).block();
    }

    /**
     * Picks the forecast to carry forward. When nothing could be ranked (no backtest was
     * possible) the first successful result in request order is used.
     */
    public ForecastResult choose(ForecastRun run, SelectionPolicy policy) {
        return choose(run, policy, configStore.current());
    }

    public ForecastResult choose(ForecastRun run, SelectionPolicy policy, PlannerSettings settings) {
        if (run.getRanking().isEmpty()) {
            return run.getResults().stream()
                .filter(ForecastResult::isOk)
                .findFirst()
                .orElseThrow(() -> new InputException("No model produced a usable forecast"));
        }
        if (policy == SelectionPolicy.BEST) {
            return run.best().orElseThrow();
        }
        int topN = settings.hyperparametersFor(ModelId.ENSEMBLE).getInt("top_n", 1);
        List<ForecastResult> top = run.getRanking().stream()
            .limit(topN)
            .map(r -> run.result(r.modelId()).orElseThrow())
            .toList();
        return mean(top);
    }

    private Mono<ForecastResult> runOne(ModelId id, Series smoothed, int horizon, PlannerSettings settings) {
        String category = smoothed.getCategory();
        ForecastModel model = models.get(id);
        if (model == null) {
            return Mono.just(ForecastResult.skipped(id, category, "model not registered"));
        }
        if (!settings.hyperparametersFor(id).getBoolean(ModelDefaults.ENABLED)) {
            return Mono.just(ForecastResult.skipped(id, category, "model disabled"));
        }
        Duration timeout = Duration.ofSeconds(settings.getModelTimeoutSeconds());
        return Mono.defer(() -> {
                // The clock starts once a worker picks the model up, not while it waits in the queue.
                Sinks.Empty<Void> started = Sinks.empty();
                return Mono.fromCallable(() -> {
                        started.tryEmitEmpty();
                        return evaluate(model, smoothed, horizon, settings);
                    })
                    .subscribeOn(modelScheduler)
                    .timeout(started.asMono().then(Mono.delay(timeout)));
            })
            .onErrorResume(TimeoutException.class, ex -> {
                log.warn("Model timed out | model={} | timeoutSeconds={}", id.key(), settings.getModelTimeoutSeconds());
                return Mono.just(ForecastResult.failed(id, category, "timeout", List.of()));
            })
            .onErrorResume(ex -> {
                log.error("Model run failed outside fit | model={} | error={}", id.key(), ex.toString(), ex);
                return Mono.just(ForecastResult.failed(id, category, ex.getMessage(), List.of()));
            });
    }

    private ForecastResult evaluate(ForecastModel model, Series smoothed, int horizon, PlannerSettings settings) {
        ModelId id = model.id();
        int window = settings.getBacktestWindow();
        List<String> backtestWarnings = new ArrayList<>();
        AccuracyMetrics accuracy = null;
        if (smoothed.size() - window < settings.getMinimumPeriods()) {
            backtestWarnings.add("series too short for a " + window + "-period backtest");
        } else {
            ForecastResult backtest = model.fitAndForecast(
                smoothed.head(smoothed.size() - window), window, settings.hyperparametersFor(id));
            if (backtest.isOk()) {
                double[] actual = smoothed.tail(window).values();
                accuracy = AccuracyMetrics.of(actual, backtest.pointEstimates());
            } else {
                backtestWarnings.add("backtest failed: " + backtest.getFailureReason());
            }
        }
        ForecastResult forward = model.fitAndForecast(smoothed, horizon, settings.hyperparametersFor(id));
        if (!forward.isOk()) {
            return forward;
        }
        return forward.withAccuracy(accuracy, backtestWarnings);
    }

    private ForecastRun assemble(List<ForecastResult> results, int horizon, PlannerSettings settings) {
        ErrorMetric metric = settings.getErrorMetric();
        List<ForecastResult> ranked = results.stream()
            .filter(ForecastResult::isOk)
            .filter(r -> r.getAccuracy() != null && r.getAccuracy().value(metric) != null)
            .sorted(Comparator.<ForecastResult>comparingDouble(r -> r.getAccuracy().value(metric))
                        .thenComparing(ForecastResult::getModelId))
            .toList();
        List<ModelRanking> ranking = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            ForecastResult r = ranked.get(i);
            ranking.add(new ModelRanking(i + 1, r.getModelId(), r.getAccuracy().value(metric)));
        }
        return ForecastRun.builder()
            .results(List.copyOf(results))
            .ranking(List.copyOf(ranking))
            .metric(metric)
            .backtestWindow(settings.getBacktestWindow())
            .horizon(horizon)
            .generatedAt(Instant.now())
            .build();
    }

    private ForecastResult mean(List<ForecastResult> top) {
        int steps = top.get(0).getHorizon().size();
        List<ForecastPoint> points = new ArrayList<>(steps);
        for (int h = 0; h < steps; h++) {
            double point = 0.0;
            double lower = 0.0;
            double upper = 0.0;
            for (ForecastResult r : top) {
                ForecastPoint p = r.getHorizon().get(h);
                point += p.pointEstimate();
                lower += p.lowerBound();
                upper += p.upperBound();
            }
            int n = top.size();
            points.add(ForecastPoint.clipped(top.get(0).getHorizon().get(h).period(), point / n, lower / n, upper / n));
        }
        List<String> members = top.stream().map(r -> "member: " + r.getModelId().key()).toList();
        return ForecastResult.ok(ModelId.ENSEMBLE, top.get(0).getCategory(), points, members);
    }
}
