package com.capacityforecast.service;

import com.capacityforecast.SeriesFixtures;
import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.config.InMemoryConfigStore;
import com.capacityforecast.config.ModelDefaults;
import com.capacityforecast.config.PlannerSettings;
import com.capacityforecast.exception.InputException;
import com.capacityforecast.forecast.ForecastModel;
import com.capacityforecast.forecast.ProphetStyleModel;
import com.capacityforecast.forecast.RandomForestModel;
import com.capacityforecast.forecast.SarimaxModel;
import com.capacityforecast.forecast.VarModel;
import com.capacityforecast.forecast.XgboostModel;
import com.capacityforecast.model.FitStatus;
import com.capacityforecast.model.ForecastPoint;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ForecastRun;
import com.capacityforecast.model.Granularity;
import com.capacityforecast.model.ModelId;
import com.capacityforecast.model.ModelRanking;
import com.capacityforecast.model.Series;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ForecastOrchestratorTest {

    private Scheduler scheduler;
    private InMemoryConfigStore configStore;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newBoundedElastic(4, 100, "orchestrator-test");
        configStore = new InMemoryConfigStore();
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private ForecastOrchestrator orchestrator(ForecastModel... models) {
        return new ForecastOrchestrator(List.of(models), scheduler, configStore);
    }

    private ForecastOrchestrator allModels() {
        return orchestrator(new ProphetStyleModel(), new RandomForestModel(), new XgboostModel(),
                            new VarModel(), new SarimaxModel());
    }

    @Test
    void run_returnsOneResultPerRequestedModelInRequestOrder() {
        List<ModelId> requested = List.of(ModelId.SARIMAX, ModelId.PROPHET, ModelId.RF, ModelId.XGBOOST, ModelId.VAR);

        StepVerifier.create(allModels().run(SeriesFixtures.seasonalMonthly(36), requested, 6))
            .assertNext(run -> {
                assertThat(run.getResults()).extracting(ForecastResult::getModelId).containsExactlyElementsOf(requested);
                assertThat(run.getResults()).allSatisfy(r -> {
                    assertThat(r.getFitStatus()).isEqualTo(FitStatus.OK);
                    assertThat(r.getHorizon()).hasSize(6);
                    assertThat(r.getAccuracy()).isNotNull();
                    assertThat(r.getAccuracy().sampleCount()).isEqualTo(3);
                });
                assertThat(run.getRanking()).hasSize(5);
                assertThat(run.getHorizon()).isEqualTo(6);
                assertThat(run.getBacktestWindow()).isEqualTo(3);
            })
            .verifyComplete();
    }

    @Test
    void shortHistory_failsOnlyTheModelThatNeedsMore() {
        Series shortSeries = SeriesFixtures.seasonalMonthly(10);

        ForecastRun run = allModels().runBlocking(shortSeries, List.of(ModelId.PROPHET, ModelId.SARIMAX), 3,
                                                  PlannerSettings.defaults());

        ForecastResult prophet = run.result(ModelId.PROPHET).orElseThrow();
        ForecastResult sarimax = run.result(ModelId.SARIMAX).orElseThrow();
        assertThat(prophet.isOk()).isTrue();
        assertThat(sarimax.getFitStatus()).isEqualTo(FitStatus.FAILED);
        assertThat(sarimax.getFailureReason()).isNotBlank().contains("insufficient history");
        assertThat(run.getRanking()).extracting(ModelRanking::modelId).containsExactly(ModelId.PROPHET);
    }

    @Test
    void ranking_ordersByErrorMetricAscending() {
        Series flat = SeriesFixtures.flat(24, 100);
        ForecastOrchestrator orchestrator = orchestrator(
            new ConstantModel(ModelId.VAR, 120), new ConstantModel(ModelId.PROPHET, 100), new ConstantModel(ModelId.RF, 90));

        ForecastRun run = orchestrator.runBlocking(flat, List.of(ModelId.VAR, ModelId.PROPHET, ModelId.RF), 2,
                                                   PlannerSettings.defaults());

        assertThat(run.getRanking()).extracting(ModelRanking::modelId)
            .containsExactly(ModelId.PROPHET, ModelId.RF, ModelId.VAR);
        assertThat(run.getRanking()).extracting(ModelRanking::score).containsExactly(0.0, 10.0, 20.0);
        assertThat(run.getRanking()).extracting(ModelRanking::rank).containsExactly(1, 2, 3);
        assertThat(run.best()).map(ForecastResult::getModelId).contains(ModelId.PROPHET);
    }

    @Test
    void slowModel_timesOutWithoutBlockingSiblings() {
        CountDownLatch interrupted = new CountDownLatch(1);
        ForecastModel slow = new ForecastModel() {
            @Override
            public ModelId id() {
                return ModelId.XGBOOST;
            }

            @Override
            public ForecastResult fitAndForecast(Series history, int horizon, Hyperparameters hyperparameters) {
                try {
                    Thread.sleep(30_000);
                } catch (InterruptedException ex) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return ForecastResult.failed(id(), null, "interrupted", List.of());
            }
        };
        PlannerSettings settings = PlannerSettings.defaults().toBuilder().modelTimeoutSeconds(1).build();
        ForecastOrchestrator orchestrator = orchestrator(slow, new ConstantModel(ModelId.PROPHET, 100));

        StepVerifier.create(orchestrator.run(SeriesFixtures.flat(12, 100), List.of(ModelId.XGBOOST, ModelId.PROPHET), 3, settings))
            .assertNext(run -> {
                ForecastResult timedOut = run.result(ModelId.XGBOOST).orElseThrow();
                assertThat(timedOut.getFitStatus()).isEqualTo(FitStatus.FAILED);
                assertThat(timedOut.getFailureReason()).isEqualTo("timeout");
                assertThat(run.result(ModelId.PROPHET).orElseThrow().isOk()).isTrue();
            })
            .expectComplete()
            .verify(Duration.ofSeconds(10));
        assertThat(awaitQuietly(interrupted)).isTrue();
    }

    @Test
    void timeout_countsOnlyRunningTimeWhenModelsOutnumberWorkers() {
        ExecutorService twoWorkers = Executors.newFixedThreadPool(2);
        Scheduler narrow = Schedulers.fromExecutorService(twoWorkers, "orchestrator-narrow");
        try {
            ForecastOrchestrator orchestrator = new ForecastOrchestrator(
                List.of(new BusyModel(ModelId.PROPHET, 700), new BusyModel(ModelId.RF, 700), new BusyModel(ModelId.VAR, 700)),
                narrow, configStore);
            PlannerSettings settings = PlannerSettings.defaults().toBuilder().modelTimeoutSeconds(2).build();

            StepVerifier.create(orchestrator.run(SeriesFixtures.flat(12, 100),
                                                 List.of(ModelId.PROPHET, ModelId.RF, ModelId.VAR), 3, settings))
                .assertNext(run -> assertThat(run.getResults())
                    .allSatisfy(r -> assertThat(r.getFitStatus()).as("%s: %s", r.getModelId(), r.getFailureReason())
                        .isEqualTo(FitStatus.OK)))
                .expectComplete()
                .verify(Duration.ofSeconds(15));
        } finally {
            narrow.dispose();
            twoWorkers.shutdownNow();
        }
    }

    @Test
    void disabledAndUnregisteredModels_areSkipped() {
        Map<ModelId, Map<String, Object>> hyperparameters = new EnumMap<>(ModelDefaults.all());
        hyperparameters.get(ModelId.VAR).put(ModelDefaults.ENABLED, false);
        PlannerSettings settings = PlannerSettings.defaults().toBuilder().hyperparameters(hyperparameters).build();
        ForecastOrchestrator orchestrator = orchestrator(new ConstantModel(ModelId.VAR, 100), new ConstantModel(ModelId.PROPHET, 100));

        ForecastRun run = orchestrator.runBlocking(SeriesFixtures.flat(12, 100),
                                                   List.of(ModelId.VAR, ModelId.SARIMAX, ModelId.PROPHET), 2, settings);

        assertThat(run.result(ModelId.VAR).orElseThrow().getFitStatus()).isEqualTo(FitStatus.SKIPPED);
        assertThat(run.result(ModelId.VAR).orElseThrow().getFailureReason()).isEqualTo("model disabled");
        assertThat(run.result(ModelId.SARIMAX).orElseThrow().getFailureReason()).isEqualTo("model not registered");
        assertThat(run.okCount()).isEqualTo(1);
    }

    @Test
    void duplicateModelRequests_runOnce() {
        ForecastRun run = orchestrator(new ConstantModel(ModelId.PROPHET, 100))
            .runBlocking(SeriesFixtures.flat(12, 100), List.of(ModelId.PROPHET, ModelId.PROPHET), 2, PlannerSettings.defaults());

        assertThat(run.getResults()).hasSize(1);
    }

    @Test
    void seriesTooShortForBacktest_isForecastButUnranked() {
        ForecastRun run = orchestrator(new ConstantModel(ModelId.PROPHET, 100))
            .runBlocking(SeriesFixtures.flat(4, 100), List.of(ModelId.PROPHET), 2, PlannerSettings.defaults());

        ForecastResult result = run.getResults().get(0);
        assertThat(result.isOk()).isTrue();
        assertThat(result.getAccuracy()).isNull();
        assertThat(result.getWarnings()).contains("series too short for a 3-period backtest");
        assertThat(run.getRanking()).isEmpty();
        assertThat(orchestrator().choose(run, SelectionPolicy.BEST)).isSameAs(result);
    }

    @Test
    void invalidInput_isSignalledAsError() {
        Series empty = Series.of(Granularity.MONTHLY, List.of());

        StepVerifier.create(allModels().run(empty, List.of(ModelId.PROPHET), 3))
            .expectError(InputException.class)
            .verify();
        StepVerifier.create(allModels().run(SeriesFixtures.flat(12, 1), List.of(ModelId.PROPHET), 0))
            .expectErrorMessage("Horizon must be >= 1 but was 0")
            .verify();
    }

    @Test
    void choose_bestAndMeanOfTopN() {
        ForecastOrchestrator orchestrator = orchestrator(
            new ConstantModel(ModelId.VAR, 120), new ConstantModel(ModelId.PROPHET, 100), new ConstantModel(ModelId.RF, 90));
        ForecastRun run = orchestrator.runBlocking(SeriesFixtures.flat(24, 100),
                                                   List.of(ModelId.VAR, ModelId.PROPHET, ModelId.RF), 2,
                                                   PlannerSettings.defaults());

        ForecastResult best = orchestrator.choose(run, SelectionPolicy.BEST);
        Map<ModelId, Map<String, Object>> hyperparameters = new EnumMap<>(ModelDefaults.all());
        hyperparameters.get(ModelId.ENSEMBLE).put("top_n", 2);
        ForecastResult ensemble = orchestrator.choose(run, SelectionPolicy.MEAN_OF_TOP_N,
            PlannerSettings.defaults().toBuilder().hyperparameters(hyperparameters).build());

        assertThat(best.getModelId()).isEqualTo(ModelId.PROPHET);
        assertThat(ensemble.getModelId()).isEqualTo(ModelId.ENSEMBLE);
        assertThat(ensemble.getHorizon()).extracting(ForecastPoint::pointEstimate).containsExactly(95.0, 95.0);
        assertThat(ensemble.getWarnings()).containsExactly("member: prophet", "member: rf");
    }

    @Test
    void choose_withNoSuccessfulModel_isRejected() {
        ForecastRun run = orchestrator()
            .runBlocking(SeriesFixtures.flat(12, 1), List.of(ModelId.PROPHET), 2, PlannerSettings.defaults());

        assertThatThrownBy(() -> orchestrator().choose(run, SelectionPolicy.BEST))
            .isInstanceOf(InputException.class);
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Forecasts the same level for every period. */
    /** Holds its worker for a fixed time per fit, then answers like {@link ConstantModel}. */
    private static final class BusyModel implements ForecastModel {
        private final ConstantModel delegate;
        private final long busyMillis;

        private BusyModel(ModelId id, long busyMillis) {
            this.delegate = new ConstantModel(id, 100);
            this.busyMillis = busyMillis;
        }

        @Override
        public ModelId id() {
            return delegate.id();
        }

        @Override
        public ForecastResult fitAndForecast(Series history, int horizon, Hyperparameters hyperparameters) {
            try {
                Thread.sleep(busyMillis);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return ForecastResult.failed(id(), null, "interrupted", List.of());
            }
            return delegate.fitAndForecast(history, horizon, hyperparameters);
        }
    }

    private static final class ConstantModel implements ForecastModel {
        private final ModelId id;
        private final double level;

        private ConstantModel(ModelId id, double level) {
            this.id = id;
            this.level = level;
        }

        @Override
        public ModelId id() {
            return id;
        }

        @Override
        public ForecastResult fitAndForecast(Series history, int horizon, Hyperparameters hyperparameters) {
            List<ForecastPoint> points = new ArrayList<>();
            for (LocalDate period : history.futurePeriods(horizon)) {
                points.add(new ForecastPoint(period, level, level * 0.9, level * 1.1));
            }
            return ForecastResult.ok(id, history.getCategory(), points, List.of());
        }
    }
}
