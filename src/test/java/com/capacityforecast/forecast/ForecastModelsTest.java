package com.capacityforecast.forecast;

import com.capacityforecast.SeriesFixtures;
import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.model.FitStatus;
import com.capacityforecast.model.ForecastPoint;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.Series;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.LocalDate;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class ForecastModelsTest {

    static Stream<Arguments> models() {
        return Stream.of(
            Arguments.of(new ProphetStyleModel()),
            Arguments.of(new RandomForestModel()),
            Arguments.of(new XgboostModel()),
            Arguments.of(new VarModel()),
            Arguments.of(new SarimaxModel()));
    }

    private static Hyperparameters defaults(ForecastModel model) {
        return Hyperparameters.defaults(model.id());
    }

    @ParameterizedTest
    @MethodSource("models")
    void forecast_coversHorizonWithOrderedNonNegativeBounds(ForecastModel model) {
        Series history = SeriesFixtures.seasonalMonthly(36, "Retail");

        ForecastResult result = model.fitAndForecast(history, 6, defaults(model));

        assertThat(result.getFitStatus()).as("failure: %s", result.getFailureReason()).isEqualTo(FitStatus.OK);
        assertThat(result.getModelId()).isEqualTo(model.id());
        assertThat(result.getCategory()).isEqualTo("Retail");
        assertThat(result.getHorizon()).hasSize(6);
        assertThat(result.getHorizon().get(0).period()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(result.getHorizon().get(5).period()).isEqualTo(LocalDate.of(2024, 6, 1));
        for (ForecastPoint point : result.getHorizon()) {
            assertThat(point.lowerBound()).isGreaterThanOrEqualTo(0.0).isLessThanOrEqualTo(point.pointEstimate());
            assertThat(point.upperBound()).isGreaterThanOrEqualTo(point.pointEstimate());
            assertThat(point.pointEstimate()).isBetween(200.0, 1000.0);
        }
    }

    @ParameterizedTest
    @MethodSource("models")
    void decliningSeries_neverForecastsNegativeVolume(ForecastModel model) {
        Series declining = SeriesFixtures.seasonalMonthly(36).map(p -> {
            long i = SeriesFixtures.START.until(p.period()).toTotalMonths();
            return p.withValue(Math.max(0.0, 400 - 11.0 * i + 20 * Math.sin(2 * Math.PI * i / 12.0) + 6 * Math.sin(1.7 * i)));
        });

        ForecastResult result = model.fitAndForecast(declining, 12, defaults(model));

        assertThat(result.isOk()).as("failure: %s", result.getFailureReason()).isTrue();
        assertThat(result.getHorizon())
            .allSatisfy(p -> assertThat(p.lowerBound()).isGreaterThanOrEqualTo(0.0))
            .allSatisfy(p -> assertThat(p.pointEstimate()).isGreaterThanOrEqualTo(0.0));
    }

    @ParameterizedTest
    @MethodSource("models")
    void tooShortHistory_isReportedAsFailedNotThrown(ForecastModel model) {
        Series history = SeriesFixtures.seasonalMonthly(2);

        ForecastResult result = model.fitAndForecast(history, 3, defaults(model));

        assertThat(result.getFitStatus()).isEqualTo(FitStatus.FAILED);
        assertThat(result.getFailureReason()).contains("insufficient history");
        assertThat(result.getHorizon()).isEmpty();
    }

    @ParameterizedTest
    @MethodSource("models")
    void refitOnSameHistory_isDeterministic(ForecastModel model) {
        Series history = SeriesFixtures.seasonalMonthly(30);

        ForecastResult first = model.fitAndForecast(history, 4, defaults(model));
        ForecastResult second = model.fitAndForecast(history, 4, defaults(model));

        assertThat(first.isOk()).as("failure: %s", first.getFailureReason()).isTrue();
        assertThat(second.getHorizon()).isEqualTo(first.getHorizon());
    }

    @ParameterizedTest
    @MethodSource("models")
    void invalidHorizon_isRejected(ForecastModel model) {
        ForecastResult result = model.fitAndForecast(SeriesFixtures.seasonalMonthly(36), 0, defaults(model));

        assertThat(result.getFitStatus()).isEqualTo(FitStatus.FAILED);
        assertThat(result.getFailureReason()).contains("horizon");
    }
}
