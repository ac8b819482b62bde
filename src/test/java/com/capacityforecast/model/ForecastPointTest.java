package com.capacityforecast.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class ForecastPointTest {

    private static final LocalDate JAN = LocalDate.of(2025, 1, 1);

    @Test
    void clipped_raisesNegativeOutputToZero() {
        ForecastPoint point = ForecastPoint.clipped(JAN, -4.0, -10.0, 3.0);

        assertThat(point.pointEstimate()).isZero();
        assertThat(point.lowerBound()).isZero();
        assertThat(point.upperBound()).isEqualTo(3.0);
    }

    @Test
    void clipped_widensBoundsToContainEstimate() {
        ForecastPoint point = ForecastPoint.clipped(JAN, 50.0, 60.0, 70.0);

        assertThat(point.lowerBound()).isEqualTo(50.0);
        assertThat(point.upperBound()).isEqualTo(70.0);
    }

    @Test
    void clipped_replacesNonFiniteValues() {
        ForecastPoint point = ForecastPoint.clipped(JAN, Double.NaN, Double.NEGATIVE_INFINITY, 5.0);

        assertThat(point.pointEstimate()).isZero();
        assertThat(point.upperBound()).isEqualTo(5.0);
    }

    @Test
    void constructor_rejectsUnorderedBounds() {
        assertThatThrownBy(() -> new ForecastPoint(JAN, 10.0, 11.0, 12.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lower <= point <= upper");
        assertThatThrownBy(() -> new ForecastPoint(JAN, -1.0, -2.0, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
