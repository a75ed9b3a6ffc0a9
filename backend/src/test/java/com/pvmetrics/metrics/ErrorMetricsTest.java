package com.pvmetrics.metrics;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ErrorMetricsTest {

    private static final double[] OBSERVED = {10, 20, 30};
    private static final double[] PREDICTED = {12, 18, 33};

    @Test
    void meanAbsoluteError_averagesAbsoluteErrors() {
        assertThat(ErrorMetrics.meanAbsoluteError(PREDICTED, OBSERVED)).isCloseTo(2.3333, within(1e-4));
    }

    @Test
    void rootMeanSquareError_isSquareRootOfMeanSquaredError() {
        assertThat(ErrorMetrics.rootMeanSquareError(PREDICTED, OBSERVED)).isCloseTo(2.3805, within(1e-4));
    }

    @Test
    void meanBiasError_keepsSign() {
        assertThat(ErrorMetrics.meanBiasError(PREDICTED, OBSERVED)).isEqualTo(1.0);
        assertThat(ErrorMetrics.meanBiasError(new double[] {8, 18}, new double[] {10, 20})).isEqualTo(-2.0);
    }

    @Test
    void meanAbsolutePercentageError_isAFraction() {
        // 2/10, 2/20, 3/30
        assertThat(ErrorMetrics.meanAbsolutePercentageError(PREDICTED, OBSERVED))
            .isCloseTo((0.2 + 0.1 + 0.1) / 3, within(1e-12));
    }

    @Test
    void meanAbsolutePercentageError_skipsZeroObservations() {
        double mape = ErrorMetrics.meanAbsolutePercentageError(new double[] {5, 12}, new double[] {0, 10});
        assertThat(mape).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void meanAbsolutePercentageError_allZeroObservations_isNaN() {
        double mape = ErrorMetrics.meanAbsolutePercentageError(new double[] {1, 2}, new double[] {0, 0});
        assertThat(mape).isNaN();
    }

    @Test
    void emptyInput_yieldsNaNForEveryMetric() {
        double[] empty = new double[0];
        assertThat(ErrorMetrics.meanAbsoluteError(empty, empty)).isNaN();
        assertThat(ErrorMetrics.rootMeanSquareError(empty, empty)).isNaN();
        assertThat(ErrorMetrics.meanBiasError(empty, empty)).isNaN();
        assertThat(ErrorMetrics.meanAbsolutePercentageError(empty, empty)).isNaN();
        assertThat(ErrorMetrics.countLargeErrors(empty, empty, 1.0)).isNaN();
    }

    @Test
    void countLargeErrors_countsStrictlyAboveThreshold() {
        assertThat(ErrorMetrics.countLargeErrors(PREDICTED, OBSERVED, 2.0)).isEqualTo(1.0);
        assertThat(ErrorMetrics.countLargeErrors(PREDICTED, OBSERVED, 1.5)).isEqualTo(3.0);
    }

    @Test
    void misalignedInput_throws() {
        assertThatThrownBy(() -> ErrorMetrics.meanAbsoluteError(new double[] {1}, new double[] {1, 2}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("same length");
    }

    @Test
    void metricSuite_scoresEveryMetricInOrder() {
        MetricSuite suite = new MetricSuite(List.of(2.5));

        Map<String, Double> scores = suite.score(PREDICTED, OBSERVED);

        assertThat(suite.names()).containsExactly("mae", "rmse", "mbe", "mape", "large_error_count_threshold_2.5");
        assertThat(scores.keySet()).containsExactlyElementsOf(suite.names());
        assertThat(scores.get("mbe")).isEqualTo(1.0);
        assertThat(scores.get("large_error_count_threshold_2.5")).isEqualTo(1.0);
    }

    @Test
    void metricSuite_emptyInput_allNaN() {
        Map<String, Double> scores = new MetricSuite(List.of(1.0)).score(new double[0], new double[0]);
        assertThat(scores.values()).hasSize(5).allMatch(v -> v.isNaN());
    }
}
