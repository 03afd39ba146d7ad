package com.kpiforecast.ml;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EvaluationMetricsTest {

    @Test
    void mape_ofIdenticalSeries_isZero() {
        double[] actual = {120.0, 0.0, 87.5, 310.0};
        assertThat(EvaluationMetrics.mape(actual, actual)).isZero();
    }

    @Test
    void mape_masksZeroActuals() {
        double[] actual = {0.0, 100.0, 200.0};
        double[] predicted = {50.0, 110.0, 180.0};
        assertThat(EvaluationMetrics.mape(actual, predicted)).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void mape_allZeroActuals_isZero() {
        assertThat(EvaluationMetrics.mape(new double[] {0, 0}, new double[] {3, 4})).isZero();
    }

    @Test
    void smape_isSymmetric() {
        double[] a = {100, 250, 0, 40};
        double[] b = {90, 300, 10, 40};
        assertThat(EvaluationMetrics.smape(a, b)).isEqualTo(EvaluationMetrics.smape(b, a));
    }

    @Test
    void smape_masksZeroDenominators() {
        assertThat(EvaluationMetrics.smape(new double[] {0, 100}, new double[] {0, 100})).isZero();
    }

    @Test
    void rmseAndMae() {
        double[] actual = {1, 2, 3};
        double[] predicted = {2, 2, 5};
        assertThat(EvaluationMetrics.mae(actual, predicted)).isCloseTo(1.0, within(1e-12));
        assertThat(EvaluationMetrics.rmse(actual, predicted)).isCloseTo(Math.sqrt(5.0 / 3.0), within(1e-12));
    }

    @Test
    void mismatchedLengths_throw() {
        assertThatThrownBy(() -> EvaluationMetrics.rmse(new double[] {1}, new double[] {1, 2}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void naiveBaseline_repeatsLastWeek() {
        double[] train = {10, 20, 30, 40, 50, 60, 70};
        assertThat(EvaluationMetrics.naiveBaseline(train, 7)).containsExactly(10, 20, 30, 40, 50, 60, 70);
    }

    @Test
    void naiveBaseline_wrapsPastOneWeek() {
        double[] train = {1, 2, 3, 10, 20, 30, 40, 50, 60, 70};
        assertThat(EvaluationMetrics.naiveBaseline(train, 9))
            .containsExactly(10, 20, 30, 40, 50, 60, 70, 10, 20);
    }

    @Test
    void naiveBaseline_shortTraining_repeatsMean() {
        assertThat(EvaluationMetrics.naiveBaseline(new double[] {2, 4, 6}, 3)).containsExactly(4, 4, 4);
    }

    @Test
    void improvementPct_nullWithoutPositiveBaseline() {
        assertThat(EvaluationMetrics.improvementPct(0.0, 5.0)).isNull();
        assertThat(EvaluationMetrics.improvementPct(null, 5.0)).isNull();
        assertThat(EvaluationMetrics.improvementPct(20.0, 10.0)).isCloseTo(50.0, within(1e-9));
    }
}
