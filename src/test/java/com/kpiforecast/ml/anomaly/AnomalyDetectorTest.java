package com.kpiforecast.ml.anomaly;

import com.kpiforecast.ml.MetricObservation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectorTest {

    /** A Monday. */
    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Mock OutlierScorer mockScorer;

    private final AnomalyDetector forestDetector = new AnomalyDetector(new RandomCutForestScorer(50, 256, 42));

    private static List<MetricObservation> constant(int days, double value) {
        List<MetricObservation> rows = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            rows.add(new MetricObservation(START.plusDays(i), "total_revenue", value));
        }
        return rows;
    }

    private static List<MetricObservation> withValue(List<MetricObservation> rows, int index, double value) {
        List<MetricObservation> copy = new ArrayList<>(rows);
        MetricObservation old = copy.get(index);
        copy.set(index, new MetricObservation(old.date(), old.metric(), value));
        return copy;
    }

    @Test
    void shortSeries_returnsEmpty_forAnyContamination() {
        AnomalyDetector detector = new AnomalyDetector(mockScorer);
        List<MetricObservation> rows = withValue(constant(13, 100), 5, 5000);

        assertThat(detector.detect(rows, "total_revenue", 0.1)).isEmpty();
        assertThat(detector.detect(rows, "total_revenue", 0.9)).isEmpty();
        verifyNoInteractions(mockScorer);
    }

    @Test
    void flatSeries_flagsNothing() {
        assertThat(forestDetector.detect(constant(60, 100), "total_revenue", 0.1)).isEmpty();
    }

    @Test
    void singleSpike_isCriticalSpike() {
        List<MetricObservation> rows = withValue(constant(60, 100), 30, 1000);

        List<AnomalyFinding> findings = forestDetector.detect(rows, "total_revenue", 0.1);

        LocalDate spikeDay = START.plusDays(30);
        assertThat(findings).anySatisfy(f -> {
            assertThat(f.date()).isEqualTo(spikeDay);
            assertThat(f.type()).isEqualTo(AnomalyType.SPIKE);
            assertThat(f.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(f.expected()).isCloseTo(325.0, within(1e-9));
            assertThat(f.deviationPct()).isEqualTo(207.69);
            assertThat(f.zScore()).isCloseTo(1.5, within(1e-9));
            assertThat(f.weekend()).isFalse();
            assertThat(f.dayOfWeek()).isEqualTo(2);
            assertThat(f.businessInterpretation())
                .isEqualTo("Unexpected high total revenue on Wed. Review for campaign impact.");
            assertThat(f.recommendedAction()).startsWith("Review:");
        });
        assertThat(findings).noneMatch(f -> f.type() == AnomalyType.SPIKE && !f.date().equals(spikeDay));
    }

    @Test
    void largeZScore_flagsEvenWhenScorerFlagsNothing() {
        AnomalyDetector detector = new AnomalyDetector((values, contamination) -> new boolean[values.length]);
        // first Saturday, so the baseline falls back to the weekend mean and the series std
        List<MetricObservation> rows = withValue(constant(60, 100), 5, 40);

        List<AnomalyFinding> findings = detector.detect(rows, "total_revenue", 0.1);

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.date()).isEqualTo(START.plusDays(5));
            assertThat(f.type()).isEqualTo(AnomalyType.DROP);
            assertThat(f.weekend()).isTrue();
            assertThat(f.dayOfWeek()).isEqualTo(5);
            assertThat(f.expected()).isCloseTo(96.25, within(1e-9));
            assertThat(Math.abs(f.zScore())).isGreaterThan(2.5);
            assertThat(f.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(f.businessInterpretation())
                .isEqualTo("Weekend drop on Sat below normal patterns. Check for site issues.");
            assertThat(f.recommendedAction()).startsWith("URGENT:");
        });
    }

    @Test
    void flaggedRowsWithoutDeviation_areDropped() {
        AnomalyDetector detector = new AnomalyDetector((values, contamination) -> {
            boolean[] all = new boolean[values.length];
            java.util.Arrays.fill(all, true);
            return all;
        });
        assertThat(detector.detect(constant(30, 100), "total_orders", 0.1)).isEmpty();
    }

    @Test
    void contaminationOutsideRange_isRejected() {
        assertThatThrownBy(() -> forestDetector.detect(constant(20, 100), "total_revenue", 0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> forestDetector.detect(constant(20, 100), "total_revenue", 0.6))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unorderedInput_isSortedByDate() {
        List<MetricObservation> rows = new ArrayList<>(withValue(constant(60, 100), 30, 1000));
        java.util.Collections.reverse(rows);

        List<AnomalyFinding> findings = forestDetector.detect(rows, "total_revenue", 0.1);

        assertThat(findings).extracting(AnomalyFinding::date).isSorted();
        assertThat(findings).anyMatch(f -> f.date().equals(START.plusDays(30)));
    }
}
