package com.kpiforecast.ml.anomaly;

import com.amazon.randomcutforest.RandomCutForest;

import java.util.Arrays;

/**
 * Random Cut Forest over the residuals. The whole sample is streamed into a seeded forest first,
 * then every point is scored against the final forest; points scoring strictly above the
 * {@code (1 - contamination)} quantile of all scores are flagged.
 */
public class RandomCutForestScorer implements OutlierScorer {

    private final int numberOfTrees;
    private final int sampleSize;
    private final long seed;

    public RandomCutForestScorer(int numberOfTrees, int sampleSize, long seed) {
        if (numberOfTrees < 1 || sampleSize < 2) {
            throw new IllegalArgumentException("numberOfTrees must be >= 1 and sampleSize >= 2");
        }
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    @Override
    public boolean[] flagOutliers(double[] values, double contamination) {
        boolean[] flags = new boolean[values.length];
        if (values.length == 0) {
            return flags;
        }
        RandomCutForest forest = RandomCutForest.builder()
            .dimensions(1)
            .numberOfTrees(numberOfTrees)
            .sampleSize(sampleSize)
            .randomSeed(seed)
            .outputAfter(1)
            .initialAcceptFraction(1.0)
            .build();
        for (double v : values) {
            forest.update(new double[] {v});
        }

        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = forest.getAnomalyScore(new double[] {values[i]});
        }
        double threshold = quantile(scores, 1.0 - contamination);
        for (int i = 0; i < scores.length; i++) {
            flags[i] = scores[i] > threshold;
        }
        return flags;
    }

    /** Linear-interpolated quantile, q in [0, 1]. */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
