package com.kpiforecast.ml.anomaly;

/**
 * Unsupervised outlier flagging over a one-dimensional sample. Implementations must be
 * deterministic for a given input.
 */
public interface OutlierScorer {

    /**
     * @param values        the sample, in time order
     * @param contamination expected share of outliers, in (0, 0.5]
     * @return one flag per input value
     */
    boolean[] flagOutliers(double[] values, double contamination);
}
