package com.kpiforecast.ml.model;

import com.kpiforecast.exception.InsufficientDataException;
import com.kpiforecast.ml.DailySeries;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Triple exponential smoothing with additive trend and additive weekly seasonality. Smoothing
 * parameters are picked from a fixed grid by in-sample one-step SSE; the interval is a symmetric
 * normal approximation built from the in-sample residual spread.
 */
public class HoltWintersModel implements ForecastModel {

    private static final double[] ALPHA_GRID = {0.1, 0.2, 0.3, 0.5, 0.7, 0.9};
    private static final double[] BETA_GRID = {0.01, 0.05, 0.1, 0.2};
    private static final double[] GAMMA_GRID = {0.05, 0.1, 0.2, 0.4};
    private static final double Z_95 = 1.96;

    private final int seasonLength;

    public HoltWintersModel() {
        this(7);
    }

    public HoltWintersModel(int seasonLength) {
        if (seasonLength < 2) {
            throw new IllegalArgumentException("seasonLength must be >= 2");
        }
        this.seasonLength = seasonLength;
    }

    @Override
    public ModelType type() {
        return ModelType.HOLT_WINTERS;
    }

    public int minimumObservations() {
        return 2 * seasonLength;
    }

    @Override
    public FittedModel fit(DailySeries series) {
        int n = series.size();
        if (n < minimumObservations()) {
            throw new InsufficientDataException("holt-winters fit", minimumObservations(), n);
        }
        double[] y = series.values();

        Smoothing best = null;
        for (double alpha : ALPHA_GRID) {
            for (double beta : BETA_GRID) {
                for (double gamma : GAMMA_GRID) {
                    Smoothing candidate = smooth(y, alpha, beta, gamma);
                    if (best == null || candidate.sse < best.sse) {
                        best = candidate;
                    }
                }
            }
        }
        return new Fitted(best, n, standardDeviation(best.residuals));
    }

    private Smoothing smooth(double[] y, double alpha, double beta, double gamma) {
        int m = seasonLength;
        double firstMean = mean(y, 0, m);
        double secondMean = mean(y, m, 2 * m);
        double level = firstMean;
        double trend = (secondMean - firstMean) / m;
        double[] seasonal = new double[m];
        for (int i = 0; i < m; i++) {
            seasonal[i] = y[i] - firstMean;
        }
        double initialLevel = level;
        double initialTrend = trend;

        double[] residuals = new double[y.length];
        double sse = 0.0;
        for (int t = 0; t < y.length; t++) {
            int s = t % m;
            double forecast = level + trend + seasonal[s];
            residuals[t] = y[t] - forecast;
            sse += residuals[t] * residuals[t];

            double previousLevel = level;
            level = alpha * (y[t] - seasonal[s]) + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
            seasonal[s] = gamma * (y[t] - level) + (1 - gamma) * seasonal[s];
        }
        return new Smoothing(alpha, beta, gamma, level, trend, seasonal, residuals, sse,
            initialLevel, initialTrend);
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    private static double standardDeviation(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values, 0, values.length);
        double sq = 0.0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sq / (values.length - 1));
    }

    private record Smoothing(double alpha, double beta, double gamma, double level, double trend,
                             double[] seasonal, double[] residuals, double sse,
                             double initialLevel, double initialTrend) {}

    private final class Fitted implements FittedModel {
        private final Smoothing state;
        private final int trainSize;
        private final double residualStd;

        private Fitted(Smoothing state, int trainSize, double residualStd) {
            this.state = state;
            this.trainSize = trainSize;
            this.residualStd = residualStd;
        }

        @Override
        public ForecastBand predict(int horizon) {
            double[] predicted = new double[horizon];
            double[] lower = new double[horizon];
            double[] upper = new double[horizon];
            for (int h = 1; h <= horizon; h++) {
                double value = state.level + h * state.trend
                    + state.seasonal[(trainSize + h - 1) % seasonLength];
                predicted[h - 1] = value;
                lower[h - 1] = value - Z_95 * residualStd;
                upper[h - 1] = value + Z_95 * residualStd;
            }
            return new ForecastBand(predicted, lower, upper).clippedAtZero();
        }

        @Override
        public Map<String, Object> paramsUsed() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("trend", "add");
            params.put("seasonal", "add");
            params.put("seasonal_periods", seasonLength);
            params.put("smoothing_level", state.alpha);
            params.put("smoothing_trend", state.beta);
            params.put("smoothing_seasonal", state.gamma);
            params.put("initial_level", state.initialLevel);
            params.put("initial_trend", state.initialTrend);
            params.put("sse", state.sse);
            params.put("residual_std", residualStd);
            return params;
        }

        @Override
        public double confidenceLevel() {
            return 0.95;
        }
    }
}
