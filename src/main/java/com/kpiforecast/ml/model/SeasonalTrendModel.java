package com.kpiforecast.ml.model;

import com.kpiforecast.exception.InsufficientDataException;
import com.kpiforecast.ml.DailySeries;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Additive decomposition: piecewise-linear trend with automatic changepoints, yearly and weekly
 * Fourier seasonality, no intra-day component. Priors are expressed as ridge penalties on the
 * max-scaled series, so a small changepoint prior keeps the trend stiff and a large seasonality
 * prior leaves the seasonal terms nearly free. Yearly terms are fitted only once the history
 * covers two full years; on shorter history they are unidentified and extrapolate freely.
 */
public class SeasonalTrendModel implements ForecastModel {

    private static final double YEAR_DAYS = 365.25;
    private static final double WEEK_DAYS = 7.0;
    private static final double HISTORY_FRACTION_FOR_CHANGEPOINTS = 0.8;
    private static final double UNPENALIZED = 1e-6;
    private static final int MIN_OBSERVATIONS = 2;
    private static final double MIN_YEARLY_SPAN_DAYS = 2 * YEAR_DAYS;

    private final double changepointPriorScale;
    private final double seasonalityPriorScale;
    private final int yearlyOrder;
    private final int weeklyOrder;
    private final int maxChangepoints;
    private final double intervalWidth;

    public SeasonalTrendModel() {
        this(0.05, 10.0, 10, 3, 25, 0.80);
    }

    public SeasonalTrendModel(double changepointPriorScale, double seasonalityPriorScale,
                              int yearlyOrder, int weeklyOrder, int maxChangepoints, double intervalWidth) {
        if (changepointPriorScale <= 0 || seasonalityPriorScale <= 0) {
            throw new IllegalArgumentException("prior scales must be > 0");
        }
        if (intervalWidth <= 0 || intervalWidth >= 1) {
            throw new IllegalArgumentException("intervalWidth must be in (0, 1)");
        }
        this.changepointPriorScale = changepointPriorScale;
        this.seasonalityPriorScale = seasonalityPriorScale;
        this.yearlyOrder = yearlyOrder;
        this.weeklyOrder = weeklyOrder;
        this.maxChangepoints = maxChangepoints;
        this.intervalWidth = intervalWidth;
    }

    @Override
    public ModelType type() {
        return ModelType.SEASONAL_TREND;
    }

    @Override
    public FittedModel fit(DailySeries series) {
        int n = series.size();
        if (n < MIN_OBSERVATIONS) {
            throw new InsufficientDataException("seasonal-trend fit", MIN_OBSERVATIONS, n);
        }
        double[] y = series.values();
        double scale = 0.0;
        for (double v : y) {
            scale = Math.max(scale, Math.abs(v));
        }
        if (scale == 0.0) {
            scale = 1.0;
        }

        int yearly = n - 1 >= MIN_YEARLY_SPAN_DAYS ? yearlyOrder : 0;
        Design design = new Design(series.startDate(), n - 1, changepoints(n), yearly);
        double[][] x = new double[n][];
        double[] scaled = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = design.row(i);
            scaled[i] = y[i] / scale;
        }
        RidgeRegression regression = RidgeRegression.fit(x, scaled, design.penalties());
        return new Fitted(n, design, regression, scale);
    }

    /** Changepoint locations in scaled time, evenly spread over the first 80% of history. */
    private double[] changepoints(int n) {
        int historySize = (int) Math.floor(n * HISTORY_FRACTION_FOR_CHANGEPOINTS);
        int count = Math.min(maxChangepoints, historySize - 1);
        if (count <= 0) {
            return new double[0];
        }
        double span = n - 1;
        double[] points = new double[count];
        for (int j = 1; j <= count; j++) {
            long index = Math.round((double) j * (historySize - 1) / count);
            points[j - 1] = index / span;
        }
        return points;
    }

    /** Column layout: intercept, slope, changepoint deltas, yearly sin/cos, weekly sin/cos. */
    private final class Design {
        private final long startEpochDay;
        private final double span;
        private final double[] changepoints;
        private final int yearly;

        private Design(LocalDate start, int span, double[] changepoints, int yearly) {
            this.startEpochDay = start.toEpochDay();
            this.span = Math.max(span, 1);
            this.changepoints = changepoints;
            this.yearly = yearly;
        }

        int width() {
            return 2 + changepoints.length + 2 * yearly + 2 * weeklyOrder;
        }

        double[] row(int offset) {
            double[] row = new double[width()];
            double t = offset / span;
            double day = startEpochDay + offset;
            int c = 0;
            row[c++] = 1.0;
            row[c++] = t;
            for (double s : changepoints) {
                row[c++] = Math.max(0.0, t - s);
            }
            c = fourier(row, c, day, YEAR_DAYS, yearly);
            fourier(row, c, day, WEEK_DAYS, weeklyOrder);
            return row;
        }

        double[] penalties() {
            double[] penalties = new double[width()];
            double changepointPenalty = 1.0 / (changepointPriorScale * changepointPriorScale);
            double seasonalityPenalty = 1.0 / (seasonalityPriorScale * seasonalityPriorScale);
            penalties[0] = UNPENALIZED;
            penalties[1] = UNPENALIZED;
            int c = 2;
            for (int j = 0; j < changepoints.length; j++) {
                penalties[c++] = changepointPenalty;
            }
            while (c < penalties.length) {
                penalties[c++] = seasonalityPenalty;
            }
            return penalties;
        }

        private int fourier(double[] row, int c, double day, double period, int order) {
            for (int k = 1; k <= order; k++) {
                double angle = 2.0 * Math.PI * k * day / period;
                row[c++] = Math.sin(angle);
                row[c++] = Math.cos(angle);
            }
            return c;
        }
    }

    private final class Fitted implements FittedModel {
        private final int trainSize;
        private final Design design;
        private final RidgeRegression regression;
        private final double scale;

        private Fitted(int trainSize, Design design, RidgeRegression regression, double scale) {
            this.trainSize = trainSize;
            this.design = design;
            this.regression = regression;
            this.scale = scale;
        }

        @Override
        public ForecastBand predict(int horizon) {
            double z = normalQuantile((1.0 + intervalWidth) / 2.0);
            double[] predicted = new double[horizon];
            double[] lower = new double[horizon];
            double[] upper = new double[horizon];
            for (int h = 0; h < horizon; h++) {
                double[] row = design.row(trainSize + h);
                double mean = regression.predict(row) * scale;
                double sd = Math.sqrt(regression.predictiveVariance(row)) * scale;
                predicted[h] = mean;
                lower[h] = mean - z * sd;
                upper[h] = mean + z * sd;
            }
            return new ForecastBand(predicted, lower, upper).clippedAtZero();
        }

        @Override
        public Map<String, Object> paramsUsed() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("yearly_seasonality", design.yearly > 0);
            params.put("weekly_seasonality", true);
            params.put("daily_seasonality", false);
            params.put("changepoint_prior_scale", changepointPriorScale);
            params.put("seasonality_prior_scale", seasonalityPriorScale);
            params.put("yearly_fourier_order", design.yearly);
            params.put("weekly_fourier_order", weeklyOrder);
            params.put("n_changepoints", design.changepoints.length);
            params.put("interval_width", intervalWidth);
            params.put("y_scale", scale);
            params.put("base_slope", regression.coefficient(1) * scale / design.span);
            params.put("residual_sigma", Math.sqrt(regression.residualVariance()) * scale);
            return params;
        }

        @Override
        public double confidenceLevel() {
            return intervalWidth;
        }
    }

    /** Standard normal quantile, Abramowitz and Stegun 26.2.23 (|error| < 4.5e-4). */
    static double normalQuantile(double p) {
        if (p < 0.5) {
            return -normalQuantile(1.0 - p);
        }
        double t = Math.sqrt(-2.0 * Math.log(1.0 - p));
        return t - (2.515517 + 0.802853 * t + 0.010328 * t * t)
            / (1.0 + 1.432788 * t + 0.189269 * t * t + 0.001308 * t * t * t);
    }
}
