package com.kpiforecast.config;

import com.kpiforecast.ml.anomaly.AnomalyDetector;
import com.kpiforecast.ml.anomaly.OutlierScorer;
import com.kpiforecast.ml.anomaly.RandomCutForestScorer;
import com.kpiforecast.ml.model.HoltWintersModel;
import com.kpiforecast.ml.model.SeasonalTrendModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

/**
 * Model variants and the anomaly detector. The {@code @Order} of each variant is its position in
 * model selection.
 */
@Configuration
public class ForecastingConfig {

    @Bean
    @Order(1)
    public SeasonalTrendModel seasonalTrendModel(
            @Value("${forecasting.seasonal-trend.changepoint-prior-scale:0.05}") double changepointPriorScale,
            @Value("${forecasting.seasonal-trend.seasonality-prior-scale:10.0}") double seasonalityPriorScale,
            @Value("${forecasting.seasonal-trend.yearly-order:10}") int yearlyOrder,
            @Value("${forecasting.seasonal-trend.weekly-order:3}") int weeklyOrder,
            @Value("${forecasting.seasonal-trend.n-changepoints:25}") int changepoints,
            @Value("${forecasting.seasonal-trend.interval-width:0.80}") double intervalWidth) {
        return new SeasonalTrendModel(changepointPriorScale, seasonalityPriorScale,
                                      yearlyOrder, weeklyOrder, changepoints, intervalWidth);
    }

    @Bean
    @Order(2)
    public HoltWintersModel holtWintersModel(
            @Value("${forecasting.holt-winters.season-length:7}") int seasonLength) {
        return new HoltWintersModel(seasonLength);
    }

    @Bean
    public OutlierScorer outlierScorer(
            @Value("${anomaly.forest.trees:50}") int trees,
            @Value("${anomaly.forest.sample-size:256}") int sampleSize,
            @Value("${anomaly.forest.seed:42}") long seed) {
        return new RandomCutForestScorer(trees, sampleSize, seed);
    }

    @Bean
    public AnomalyDetector anomalyDetector(OutlierScorer outlierScorer) {
        return new AnomalyDetector(outlierScorer);
    }
}
