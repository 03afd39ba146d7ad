package com.kpiforecast.service;

import com.kpiforecast.exception.UnsupportedModelException;
import com.kpiforecast.ml.model.ForecastModel;
import com.kpiforecast.ml.model.ModelType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * The forecasting variants available to selection, in registration order. Registration order is
 * the tie-break when two candidates score the same MAPE.
 */
@Slf4j
@Service
public class ModelRegistryService {

    public static final String AUTO = "auto";

    private final List<ForecastModel> models;

    public ModelRegistryService(List<ForecastModel> models) {
        if (models.isEmpty()) {
            throw new IllegalStateException("At least one forecast model must be registered.");
        }
        this.models = List.copyOf(models);
        log.info("Forecast models registered | models={}", choices());
    }

    public List<ForecastModel> candidates() {
        return models;
    }

    public boolean isAuto(String choice) {
        return choice == null || choice.isBlank() || AUTO.equalsIgnoreCase(choice.trim());
    }

    public ForecastModel resolve(String choice) {
        ModelType type = ModelType.fromId(choice)
            .orElseThrow(() -> new UnsupportedModelException(choice, choices()));
        return resolve(type);
    }

    public ForecastModel resolve(ModelType type) {
        return models.stream()
            .filter(m -> m.type() == type)
            .findFirst()
            .orElseThrow(() -> new UnsupportedModelException(type.id(), choices()));
    }

    public List<String> choices() {
        List<String> choices = new ArrayList<>();
        choices.add(AUTO);
        models.forEach(m -> choices.add(m.type().id()));
        return choices;
    }
}
