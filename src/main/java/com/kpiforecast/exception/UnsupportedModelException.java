package com.kpiforecast.exception;

import java.util.Collection;

public class UnsupportedModelException extends KpiForecastException {
    public UnsupportedModelException(String model, Collection<String> supported) {
        super("UNSUPPORTED_MODEL",
              "Unsupported model '" + model + "'. Choose from: " + supported);
    }
}
