package com.kpiforecast.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class NoUsableModelException extends KpiForecastException {
    private final Map<String, String> failures;

    public NoUsableModelException(Map<String, String> failures) {
        super("NO_USABLE_MODEL",
              "Every candidate model failed during selection: " + failures);
        this.failures = Map.copyOf(failures);
    }
}
