package com.kpiforecast.exception;

import java.util.Collection;

public class InvalidMetricException extends KpiForecastException {
    public InvalidMetricException(String metric, Collection<String> supported) {
        super("INVALID_METRIC",
              "Invalid metric '" + metric + "'. Choose from: " + supported);
    }
}
