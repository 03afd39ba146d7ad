package com.kpiforecast.exception;

public class NoDataException extends KpiForecastException {
    public NoDataException(String operation) {
        super("NO_DATA", "No data available for " + operation + ".");
    }
}
