package com.kpiforecast.exception;

import lombok.Getter;

@Getter
public class InsufficientDataException extends KpiForecastException {
    private final int required;
    private final int available;

    public InsufficientDataException(String operation, int required, int available) {
        super("INSUFFICIENT_DATA",
              "Insufficient data for " + operation + ". Need at least " + required
                  + " days, have " + available + ".");
        this.required = required;
        this.available = available;
    }
}
