package com.kpiforecast.exception;

import lombok.Getter;

@Getter
public abstract class KpiForecastException extends RuntimeException {
    private final String errorCode;
    protected KpiForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected KpiForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
