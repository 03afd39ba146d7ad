package com.kpiforecast.ml;

import java.time.LocalDate;

public record HoldoutPoint(LocalDate date, double actual, double predicted, double lower, double upper) {

    public boolean withinInterval() {
        return actual >= lower && actual <= upper;
    }
}
