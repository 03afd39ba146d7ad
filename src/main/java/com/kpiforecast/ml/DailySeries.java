package com.kpiforecast.ml;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * Gap-free daily series: {@code values[i]} is the observation for {@code startDate + i days}.
 */
public record DailySeries(LocalDate startDate, double[] values) {

    public DailySeries {
        values = values.clone();
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public LocalDate endDate() {
        return dateAt(values.length - 1);
    }

    public LocalDate dateAt(int index) {
        return startDate.plusDays(index);
    }

    public double valueAt(int index) {
        return values[index];
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public DailySeries head(int count) {
        return new DailySeries(startDate, Arrays.copyOfRange(values, 0, count));
    }

    public DailySeries tail(int count) {
        int from = values.length - count;
        return new DailySeries(dateAt(from), Arrays.copyOfRange(values, from, values.length));
    }
}
