package com.jasmin.trafficinsights.detectors;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

public class DetectorUtils {

    private DetectorUtils() {
    }

    /** ISO calendar date, the only date format results carry. */
    public static String formatDate(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    /**
     * Seconds between the two instants, fractional part kept.
     * Zero (and, for out-of-order instants, negative) durations count as one second
     * so that rates stay finite.
     */
    public static double durationSeconds(Instant first, Instant last) {
        if (first == null || last == null) return 1.0;
        double seconds = Duration.between(first, last).toNanos() / 1_000_000_000.0;
        return seconds > 0.0 ? seconds : 1.0;
    }

    /** Missing optional features count as 0. */
    public static double orZero(Double value) {
        return (value == null || value.isNaN()) ? 0.0 : value;
    }

    /** Values of one column of a feature table. */
    public static double[] column(double[][] table, int col) {
        double[] out = new double[table.length];
        for (int i = 0; i < table.length; i++) out[i] = table[i][col];
        return out;
    }

    /** Rejects a null record list; an empty one is fine. */
    public static <T> List<T> requireRecords(List<T> records) {
        if (records == null) {
            throw new IllegalArgumentException("Records must not be null");
        }
        return records;
    }
}
