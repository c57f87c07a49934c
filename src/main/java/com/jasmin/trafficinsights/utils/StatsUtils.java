package com.jasmin.trafficinsights.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class StatsUtils {

    private StatsUtils() {
    }

    /** Arithmetic mean; 0 for an empty array. */
    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Arithmetic mean; 0 for an empty array. */
    public static double mean(long[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (long v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Rounds the exact binary value of {@code value} half-to-even, so 2.675 (stored as
     * 2.67499...) becomes 2.67 and 2.25 becomes 2.2.
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    /** True when every value equals the first one. */
    public static boolean isConstant(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (Double.compare(values[i], values[0]) != 0) return false;
        }
        return true;
    }
}
