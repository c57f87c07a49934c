package com.jasmin.trafficinsights.engine;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * How the engine turns scores into outlier flags: either the score of a row on purely
 * random data ({@link #auto()}) or a fixed share of the rows ({@link #contamination(double)}).
 */
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ThresholdMode {

    private static final ThresholdMode AUTO = new ThresholdMode(Double.NaN);

    private final double contamination;

    public static ThresholdMode auto() {
        return AUTO;
    }

    /**
     * @param fraction expected share of outliers, in {@code (0, 0.5]}
     */
    public static ThresholdMode contamination(double fraction) {
        if (!(fraction > 0.0 && fraction <= 0.5)) {
            throw new IllegalArgumentException("Contamination must be in (0, 0.5], got " + fraction);
        }
        return new ThresholdMode(fraction);
    }

    public boolean isAuto() {
        return Double.isNaN(contamination);
    }

    public double getContamination() {
        if (isAuto()) {
            throw new IllegalStateException("Auto threshold has no contamination fraction");
        }
        return contamination;
    }
}
