package com.jasmin.trafficinsights.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Per-row result of one {@link OutlierEngine#score} call. Row {@code i} here is row
 * {@code i} of the scored table.
 */
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class OutlierScores {

    private final double[] scores;

    private final boolean[] outliers;

    /** Score a row had to exceed (auto) or reach (contamination) to be flagged. */
    @Getter
    private final double threshold;

    static OutlierScores none(int rows, double neutralScore) {
        double[] scores = new double[rows];
        Arrays.fill(scores, neutralScore);
        return new OutlierScores(scores, new boolean[rows], Double.POSITIVE_INFINITY);
    }

    /** Copy of the scores in {@code (0, 1]}; higher means easier to isolate. */
    public double[] getScores() {
        return scores.clone();
    }

    public int size() {
        return scores.length;
    }

    public double score(int row) {
        return scores[row];
    }

    /** Indices of flagged rows, ascending. */
    public List<Integer> outlierRows() {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < outliers.length; i++) {
            if (outliers[i]) out.add(i);
        }
        return out;
    }

    public int outlierCount() {
        int n = 0;
        for (boolean o : outliers) if (o) n++;
        return n;
    }
}
