package com.jasmin.trafficinsights.engine;

import com.jasmin.trafficinsights.utils.StatsUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Isolation forest shared by the detectors. Rows that random recursive partitioning
 * separates in few steps score close to 1, rows buried in dense regions well below 0.5.
 * <p>
 * The engine holds no per-call state: every {@link #score} call seeds a fresh
 * {@link Random} from the configured seed, so identical tables always get identical
 * scores and concurrent calls do not interfere.
 */
@Service
@Slf4j
public class OutlierEngine {

    /** Score of any row on a table without structure; the auto threshold. */
    static final double RANDOM_DATA_SCORE = 0.5;

    private final long seed;
    private final int trees;
    private final int maxSamples;

    public OutlierEngine(OutlierEngineProperties props) {
        this.seed = props.getSeed();
        this.trees = props.getTrees();
        this.maxSamples = props.getMaxSamples();
    }

    public OutlierScores score(double[][] table, ThresholdMode mode) {
        validate(table);
        final int n = table.length;

        if (allColumnsConstant(table)) {
            log.debug("All {} rows share the same features, nothing to isolate", n);
            return OutlierScores.none(n, RANDOM_DATA_SCORE);
        }

        final int subsample = Math.min(maxSamples, n);
        final double normalizer = IsolationTree.averagePathLength(subsample);
        if (normalizer <= 0.0) {
            return OutlierScores.none(n, RANDOM_DATA_SCORE);
        }
        // ceil(log2(subsample))
        final int heightLimit = 32 - Integer.numberOfLeadingZeros(subsample - 1);

        Random rnd = new Random(seed);
        double[] pathSums = new double[n];
        for (int t = 0; t < trees; t++) {
            int[] rows = sampleWithoutReplacement(n, subsample, rnd);
            IsolationTree tree = IsolationTree.grow(table, rows, heightLimit, rnd);
            for (int i = 0; i < n; i++) {
                pathSums[i] += tree.pathLength(table[i]);
            }
        }

        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double meanPath = pathSums[i] / trees;
            scores[i] = Math.pow(2.0, -meanPath / normalizer);
        }

        OutlierScores result = mode.isAuto()
                ? flagAboveRandom(scores)
                : flagTopFraction(scores, mode.getContamination());

        log.debug("Scored {} rows with {} trees (subsample={}, mode={}): {} outliers",
                n, trees, subsample, mode, result.outlierCount());
        return result;
    }

    private static OutlierScores flagAboveRandom(double[] scores) {
        boolean[] outliers = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            outliers[i] = scores[i] > RANDOM_DATA_SCORE;
        }
        return new OutlierScores(scores, outliers, RANDOM_DATA_SCORE);
    }

    /** Flags exactly {@code round(fraction * n)} rows, highest scores first, earlier rows on ties. */
    private static OutlierScores flagTopFraction(double[] scores, double fraction) {
        int n = scores.length;
        int k = (int) Math.round(fraction * n);

        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> scores[i]).reversed()
                .thenComparingInt(i -> i));

        boolean[] outliers = new boolean[n];
        for (int j = 0; j < k; j++) {
            outliers[order[j]] = true;
        }
        double threshold = k > 0 ? scores[order[k - 1]] : Double.POSITIVE_INFINITY;
        return new OutlierScores(scores, outliers, threshold);
    }

    /** Partial Fisher-Yates shuffle; returns {@code k} distinct indices of {@code [0, n)}. */
    private static int[] sampleWithoutReplacement(int n, int k, Random rnd) {
        int[] idx = IntStream.range(0, n).toArray();
        for (int i = 0; i < k; i++) {
            int j = i + rnd.nextInt(n - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
        }
        return Arrays.copyOf(idx, k);
    }

    private static boolean allColumnsConstant(double[][] table) {
        int features = table[0].length;
        for (int f = 0; f < features; f++) {
            double[] column = new double[table.length];
            for (int i = 0; i < table.length; i++) column[i] = table[i][f];
            if (!StatsUtils.isConstant(column)) return false;
        }
        return true;
    }

    private static void validate(double[][] table) {
        if (table == null || table.length == 0) {
            throw new IllegalArgumentException("Feature table must contain at least one row");
        }
        int features = table[0] == null ? 0 : table[0].length;
        if (features == 0) {
            throw new IllegalArgumentException("Feature rows must contain at least one feature");
        }
        for (double[] row : table) {
            if (row == null || row.length != features) {
                throw new IllegalArgumentException("All feature rows must have " + features + " features");
            }
            for (double v : row) {
                if (Double.isNaN(v) || Double.isInfinite(v)) {
                    throw new IllegalArgumentException("Feature values must be finite");
                }
            }
        }
    }
}
