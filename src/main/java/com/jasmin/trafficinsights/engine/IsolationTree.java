package com.jasmin.trafficinsights.engine;

import java.util.Arrays;
import java.util.Random;

/**
 * One randomized isolation tree. Every internal node splits on a feature that is not
 * constant among its rows, at a value drawn uniformly from {@code [min, max)} of that
 * feature; rows below the value go left.
 */
final class IsolationTree {

    private static final double EULER_GAMMA = 0.5772156649;

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    /**
     * Grows a tree over the given row indices of {@code data}.
     *
     * @param heightLimit depth at which nodes become leaves regardless of their size
     */
    static IsolationTree grow(double[][] data, int[] rows, int heightLimit, Random rnd) {
        return new IsolationTree(build(data, rows, 0, heightLimit, rnd));
    }

    /** Depth of the leaf {@code row} falls into, adjusted by the size of that leaf. */
    double pathLength(double[] row) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = row[node.feature] < node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of
     * {@code n} nodes: {@code 2H(n-1) - 2(n-1)/n}, 0 for one node and 1 for two.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static Node build(double[][] data, int[] rows, int depth, int heightLimit, Random rnd) {
        if (rows.length <= 1 || depth >= heightLimit) {
            return Node.leaf(rows.length);
        }

        int features = data[rows[0]].length;
        double[] min = new double[features];
        double[] max = new double[features];
        int[] candidates = new int[features];
        int candidateCount = 0;
        for (int f = 0; f < features; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
            for (int r : rows) {
                min[f] = Math.min(min[f], data[r][f]);
                max[f] = Math.max(max[f], data[r][f]);
            }
            if (max[f] > min[f]) {
                candidates[candidateCount++] = f;
            }
        }
        if (candidateCount == 0) {
            return Node.leaf(rows.length);
        }

        int feature = candidates[rnd.nextInt(candidateCount)];
        double split = min[feature] + rnd.nextDouble() * (max[feature] - min[feature]);

        int[] left = new int[rows.length];
        int[] right = new int[rows.length];
        int l = 0;
        int r = 0;
        for (int row : rows) {
            if (data[row][feature] < split) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }
        // split landed exactly on the minimum
        if (l == 0 || r == 0) {
            return Node.leaf(rows.length);
        }

        return Node.internal(feature, split,
                build(data, Arrays.copyOf(left, l), depth + 1, heightLimit, rnd),
                build(data, Arrays.copyOf(right, r), depth + 1, heightLimit, rnd));
    }

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node internal(int feature, double split, Node left, Node right) {
            return new Node(feature, split, left, right, left.size + right.size);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
