package com.tsmonitor.anomaly.engine.isolationforest;

import java.util.Random;

/**
 * One random isolation tree grown over a sub-sample of training rows.
 */
public class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    /**
     * @param data    all training rows
     * @param rows    indices of the rows sampled for this tree; reordered in place while growing
     * @param maxDepth height limit, ceil(log2(sample size))
     */
    static IsolationTree grow(double[][] data, int[] rows, int maxDepth, Random random) {
        return new IsolationTree(split(data, rows, 0, rows.length, 0, maxDepth, random));
    }

    // Grows the subtree for rows[from, to)
    private static IsolationNode split(double[][] data, int[] rows, int from, int to, int depth,
                                       int maxDepth, Random random) {
        int count = to - from;
        if (count <= 1 || depth >= maxDepth) {
            return IsolationNode.externalNode(count);
        }

        int feature = random.nextInt(data[rows[from]].length);
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double v = data[rows[i]][feature];
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        if (!(hi > lo)) {
            // Every row agrees on this feature
            return IsolationNode.externalNode(count);
        }

        double cut = lo + random.nextDouble() * (hi - lo);
        int boundary = partition(data, rows, from, to, feature, cut);
        return IsolationNode.internalNode(feature, cut,
                split(data, rows, from, boundary, depth + 1, maxDepth, random),
                split(data, rows, boundary, to, depth + 1, maxDepth, random));
    }

    /**
     * Moves rows with {@code value < cut} to the front of the range and returns the first index of the rest.
     */
    private static int partition(double[][] data, int[] rows, int from, int to, int feature, double cut) {
        int store = from;
        for (int i = from; i < to; i++) {
            if (data[rows[i]][feature] < cut) {
                int tmp = rows[store];
                rows[store] = rows[i];
                rows[i] = tmp;
                store++;
            }
        }
        return store;
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }
}
