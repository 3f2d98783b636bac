package com.tsmonitor.anomaly.engine.isolationforest;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Isolation forest over fixed-width feature rows.
 *
 * Rows that are easy to separate end up on short paths; the score maps the mean path length
 * over all trees to {@code 2^(-E[h(x)] / c(n))}, so values near 1 are anomalous and values
 * around 0.5 unremarkable.
 */
public class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final int featureCount;
    private final double expectedDepth;

    private IsolationForest(List<IsolationTree> trees, int sampleSize, int featureCount) {
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.featureCount = featureCount;
        this.expectedDepth = IsolationNode.averagePathLength(sampleSize);
    }

    /**
     * @param data       training rows, all of the same width
     * @param numTrees   trees to grow
     * @param sampleSize rows drawn without replacement per tree, capped at the row count
     * @param seed       fixes both the sampling and the splits
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        int perTree = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(perTree, 2)) / Math.log(2));
        Random random = new Random(seed);

        IsolationTree[] grown = new IsolationTree[numTrees];
        for (int t = 0; t < numTrees; t++) {
            grown[t] = IsolationTree.grow(data, drawRows(data.length, perTree, random), maxDepth, random);
        }
        return new IsolationForest(List.of(grown), perTree, data[0].length);
    }

    public double anomalyScore(double[] point) {
        if (expectedDepth <= 0) {
            return 0.0;
        }
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / trees.size()) / expectedDepth);
    }

    public double[] anomalyScores(double[][] points) {
        return IntStream.range(0, points.length)
                .mapToDouble(i -> anomalyScore(points[i]))
                .toArray();
    }

    // The first k slots of a partial Fisher-Yates shuffle of 0..n-1
    private static int[] drawRows(int n, int k, Random random) {
        int[] all = IntStream.range(0, n).toArray();
        if (k >= n) {
            return all;
        }
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] drawn = new int[k];
        System.arraycopy(all, 0, drawn, 0, k);
        return drawn;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getFeatureCount() {
        return featureCount;
    }
}
